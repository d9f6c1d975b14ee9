package com.swaptrader.repository;

import com.swaptrader.config.RedisConfig;
import com.swaptrader.domain.model.StrategyState;
import com.swaptrader.mapper.StrategyStateRecordMapper;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

/** Persists {@link StrategyState} at {@code strategy:{id}:state}. No caching: strategies hold their own copy. */
@Repository
@RequiredArgsConstructor
public class StrategyStateRepository {

    private final StateStore stateStore;
    private final StrategyStateRecordMapper strategyStateRecordMapper;

    public Optional<StrategyState> findById(String strategyId) {
        String key = RedisConfig.strategyStateKey(strategyId);
        return stateStore.get(key).map(record -> strategyStateRecordMapper.fromRecord(key, record));
    }

    public void save(StrategyState state) {
        stateStore.set(RedisConfig.strategyStateKey(state.getStrategyId()), strategyStateRecordMapper.toRecord(state));
    }
}
