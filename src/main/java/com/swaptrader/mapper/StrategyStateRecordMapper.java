package com.swaptrader.mapper;

import static com.swaptrader.mapper.RecordFields.*;

import com.swaptrader.domain.model.StrategyState;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class StrategyStateRecordMapper implements RecordMapper<StrategyState> {

    @Override
    public Map<String, Object> toRecord(StrategyState state) {
        Map<String, Object> record = new LinkedHashMap<>();
        put(record, "strategy_id", state.getStrategyId());
        put(record, "symbol", state.getSymbol());
        record.put("is_active", state.isActive());
        putInstant(record, "last_update", state.getLastUpdate());
        putDecimal(record, "position_size", state.getPositionSize());
        put(record, "current_position", state.getCurrentPosition());
        putMetadata(record, state.getMetadata());
        return record;
    }

    @Override
    public StrategyState fromRecord(String key, Map<String, Object> record) {
        BigDecimal positionSize = optionalDecimal(key, record, "position_size");
        return StrategyState.builder()
                .strategyId(requireString(key, record, "strategy_id"))
                .symbol(requireString(key, record, "symbol"))
                .active(optionalBoolean(record, "is_active"))
                .lastUpdate(optionalInstant(key, record, "last_update"))
                .positionSize(positionSize != null ? positionSize : BigDecimal.ZERO)
                .currentPosition(optionalString(record, "current_position"))
                .metadata(metadata(record))
                .build();
    }
}
