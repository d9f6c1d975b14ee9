package com.swaptrader.strategy;

import com.swaptrader.domain.enums.StrategyType;
import com.swaptrader.repository.StrategyStateRepository;
import com.swaptrader.strategy.base.BaseStrategy;
import com.swaptrader.strategy.base.BaseStrategyConfig;
import com.swaptrader.strategy.impl.MovingAverageCrossoverConfig;
import com.swaptrader.strategy.impl.MovingAverageCrossoverStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Creates strategy instances from a {@link StrategyType} tag and its config.
 *
 * <p><b>Adding a new strategy type:</b>
 * <ol>
 *   <li>Create the strategy class extending {@link BaseStrategy}</li>
 *   <li>Create its config class extending {@link BaseStrategyConfig}</li>
 *   <li>Add the type to {@link StrategyType}</li>
 *   <li>Add a case to the switch in {@link #create}; the compiler flags the missing case</li>
 * </ol>
 *
 * <p>Strategy instances are plain objects, not Spring beans.
 */
@Component
public class StrategyFactory {

    private static final Logger log = LoggerFactory.getLogger(StrategyFactory.class);

    private final StrategyStateRepository strategyStateRepository;

    public StrategyFactory(StrategyStateRepository strategyStateRepository) {
        this.strategyStateRepository = strategyStateRepository;
    }

    /**
     * @param config strategy-specific config, or null for that type's defaults
     * @throws IllegalArgumentException if the config does not match the type
     */
    public BaseStrategy create(StrategyType type, String strategyId, String symbol, BaseStrategyConfig config) {
        BaseStrategy strategy = switch (type) {
            case MA_CROSSOVER -> new MovingAverageCrossoverStrategy(
                    strategyId,
                    symbol,
                    config != null
                            ? asConfig(config, MovingAverageCrossoverConfig.class)
                            : MovingAverageCrossoverConfig.builder().build(),
                    strategyStateRepository);
        };
        log.info("Created strategy: id={}, type={}, symbol={}", strategyId, type.getValue(), symbol);
        return strategy;
    }

    private <T extends BaseStrategyConfig> T asConfig(BaseStrategyConfig config, Class<T> expectedType) {
        if (!expectedType.isInstance(config)) {
            throw new IllegalArgumentException("Expected config type " + expectedType.getSimpleName() + " but got "
                    + config.getClass().getSimpleName());
        }
        return expectedType.cast(config);
    }
}
