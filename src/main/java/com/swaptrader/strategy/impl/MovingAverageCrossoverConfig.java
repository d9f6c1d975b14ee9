package com.swaptrader.strategy.impl;

import com.swaptrader.strategy.base.BaseStrategyConfig;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.experimental.SuperBuilder;

/** Settings for {@link MovingAverageCrossoverStrategy}. The fast period must be shorter than the slow one. */
@Data
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
public class MovingAverageCrossoverConfig extends BaseStrategyConfig {

    @Builder.Default
    private int fastPeriod = 10;

    @Builder.Default
    private int slowPeriod = 21;

    /** Latest candle volume below this suppresses signals. */
    @Builder.Default
    private double minVolume = 1_000_000;
}
