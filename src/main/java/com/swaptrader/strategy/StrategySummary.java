package com.swaptrader.strategy;

import com.swaptrader.domain.enums.StrategyType;
import java.math.BigDecimal;
import java.time.Instant;

/** Status line for one registered strategy. */
public record StrategySummary(
        String strategyId,
        StrategyType type,
        String symbol,
        boolean active,
        Instant lastUpdate,
        String currentPosition,
        BigDecimal positionSize) {}
