package com.swaptrader.service;

import com.swaptrader.domain.model.PositionSummary;
import com.swaptrader.strategy.StrategySummary;
import java.time.Instant;
import java.util.List;

/** Snapshot returned by {@link TradingSystemService#getSystemStatus()}. */
public record SystemStatus(
        boolean running,
        Instant timestamp,
        int queueDepth,
        List<StrategySummary> strategies,
        PositionSummary positions) {}
