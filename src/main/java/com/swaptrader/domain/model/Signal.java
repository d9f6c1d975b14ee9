package com.swaptrader.domain.model;

import com.swaptrader.domain.enums.OrderSide;
import com.swaptrader.domain.enums.SignalType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * A candidate trade decision produced by a strategy. Validated, then consumed once by
 * the StrategyManager.
 */
@Data
@Builder
public class Signal {

    private String strategyId;
    private String symbol;
    private OrderSide side;
    private BigDecimal size;
    private BigDecimal price;
    private SignalType signalType;

    /** 0.0 - 1.0. */
    private double confidence;

    private Instant timestamp;

    /** Null = never expires. */
    private Instant expiry;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
