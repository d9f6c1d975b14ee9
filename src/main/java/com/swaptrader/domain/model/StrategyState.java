package com.swaptrader.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted runtime state of one strategy instance, stored at {@code strategy:{id}:state}.
 *
 * <p>Created on first activation and marked inactive (never deleted) when the strategy is
 * removed, so a restarted process can see which strategies were running and what they last did.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StrategyState {

    private String strategyId;
    private String symbol;
    private boolean active;
    private Instant lastUpdate;

    @Builder.Default
    private BigDecimal positionSize = BigDecimal.ZERO;

    /** Id of the position most recently opened for this strategy. */
    private String currentPosition;

    /** Free-form state; {@code last_signal} holds side, price and timestamp of the last emitted signal. */
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public StrategyState copy() {
        return toBuilder().metadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>()).build();
    }
}
