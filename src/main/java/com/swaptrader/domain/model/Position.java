package com.swaptrader.domain.model;

import com.swaptrader.domain.enums.OrderSide;
import com.swaptrader.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Exposure opened by a filled entry order.
 *
 * <p>Size never changes after creation: a position is closed in full by one opposite-side
 * order. P&L is signed from the position's point of view: a BUY gains when price rises,
 * a SELL gains when price falls.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String id;
    private String symbol;
    private OrderSide side;
    private BigDecimal size;
    private BigDecimal entryPrice;
    private BigDecimal currentPrice;
    private PositionStatus status;

    @Builder.Default
    private BigDecimal unrealizedPnl = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    /** Stop price. Null = no stop-loss. */
    private BigDecimal stopLoss;

    private Instant entryTime;
    private Instant lastUpdateTime;
    private Instant closedAt;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    /**
     * P&L of this position if valued at {@code price}: (price - entry) x size, sign-flipped for SELL.
     */
    public BigDecimal pnlAt(BigDecimal price) {
        BigDecimal diff = price.subtract(entryPrice);
        if (side == OrderSide.SELL) {
            diff = diff.negate();
        }
        return diff.multiply(size);
    }

    /** True when a stop-loss is set and {@code price} is at or through it. */
    public boolean isStopLossBreached(BigDecimal price) {
        if (stopLoss == null) {
            return false;
        }
        return switch (side) {
            case BUY -> price.compareTo(stopLoss) <= 0;
            case SELL -> price.compareTo(stopLoss) >= 0;
        };
    }

    public Position copy() {
        return toBuilder().metadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>()).build();
    }
}
