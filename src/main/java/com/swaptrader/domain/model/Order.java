package com.swaptrader.domain.model;

import com.swaptrader.domain.enums.OrderSide;
import com.swaptrader.domain.enums.OrderStatus;
import com.swaptrader.domain.enums.OrderType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A request to swap {@code size} units of a token pair, and its outcome.
 *
 * <p>Owned by the OrderLedger. Status moves forward only (see {@link OrderStatus}); the
 * fill fields are populated when the order reaches FILLED, {@code error} when it reaches FAILED.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    private String id;
    private String symbol;
    private OrderSide side;
    private BigDecimal size;

    /** Requested price. Null for market orders. */
    private BigDecimal price;

    private OrderType type;
    private OrderStatus status;
    private Instant submittedAt;

    private BigDecimal filledPrice;
    private BigDecimal filledSize;
    private Instant filledAt;

    /** Execution failure text. Only set on FAILED orders. */
    private String error;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    /** Detached copy; the ledger never hands out its cached instance. */
    public Order copy() {
        return toBuilder().metadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>()).build();
    }
}
