package com.swaptrader.domain.model;

import com.swaptrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An executed swap. Immutable once created except for {@code positionId}, which is attached
 * exactly once after the opening position exists.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Trade {

    private String id;
    private String orderId;

    /** Null until the position created from this trade exists. */
    private String positionId;

    private String symbol;
    private OrderSide side;
    private BigDecimal size;
    private BigDecimal price;
    private BigDecimal fee;
    private Instant timestamp;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public Trade copy() {
        return toBuilder().metadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>()).build();
    }
}
