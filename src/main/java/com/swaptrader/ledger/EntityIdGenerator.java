package com.swaptrader.ledger;

import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Generates ledger ids: an entity prefix plus 8 random hex characters
 * ({@code ord_3fa85f64}, {@code trade_...}, {@code pos_...}).
 *
 * <p>Ids are assumed unique; nothing checks for collisions.
 */
@Component
public class EntityIdGenerator {

    public static final String ORDER_PREFIX = "ord_";
    public static final String TRADE_PREFIX = "trade_";
    public static final String POSITION_PREFIX = "pos_";

    private static final int TOKEN_LENGTH = 8;

    public String nextOrderId() {
        return ORDER_PREFIX + token();
    }

    public String nextTradeId() {
        return TRADE_PREFIX + token();
    }

    public String nextPositionId() {
        return POSITION_PREFIX + token();
    }

    private static String token() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, TOKEN_LENGTH);
    }
}
