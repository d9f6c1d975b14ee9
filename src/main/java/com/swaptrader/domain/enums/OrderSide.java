package com.swaptrader.domain.enums;

/**
 * Buy or sell side of an order, trade, position or signal.
 * Persisted as the lowercase token ("buy" / "sell").
 */
public enum OrderSide {
    BUY("buy"),
    SELL("sell");

    private final String value;

    OrderSide(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used for closing orders. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    public static OrderSide fromValue(String value) {
        for (OrderSide side : values()) {
            if (side.value.equalsIgnoreCase(value)) {
                return side;
            }
        }
        throw new IllegalArgumentException("Unknown order side: " + value);
    }
}
