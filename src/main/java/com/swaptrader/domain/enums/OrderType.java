package com.swaptrader.domain.enums;

/**
 * Order execution type. Only MARKET orders are executed by the trading engine;
 * LIMIT is carried for records created by external tooling.
 */
public enum OrderType {
    MARKET("market"),
    LIMIT("limit");

    private final String value;

    OrderType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static OrderType fromValue(String value) {
        for (OrderType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown order type: " + value);
    }
}
