package com.swaptrader.domain.enums;

/** Whether a strategy signal opens new exposure or exits existing exposure. */
public enum SignalType {
    ENTRY("entry"),
    EXIT("exit");

    private final String value;

    SignalType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static SignalType fromValue(String value) {
        for (SignalType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown signal type: " + value);
    }
}
