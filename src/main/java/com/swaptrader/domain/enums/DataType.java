package com.swaptrader.domain.enums;

/**
 * Tag carried by every ingested {@link com.swaptrader.domain.model.DataPoint}.
 * Strategies declare the tags they consume and only receive matching points.
 */
public enum DataType {
    CANDLE("candle"),
    PRICE("price"),
    TRADE("trade"),
    VOLUME("volume");

    private final String value;

    DataType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static DataType fromValue(String value) {
        for (DataType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown data type: " + value);
    }
}
