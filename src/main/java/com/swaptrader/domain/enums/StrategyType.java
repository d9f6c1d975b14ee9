package com.swaptrader.domain.enums;

/**
 * Registered strategy implementations. The token is the type tag used by callers that
 * deploy strategies by name (see {@link com.swaptrader.strategy.StrategyFactory}).
 */
public enum StrategyType {

    /** Fast/slow simple moving average crossover with a volume gate. */
    MA_CROSSOVER("ma_crossover");

    private final String value;

    StrategyType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static StrategyType fromValue(String value) {
        for (StrategyType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown strategy type: " + value);
    }
}
