package com.swaptrader.domain.enums;

/**
 * Lifecycle status of an order.
 *
 * <p>Orders move forward only: PENDING is the single non-terminal state and may move to
 * FILLED, FAILED or CANCELLED. Nothing leaves a terminal state.
 */
public enum OrderStatus {
    PENDING("pending"),
    FILLED("filled"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    /** Whether an order in this status may move to {@code next}. */
    public boolean canTransitionTo(OrderStatus next) {
        return switch (this) {
            case PENDING -> next == FILLED || next == FAILED || next == CANCELLED;
            case FILLED, FAILED, CANCELLED -> false;
        };
    }

    public static OrderStatus fromValue(String value) {
        for (OrderStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown order status: " + value);
    }
}
