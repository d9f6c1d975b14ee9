package com.swaptrader.domain.enums;

/**
 * Lifecycle status of a position.
 *
 * <p>OPEN -> CLOSING when a stop-loss is breached, CLOSING -> CLOSED once the closing swap
 * fills. A manual close goes OPEN -> CLOSED directly. A CLOSED position is never re-opened.
 */
public enum PositionStatus {
    OPEN("open"),
    CLOSING("closing"),
    CLOSED("closed");

    private final String value;

    PositionStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /** OPEN and CLOSING positions still carry exposure. */
    public boolean isLive() {
        return this != CLOSED;
    }

    public boolean canTransitionTo(PositionStatus next) {
        return switch (this) {
            case OPEN -> next == CLOSING || next == CLOSED;
            case CLOSING -> next == CLOSED;
            case CLOSED -> false;
        };
    }

    public static PositionStatus fromValue(String value) {
        for (PositionStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown position status: " + value);
    }
}
