package com.swaptrader.event;

import java.util.Arrays;
import java.util.List;

/**
 * Closed set of event types published on the {@link EventBus}.
 *
 * <p>The token is the wire name stamped into every payload as {@code event_type}. Transport
 * adapters that receive type names from clients resolve them with {@link #fromValue(String)},
 * which rejects anything outside this set.
 */
public enum EventType {

    // ---- Trading ----
    TRADE_EXECUTED("trade_executed", EventCategory.TRADE),
    ORDER_PLACED("order_placed", EventCategory.ORDER),
    ORDER_FILLED("order_filled", EventCategory.ORDER),
    ORDER_FAILED("order_failed", EventCategory.ORDER),
    ORDER_CANCELLED("order_cancelled", EventCategory.ORDER),
    POSITION_OPENED("position_opened", EventCategory.POSITION),
    POSITION_UPDATED("position_updated", EventCategory.POSITION),
    POSITION_CLOSED("position_closed", EventCategory.POSITION),

    // ---- Strategy ----
    STRATEGY_STARTED("strategy_started", EventCategory.STRATEGY),
    STRATEGY_STOPPED("strategy_stopped", EventCategory.STRATEGY),
    STRATEGY_UPDATED("strategy_updated", EventCategory.STRATEGY),
    STRATEGY_SIGNAL("strategy_signal", EventCategory.STRATEGY),

    // ---- System ----
    SYSTEM_ERROR("system_error", EventCategory.SYSTEM),
    SYSTEM_WARNING("system_warning", EventCategory.SYSTEM),
    SYSTEM_STATUS("system_status", EventCategory.SYSTEM),

    // ---- Market ----
    PRICE_UPDATE("price_update", EventCategory.MARKET),
    VOLUME_SPIKE("volume_spike", EventCategory.MARKET),
    VOLATILITY_ALERT("volatility_alert", EventCategory.MARKET),

    // ---- Risk ----
    RISK_LIMIT_BREACH("risk_limit_breach", EventCategory.RISK),
    MARGIN_CALL("margin_call", EventCategory.RISK),
    ACCOUNT_VALUE_UPDATE("account_value_update", EventCategory.RISK);

    private final String value;
    private final EventCategory category;

    EventType(String value, EventCategory category) {
        this.value = value;
        this.category = category;
    }

    public String getValue() {
        return value;
    }

    public EventCategory getCategory() {
        return category;
    }

    public static List<EventType> inCategory(EventCategory category) {
        return Arrays.stream(values()).filter(t -> t.category == category).toList();
    }

    public static EventType fromValue(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }
}
