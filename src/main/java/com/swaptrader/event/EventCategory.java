package com.swaptrader.event;

/** Groups {@link EventType}s for subscribers that care about a whole area (e.g. a dashboard tab). */
public enum EventCategory {
    TRADE,
    ORDER,
    POSITION,
    STRATEGY,
    SYSTEM,
    MARKET,
    RISK
}
