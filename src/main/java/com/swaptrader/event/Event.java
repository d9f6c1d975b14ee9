package com.swaptrader.event;

import java.time.Instant;
import java.util.Map;

/**
 * One emitted event. The payload already contains the {@code timestamp} and
 * {@code event_type} stamps added by {@link EventBus#emit}; it is unmodifiable.
 */
public record Event(EventType type, Map<String, Object> payload, Instant timestamp) {}
