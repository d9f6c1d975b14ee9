package com.swaptrader.event;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * In-process publish/subscribe hub that every other component uses to broadcast state changes.
 *
 * <p>Each {@link #emit} call:
 * <ol>
 *   <li>copies the payload and stamps it with {@code timestamp} (ISO-8601 UTC) and {@code event_type}</li>
 *   <li>appends the event to that type's history ring (oldest evicted past {@value #MAX_HISTORY})</li>
 *   <li>schedules one task per current subscriber on the event executor and waits for all of them</li>
 * </ol>
 * A handler that throws is logged and counted; it never stops delivery to the other handlers and
 * never reaches the caller of {@code emit}.
 *
 * <p>Thread safety: subscriber sets are {@link CopyOnWriteArraySet}s (subscriptions change rarely,
 * emits are frequent), and each history ring is guarded by its own monitor.
 */
@Component
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** History capacity per event type. */
    public static final int MAX_HISTORY = 1000;

    /** Number of events returned by {@link #getHistory(EventType)}. */
    public static final int DEFAULT_HISTORY_LIMIT = 100;

    private final Map<EventType, CopyOnWriteArraySet<EventHandler>> subscribers = new EnumMap<>(EventType.class);
    private final Map<EventType, Deque<Event>> history = new EnumMap<>(EventType.class);
    private final AtomicLong handlerFailures = new AtomicLong();
    private final Executor eventExecutor;

    public EventBus(@Qualifier("eventExecutor") Executor eventExecutor) {
        this.eventExecutor = eventExecutor;
        for (EventType type : EventType.values()) {
            subscribers.put(type, new CopyOnWriteArraySet<>());
            history.put(type, new ArrayDeque<>());
        }
    }

    // ---- Subscriptions ----

    public void subscribe(EventType eventType, EventHandler handler) {
        requireType(eventType);
        Objects.requireNonNull(handler, "handler");
        subscribers.get(eventType).add(handler);
        log.debug("Subscribed to {}", eventType.getValue());
    }

    /** Subscribes one handler to every type in a category. */
    public void subscribe(EventCategory category, EventHandler handler) {
        for (EventType type : EventType.inCategory(category)) {
            subscribe(type, handler);
        }
    }

    public void unsubscribe(EventType eventType, EventHandler handler) {
        requireType(eventType);
        subscribers.get(eventType).remove(handler);
        log.debug("Unsubscribed from {}", eventType.getValue());
    }

    public int subscriberCount(EventType eventType) {
        requireType(eventType);
        return subscribers.get(eventType).size();
    }

    // ---- Emit ----

    /**
     * Records the event and delivers it to all current subscribers of its type.
     *
     * @param eventType the event type (must not be null)
     * @param payload   event data; copied, never mutated. Null is treated as empty.
     * @return delivery outcome; handler failures are reported here, not thrown
     */
    public EventDispatchResult emit(EventType eventType, Map<String, Object> payload) {
        requireType(eventType);
        Instant timestamp = Instant.now();

        Map<String, Object> stamped = new LinkedHashMap<>();
        if (payload != null) {
            stamped.putAll(payload);
        }
        stamped.put("timestamp", timestamp.toString());
        stamped.put("event_type", eventType.getValue());
        Event event = new Event(eventType, Collections.unmodifiableMap(stamped), timestamp);

        Deque<Event> ring = history.get(eventType);
        synchronized (ring) {
            ring.addLast(event);
            if (ring.size() > MAX_HISTORY) {
                ring.removeFirst();
            }
        }

        List<EventHandler> handlers = new ArrayList<>(subscribers.get(eventType));
        if (handlers.isEmpty()) {
            return new EventDispatchResult(event, 0, List.of());
        }

        List<CompletableFuture<Throwable>> tasks = new ArrayList<>(handlers.size());
        for (EventHandler handler : handlers) {
            tasks.add(CompletableFuture.supplyAsync(() -> invoke(handler, event), eventExecutor));
        }

        List<Throwable> failures = new ArrayList<>();
        for (CompletableFuture<Throwable> task : tasks) {
            Throwable failure = task.join();
            if (failure != null) {
                failures.add(failure);
            }
        }
        return new EventDispatchResult(event, handlers.size() - failures.size(), List.copyOf(failures));
    }

    private Throwable invoke(EventHandler handler, Event event) {
        try {
            handler.handle(event);
            return null;
        } catch (Exception e) {
            handlerFailures.incrementAndGet();
            log.error("Event handler failed: eventType={}, handler={}", event.type().getValue(), handler, e);
            return e;
        }
    }

    // ---- History ----

    /** Returns the most recent {@value #DEFAULT_HISTORY_LIMIT} events of a type, oldest first. */
    public List<Event> getHistory(EventType eventType) {
        return getHistory(eventType, DEFAULT_HISTORY_LIMIT);
    }

    /**
     * Returns the most recent {@code limit} events of a type in insertion order.
     * A limit of zero or less returns the full retained history.
     */
    public List<Event> getHistory(EventType eventType, int limit) {
        requireType(eventType);
        Deque<Event> ring = history.get(eventType);
        synchronized (ring) {
            List<Event> all = new ArrayList<>(ring);
            if (limit <= 0 || limit >= all.size()) {
                return all;
            }
            return new ArrayList<>(all.subList(all.size() - limit, all.size()));
        }
    }

    public void clearHistory(EventType eventType) {
        requireType(eventType);
        Deque<Event> ring = history.get(eventType);
        synchronized (ring) {
            ring.clear();
        }
    }

    public void clearHistory() {
        for (EventType type : EventType.values()) {
            clearHistory(type);
        }
    }

    /** Total handler failures since startup. Exposed as a metric. */
    public long getHandlerFailureCount() {
        return handlerFailures.get();
    }

    private static void requireType(EventType eventType) {
        if (eventType == null) {
            throw new IllegalArgumentException("Event type is required");
        }
    }
}
