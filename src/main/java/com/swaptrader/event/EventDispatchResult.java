package com.swaptrader.event;

import java.util.List;

/**
 * Outcome of one {@link EventBus#emit} fan-out.
 *
 * @param event      the stamped event that was recorded and delivered
 * @param delivered  number of handlers that completed normally
 * @param failures   one entry per handler that threw, in no particular order
 */
public record EventDispatchResult(Event event, int delivered, List<Throwable> failures) {

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
