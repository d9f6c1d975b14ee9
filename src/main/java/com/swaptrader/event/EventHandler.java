package com.swaptrader.event;

/**
 * Subscriber callback. Handlers may block (I/O) and may throw; a failure is isolated to
 * the handler that raised it.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(Event event) throws Exception;
}
