package com.swaptrader.core.engine;

import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link TradingEngine#closeAllPositions}: ids closed, and the error text for each
 * position that could not be closed (those are left in their prior status).
 */
public record BatchCloseResult(List<String> closed, Map<String, String> failures) {

    public boolean allSucceeded() {
        return failures.isEmpty();
    }

    public int attempted() {
        return closed.size() + failures.size();
    }
}
