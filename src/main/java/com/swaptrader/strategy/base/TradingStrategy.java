package com.swaptrader.strategy.base;

import com.swaptrader.domain.enums.DataType;
import com.swaptrader.domain.enums.StrategyType;
import com.swaptrader.domain.model.DataPoint;
import com.swaptrader.domain.model.Signal;
import com.swaptrader.domain.model.StrategyState;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.Set;

/**
 * Contract for every strategy variant.
 *
 * <p>The {@link com.swaptrader.strategy.StrategyManager} drives a strategy through this
 * interface only: it feeds matching {@link DataPoint}s to {@link #processData}, asks for a
 * {@link Signal} with {@link #generateSignal}, and forwards the signal to the trading engine
 * only if {@link #validateSignal} approves it. Strategies never execute trades themselves.
 *
 * <p>Implementations are driven from a single thread and need not be thread-safe.
 */
public interface TradingStrategy {

    // ---- Identity ----

    String getId();

    String getSymbol();

    StrategyType getType();

    // ---- Lifecycle ----

    /** Loads (or creates) persisted state and prepares indicators. Called once before any data. */
    void initialize();

    /** Marks the strategy inactive in its persisted state and releases indicator state. */
    void cleanup();

    boolean isActive();

    // ---- Data and signals ----

    /** Data types this strategy consumes. Points of other types are never routed to it. */
    Set<DataType> getDataRequirements();

    void processData(DataPoint dataPoint);

    /** A signal if the latest data warrants one. Always empty while inactive. */
    Optional<Signal> generateSignal();

    /** Generic checks (price, size, expiry) followed by the strategy's own rules. */
    boolean validateSignal(Signal signal);

    // ---- State ----

    /** Copy of the persisted state. */
    StrategyState getState();

    /** Records the position opened (or, with a null id, released) on this strategy's behalf. */
    void recordPosition(String positionId, BigDecimal positionSize);
}
