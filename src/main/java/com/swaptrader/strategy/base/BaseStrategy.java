package com.swaptrader.strategy.base;

import com.swaptrader.domain.enums.DataType;
import com.swaptrader.domain.model.Signal;
import com.swaptrader.domain.model.StrategyState;
import com.swaptrader.repository.StrategyStateRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract base for all strategies: owns the persisted {@link StrategyState}, the generic
 * signal checks and position sizing.
 *
 * <p>Lifecycle:
 * <ul>
 *   <li>{@link #initialize()} loads the stored state, or creates and stores an active default
 *       state, then calls {@link #onInitialize()}</li>
 *   <li>while {@link #isActive()} is false, subclasses must not emit signals</li>
 *   <li>{@link #cleanup()} stores {@code active=false} (the state is kept, never deleted) and
 *       calls {@link #onCleanup()}</li>
 * </ul>
 *
 * <p>Every state change goes through {@link #updateState(Consumer)}, which persists the new
 * state before it replaces the in-memory copy.
 */
public abstract class BaseStrategy implements TradingStrategy {

    private static final Logger log = LoggerFactory.getLogger(BaseStrategy.class);

    private static final int SIZE_SCALE = 8;

    protected final String id;
    protected final String symbol;
    private final BaseStrategyConfig baseConfig;
    private final StrategyStateRepository strategyStateRepository;

    private volatile StrategyState state;

    protected BaseStrategy(
            String id, String symbol, BaseStrategyConfig baseConfig, StrategyStateRepository strategyStateRepository) {
        this.id = id;
        this.symbol = symbol;
        this.baseConfig = baseConfig;
        this.strategyStateRepository = strategyStateRepository;
    }

    // ---- Subclass hooks ----

    /** Called at the end of {@link #initialize()}, after state is loaded. */
    protected abstract void onInitialize();

    /** Called at the end of {@link #cleanup()}. Clear indicator buffers here. */
    protected abstract void onCleanup();

    /** Strategy-specific approval, run after the generic checks pass. Defaults to approve. */
    protected boolean validateStrategySignal(Signal signal) {
        return true;
    }

    // ---- Identity ----

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getSymbol() {
        return symbol;
    }

    @Override
    public Set<DataType> getDataRequirements() {
        return EnumSet.of(DataType.CANDLE);
    }

    // ---- Lifecycle ----

    @Override
    public void initialize() {
        state = strategyStateRepository.findById(id).orElse(null);
        if (state == null) {
            StrategyState initial = StrategyState.builder()
                    .strategyId(id)
                    .symbol(symbol)
                    .active(true)
                    .lastUpdate(Instant.now())
                    .positionSize(BigDecimal.ZERO)
                    .metadata(new HashMap<>())
                    .build();
            strategyStateRepository.save(initial);
            state = initial;
            log.info("Strategy state created: strategyId={}, symbol={}", id, symbol);
        } else {
            log.info("Strategy state loaded: strategyId={}, active={}", id, state.isActive());
        }
        onInitialize();
    }

    @Override
    public void cleanup() {
        updateState(s -> s.setActive(false));
        onCleanup();
        log.info("Strategy cleaned up: strategyId={}", id);
    }

    @Override
    public boolean isActive() {
        StrategyState current = state;
        return current != null && current.isActive();
    }

    // ---- Validation ----

    /**
     * Rejects signals with a non-positive price or size, or an expiry in the past, then defers
     * to {@link #validateStrategySignal(Signal)}. A hook that throws counts as a rejection.
     */
    @Override
    public final boolean validateSignal(Signal signal) {
        if (signal.getPrice() == null || signal.getPrice().signum() <= 0) {
            log.warn("Signal rejected, invalid price: strategyId={}, price={}", id, signal.getPrice());
            return false;
        }
        if (signal.getSize() == null || signal.getSize().signum() <= 0) {
            log.warn("Signal rejected, invalid size: strategyId={}, size={}", id, signal.getSize());
            return false;
        }
        if (signal.getExpiry() != null && signal.getExpiry().isBefore(Instant.now())) {
            log.warn("Signal rejected, expired: strategyId={}, expiry={}", id, signal.getExpiry());
            return false;
        }
        try {
            return validateStrategySignal(signal);
        } catch (RuntimeException e) {
            log.error("Signal validation failed: strategyId={}", id, e);
            return false;
        }
    }

    // ---- State ----

    @Override
    public StrategyState getState() {
        StrategyState current = state;
        return current != null ? current.copy() : null;
    }

    @Override
    public void recordPosition(String positionId, BigDecimal positionSize) {
        updateState(s -> {
            s.setCurrentPosition(positionId);
            s.setPositionSize(positionSize != null ? positionSize : BigDecimal.ZERO);
        });
    }

    /**
     * Applies {@code change} to a copy of the current state, stamps {@code lastUpdate} and
     * persists it. The in-memory state is replaced only after the save succeeds.
     */
    protected void updateState(Consumer<StrategyState> change) {
        if (state == null) {
            throw new IllegalStateException("Strategy " + id + " is not initialized");
        }
        StrategyState next = state.copy();
        change.accept(next);
        next.setLastUpdate(Instant.now());
        strategyStateRepository.save(next);
        state = next;
    }

    // ---- Sizing ----

    /** {@code (accountSize × riskFactor) / (price × assumedStopLossFraction)}, 8 decimal places. */
    protected BigDecimal calculatePositionSize(BigDecimal price) {
        BigDecimal riskAmount = baseConfig.getAccountSize().multiply(baseConfig.getRiskFactor());
        BigDecimal perUnitRisk = price.multiply(baseConfig.getAssumedStopLossFraction());
        if (perUnitRisk.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return riskAmount.divide(perUnitRisk, SIZE_SCALE, RoundingMode.HALF_UP);
    }
}
