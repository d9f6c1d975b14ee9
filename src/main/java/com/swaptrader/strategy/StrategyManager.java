package com.swaptrader.strategy;

import com.swaptrader.config.TradingConfig;
import com.swaptrader.core.engine.TradingEngine;
import com.swaptrader.domain.enums.OrderSide;
import com.swaptrader.domain.enums.StrategyType;
import com.swaptrader.domain.model.DataPoint;
import com.swaptrader.domain.model.Order;
import com.swaptrader.domain.model.Position;
import com.swaptrader.domain.model.Signal;
import com.swaptrader.domain.model.StrategyState;
import com.swaptrader.event.EventPublisherHelper;
import com.swaptrader.exception.InvalidStateException;
import com.swaptrader.exception.ResourceNotFoundException;
import com.swaptrader.execution.TokenPair;
import com.swaptrader.strategy.base.BaseStrategyConfig;
import com.swaptrader.strategy.base.TradingStrategy;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the running strategies and connects them to the {@link TradingEngine}.
 *
 * <p>Each incoming {@link DataPoint} goes only to strategies whose data requirements include
 * its type and whose symbol matches. After {@code processData}, the strategy is asked for a
 * signal; a signal that passes {@code validateSignal} is executed, one that fails is dropped
 * with a warning. ENTRY signals open a position (with a stop-loss derived from
 * {@code swaptrader.trading.default-stop-loss-percent}); EXIT signals close the positions the
 * strategy opened on its symbol.
 *
 * <p>Failures are isolated per strategy: an exception from one strategy or from executing its
 * signal is logged and reported as a {@code system_error} event, and routing continues.
 */
@Service
public class StrategyManager {

    private static final Logger log = LoggerFactory.getLogger(StrategyManager.class);

    private static final String STRATEGY_ID_KEY = "strategy_id";

    private final Map<String, TradingStrategy> strategies = new ConcurrentHashMap<>();

    private final StrategyFactory strategyFactory;
    private final TradingEngine tradingEngine;
    private final EventPublisherHelper eventPublisherHelper;
    private final TradingConfig tradingConfig;

    public StrategyManager(
            StrategyFactory strategyFactory,
            TradingEngine tradingEngine,
            EventPublisherHelper eventPublisherHelper,
            TradingConfig tradingConfig) {
        this.strategyFactory = strategyFactory;
        this.tradingEngine = tradingEngine;
        this.eventPublisherHelper = eventPublisherHelper;
        this.tradingConfig = tradingConfig;
    }

    // ---- Registry ----

    /**
     * Creates, initializes and registers a strategy.
     *
     * @throws InvalidStateException if a strategy with this id is already registered
     */
    public TradingStrategy addStrategy(
            String strategyId, StrategyType type, String symbol, BaseStrategyConfig config) {
        if (strategies.containsKey(strategyId)) {
            throw new InvalidStateException(
                    "Strategy already registered: " + strategyId, Map.of(STRATEGY_ID_KEY, strategyId));
        }
        TokenPair.parse(symbol);

        TradingStrategy strategy = strategyFactory.create(type, strategyId, symbol, config);
        strategy.initialize();
        if (strategies.putIfAbsent(strategyId, strategy) != null) {
            throw new InvalidStateException(
                    "Strategy already registered: " + strategyId, Map.of(STRATEGY_ID_KEY, strategyId));
        }

        eventPublisherHelper.publishStrategyStarted(strategyId, type.getValue(), symbol);
        log.info(
                "Strategy added: strategyId={}, type={}, symbol={}, active={}",
                strategyId,
                type.getValue(),
                symbol,
                strategy.isActive());
        return strategy;
    }

    /**
     * Cleans up and deregisters a strategy. Its persisted state is marked inactive, not deleted.
     *
     * @throws ResourceNotFoundException if no strategy has this id
     */
    public void removeStrategy(String strategyId) {
        TradingStrategy strategy = strategies.remove(strategyId);
        if (strategy == null) {
            throw new ResourceNotFoundException("Strategy", strategyId);
        }
        strategy.cleanup();
        eventPublisherHelper.publishStrategyStopped(strategyId);
        log.info("Strategy removed: strategyId={}", strategyId);
    }

    public Optional<TradingStrategy> getStrategy(String strategyId) {
        return Optional.ofNullable(strategies.get(strategyId));
    }

    public int getStrategyCount() {
        return strategies.size();
    }

    public List<StrategySummary> getStrategySummary() {
        return strategies.values().stream()
                .sorted(Comparator.comparing(TradingStrategy::getId))
                .map(StrategyManager::summarize)
                .toList();
    }

    private static StrategySummary summarize(TradingStrategy strategy) {
        StrategyState state = strategy.getState();
        return new StrategySummary(
                strategy.getId(),
                strategy.getType(),
                strategy.getSymbol(),
                strategy.isActive(),
                state != null ? state.getLastUpdate() : null,
                state != null ? state.getCurrentPosition() : null,
                state != null ? state.getPositionSize() : BigDecimal.ZERO);
    }

    // ---- Routing ----

    /** Routes one data point to every matching strategy and executes the signals they produce. */
    public void processData(DataPoint dataPoint) {
        for (TradingStrategy strategy : strategies.values()) {
            if (!strategy.getDataRequirements().contains(dataPoint.getDataType())
                    || !strategy.getSymbol().equals(dataPoint.getSymbol())) {
                continue;
            }
            try {
                strategy.processData(dataPoint);
                Optional<Signal> signal = strategy.generateSignal();
                signal.ifPresent(s -> handleSignal(strategy, s));
            } catch (RuntimeException e) {
                log.error(
                        "Strategy processing failed: strategyId={}, symbol={}",
                        strategy.getId(),
                        dataPoint.getSymbol(),
                        e);
                eventPublisherHelper.publishSystemError(
                        "strategy_manager", e.getMessage(), Map.of(STRATEGY_ID_KEY, strategy.getId()));
            }
        }
    }

    private void handleSignal(TradingStrategy strategy, Signal signal) {
        if (!strategy.validateSignal(signal)) {
            log.warn(
                    "Signal rejected: strategyId={}, side={}, price={}, size={}",
                    strategy.getId(),
                    signal.getSide(),
                    signal.getPrice(),
                    signal.getSize());
            eventPublisherHelper.publishStrategySignal(signal, false);
            return;
        }
        eventPublisherHelper.publishStrategySignal(signal, true);

        switch (signal.getSignalType()) {
            case ENTRY -> enter(strategy, signal);
            case EXIT -> exit(strategy, signal);
        }
    }

    private void enter(TradingStrategy strategy, Signal signal) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(STRATEGY_ID_KEY, strategy.getId());
        metadata.put("signal_confidence", signal.getConfidence());

        Order order = tradingEngine.executeMarketOrder(
                signal.getSymbol(),
                signal.getSide(),
                signal.getSize(),
                stopLossFor(signal.getSide(), signal.getPrice()),
                metadata);

        tradingEngine
                .findPositionForOrder(order.getId())
                .ifPresent(position -> strategy.recordPosition(position.getId(), position.getSize()));
    }

    private void exit(TradingStrategy strategy, Signal signal) {
        List<Position> owned = tradingEngine.getPositionSummary().getPositions().stream()
                .filter(p -> p.getSymbol().equals(signal.getSymbol()))
                .filter(p -> strategy.getId().equals(p.getMetadata().get(STRATEGY_ID_KEY)))
                .toList();
        for (Position position : owned) {
            tradingEngine.closePosition(position.getId(), Map.of("reason", "strategy_exit"));
        }
        strategy.recordPosition(null, BigDecimal.ZERO);
        log.info("Strategy exit: strategyId={}, closed={}", strategy.getId(), owned.size());
    }

    /**
     * Stop price for a new entry: below the entry for a buy, above it for a sell.
     * Null when the configured stop distance is null or zero.
     */
    private BigDecimal stopLossFor(OrderSide side, BigDecimal entryPrice) {
        BigDecimal percent = tradingConfig.getDefaultStopLossPercent();
        if (percent == null || percent.signum() == 0 || entryPrice == null) {
            return null;
        }
        BigDecimal factor = side == OrderSide.BUY ? BigDecimal.ONE.subtract(percent) : BigDecimal.ONE.add(percent);
        return entryPrice.multiply(factor);
    }
}
