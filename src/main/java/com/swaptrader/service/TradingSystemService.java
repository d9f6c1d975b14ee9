package com.swaptrader.service;

import com.swaptrader.config.TradingConfig;
import com.swaptrader.core.engine.BatchCloseResult;
import com.swaptrader.core.engine.TradingEngine;
import com.swaptrader.domain.enums.DataType;
import com.swaptrader.domain.enums.StrategyType;
import com.swaptrader.domain.model.DataPoint;
import com.swaptrader.domain.model.Trade;
import com.swaptrader.event.EventPublisherHelper;
import com.swaptrader.ingestion.DataIngestionLoop;
import com.swaptrader.repository.MarketDataRepository;
import com.swaptrader.strategy.StrategyManager;
import com.swaptrader.strategy.StrategySummary;
import com.swaptrader.strategy.base.BaseStrategyConfig;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Entry point for the transport layer: starts and stops the trading system, accepts market
 * data, manages strategies and serves read-only views.
 *
 * <p>Runs as a {@link SmartLifecycle} bean so the ingestion loop starts with the application
 * context ({@code swaptrader.trading.auto-start}) and, on shutdown, open positions are closed
 * best-effort ({@code swaptrader.trading.close-positions-on-shutdown}).
 */
@Service
public class TradingSystemService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TradingSystemService.class);

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final DataIngestionLoop dataIngestionLoop;
    private final StrategyManager strategyManager;
    private final TradingEngine tradingEngine;
    private final EventPublisherHelper eventPublisherHelper;
    private final MarketDataRepository marketDataRepository;
    private final TradingConfig tradingConfig;

    public TradingSystemService(
            DataIngestionLoop dataIngestionLoop,
            StrategyManager strategyManager,
            TradingEngine tradingEngine,
            EventPublisherHelper eventPublisherHelper,
            MarketDataRepository marketDataRepository,
            TradingConfig tradingConfig) {
        this.dataIngestionLoop = dataIngestionLoop;
        this.strategyManager = strategyManager;
        this.tradingEngine = tradingEngine;
        this.eventPublisherHelper = eventPublisherHelper;
        this.marketDataRepository = marketDataRepository;
        this.tradingConfig = tradingConfig;
    }

    // ---- Lifecycle ----

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Trading system is already running");
            return;
        }
        dataIngestionLoop.start();
        eventPublisherHelper.publishSystemStatus("started", Map.of());
        log.info("Trading system started");
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.warn("Trading system is not running");
            return;
        }
        log.info("Stopping trading system");
        eventPublisherHelper.publishSystemStatus("stopping", Map.of());
        dataIngestionLoop.stop();

        Map<String, Object> details = new HashMap<>();
        if (tradingConfig.isClosePositionsOnShutdown()) {
            BatchCloseResult result = tradingEngine.closeAllPositions("system_shutdown");
            details.put("positions_closed", result.closed().size());
            details.put("positions_failed", result.failures().size());
            if (!result.allSucceeded()) {
                log.error("Positions left open after shutdown: {}", result.failures().keySet());
            }
        }
        eventPublisherHelper.publishSystemStatus("stopped", details);
        log.info("Trading system stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return tradingConfig.isAutoStart();
    }

    // ---- Market data ----

    /**
     * Queues a market observation for processing. Ignored, with a warning, while the system
     * is stopped.
     *
     * @param timestamp observation time, or null for now
     * @return whether the point was queued
     */
    public boolean submitMarketData(String symbol, DataType dataType, Object value, Instant timestamp) {
        DataPoint dataPoint = DataPoint.builder()
                .dataType(dataType)
                .symbol(symbol)
                .value(value)
                .timestamp(timestamp != null ? timestamp : Instant.now())
                .metadata(new HashMap<>())
                .build();
        return submitDataPoint(dataPoint);
    }

    public boolean submitDataPoint(DataPoint dataPoint) {
        if (!running.get()) {
            log.warn("Trading system is not running, ignoring market data: symbol={}", dataPoint.getSymbol());
            eventPublisherHelper.publishSystemWarning(
                    "trading_system",
                    "Market data ignored while stopped",
                    Map.of("symbol", String.valueOf(dataPoint.getSymbol())));
            return false;
        }
        dataIngestionLoop.enqueue(dataPoint);
        return true;
    }

    // ---- Strategies ----

    public void addStrategy(String strategyId, StrategyType type, String symbol, BaseStrategyConfig config) {
        strategyManager.addStrategy(strategyId, type, symbol, config);
    }

    public void removeStrategy(String strategyId) {
        strategyManager.removeStrategy(strategyId);
    }

    public List<StrategySummary> getStrategies() {
        return strategyManager.getStrategySummary();
    }

    // ---- Views ----

    public SystemStatus getSystemStatus() {
        return new SystemStatus(
                running.get(),
                Instant.now(),
                dataIngestionLoop.getQueueDepth(),
                strategyManager.getStrategySummary(),
                tradingEngine.getPositionSummary());
    }

    /**
     * Latest known price for a symbol: the cached market snapshot if it has not expired,
     * otherwise the price of the most recent trade on the symbol.
     */
    public Optional<BigDecimal> getLatestPrice(String symbol) {
        Optional<BigDecimal> cached = marketDataRepository.findLatestPrice(symbol);
        if (cached.isPresent()) {
            return cached;
        }
        List<Trade> trades = tradingEngine.getTradeHistory(symbol, null, null);
        return trades.isEmpty() ? Optional.empty() : Optional.of(trades.get(trades.size() - 1).getPrice());
    }

    public TradeHistory getTradeHistory(String symbol, Instant from, Instant to) {
        List<Trade> trades = tradingEngine.getTradeHistory(symbol, from, to);
        return new TradeHistory(trades.size(), trades);
    }
}
