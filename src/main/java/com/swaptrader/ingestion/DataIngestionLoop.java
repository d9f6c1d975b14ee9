package com.swaptrader.ingestion;

import com.swaptrader.core.engine.TradingEngine;
import com.swaptrader.domain.enums.DataType;
import com.swaptrader.domain.model.Candle;
import com.swaptrader.domain.model.DataPoint;
import com.swaptrader.event.EventPublisherHelper;
import com.swaptrader.exception.StoreUnavailableException;
import com.swaptrader.repository.MarketDataRepository;
import com.swaptrader.strategy.StrategyManager;
import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Single consumer that takes queued {@link DataPoint}s in arrival order and processes them one
 * at a time.
 *
 * <p>For each point: candle and price points are first cached as the symbol's market snapshot,
 * published as {@code price_update} and used to mark open positions to market (which may trigger
 * stop-loss closes); then the point is routed to the strategies. A failure on one point is logged and reported as
 * {@code system_error}; the loop carries on with the next. A snapshot that cannot be cached is
 * only a {@code system_warning}.
 *
 * <p>{@link #stop()} interrupts the consumer, which exits without draining: points still queued
 * are left unprocessed. A point already being processed runs to completion.
 */
@Component
public class DataIngestionLoop {

    private static final Logger log = LoggerFactory.getLogger(DataIngestionLoop.class);

    private static final long STOP_JOIN_MILLIS = 5_000;

    private final LinkedBlockingQueue<DataPoint> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread consumerThread;

    private final StrategyManager strategyManager;
    private final TradingEngine tradingEngine;
    private final EventPublisherHelper eventPublisherHelper;
    private final MarketDataRepository marketDataRepository;

    public DataIngestionLoop(
            StrategyManager strategyManager,
            TradingEngine tradingEngine,
            EventPublisherHelper eventPublisherHelper,
            MarketDataRepository marketDataRepository) {
        this.strategyManager = strategyManager;
        this.tradingEngine = tradingEngine;
        this.eventPublisherHelper = eventPublisherHelper;
        this.marketDataRepository = marketDataRepository;
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            Thread thread = new Thread(this::processLoop, "data-ingestion");
            thread.setDaemon(true);
            consumerThread = thread;
            thread.start();
            log.info("Data ingestion loop started");
        }
    }

    /** Stops the consumer and waits briefly for it to exit. Queued points are not drained. */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread thread = consumerThread;
            if (thread != null) {
                thread.interrupt();
                if (thread != Thread.currentThread()) {
                    try {
                        thread.join(STOP_JOIN_MILLIS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
            log.info("Data ingestion loop stopped: undrained={}", queue.size());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public void enqueue(DataPoint dataPoint) {
        queue.add(dataPoint);
    }

    public int getQueueDepth() {
        return queue.size();
    }

    /**
     * Processes the oldest queued point on the calling thread.
     *
     * @return false if the queue was empty
     */
    public boolean processNext() {
        DataPoint dataPoint = queue.poll();
        if (dataPoint == null) {
            return false;
        }
        process(dataPoint);
        return true;
    }

    private void processLoop() {
        while (running.get()) {
            try {
                DataPoint dataPoint = queue.take();
                process(dataPoint);
            } catch (InterruptedException e) {
                if (!running.get()) {
                    log.info("Data ingestion loop interrupted during shutdown");
                    Thread.currentThread().interrupt();
                    break;
                }
                log.warn("Data ingestion loop interrupted unexpectedly, resuming");
            }
        }
    }

    private void process(DataPoint dataPoint) {
        try {
            BigDecimal price = marketPrice(dataPoint);
            if (price != null) {
                cacheSnapshot(dataPoint, price);
                eventPublisherHelper.publishPriceUpdate(dataPoint.getSymbol(), price, dataPoint.getTimestamp());
                int updated = tradingEngine.updatePositions(dataPoint.getSymbol(), price);
                if (updated > 0) {
                    log.debug("Marked to market: symbol={}, price={}, positions={}", dataPoint.getSymbol(), price, updated);
                }
            }
            strategyManager.processData(dataPoint);
        } catch (RuntimeException e) {
            log.error(
                    "Failed to process data point: symbol={}, type={}",
                    dataPoint.getSymbol(),
                    dataPoint.getDataType(),
                    e);
            eventPublisherHelper.publishSystemError(
                    "data_ingestion",
                    e.getMessage(),
                    Map.of(
                            "symbol",
                            String.valueOf(dataPoint.getSymbol()),
                            "data_type",
                            dataPoint.getDataType() != null ? dataPoint.getDataType().getValue() : "unknown"));
        }
    }

    private void cacheSnapshot(DataPoint dataPoint, BigDecimal price) {
        String symbol = dataPoint.getSymbol();
        try {
            if (dataPoint.getValue() instanceof Candle candle) {
                marketDataRepository.saveLatestPrice(symbol, price, candle.volume(), dataPoint.getTimestamp());
                marketDataRepository.saveCandle(symbol, interval(dataPoint), candle, dataPoint.getTimestamp());
            } else {
                marketDataRepository.saveLatestPrice(symbol, price, null, dataPoint.getTimestamp());
            }
        } catch (StoreUnavailableException e) {
            log.warn("Market snapshot not cached: symbol={}, error={}", symbol, e.getMessage());
            eventPublisherHelper.publishSystemWarning("data_ingestion", e.getMessage(), Map.of("symbol", symbol));
        }
    }

    private static String interval(DataPoint dataPoint) {
        Object interval = dataPoint.getMetadata() != null ? dataPoint.getMetadata().get("interval") : null;
        return interval != null ? interval.toString() : MarketDataRepository.DEFAULT_INTERVAL;
    }

    /** Price carried by a candle (its close) or price point; null for other data types. */
    private static BigDecimal marketPrice(DataPoint dataPoint) {
        if (dataPoint.getDataType() == DataType.CANDLE && dataPoint.getValue() instanceof Candle candle) {
            return candle.close();
        }
        if (dataPoint.getDataType() == DataType.PRICE) {
            Object value = dataPoint.getValue();
            if (value instanceof BigDecimal decimal) {
                return decimal;
            }
            if (value instanceof Number number) {
                return new BigDecimal(number.toString());
            }
        }
        return null;
    }
}
