package com.swaptrader.observability;

import com.swaptrader.event.Event;
import com.swaptrader.event.EventBus;
import com.swaptrader.event.EventType;
import com.swaptrader.strategy.StrategyManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the trading core, fed from {@link EventBus} subscriptions:
 * <ul>
 *   <li><b>orders.filled.count</b> / <b>orders.failed.count</b>: order outcomes</li>
 *   <li><b>positions.closed.count</b>: positions reaching CLOSED</li>
 *   <li><b>stoploss.triggered.count</b>: stop-loss breaches</li>
 *   <li><b>signals.accepted.count</b> / <b>signals.rejected.count</b>: strategy signal validation</li>
 *   <li><b>eventbus.handler.failures</b>: isolated handler failures, read from the bus</li>
 *   <li><b>active.strategies</b> (gauge): registered strategies</li>
 * </ul>
 */
@Service
public class TradingMetrics {

    private static final Logger log = LoggerFactory.getLogger(TradingMetrics.class);

    private final EventBus eventBus;

    private final Counter ordersFilledCounter;
    private final Counter ordersFailedCounter;
    private final Counter positionsClosedCounter;
    private final Counter stopLossTriggeredCounter;
    private final Counter signalsAcceptedCounter;
    private final Counter signalsRejectedCounter;

    public TradingMetrics(MeterRegistry meterRegistry, EventBus eventBus, StrategyManager strategyManager) {
        this.eventBus = eventBus;

        this.ordersFilledCounter = Counter.builder("orders.filled.count")
                .description("Orders filled by the execution venue")
                .register(meterRegistry);
        this.ordersFailedCounter = Counter.builder("orders.failed.count")
                .description("Orders that failed at quote or swap")
                .register(meterRegistry);
        this.positionsClosedCounter = Counter.builder("positions.closed.count")
                .description("Positions closed, manually or by stop-loss")
                .register(meterRegistry);
        this.stopLossTriggeredCounter = Counter.builder("stoploss.triggered.count")
                .description("Stop-loss breaches detected during mark-to-market")
                .register(meterRegistry);
        this.signalsAcceptedCounter = Counter.builder("signals.accepted.count")
                .description("Strategy signals that passed validation")
                .register(meterRegistry);
        this.signalsRejectedCounter = Counter.builder("signals.rejected.count")
                .description("Strategy signals dropped by validation")
                .register(meterRegistry);

        FunctionCounter.builder("eventbus.handler.failures", eventBus, EventBus::getHandlerFailureCount)
                .description("Event handlers that threw during dispatch")
                .register(meterRegistry);

        meterRegistry.gauge("active.strategies", strategyManager, StrategyManager::getStrategyCount);
    }

    @PostConstruct
    public void subscribe() {
        eventBus.subscribe(EventType.ORDER_FILLED, event -> ordersFilledCounter.increment());
        eventBus.subscribe(EventType.ORDER_FAILED, event -> ordersFailedCounter.increment());
        eventBus.subscribe(EventType.POSITION_CLOSED, event -> positionsClosedCounter.increment());
        eventBus.subscribe(EventType.RISK_LIMIT_BREACH, this::onRiskLimitBreach);
        eventBus.subscribe(EventType.STRATEGY_SIGNAL, this::onStrategySignal);
        log.info("Trading metrics subscribed to event bus");
    }

    private void onRiskLimitBreach(Event event) {
        if ("stop_loss".equals(event.payload().get("reason"))) {
            stopLossTriggeredCounter.increment();
        }
    }

    private void onStrategySignal(Event event) {
        if (Boolean.TRUE.equals(event.payload().get("accepted"))) {
            signalsAcceptedCounter.increment();
        } else {
            signalsRejectedCounter.increment();
        }
    }
}
