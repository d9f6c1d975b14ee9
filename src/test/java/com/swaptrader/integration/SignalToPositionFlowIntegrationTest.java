package com.swaptrader.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.swaptrader.config.SimulatorConfig;
import com.swaptrader.domain.enums.OrderSide;
import com.swaptrader.domain.enums.OrderStatus;
import com.swaptrader.domain.enums.PositionStatus;
import com.swaptrader.domain.enums.StrategyType;
import com.swaptrader.domain.model.Candle;
import com.swaptrader.domain.model.DataPoint;
import com.swaptrader.domain.model.Order;
import com.swaptrader.domain.model.Position;
import com.swaptrader.domain.model.Trade;
import com.swaptrader.event.Event;
import com.swaptrader.event.EventType;
import com.swaptrader.ingestion.DataIngestionLoop;
import com.swaptrader.simulator.SimulatedExecutionClient;
import com.swaptrader.support.TradingFixture;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Candles in, filled order and open position out: ingestion loop, default 10/21 crossover
 * strategy, trading engine and simulated execution wired together over an in-memory store.
 *
 * <p>Twenty-one flat closes at 100 followed by 110 give a bullish cross on the 22nd candle, the
 * first one where both the current and previous averages exist.
 */
class SignalToPositionFlowIntegrationTest {

    private static final String SYMBOL = "SOL-USDC";
    private static final BigDecimal VOLUME = new BigDecimal("2000000");

    private TradingFixture fixture;
    private DataIngestionLoop loop;
    private Instant clock = Instant.parse("2024-01-01T00:00:00Z");

    @BeforeEach
    void setUp() {
        fixture = new TradingFixture(bus -> {
            SimulatedExecutionClient simulator = new SimulatedExecutionClient(bus, new SimulatorConfig());
            simulator.subscribe();
            return simulator;
        });
        loop = new DataIngestionLoop(
                fixture.strategyManager,
                fixture.tradingEngine,
                fixture.eventPublisherHelper,
                fixture.marketDataRepository);
        fixture.strategyManager.addStrategy("ma_sol", StrategyType.MA_CROSSOVER, SYMBOL, null);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private void feed(String close) {
        clock = clock.plusSeconds(60);
        loop.enqueue(DataPoint.candle(SYMBOL, clock, Candle.ofClose(new BigDecimal(close), VOLUME)));
        assertThat(loop.processNext()).isTrue();
    }

    private void feedCrossover() {
        for (int i = 0; i < 21; i++) {
            feed("100");
        }
        feed("110");
        feed("111");
        feed("112");
        feed("113");
    }

    @Test
    @DisplayName("a bullish crossover produces exactly one filled buy and an open position")
    void crossoverOpensPosition() {
        feedCrossover();

        List<Event> signals = fixture.eventBus.getHistory(EventType.STRATEGY_SIGNAL);
        assertThat(signals).hasSize(1);
        assertThat(signals.get(0).payload()).containsEntry("side", "buy").containsEntry("accepted", true);

        List<Event> filled = fixture.eventBus.getHistory(EventType.ORDER_FILLED);
        assertThat(filled).hasSize(1);
        Order order = fixture.orderLedger.requireOrder(filled.get(0).payload().get("id").toString());
        assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(order.getSide()).isEqualTo(OrderSide.BUY);
        assertThat(order.getFilledPrice()).isEqualByComparingTo("110");
        // (1000 * 0.02) / (110 * 0.05)
        assertThat(order.getSize()).isEqualByComparingTo("3.63636364");

        List<Position> open = fixture.positionLedger.getOpenPositions(SYMBOL);
        assertThat(open).hasSize(1);
        Position position = open.get(0);
        assertThat(position.getStatus()).isEqualTo(PositionStatus.OPEN);
        assertThat(position.getEntryPrice()).isEqualByComparingTo("110");
        assertThat(position.getStopLoss()).isEqualByComparingTo("104.5");
        assertThat(position.getCurrentPrice()).isEqualByComparingTo("113");
        assertThat(position.getMetadata()).containsEntry("strategy_id", "ma_sol");

        List<Trade> trades = fixture.tradingEngine.getTradeHistory(SYMBOL, null, null);
        assertThat(trades).singleElement().satisfies(trade -> {
            assertThat(trade.getPositionId()).isEqualTo(position.getId());
            assertThat(trade.getFee()).isEqualByComparingTo("1.20000000");
        });

        assertThat(fixture.strategyManager.getStrategySummary())
                .singleElement()
                .satisfies(summary -> assertThat(summary.currentPosition()).isEqualTo(position.getId()));
    }

    @Test
    @DisplayName("each candle refreshes the market snapshot that serves the latest price")
    void marketSnapshotCached() {
        feedCrossover();

        assertThat(fixture.marketDataRepository.findLatestPrice(SYMBOL)).contains(new BigDecimal("113"));
        assertThat(fixture.stateStore.raw("market:SOL-USDC:candle:1m"))
                .containsEntry("close", "113")
                .containsEntry("volume", "2000000");
    }

    @Test
    @DisplayName("a later drop through the stop closes the position at market")
    void stopLossClosesPosition() {
        feedCrossover();
        Position opened = fixture.positionLedger.getOpenPositions(SYMBOL).get(0);

        feed("100");

        Position closed = fixture.positionLedger.requirePosition(opened.getId());
        assertThat(closed.getStatus()).isEqualTo(PositionStatus.CLOSED);
        assertThat(closed.getCurrentPrice()).isEqualByComparingTo("100");
        assertThat(closed.getRealizedPnl()).isNegative();
        assertThat(closed.getMetadata()).containsEntry("reason", "stop_loss");
        assertThat(fixture.eventBus.getHistory(EventType.RISK_LIMIT_BREACH)).hasSize(1);
        assertThat(fixture.tradingEngine.getPositionSummary().getTotalPositions()).isZero();
    }
}
