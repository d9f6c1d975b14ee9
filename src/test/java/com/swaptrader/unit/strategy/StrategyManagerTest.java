package com.swaptrader.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.swaptrader.config.TradingConfig;
import com.swaptrader.core.engine.TradingEngine;
import com.swaptrader.domain.enums.DataType;
import com.swaptrader.domain.enums.OrderSide;
import com.swaptrader.domain.enums.SignalType;
import com.swaptrader.domain.enums.StrategyType;
import com.swaptrader.domain.model.Candle;
import com.swaptrader.domain.model.DataPoint;
import com.swaptrader.domain.model.Order;
import com.swaptrader.domain.model.Position;
import com.swaptrader.domain.model.PositionSummary;
import com.swaptrader.domain.model.Signal;
import com.swaptrader.event.EventPublisherHelper;
import com.swaptrader.exception.InvalidStateException;
import com.swaptrader.exception.ResourceNotFoundException;
import com.swaptrader.exception.TradeExecutionException;
import com.swaptrader.exception.ValidationException;
import com.swaptrader.strategy.StrategyFactory;
import com.swaptrader.strategy.StrategyManager;
import com.swaptrader.strategy.StrategySummary;
import com.swaptrader.strategy.base.BaseStrategy;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class StrategyManagerTest {

    private StrategyFactory strategyFactory;
    private TradingEngine tradingEngine;
    private EventPublisherHelper eventPublisherHelper;
    private TradingConfig tradingConfig;
    private StrategyManager strategyManager;

    @BeforeEach
    void setUp() {
        strategyFactory = mock(StrategyFactory.class);
        tradingEngine = mock(TradingEngine.class);
        eventPublisherHelper = mock(EventPublisherHelper.class);
        tradingConfig = new TradingConfig();
        strategyManager = new StrategyManager(strategyFactory, tradingEngine, eventPublisherHelper, tradingConfig);
    }

    private BaseStrategy register(String id, String symbol) {
        BaseStrategy strategy = mock(BaseStrategy.class);
        when(strategy.getId()).thenReturn(id);
        when(strategy.getSymbol()).thenReturn(symbol);
        when(strategy.getType()).thenReturn(StrategyType.MA_CROSSOVER);
        when(strategy.isActive()).thenReturn(true);
        when(strategy.getDataRequirements()).thenReturn(EnumSet.of(DataType.CANDLE));
        when(strategy.generateSignal()).thenReturn(Optional.empty());
        when(strategyFactory.create(eq(StrategyType.MA_CROSSOVER), eq(id), eq(symbol), any()))
                .thenReturn(strategy);
        strategyManager.addStrategy(id, StrategyType.MA_CROSSOVER, symbol, null);
        return strategy;
    }

    private static DataPoint candle(String symbol, String close) {
        return DataPoint.candle(
                symbol, Instant.now(), Candle.ofClose(new BigDecimal(close), new BigDecimal("2000000")));
    }

    private static Signal signal(String strategyId, OrderSide side, SignalType type) {
        return Signal.builder()
                .strategyId(strategyId)
                .symbol("SOL-USDC")
                .side(side)
                .size(new BigDecimal("2"))
                .price(new BigDecimal("100"))
                .signalType(type)
                .confidence(0.8)
                .timestamp(Instant.now())
                .build();
    }

    private static Position position(String id, String symbol, String owner) {
        return Position.builder()
                .id(id)
                .symbol(symbol)
                .side(OrderSide.BUY)
                .size(BigDecimal.ONE)
                .metadata(owner != null ? new HashMap<>(Map.of("strategy_id", owner)) : new HashMap<>())
                .build();
    }

    @Nested
    @DisplayName("Registry")
    class Registry {

        @Test
        @DisplayName("added strategies are initialized and announced")
        void add() {
            BaseStrategy strategy = register("ma_1", "SOL-USDC");

            verify(strategy).initialize();
            verify(eventPublisherHelper).publishStrategyStarted("ma_1", "ma_crossover", "SOL-USDC");
            assertThat(strategyManager.getStrategy("ma_1")).containsSame(strategy);
            assertThat(strategyManager.getStrategyCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("duplicate id is rejected without creating a second instance")
        void duplicate() {
            register("ma_1", "SOL-USDC");

            assertThatThrownBy(() -> strategyManager.addStrategy("ma_1", StrategyType.MA_CROSSOVER, "SOL-USDC", null))
                    .isInstanceOf(InvalidStateException.class);
            verify(strategyFactory, times(1)).create(any(), anyString(), anyString(), any());
        }

        @Test
        @DisplayName("malformed symbol is rejected before creation")
        void badSymbol() {
            assertThatThrownBy(() -> strategyManager.addStrategy("ma_1", StrategyType.MA_CROSSOVER, "SOLUSDC", null))
                    .isInstanceOf(ValidationException.class);
            verify(strategyFactory, never()).create(any(), anyString(), anyString(), any());
        }

        @Test
        @DisplayName("remove cleans up and announces the stop")
        void remove() {
            BaseStrategy strategy = register("ma_1", "SOL-USDC");

            strategyManager.removeStrategy("ma_1");

            verify(strategy).cleanup();
            verify(eventPublisherHelper).publishStrategyStopped("ma_1");
            assertThat(strategyManager.getStrategyCount()).isZero();
        }

        @Test
        @DisplayName("removing an unknown strategy is not found")
        void removeUnknown() {
            assertThatThrownBy(() -> strategyManager.removeStrategy("nope"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("summary is sorted by id")
        void summary() {
            register("ma_2", "ETH-USDC");
            register("ma_1", "SOL-USDC");

            assertThat(strategyManager.getStrategySummary())
                    .extracting(StrategySummary::strategyId)
                    .containsExactly("ma_1", "ma_2");
        }
    }

    @Nested
    @DisplayName("Routing")
    class Routing {

        @Test
        @DisplayName("points reach only strategies with a matching symbol and data type")
        void routesBySymbolAndType() {
            BaseStrategy sol = register("ma_sol", "SOL-USDC");
            BaseStrategy eth = register("ma_eth", "ETH-USDC");

            DataPoint solCandle = candle("SOL-USDC", "100");
            strategyManager.processData(solCandle);
            strategyManager.processData(DataPoint.builder()
                    .dataType(DataType.PRICE)
                    .symbol("SOL-USDC")
                    .timestamp(Instant.now())
                    .value(new BigDecimal("100"))
                    .build());

            verify(sol, times(1)).processData(any());
            verify(sol).processData(solCandle);
            verify(eth, never()).processData(any());
        }

        @Test
        @DisplayName("a failing strategy does not stop the others")
        void failureIsolation() {
            BaseStrategy broken = register("ma_a", "SOL-USDC");
            BaseStrategy healthy = register("ma_b", "SOL-USDC");
            doThrow(new IllegalStateException("bad data"))
                    .when(broken)
                    .processData(any());

            strategyManager.processData(candle("SOL-USDC", "100"));

            verify(healthy).processData(any());
            verify(eventPublisherHelper).publishSystemError(eq("strategy_manager"), eq("bad data"), any());
        }
    }

    @Nested
    @DisplayName("Signals")
    class Signals {

        @Test
        @DisplayName("rejected signals are reported and never executed")
        void rejected() {
            BaseStrategy strategy = register("ma_1", "SOL-USDC");
            Signal buy = signal("ma_1", OrderSide.BUY, SignalType.ENTRY);
            when(strategy.generateSignal()).thenReturn(Optional.of(buy));
            when(strategy.validateSignal(buy)).thenReturn(false);

            strategyManager.processData(candle("SOL-USDC", "100"));

            verify(eventPublisherHelper).publishStrategySignal(buy, false);
            verify(tradingEngine, never()).executeMarketOrder(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("accepted entry opens a position with a derived stop and records it on the strategy")
        @SuppressWarnings("unchecked")
        void entry() {
            BaseStrategy strategy = register("ma_1", "SOL-USDC");
            Signal buy = signal("ma_1", OrderSide.BUY, SignalType.ENTRY);
            when(strategy.generateSignal()).thenReturn(Optional.of(buy));
            when(strategy.validateSignal(buy)).thenReturn(true);
            Order order = Order.builder().id("ord_1").build();
            when(tradingEngine.executeMarketOrder(any(), any(), any(), any(), any())).thenReturn(order);
            Position opened = Position.builder().id("pos_1").size(new BigDecimal("2")).build();
            when(tradingEngine.findPositionForOrder("ord_1")).thenReturn(Optional.of(opened));

            strategyManager.processData(candle("SOL-USDC", "100"));

            ArgumentCaptor<BigDecimal> stop = ArgumentCaptor.forClass(BigDecimal.class);
            ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
            verify(tradingEngine)
                    .executeMarketOrder(
                            eq("SOL-USDC"), eq(OrderSide.BUY), eq(new BigDecimal("2")), stop.capture(), metadata.capture());
            assertThat(stop.getValue()).isEqualByComparingTo("95");
            assertThat(metadata.getValue()).containsEntry("strategy_id", "ma_1").containsEntry("signal_confidence", 0.8);
            verify(strategy).recordPosition("pos_1", new BigDecimal("2"));
            verify(eventPublisherHelper).publishStrategySignal(buy, true);
        }

        @Test
        @DisplayName("sell entries put the stop above the entry price")
        void sellStop() {
            BaseStrategy strategy = register("ma_1", "SOL-USDC");
            Signal sell = signal("ma_1", OrderSide.SELL, SignalType.ENTRY);
            when(strategy.generateSignal()).thenReturn(Optional.of(sell));
            when(strategy.validateSignal(sell)).thenReturn(true);
            when(tradingEngine.executeMarketOrder(any(), any(), any(), any(), any()))
                    .thenReturn(Order.builder().id("ord_1").build());
            when(tradingEngine.findPositionForOrder("ord_1")).thenReturn(Optional.empty());

            strategyManager.processData(candle("SOL-USDC", "100"));

            ArgumentCaptor<BigDecimal> stop = ArgumentCaptor.forClass(BigDecimal.class);
            verify(tradingEngine).executeMarketOrder(any(), any(), any(), stop.capture(), any());
            assertThat(stop.getValue()).isEqualByComparingTo("105");
        }

        @Test
        @DisplayName("a zero stop distance opens entries without a stop")
        void noStop() {
            tradingConfig.setDefaultStopLossPercent(BigDecimal.ZERO);
            BaseStrategy strategy = register("ma_1", "SOL-USDC");
            Signal buy = signal("ma_1", OrderSide.BUY, SignalType.ENTRY);
            when(strategy.generateSignal()).thenReturn(Optional.of(buy));
            when(strategy.validateSignal(buy)).thenReturn(true);
            when(tradingEngine.executeMarketOrder(any(), any(), any(), any(), any()))
                    .thenReturn(Order.builder().id("ord_1").build());
            when(tradingEngine.findPositionForOrder("ord_1")).thenReturn(Optional.empty());

            strategyManager.processData(candle("SOL-USDC", "100"));

            verify(tradingEngine).executeMarketOrder(any(), any(), any(), isNull(), any());
        }

        @Test
        @DisplayName("exit closes only the strategy's own positions on the symbol")
        void exit() {
            BaseStrategy strategy = register("ma_1", "SOL-USDC");
            Signal exit = signal("ma_1", OrderSide.SELL, SignalType.EXIT);
            when(strategy.generateSignal()).thenReturn(Optional.of(exit));
            when(strategy.validateSignal(exit)).thenReturn(true);
            List<Position> live = List.of(
                    position("pos_own", "SOL-USDC", "ma_1"),
                    position("pos_other", "SOL-USDC", "ma_2"),
                    position("pos_manual", "SOL-USDC", null),
                    position("pos_eth", "ETH-USDC", "ma_1"));
            when(tradingEngine.getPositionSummary())
                    .thenReturn(PositionSummary.builder()
                            .totalPositions(live.size())
                            .totalUnrealizedPnl(BigDecimal.ZERO)
                            .activeSymbols(Set.of("SOL-USDC", "ETH-USDC"))
                            .positions(live)
                            .build());

            strategyManager.processData(candle("SOL-USDC", "100"));

            verify(tradingEngine).closePosition("pos_own", Map.of("reason", "strategy_exit"));
            verify(tradingEngine, times(1)).closePosition(anyString(), any());
            verify(strategy).recordPosition(null, BigDecimal.ZERO);
        }

        @Test
        @DisplayName("execution failure is reported and routing continues")
        void executionFailure() {
            BaseStrategy strategy = register("ma_1", "SOL-USDC");
            Signal buy = signal("ma_1", OrderSide.BUY, SignalType.ENTRY);
            when(strategy.generateSignal()).thenReturn(Optional.of(buy));
            when(strategy.validateSignal(buy)).thenReturn(true);
            when(tradingEngine.executeMarketOrder(any(), any(), any(), any(), any()))
                    .thenThrow(new TradeExecutionException("no liquidity"));

            strategyManager.processData(candle("SOL-USDC", "100"));

            verify(eventPublisherHelper).publishSystemError(eq("strategy_manager"), eq("no liquidity"), any());
            verify(strategy, never()).recordPosition(any(), any());
        }
    }
}
