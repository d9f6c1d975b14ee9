package com.swaptrader.event;

import com.swaptrader.domain.model.Order;
import com.swaptrader.domain.model.Position;
import com.swaptrader.domain.model.Signal;
import com.swaptrader.domain.model.Trade;
import com.swaptrader.mapper.OrderRecordMapper;
import com.swaptrader.mapper.PositionRecordMapper;
import com.swaptrader.mapper.TradeRecordMapper;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Typed publish methods over the {@link EventBus}.
 *
 * <p>Entity payloads are the same flat records the ledgers persist, so a subscriber sees
 * exactly what was written to the store. Call sites read as
 * {@code eventPublisherHelper.publishOrderFilled(order)} instead of assembling maps inline.
 */
@Component
public class EventPublisherHelper {

    private final EventBus eventBus;
    private final OrderRecordMapper orderRecordMapper;
    private final TradeRecordMapper tradeRecordMapper;
    private final PositionRecordMapper positionRecordMapper;

    public EventPublisherHelper(
            EventBus eventBus,
            OrderRecordMapper orderRecordMapper,
            TradeRecordMapper tradeRecordMapper,
            PositionRecordMapper positionRecordMapper) {
        this.eventBus = eventBus;
        this.orderRecordMapper = orderRecordMapper;
        this.tradeRecordMapper = tradeRecordMapper;
        this.positionRecordMapper = positionRecordMapper;
    }

    // ---- Order ----

    public void publishOrderPlaced(Order order) {
        eventBus.emit(EventType.ORDER_PLACED, orderRecordMapper.toRecord(order));
    }

    public void publishOrderFilled(Order order) {
        eventBus.emit(EventType.ORDER_FILLED, orderRecordMapper.toRecord(order));
    }

    public void publishOrderFailed(Order order) {
        eventBus.emit(EventType.ORDER_FAILED, orderRecordMapper.toRecord(order));
    }

    public void publishOrderCancelled(Order order) {
        eventBus.emit(EventType.ORDER_CANCELLED, orderRecordMapper.toRecord(order));
    }

    // ---- Trade ----

    public void publishTradeExecuted(Trade trade) {
        eventBus.emit(EventType.TRADE_EXECUTED, tradeRecordMapper.toRecord(trade));
    }

    // ---- Position ----

    public void publishPositionOpened(Position position) {
        eventBus.emit(EventType.POSITION_OPENED, positionRecordMapper.toRecord(position));
    }

    public void publishPositionUpdated(Position position) {
        eventBus.emit(EventType.POSITION_UPDATED, positionRecordMapper.toRecord(position));
    }

    public void publishPositionClosed(Position position) {
        eventBus.emit(EventType.POSITION_CLOSED, positionRecordMapper.toRecord(position));
    }

    /** A position's stop-loss was breached at {@code price}; the position is now CLOSING. */
    public void publishStopLossTriggered(Position position, BigDecimal price) {
        Map<String, Object> payload = positionRecordMapper.toRecord(position);
        payload.put("reason", "stop_loss");
        payload.put("trigger_price", price.toPlainString());
        eventBus.emit(EventType.RISK_LIMIT_BREACH, payload);
    }

    // ---- Strategy ----

    public void publishStrategyStarted(String strategyId, String strategyType, String symbol) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("strategy_id", strategyId);
        payload.put("strategy_type", strategyType);
        payload.put("symbol", symbol);
        eventBus.emit(EventType.STRATEGY_STARTED, payload);
    }

    public void publishStrategyStopped(String strategyId) {
        eventBus.emit(EventType.STRATEGY_STOPPED, Map.of("strategy_id", strategyId));
    }

    public void publishStrategySignal(Signal signal, boolean accepted) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("strategy_id", signal.getStrategyId());
        payload.put("symbol", signal.getSymbol());
        payload.put("side", signal.getSide() != null ? signal.getSide().getValue() : null);
        payload.put("signal_type", signal.getSignalType() != null ? signal.getSignalType().getValue() : null);
        payload.put("size", signal.getSize() != null ? signal.getSize().toPlainString() : null);
        payload.put("price", signal.getPrice() != null ? signal.getPrice().toPlainString() : null);
        payload.put("confidence", signal.getConfidence());
        payload.put("accepted", accepted);
        eventBus.emit(EventType.STRATEGY_SIGNAL, payload);
    }

    // ---- System ----

    public void publishSystemStatus(String status, Map<String, Object> details) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (details != null) {
            payload.putAll(details);
        }
        payload.put("status", status);
        eventBus.emit(EventType.SYSTEM_STATUS, payload);
    }

    public void publishSystemError(String source, String message, Map<String, Object> details) {
        eventBus.emit(EventType.SYSTEM_ERROR, problemPayload(source, message, details));
    }

    public void publishSystemWarning(String source, String message, Map<String, Object> details) {
        eventBus.emit(EventType.SYSTEM_WARNING, problemPayload(source, message, details));
    }

    // ---- Market ----

    public void publishPriceUpdate(String symbol, BigDecimal price, Instant observedAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("symbol", symbol);
        payload.put("price", price.toPlainString());
        if (observedAt != null) {
            payload.put("observed_at", observedAt.toString());
        }
        eventBus.emit(EventType.PRICE_UPDATE, payload);
    }

    private static Map<String, Object> problemPayload(String source, String message, Map<String, Object> details) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (details != null) {
            payload.putAll(details);
        }
        payload.put("source", source);
        payload.put("error", message != null ? message : "unknown");
        return payload;
    }
}
