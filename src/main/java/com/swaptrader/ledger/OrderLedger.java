package com.swaptrader.ledger;

import com.swaptrader.config.RedisConfig;
import com.swaptrader.domain.enums.OrderSide;
import com.swaptrader.domain.enums.OrderStatus;
import com.swaptrader.domain.enums.OrderType;
import com.swaptrader.domain.model.Order;
import com.swaptrader.domain.model.Trade;
import com.swaptrader.exception.InvalidStateException;
import com.swaptrader.exception.ResourceNotFoundException;
import com.swaptrader.exception.StoreUnavailableException;
import com.swaptrader.exception.ValidationException;
import com.swaptrader.mapper.OrderRecordMapper;
import com.swaptrader.mapper.TradeRecordMapper;
import com.swaptrader.repository.StateStore;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Authoritative record of orders and trades: a write-through cache over the {@link StateStore}.
 *
 * <p>Every mutation serializes the full record and writes it to the store first; the cache
 * entry is replaced only after that write succeeds, so a failed write leaves the previous value
 * visible and cache and store never disagree. Reads check the cache and fall back to the store
 * on a miss, populating the cache with what they find.
 *
 * <p>Callers always receive copies. Mutations are serialized on the ledger monitor so a
 * status check and the write that follows it cannot interleave with another transition.
 */
@Service
public class OrderLedger {

    private static final Logger log = LoggerFactory.getLogger(OrderLedger.class);

    private final Map<String, Order> orders = new ConcurrentHashMap<>();
    private final Map<String, Trade> trades = new ConcurrentHashMap<>();

    private final StateStore stateStore;
    private final OrderRecordMapper orderRecordMapper;
    private final TradeRecordMapper tradeRecordMapper;
    private final EntityIdGenerator idGenerator;

    public OrderLedger(
            StateStore stateStore,
            OrderRecordMapper orderRecordMapper,
            TradeRecordMapper tradeRecordMapper,
            EntityIdGenerator idGenerator) {
        this.stateStore = stateStore;
        this.orderRecordMapper = orderRecordMapper;
        this.tradeRecordMapper = tradeRecordMapper;
        this.idGenerator = idGenerator;
    }

    // ---- Orders ----

    /** Creates and persists a PENDING order. */
    public synchronized Order createOrder(
            String symbol,
            OrderSide side,
            BigDecimal size,
            OrderType type,
            BigDecimal price,
            Map<String, Object> metadata) {
        if (symbol == null || symbol.isBlank()) {
            throw new ValidationException("Order symbol is required");
        }
        if (side == null || type == null) {
            throw new ValidationException("Order side and type are required");
        }
        if (size == null || size.signum() <= 0) {
            throw new ValidationException("Order size must be positive", Map.of("size", String.valueOf(size)));
        }

        Order order = Order.builder()
                .id(idGenerator.nextOrderId())
                .symbol(symbol)
                .side(side)
                .size(size)
                .price(price)
                .type(type)
                .status(OrderStatus.PENDING)
                .submittedAt(Instant.now())
                .metadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>())
                .build();
        writeOrder(order);
        log.info("Order created: orderId={}, symbol={}, side={}, size={}", order.getId(), symbol, side, size);
        return order.copy();
    }

    public Optional<Order> getOrder(String orderId) {
        return Optional.ofNullable(loadOrder(orderId)).map(Order::copy);
    }

    public Order requireOrder(String orderId) {
        return getOrder(orderId).orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    }

    public Order markFilled(String orderId, BigDecimal filledPrice, BigDecimal filledSize) {
        return transition(orderId, OrderStatus.FILLED, order -> {
            order.setFilledPrice(filledPrice);
            order.setFilledSize(filledSize);
            order.setFilledAt(Instant.now());
        });
    }

    public Order markFailed(String orderId, String error) {
        return transition(orderId, OrderStatus.FAILED, order -> order.setError(error));
    }

    public Order cancelOrder(String orderId) {
        return transition(orderId, OrderStatus.CANCELLED, order -> {});
    }

    /**
     * Moves an order to {@code next}, applying {@code mutation} to the new version before it is
     * persisted. Only forward transitions out of PENDING are allowed.
     *
     * @throws ResourceNotFoundException if the order does not exist
     * @throws InvalidStateException     if the transition is not allowed from the current status
     */
    public synchronized Order transition(String orderId, OrderStatus next, Consumer<Order> mutation) {
        Order current = loadOrder(orderId);
        if (current == null) {
            throw new ResourceNotFoundException("Order", orderId);
        }
        if (!current.getStatus().canTransitionTo(next)) {
            throw new InvalidStateException(
                    "Order " + orderId + " cannot move from " + current.getStatus().getValue() + " to "
                            + next.getValue(),
                    Map.of("orderId", orderId, "from", current.getStatus().getValue(), "to", next.getValue()));
        }

        Order updated = current.copy();
        mutation.accept(updated);
        updated.setStatus(next);
        writeOrder(updated);
        log.info("Order {}: orderId={}", next.getValue(), orderId);
        return updated.copy();
    }

    /** Pending orders known to this process; candidates for reconciliation after a restart. */
    public List<Order> getPendingOrders() {
        return orders.values().stream()
                .filter(o -> o.getStatus() == OrderStatus.PENDING)
                .sorted(Comparator.comparing(Order::getSubmittedAt))
                .map(Order::copy)
                .toList();
    }

    // ---- Trades ----

    /**
     * Records a fill against an existing order. Symbol and side are taken from the order.
     *
     * @param positionId position the trade belongs to, or null when the position does not exist yet
     */
    public synchronized Trade createTrade(
            String orderId,
            String positionId,
            BigDecimal price,
            BigDecimal size,
            BigDecimal fee,
            Map<String, Object> metadata) {
        Order order = loadOrder(orderId);
        if (order == null) {
            throw new ResourceNotFoundException("Order", orderId);
        }

        Trade trade = Trade.builder()
                .id(idGenerator.nextTradeId())
                .orderId(orderId)
                .positionId(positionId)
                .symbol(order.getSymbol())
                .side(order.getSide())
                .size(size)
                .price(price)
                .fee(fee != null ? fee : BigDecimal.ZERO)
                .timestamp(Instant.now())
                .metadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>())
                .build();
        writeTrade(trade);
        log.info(
                "Trade recorded: tradeId={}, orderId={}, price={}, size={}",
                trade.getId(),
                orderId,
                price,
                size);
        return trade.copy();
    }

    /**
     * Links a trade to the position it opened. A trade's position id is set at most once.
     *
     * @throws InvalidStateException if the trade already references a position
     */
    public synchronized Trade attachPosition(String tradeId, String positionId) {
        Trade current = loadTrade(tradeId);
        if (current == null) {
            throw new ResourceNotFoundException("Trade", tradeId);
        }
        if (current.getPositionId() != null) {
            throw new InvalidStateException(
                    "Trade " + tradeId + " already belongs to position " + current.getPositionId(),
                    Map.of("tradeId", tradeId, "positionId", current.getPositionId()));
        }

        Trade updated = current.copy();
        updated.setPositionId(positionId);
        writeTrade(updated);
        return updated.copy();
    }

    public Optional<Trade> getTrade(String tradeId) {
        return Optional.ofNullable(loadTrade(tradeId)).map(Trade::copy);
    }

    /**
     * Trades known to this process, filtered by symbol and an inclusive time range (each filter
     * optional), sorted by timestamp ascending.
     */
    public List<Trade> getTrades(String symbol, Instant from, Instant to) {
        return trades.values().stream()
                .filter(t -> symbol == null || symbol.equals(t.getSymbol()))
                .filter(t -> from == null || !t.getTimestamp().isBefore(from))
                .filter(t -> to == null || !t.getTimestamp().isAfter(to))
                .sorted(Comparator.comparing(Trade::getTimestamp))
                .map(Trade::copy)
                .toList();
    }

    public List<Trade> getTradesForOrder(String orderId) {
        return trades.values().stream()
                .filter(t -> orderId.equals(t.getOrderId()))
                .sorted(Comparator.comparing(Trade::getTimestamp))
                .map(Trade::copy)
                .toList();
    }

    // ---- Store access ----

    private Order loadOrder(String orderId) {
        Order cached = orders.get(orderId);
        if (cached != null) {
            return cached;
        }
        String key = RedisConfig.orderKey(orderId);
        Optional<Order> stored = stateStore.get(key).map(record -> orderRecordMapper.fromRecord(key, record));
        if (stored.isEmpty()) {
            return null;
        }
        log.debug("Order loaded from store: orderId={}", orderId);
        Order existing = orders.putIfAbsent(orderId, stored.get());
        return existing != null ? existing : stored.get();
    }

    private Trade loadTrade(String tradeId) {
        Trade cached = trades.get(tradeId);
        if (cached != null) {
            return cached;
        }
        String key = RedisConfig.tradeKey(tradeId);
        Optional<Trade> stored = stateStore.get(key).map(record -> tradeRecordMapper.fromRecord(key, record));
        if (stored.isEmpty()) {
            return null;
        }
        Trade existing = trades.putIfAbsent(tradeId, stored.get());
        return existing != null ? existing : stored.get();
    }

    private void writeOrder(Order order) {
        String key = RedisConfig.orderKey(order.getId());
        if (!stateStore.set(key, orderRecordMapper.toRecord(order))) {
            throw new StoreUnavailableException("Store rejected write for key " + key, null);
        }
        orders.put(order.getId(), order.copy());
    }

    private void writeTrade(Trade trade) {
        String key = RedisConfig.tradeKey(trade.getId());
        if (!stateStore.set(key, tradeRecordMapper.toRecord(trade))) {
            throw new StoreUnavailableException("Store rejected write for key " + key, null);
        }
        trades.put(trade.getId(), trade.copy());
    }
}
