package com.swaptrader.core.engine;

import com.swaptrader.domain.enums.OrderSide;
import com.swaptrader.domain.enums.OrderType;
import com.swaptrader.domain.enums.PositionStatus;
import com.swaptrader.domain.model.Order;
import com.swaptrader.domain.model.Position;
import com.swaptrader.domain.model.PositionSummary;
import com.swaptrader.domain.model.Trade;
import com.swaptrader.event.EventPublisherHelper;
import com.swaptrader.exception.InvalidStateException;
import com.swaptrader.exception.ResourceNotFoundException;
import com.swaptrader.exception.TradeExecutionException;
import com.swaptrader.exception.ValidationException;
import com.swaptrader.execution.ExecutionClient;
import com.swaptrader.execution.Quote;
import com.swaptrader.execution.SwapResult;
import com.swaptrader.execution.TokenPair;
import com.swaptrader.ledger.OrderLedger;
import com.swaptrader.ledger.PositionLedger;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Turns trade decisions into ledger state: creates orders, runs them through the
 * {@link ExecutionClient}, records the resulting trades and opens or closes positions.
 *
 * <p>This is the only component that mutates the ledgers as the result of a trade. Execution
 * failures mark the triggering order FAILED, emit {@code order_failed} and {@code system_error},
 * and propagate to the caller. Nothing is retried.
 *
 * <p>Mutations of a single position (close, mark-to-market) are serialized with a per-position
 * lock, so a stop-loss close racing a manual close produces exactly one CLOSED transition; the
 * loser sees the position already closed and fails with {@link InvalidStateException}. Events
 * raised under a position lock are published after it is released, and the lock itself is
 * dropped once the position is CLOSED.
 */
@Service
public class TradingEngine {

    private static final Logger log = LoggerFactory.getLogger(TradingEngine.class);

    private final ConcurrentHashMap<String, ReentrantLock> positionLocks = new ConcurrentHashMap<>();

    private final OrderLedger orderLedger;
    private final PositionLedger positionLedger;
    private final ExecutionClient executionClient;
    private final EventPublisherHelper eventPublisherHelper;
    private final Executor tradingExecutor;

    public TradingEngine(
            OrderLedger orderLedger,
            PositionLedger positionLedger,
            ExecutionClient executionClient,
            EventPublisherHelper eventPublisherHelper,
            @Qualifier("tradingExecutor") Executor tradingExecutor) {
        this.orderLedger = orderLedger;
        this.positionLedger = positionLedger;
        this.executionClient = executionClient;
        this.eventPublisherHelper = eventPublisherHelper;
        this.tradingExecutor = tradingExecutor;
    }

    // ---- Entry ----

    /**
     * Opens a position with a market order.
     *
     * <ol>
     *   <li>Create the order (PENDING)</li>
     *   <li>Quote and execute the swap for the symbol's token pair</li>
     *   <li>Record the trade, open the position from it, link the trade to the position</li>
     *   <li>Mark the order FILLED</li>
     * </ol>
     *
     * @param stopLoss stop price for the new position, or null for none
     * @return the filled order; the trade and position are reachable through the ledgers
     * @throws ValidationException     if the symbol is malformed or the size is not positive
     * @throws TradeExecutionException if the quote or swap fails (the order is then FAILED)
     */
    public Order executeMarketOrder(
            String symbol, OrderSide side, BigDecimal size, BigDecimal stopLoss, Map<String, Object> metadata) {
        TokenPair pair = TokenPair.parse(symbol);
        if (side == null) {
            throw new ValidationException("Order side is required");
        }
        if (size == null || size.signum() <= 0) {
            throw new ValidationException("Order size must be positive", Map.of("size", String.valueOf(size)));
        }

        Order order = orderLedger.createOrder(symbol, side, size, OrderType.MARKET, null, metadata);
        eventPublisherHelper.publishOrderPlaced(order);

        List<Runnable> failureEvents = new ArrayList<>();
        SwapResult result;
        try {
            result = swap(order, pair, failureEvents);
        } finally {
            publishAll(failureEvents);
        }

        Trade trade = orderLedger.createTrade(
                order.getId(), null, result.price(), result.size(), result.fee(), swapMetadata(result));

        Map<String, Object> positionMetadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        positionMetadata.put("order_id", order.getId());
        Position position = positionLedger.createPosition(
                symbol, side, result.size(), result.price(), stopLoss, positionMetadata);

        trade = orderLedger.attachPosition(trade.getId(), position.getId());
        Order filled = orderLedger.markFilled(order.getId(), result.price(), result.size());

        eventPublisherHelper.publishTradeExecuted(trade);
        eventPublisherHelper.publishPositionOpened(position);
        eventPublisherHelper.publishOrderFilled(filled);

        log.info(
                "Market order filled: orderId={}, symbol={}, side={}, size={}, price={}, positionId={}",
                filled.getId(),
                symbol,
                side,
                result.size(),
                result.price(),
                position.getId());
        return filled;
    }

    // ---- Exit ----

    /**
     * Closes a position in full with an opposite-side market order.
     *
     * @throws ResourceNotFoundException if the position does not exist
     * @throws InvalidStateException     if the position is already CLOSED
     * @throws TradeExecutionException   if the swap fails; the position keeps its prior status
     */
    public Position closePosition(String positionId, Map<String, Object> metadata) {
        List<Runnable> events = new ArrayList<>();
        ReentrantLock lock = lockFor(positionId);
        boolean terminal = false;
        lock.lock();
        try {
            Optional<Position> found = positionLedger.getPosition(positionId);
            if (found.isEmpty()) {
                terminal = true;
                throw new ResourceNotFoundException("Position", positionId);
            }
            Position position = found.get();
            if (position.getStatus() == PositionStatus.CLOSED) {
                terminal = true;
                throw new InvalidStateException(
                        "Position " + positionId + " is already closed",
                        Map.of("positionId", positionId, "status", position.getStatus().getValue()));
            }
            Position closed = doClosePosition(position, metadata, events);
            terminal = true;
            return closed;
        } finally {
            lock.unlock();
            if (terminal) {
                releaseLock(positionId, lock);
            }
            publishAll(events);
        }
    }

    private Position doClosePosition(Position position, Map<String, Object> metadata, List<Runnable> events) {
        String positionId = position.getId();
        TokenPair pair = TokenPair.parse(position.getSymbol());
        OrderSide closeSide = position.getSide().opposite();

        Map<String, Object> orderMetadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        orderMetadata.put("position_id", positionId);
        orderMetadata.put("action", "close");
        Order order = orderLedger.createOrder(
                position.getSymbol(), closeSide, position.getSize(), OrderType.MARKET, null, orderMetadata);
        events.add(() -> eventPublisherHelper.publishOrderPlaced(order));

        SwapResult result = swap(order, pair, events);

        Trade trade = orderLedger.createTrade(
                order.getId(), positionId, result.price(), result.size(), result.fee(), swapMetadata(result));
        Order filled = orderLedger.markFilled(order.getId(), result.price(), result.size());
        Position closed = positionLedger.closePosition(positionId, result.price(), metadata);

        events.add(() -> eventPublisherHelper.publishTradeExecuted(trade));
        events.add(() -> eventPublisherHelper.publishOrderFilled(filled));
        events.add(() -> eventPublisherHelper.publishPositionClosed(closed));
        return closed;
    }

    // ---- Mark to market ----

    /**
     * Revalues every OPEN/CLOSING position on {@code symbol} at {@code currentPrice}, then closes
     * every position that is (or just became) CLOSING with {@code reason=stop_loss}.
     *
     * <p>Failures are isolated per position: one that cannot be revalued or closed is logged and
     * left as it was, and the rest of the batch still runs.
     *
     * @return number of positions revalued
     */
    public int updatePositions(String symbol, BigDecimal currentPrice) {
        List<Position> live = positionLedger.getOpenPositions(symbol);
        List<String> toClose = new ArrayList<>();
        int updated = 0;

        for (Position position : live) {
            List<Runnable> events = new ArrayList<>();
            ReentrantLock lock = lockFor(position.getId());
            boolean terminal = false;
            lock.lock();
            try {
                Position marked = positionLedger.markToMarket(position.getId(), currentPrice, null);
                updated++;
                events.add(() -> eventPublisherHelper.publishPositionUpdated(marked));
                if (position.getStatus() == PositionStatus.OPEN && marked.getStatus() == PositionStatus.CLOSING) {
                    events.add(() -> eventPublisherHelper.publishStopLossTriggered(marked, currentPrice));
                }
                if (marked.getStatus() == PositionStatus.CLOSING) {
                    toClose.add(marked.getId());
                }
            } catch (InvalidStateException e) {
                terminal = true;
                log.debug("Position closed before revaluation: positionId={}", position.getId());
            } catch (RuntimeException e) {
                log.error("Failed to revalue position: positionId={}", position.getId(), e);
                events.add(() -> eventPublisherHelper.publishSystemError(
                        "trading_engine", e.getMessage(), Map.of("position_id", position.getId())));
            } finally {
                lock.unlock();
                if (terminal) {
                    releaseLock(position.getId(), lock);
                }
                publishAll(events);
            }
        }

        for (String positionId : toClose) {
            try {
                closePosition(positionId, Map.of("reason", "stop_loss"));
                log.info("Stop-loss close completed: positionId={}, price={}", positionId, currentPrice);
            } catch (RuntimeException e) {
                log.error("Stop-loss close failed: positionId={}", positionId, e);
                eventPublisherHelper.publishSystemError(
                        "trading_engine", e.getMessage(), Map.of("position_id", positionId, "reason", "stop_loss"));
            }
        }
        return updated;
    }

    // ---- Batch close ----

    /**
     * Best-effort close of every live position. Each close runs as its own task on the trading
     * executor; all tasks are awaited and one failure never prevents the others.
     */
    public BatchCloseResult closeAllPositions(String reason) {
        List<Position> live = positionLedger.getOpenPositions(null);
        if (live.isEmpty()) {
            return new BatchCloseResult(List.of(), Map.of());
        }
        log.info("Closing all positions: count={}, reason={}", live.size(), reason);

        Map<String, CompletableFuture<Position>> tasks = new LinkedHashMap<>();
        for (Position position : live) {
            String positionId = position.getId();
            tasks.put(
                    positionId,
                    CompletableFuture.supplyAsync(
                            () -> closePosition(positionId, Map.of("reason", reason)), tradingExecutor));
        }

        List<String> closed = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<Position>> entry : tasks.entrySet()) {
            try {
                entry.getValue().join();
                closed.add(entry.getKey());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Close failed during batch: positionId={}", entry.getKey(), cause);
                failures.put(entry.getKey(), describe(cause));
            }
        }

        if (!failures.isEmpty()) {
            eventPublisherHelper.publishSystemError(
                    "trading_engine",
                    "Failed to close " + failures.size() + " of " + live.size() + " positions",
                    Map.of("reason", reason, "failed_positions", List.copyOf(failures.keySet())));
        }
        log.info("Close-all finished: closed={}, failed={}", closed.size(), failures.size());
        return new BatchCloseResult(List.copyOf(closed), Map.copyOf(failures));
    }

    // ---- Orders ----

    /** Cancels a PENDING order, e.g. one left behind by an interrupted execution. */
    public Order cancelOrder(String orderId) {
        Order cancelled = orderLedger.cancelOrder(orderId);
        eventPublisherHelper.publishOrderCancelled(cancelled);
        return cancelled;
    }

    // ---- Read-only projections ----

    /** Position locks currently retained; positions drop theirs once CLOSED. */
    public int getPositionLockCount() {
        return positionLocks.size();
    }

    public PositionSummary getPositionSummary() {
        List<Position> live = positionLedger.getOpenPositions(null);
        BigDecimal totalUnrealized = live.stream()
                .map(Position::getUnrealizedPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        Set<String> symbols =
                live.stream().map(Position::getSymbol).collect(Collectors.toCollection(TreeSet::new));
        return PositionSummary.builder()
                .totalPositions(live.size())
                .totalUnrealizedPnl(totalUnrealized)
                .activeSymbols(symbols)
                .positions(live)
                .build();
    }

    /** The position opened by a filled entry order, if any. */
    public Optional<Position> findPositionForOrder(String orderId) {
        return orderLedger.getTradesForOrder(orderId).stream()
                .map(Trade::getPositionId)
                .filter(Objects::nonNull)
                .findFirst()
                .flatMap(positionLedger::getPosition);
    }

    /** Trades filtered by symbol and inclusive time range (each optional), oldest first. */
    public List<Trade> getTradeHistory(String symbol, Instant from, Instant to) {
        return orderLedger.getTrades(symbol, from, to);
    }

    // ---- Internal ----

    /**
     * Quotes and executes the swap for {@code order}. On any failure the order is marked FAILED
     * with the error text before the failure propagates; the failure events are appended to
     * {@code events} for the caller to publish.
     */
    private SwapResult swap(Order order, TokenPair pair, List<Runnable> events) {
        OrderSide side = order.getSide();
        try {
            Quote quote = executionClient.getQuote(
                    pair.inputToken(side), pair.outputToken(side), order.getSize(), side);
            return executionClient.executeSwap(quote);
        } catch (RuntimeException e) {
            String error = describe(e);
            log.error("Swap failed: orderId={}, symbol={}, side={}", order.getId(), order.getSymbol(), side, e);
            Order failed = orderLedger.markFailed(order.getId(), error);
            events.add(() -> eventPublisherHelper.publishOrderFailed(failed));
            events.add(() -> eventPublisherHelper.publishSystemError(
                    "trading_engine", error, Map.of("order_id", order.getId(), "symbol", order.getSymbol())));
            if (e instanceof TradeExecutionException tradeExecutionException) {
                throw tradeExecutionException;
            }
            throw new TradeExecutionException(
                    "Swap failed for order " + order.getId() + ": " + error, Map.of("orderId", order.getId()), e);
        }
    }

    private ReentrantLock lockFor(String positionId) {
        return positionLocks.computeIfAbsent(positionId, id -> new ReentrantLock());
    }

    /**
     * Drops the lock of a position that is CLOSED or unknown, unless another thread holds or waits
     * on it. CLOSED is terminal, so a caller that still races onto a fresh lock only observes CLOSED.
     */
    private void releaseLock(String positionId, ReentrantLock lock) {
        if (!lock.isLocked() && !lock.hasQueuedThreads()) {
            positionLocks.remove(positionId, lock);
        }
    }

    private static void publishAll(List<Runnable> events) {
        for (Runnable event : events) {
            event.run();
        }
    }

    private static Map<String, Object> swapMetadata(SwapResult result) {
        Map<String, Object> metadata = new HashMap<>();
        if (result.transactionId() != null) {
            metadata.put("transaction_id", result.transactionId());
        }
        return metadata;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
