package com.swaptrader.ledger;

import com.swaptrader.config.RedisConfig;
import com.swaptrader.domain.enums.OrderSide;
import com.swaptrader.domain.enums.PositionStatus;
import com.swaptrader.domain.model.Position;
import com.swaptrader.exception.InvalidStateException;
import com.swaptrader.exception.ResourceNotFoundException;
import com.swaptrader.exception.StoreUnavailableException;
import com.swaptrader.exception.ValidationException;
import com.swaptrader.mapper.PositionRecordMapper;
import com.swaptrader.repository.StateStore;
import java.math.BigDecimal;
import java.time.Instant;
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
 * Authoritative record of positions: a write-through cache over the {@link StateStore}, with
 * the same store-first write rule as {@link OrderLedger}.
 *
 * <p>Status moves OPEN → CLOSING → CLOSED, or OPEN → CLOSED for a manual close. A position is
 * never re-opened and its size never changes.
 */
@Service
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private final Map<String, Position> positions = new ConcurrentHashMap<>();

    private final StateStore stateStore;
    private final PositionRecordMapper positionRecordMapper;
    private final EntityIdGenerator idGenerator;

    public PositionLedger(
            StateStore stateStore, PositionRecordMapper positionRecordMapper, EntityIdGenerator idGenerator) {
        this.stateStore = stateStore;
        this.positionRecordMapper = positionRecordMapper;
        this.idGenerator = idGenerator;
    }

    /** Creates and persists an OPEN position valued at its entry price. */
    public synchronized Position createPosition(
            String symbol,
            OrderSide side,
            BigDecimal size,
            BigDecimal entryPrice,
            BigDecimal stopLoss,
            Map<String, Object> metadata) {
        if (size == null || size.signum() <= 0) {
            throw new ValidationException("Position size must be positive", Map.of("size", String.valueOf(size)));
        }
        if (entryPrice == null || entryPrice.signum() <= 0) {
            throw new ValidationException(
                    "Position entry price must be positive", Map.of("entryPrice", String.valueOf(entryPrice)));
        }

        Instant now = Instant.now();
        Position position = Position.builder()
                .id(idGenerator.nextPositionId())
                .symbol(symbol)
                .side(side)
                .size(size)
                .entryPrice(entryPrice)
                .currentPrice(entryPrice)
                .status(PositionStatus.OPEN)
                .unrealizedPnl(BigDecimal.ZERO)
                .realizedPnl(BigDecimal.ZERO)
                .stopLoss(stopLoss)
                .entryTime(now)
                .lastUpdateTime(now)
                .metadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>())
                .build();
        write(position);
        log.info(
                "Position opened: positionId={}, symbol={}, side={}, size={}, entry={}, stopLoss={}",
                position.getId(),
                symbol,
                side,
                size,
                entryPrice,
                stopLoss);
        return position.copy();
    }

    public Optional<Position> getPosition(String positionId) {
        return Optional.ofNullable(load(positionId)).map(Position::copy);
    }

    public Position requirePosition(String positionId) {
        return getPosition(positionId).orElseThrow(() -> new ResourceNotFoundException("Position", positionId));
    }

    /** OPEN and CLOSING positions, optionally limited to one symbol, oldest first. */
    public List<Position> getOpenPositions(String symbol) {
        return positions.values().stream()
                .filter(p -> p.getStatus().isLive())
                .filter(p -> symbol == null || symbol.equals(p.getSymbol()))
                .sorted(Comparator.comparing(Position::getEntryTime))
                .map(Position::copy)
                .toList();
    }

    public List<Position> getAllPositions() {
        return positions.values().stream()
                .sorted(Comparator.comparing(Position::getEntryTime))
                .map(Position::copy)
                .toList();
    }

    /**
     * Revalues a live position at {@code currentPrice}. An OPEN position whose stop-loss is
     * breached moves to CLOSING; the caller is responsible for closing it.
     *
     * @throws InvalidStateException if the position is already CLOSED
     */
    public synchronized Position markToMarket(String positionId, BigDecimal currentPrice, Map<String, Object> metadata) {
        Position current = loadRequired(positionId);
        if (current.getStatus() == PositionStatus.CLOSED) {
            throw new InvalidStateException(
                    "Position " + positionId + " is closed", Map.of("positionId", positionId, "status", "closed"));
        }

        Position updated = current.copy();
        updated.setCurrentPrice(currentPrice);
        updated.setUnrealizedPnl(updated.pnlAt(currentPrice));
        updated.setLastUpdateTime(Instant.now());
        if (metadata != null) {
            updated.getMetadata().putAll(metadata);
        }
        if (updated.getStatus() == PositionStatus.OPEN && updated.isStopLossBreached(currentPrice)) {
            updated.setStatus(nextStatus(updated, PositionStatus.CLOSING));
            log.warn(
                    "Stop-loss breached: positionId={}, side={}, stopLoss={}, price={}",
                    positionId,
                    updated.getSide(),
                    updated.getStopLoss(),
                    currentPrice);
        }
        write(updated);
        return updated.copy();
    }

    /**
     * Closes a position at {@code closePrice}: realized PnL is fixed, unrealized PnL zeroed.
     *
     * @throws InvalidStateException if the position is already CLOSED
     */
    public synchronized Position closePosition(String positionId, BigDecimal closePrice, Map<String, Object> metadata) {
        Position current = loadRequired(positionId);

        Position updated = current.copy();
        updated.setStatus(nextStatus(current, PositionStatus.CLOSED));
        updated.setRealizedPnl(current.pnlAt(closePrice));
        updated.setUnrealizedPnl(BigDecimal.ZERO);
        updated.setCurrentPrice(closePrice);
        Instant now = Instant.now();
        updated.setLastUpdateTime(now);
        updated.setClosedAt(now);
        if (metadata != null) {
            updated.getMetadata().putAll(metadata);
        }
        write(updated);
        log.info(
                "Position closed: positionId={}, closePrice={}, realizedPnl={}",
                positionId,
                closePrice,
                updated.getRealizedPnl());
        return updated.copy();
    }

    private static PositionStatus nextStatus(Position position, PositionStatus next) {
        if (!position.getStatus().canTransitionTo(next)) {
            throw new InvalidStateException(
                    "Position " + position.getId() + " cannot move from " + position.getStatus().getValue() + " to "
                            + next.getValue(),
                    Map.of(
                            "positionId",
                            position.getId(),
                            "from",
                            position.getStatus().getValue(),
                            "to",
                            next.getValue()));
        }
        return next;
    }

    // ---- Store access ----

    private Position loadRequired(String positionId) {
        Position position = load(positionId);
        if (position == null) {
            throw new ResourceNotFoundException("Position", positionId);
        }
        return position;
    }

    private Position load(String positionId) {
        Position cached = positions.get(positionId);
        if (cached != null) {
            return cached;
        }
        String key = RedisConfig.positionKey(positionId);
        Optional<Position> stored =
                stateStore.get(key).map(record -> positionRecordMapper.fromRecord(key, record));
        if (stored.isEmpty()) {
            return null;
        }
        log.debug("Position loaded from store: positionId={}", positionId);
        Position existing = positions.putIfAbsent(positionId, stored.get());
        return existing != null ? existing : stored.get();
    }

    private void write(Position position) {
        String key = RedisConfig.positionKey(position.getId());
        if (!stateStore.set(key, positionRecordMapper.toRecord(position))) {
            throw new StoreUnavailableException("Store rejected write for key " + key, null);
        }
        positions.put(position.getId(), position.copy());
    }
}
