package com.swaptrader.mapper;

import static com.swaptrader.mapper.RecordFields.*;

import com.swaptrader.domain.enums.OrderSide;
import com.swaptrader.domain.enums.PositionStatus;
import com.swaptrader.domain.model.Position;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class PositionRecordMapper implements RecordMapper<Position> {

    @Override
    public Map<String, Object> toRecord(Position position) {
        Map<String, Object> record = new LinkedHashMap<>();
        put(record, "id", position.getId());
        put(record, "symbol", position.getSymbol());
        put(record, "side", position.getSide() != null ? position.getSide().getValue() : null);
        putDecimal(record, "size", position.getSize());
        putDecimal(record, "entry_price", position.getEntryPrice());
        putDecimal(record, "current_price", position.getCurrentPrice());
        put(record, "status", position.getStatus() != null ? position.getStatus().getValue() : null);
        putDecimal(record, "unrealized_pnl", position.getUnrealizedPnl());
        putDecimal(record, "realized_pnl", position.getRealizedPnl());
        putDecimal(record, "stop_loss", position.getStopLoss());
        putInstant(record, "entry_time", position.getEntryTime());
        putInstant(record, "last_update", position.getLastUpdateTime());
        putInstant(record, "closed_at", position.getClosedAt());
        putMetadata(record, position.getMetadata());
        return record;
    }

    @Override
    public Position fromRecord(String key, Map<String, Object> record) {
        BigDecimal unrealized = optionalDecimal(key, record, "unrealized_pnl");
        BigDecimal realized = optionalDecimal(key, record, "realized_pnl");
        return Position.builder()
                .id(requireString(key, record, "id"))
                .symbol(requireString(key, record, "symbol"))
                .side(requireEnum(key, record, "side", OrderSide::fromValue))
                .size(requireDecimal(key, record, "size"))
                .entryPrice(requireDecimal(key, record, "entry_price"))
                .currentPrice(requireDecimal(key, record, "current_price"))
                .status(requireEnum(key, record, "status", PositionStatus::fromValue))
                .unrealizedPnl(unrealized != null ? unrealized : BigDecimal.ZERO)
                .realizedPnl(realized != null ? realized : BigDecimal.ZERO)
                .stopLoss(optionalDecimal(key, record, "stop_loss"))
                .entryTime(requireInstant(key, record, "entry_time"))
                .lastUpdateTime(optionalInstant(key, record, "last_update"))
                .closedAt(optionalInstant(key, record, "closed_at"))
                .metadata(metadata(record))
                .build();
    }
}
