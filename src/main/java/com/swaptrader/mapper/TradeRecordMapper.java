package com.swaptrader.mapper;

import static com.swaptrader.mapper.RecordFields.*;

import com.swaptrader.domain.enums.OrderSide;
import com.swaptrader.domain.model.Trade;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class TradeRecordMapper implements RecordMapper<Trade> {

    @Override
    public Map<String, Object> toRecord(Trade trade) {
        Map<String, Object> record = new LinkedHashMap<>();
        put(record, "id", trade.getId());
        put(record, "order_id", trade.getOrderId());
        put(record, "position_id", trade.getPositionId());
        put(record, "symbol", trade.getSymbol());
        put(record, "side", trade.getSide() != null ? trade.getSide().getValue() : null);
        putDecimal(record, "size", trade.getSize());
        putDecimal(record, "price", trade.getPrice());
        putDecimal(record, "fee", trade.getFee());
        putInstant(record, "executed_at", trade.getTimestamp());
        putMetadata(record, trade.getMetadata());
        return record;
    }

    @Override
    public Trade fromRecord(String key, Map<String, Object> record) {
        return Trade.builder()
                .id(requireString(key, record, "id"))
                .orderId(requireString(key, record, "order_id"))
                .positionId(optionalString(record, "position_id"))
                .symbol(requireString(key, record, "symbol"))
                .side(requireEnum(key, record, "side", OrderSide::fromValue))
                .size(requireDecimal(key, record, "size"))
                .price(requireDecimal(key, record, "price"))
                .fee(requireDecimal(key, record, "fee"))
                .timestamp(requireInstant(key, record, "executed_at"))
                .metadata(metadata(record))
                .build();
    }
}
