package com.swaptrader.mapper;

import static com.swaptrader.mapper.RecordFields.*;

import com.swaptrader.domain.enums.OrderSide;
import com.swaptrader.domain.enums.OrderStatus;
import com.swaptrader.domain.enums.OrderType;
import com.swaptrader.domain.model.Order;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class OrderRecordMapper implements RecordMapper<Order> {

    @Override
    public Map<String, Object> toRecord(Order order) {
        Map<String, Object> record = new LinkedHashMap<>();
        put(record, "id", order.getId());
        put(record, "symbol", order.getSymbol());
        put(record, "side", order.getSide() != null ? order.getSide().getValue() : null);
        putDecimal(record, "size", order.getSize());
        putDecimal(record, "price", order.getPrice());
        put(record, "order_type", order.getType() != null ? order.getType().getValue() : null);
        put(record, "status", order.getStatus() != null ? order.getStatus().getValue() : null);
        putInstant(record, "submitted_at", order.getSubmittedAt());
        putDecimal(record, "filled_price", order.getFilledPrice());
        putDecimal(record, "filled_size", order.getFilledSize());
        putInstant(record, "filled_at", order.getFilledAt());
        put(record, "error", order.getError());
        putMetadata(record, order.getMetadata());
        return record;
    }

    @Override
    public Order fromRecord(String key, Map<String, Object> record) {
        return Order.builder()
                .id(requireString(key, record, "id"))
                .symbol(requireString(key, record, "symbol"))
                .side(requireEnum(key, record, "side", OrderSide::fromValue))
                .size(requireDecimal(key, record, "size"))
                .price(optionalDecimal(key, record, "price"))
                .type(requireEnum(key, record, "order_type", OrderType::fromValue))
                .status(requireEnum(key, record, "status", OrderStatus::fromValue))
                .submittedAt(requireInstant(key, record, "submitted_at"))
                .filledPrice(optionalDecimal(key, record, "filled_price"))
                .filledSize(optionalDecimal(key, record, "filled_size"))
                .filledAt(optionalInstant(key, record, "filled_at"))
                .error(optionalString(record, "error"))
                .metadata(metadata(record))
                .build();
    }
}
