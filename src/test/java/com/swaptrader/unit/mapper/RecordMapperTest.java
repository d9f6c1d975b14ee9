package com.swaptrader.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.swaptrader.domain.enums.OrderSide;
import com.swaptrader.domain.enums.OrderStatus;
import com.swaptrader.domain.enums.PositionStatus;
import com.swaptrader.domain.model.Position;
import com.swaptrader.exception.CorruptRecordException;
import com.swaptrader.mapper.OrderRecordMapper;
import com.swaptrader.mapper.PositionRecordMapper;
import com.swaptrader.mapper.StrategyStateRecordMapper;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RecordMapperTest {

    private static Map<String, Object> orderRecord() {
        Map<String, Object> record = new HashMap<>();
        record.put("id", "ord_1");
        record.put("symbol", "SOL-USDC");
        record.put("side", "buy");
        record.put("size", "1.5");
        record.put("order_type", "market");
        record.put("status", "filled");
        record.put("submitted_at", "2024-01-01T00:00:00Z");
        record.put("filled_price", "101.25");
        return record;
    }

    @Nested
    @DisplayName("Orders")
    class Orders {

        private final OrderRecordMapper mapper = new OrderRecordMapper();

        @Test
        @DisplayName("lowercase tokens and decimal strings are parsed")
        void parses() {
            var order = mapper.fromRecord("order:ord_1", orderRecord());

            assertThat(order.getSide()).isEqualTo(OrderSide.BUY);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
            assertThat(order.getFilledPrice()).isEqualByComparingTo("101.25");
            assertThat(order.getPrice()).isNull();
            assertThat(order.getMetadata()).isEmpty();
        }

        @Test
        @DisplayName("unknown status token is a corrupt record")
        void unknownToken() {
            Map<String, Object> record = orderRecord();
            record.put("status", "exploded");

            assertThatThrownBy(() -> mapper.fromRecord("order:ord_1", record))
                    .isInstanceOf(CorruptRecordException.class)
                    .hasMessageContaining("status");
        }

        @Test
        @DisplayName("missing required field is a corrupt record")
        void missingField() {
            Map<String, Object> record = orderRecord();
            record.remove("symbol");

            assertThatThrownBy(() -> mapper.fromRecord("order:ord_1", record))
                    .isInstanceOf(CorruptRecordException.class)
                    .hasMessageContaining("symbol");
        }

        @Test
        @DisplayName("malformed decimal is a corrupt record")
        void badDecimal() {
            Map<String, Object> record = orderRecord();
            record.put("size", "one");

            assertThatThrownBy(() -> mapper.fromRecord("order:ord_1", record))
                    .isInstanceOf(CorruptRecordException.class);
        }
    }

    @Nested
    @DisplayName("Positions")
    class Positions {

        private final PositionRecordMapper mapper = new PositionRecordMapper();

        @Test
        @DisplayName("a position survives a write and read")
        void writeRead() {
            Position position = Position.builder()
                    .id("pos_1")
                    .symbol("SOL-USDC")
                    .side(OrderSide.SELL)
                    .size(new BigDecimal("2"))
                    .entryPrice(new BigDecimal("100"))
                    .currentPrice(new BigDecimal("97.5"))
                    .status(PositionStatus.CLOSING)
                    .unrealizedPnl(new BigDecimal("5"))
                    .stopLoss(new BigDecimal("105"))
                    .entryTime(Instant.parse("2024-01-01T00:00:00Z"))
                    .lastUpdateTime(Instant.parse("2024-01-01T00:01:00Z"))
                    .metadata(new HashMap<>(Map.of("order_id", "ord_1")))
                    .build();

            Map<String, Object> record = mapper.toRecord(position);

            assertThat(record).containsEntry("side", "sell").containsEntry("status", "closing");
            assertThat(record).doesNotContainKey("closed_at");
            assertThat(mapper.fromRecord("position:pos_1", record)).isEqualTo(position);
        }
    }

    @Nested
    @DisplayName("Strategy state")
    class StrategyStates {

        private final StrategyStateRecordMapper mapper = new StrategyStateRecordMapper();

        @Test
        @DisplayName("is_active accepts boolean and string forms, missing position size is zero")
        void lenientFields() {
            Map<String, Object> record = new HashMap<>();
            record.put("strategy_id", "ma_1");
            record.put("symbol", "SOL-USDC");
            record.put("is_active", "true");

            var state = mapper.fromRecord("strategy:ma_1:state", record);

            assertThat(state.isActive()).isTrue();
            assertThat(state.getPositionSize()).isEqualByComparingTo("0");
            assertThat(state.getCurrentPosition()).isNull();
        }
    }
}
