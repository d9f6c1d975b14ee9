package com.swaptrader.domain.model;

import com.swaptrader.domain.enums.DataType;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * One timestamped market observation. For {@link DataType#CANDLE} the value is a {@link Candle};
 * for {@link DataType#PRICE} it is a {@link java.math.BigDecimal}.
 */
@Data
@Builder
public class DataPoint {

    private DataType dataType;
    private String symbol;
    private Instant timestamp;
    private Object value;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public static DataPoint candle(String symbol, Instant timestamp, Candle candle) {
        return DataPoint.builder()
                .dataType(DataType.CANDLE)
                .symbol(symbol)
                .timestamp(timestamp)
                .value(candle)
                .build();
    }
}
