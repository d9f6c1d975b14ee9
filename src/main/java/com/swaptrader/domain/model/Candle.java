package com.swaptrader.domain.model;

import java.math.BigDecimal;

/** OHLCV bar carried as the value of a candle {@link DataPoint}. */
public record Candle(BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close, BigDecimal volume) {

    /** Flat candle where open/high/low equal the close. Handy for feeds that only publish closes. */
    public static Candle ofClose(BigDecimal close, BigDecimal volume) {
        return new Candle(close, close, close, close, volume);
    }
}
