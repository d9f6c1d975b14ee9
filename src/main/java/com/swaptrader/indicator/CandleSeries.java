package com.swaptrader.indicator;

import com.swaptrader.domain.model.Candle;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;

/**
 * A ta4j {@link BarSeries} of candles for one symbol, capped at {@code maxBars}. ta4j evicts the
 * oldest bar once the cap is reached, while bar indices keep growing.
 *
 * <p>ta4j requires strictly increasing bar end times. Candles are appended in arrival order; one
 * whose timestamp does not move past the last bar is stamped {@link #BAR_PERIOD} after it.
 *
 * <p>Not thread-safe. The owning strategy is driven by the single ingestion thread.
 */
public class CandleSeries {

    static final Duration BAR_PERIOD = Duration.ofSeconds(1);

    private final BarSeries barSeries;

    public CandleSeries(String name, int maxBars) {
        if (maxBars <= 0) {
            throw new IllegalArgumentException("maxBars must be positive: " + maxBars);
        }
        this.barSeries = new BaseBarSeriesBuilder()
                .withName(name)
                .withMaxBarCount(maxBars)
                .build();
    }

    /** Appends a candle; missing open/high/low default to the close, missing volume to zero. */
    public void addCandle(Instant timestamp, Candle candle) {
        BigDecimal close = candle.close();
        barSeries.addBar(
                BAR_PERIOD,
                endTimeFor(timestamp),
                orClose(candle.open(), close),
                orClose(candle.high(), close),
                orClose(candle.low(), close),
                close,
                candle.volume() != null ? candle.volume() : BigDecimal.ZERO);
    }

    public BarSeries getBarSeries() {
        return barSeries;
    }

    /** Bars currently held, at most {@code maxBars}. */
    public int getBarCount() {
        return barSeries.getBarCount();
    }

    public int getEndIndex() {
        return barSeries.getEndIndex();
    }

    private ZonedDateTime endTimeFor(Instant timestamp) {
        ZonedDateTime endTime = (timestamp != null ? timestamp : Instant.now()).atZone(ZoneOffset.UTC);
        if (!barSeries.isEmpty()) {
            ZonedDateTime lastEnd = barSeries.getLastBar().getEndTime();
            if (!endTime.isAfter(lastEnd)) {
                endTime = lastEnd.plus(BAR_PERIOD);
            }
        }
        return endTime;
    }

    private static BigDecimal orClose(BigDecimal value, BigDecimal close) {
        return value != null ? value : close;
    }
}
