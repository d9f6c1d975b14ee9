package com.swaptrader.repository;

import com.swaptrader.config.RedisConfig;
import com.swaptrader.config.TradingConfig;
import com.swaptrader.domain.model.Candle;
import com.swaptrader.exception.CorruptRecordException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

/**
 * Short-lived market snapshots in the key-value store: the latest price per symbol and the
 * latest candle per symbol and interval. Both keys expire (see {@link TradingConfig}), so a
 * symbol that stops trading drops out on its own.
 */
@Repository
@RequiredArgsConstructor
public class MarketDataRepository {

    public static final String DEFAULT_INTERVAL = "1m";

    private final StateStore stateStore;
    private final TradingConfig tradingConfig;

    public void saveLatestPrice(String symbol, BigDecimal price, BigDecimal size, Instant observedAt) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("symbol", symbol);
        record.put("last_price", price.toPlainString());
        if (size != null) {
            record.put("last_size", size.toPlainString());
        }
        if (observedAt != null) {
            record.put("last_trade_time", observedAt.toString());
        }
        record.put("updated_at", Instant.now().toString());
        stateStore.set(RedisConfig.marketLatestKey(symbol), record, tradingConfig.getMarketDataTtl());
    }

    public void saveCandle(String symbol, String interval, Candle candle, Instant observedAt) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("symbol", symbol);
        record.put("interval", interval);
        putDecimal(record, "open", candle.open());
        putDecimal(record, "high", candle.high());
        putDecimal(record, "low", candle.low());
        putDecimal(record, "close", candle.close());
        putDecimal(record, "volume", candle.volume());
        if (observedAt != null) {
            record.put("timestamp", observedAt.toString());
        }
        stateStore.set(RedisConfig.marketCandleKey(symbol, interval), record, tradingConfig.getCandleCacheTtl());
    }

    /** Last cached price, empty once the snapshot has expired or was never written. */
    public Optional<BigDecimal> findLatestPrice(String symbol) {
        String key = RedisConfig.marketLatestKey(symbol);
        return stateStore.get(key).map(record -> {
            Object value = record.get("last_price");
            if (value == null) {
                throw new CorruptRecordException(key, "missing field 'last_price'", null);
            }
            try {
                return new BigDecimal(value.toString());
            } catch (NumberFormatException e) {
                throw new CorruptRecordException(key, "field 'last_price' is not a number: " + value, e);
            }
        });
    }

    private static void putDecimal(Map<String, Object> record, String field, BigDecimal value) {
        if (value != null) {
            record.put(field, value.toPlainString());
        }
    }
}
