package com.swaptrader.config;

import org.springframework.context.annotation.Configuration;

/**
 * Key scheme for records in the backing key-value store.
 *
 * <pre>
 *   order:{orderId}             → Order record
 *   trade:{tradeId}             → Trade record
 *   position:{positionId}       → Position record
 *   strategy:{strategyId}:state → StrategyState record
 *   market:{symbol}:latest      → latest price snapshot (expires)
 *   market:{symbol}:candle:{interval} → latest candle (expires)
 * </pre>
 *
 * The connection itself comes from Spring Boot's Redis auto-configuration
 * ({@code spring.data.redis.*}) and the auto-configured {@code StringRedisTemplate}.
 */
@Configuration
public class RedisConfig {

    public static final String KEY_PREFIX_ORDER = "order:";
    public static final String KEY_PREFIX_TRADE = "trade:";
    public static final String KEY_PREFIX_POSITION = "position:";
    public static final String KEY_PREFIX_STRATEGY = "strategy:";
    public static final String KEY_SUFFIX_STRATEGY_STATE = ":state";
    public static final String KEY_PREFIX_MARKET = "market:";

    public static String orderKey(String orderId) {
        return KEY_PREFIX_ORDER + orderId;
    }

    public static String tradeKey(String tradeId) {
        return KEY_PREFIX_TRADE + tradeId;
    }

    public static String positionKey(String positionId) {
        return KEY_PREFIX_POSITION + positionId;
    }

    public static String strategyStateKey(String strategyId) {
        return KEY_PREFIX_STRATEGY + strategyId + KEY_SUFFIX_STRATEGY_STATE;
    }

    public static String marketLatestKey(String symbol) {
        return KEY_PREFIX_MARKET + symbol + ":latest";
    }

    public static String marketCandleKey(String symbol, String interval) {
        return KEY_PREFIX_MARKET + symbol + ":candle:" + interval;
    }
}
