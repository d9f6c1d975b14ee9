package com.swaptrader.repository;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value store holding the flat records behind the ledgers and strategy state.
 *
 * <p>Keys are ASCII paths (see {@link com.swaptrader.config.RedisConfig}). Implementations
 * throw {@link com.swaptrader.exception.StoreUnavailableException} when the backend cannot be
 * reached; there is no local fallback.
 */
public interface StateStore {

    Optional<Map<String, Object>> get(String key);

    boolean set(String key, Map<String, Object> value);

    /** @param ttl expiry for the key; null means no expiry */
    boolean set(String key, Map<String, Object> value, Duration ttl);

    boolean delete(String key);
}
