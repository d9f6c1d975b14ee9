package com.swaptrader.repository.redis;

import com.swaptrader.exception.CorruptRecordException;
import com.swaptrader.exception.StoreUnavailableException;
import com.swaptrader.repository.StateStore;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

/**
 * Redis-backed {@link StateStore}. Each record is one string key holding a JSON object.
 *
 * <p>Connection failures ({@link DataAccessException}) surface as
 * {@link StoreUnavailableException}; a value that is not a JSON object surfaces as
 * {@link CorruptRecordException}.
 */
@Repository
public class RedisStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(RedisStateStore.class);
    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final StringRedisTemplate redisTemplate;
    private final JsonMapper jsonMapper;

    public RedisStateStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.jsonMapper = JsonMapper.builder().build();
    }

    @Override
    public Optional<Map<String, Object>> get(String key) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(key);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Store read failed for key " + key, e);
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(jsonMapper.readValue(json, RECORD_TYPE));
        } catch (JacksonException e) {
            log.error("Unreadable JSON at key={}", key, e);
            throw new CorruptRecordException(key, "not a JSON object", e);
        }
    }

    @Override
    public boolean set(String key, Map<String, Object> value) {
        return set(key, value, null);
    }

    @Override
    public boolean set(String key, Map<String, Object> value, Duration ttl) {
        String json = jsonMapper.writeValueAsString(value);
        try {
            if (ttl != null) {
                redisTemplate.opsForValue().set(key, json, ttl);
            } else {
                redisTemplate.opsForValue().set(key, json);
            }
            return true;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Store write failed for key " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.delete(key));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Store delete failed for key " + key, e);
        }
    }
}
