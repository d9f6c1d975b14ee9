package com.swaptrader.mapper;

import com.swaptrader.exception.CorruptRecordException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/** Field-level read/write helpers shared by the record mappers. */
final class RecordFields {

    private RecordFields() {}

    static void put(Map<String, Object> record, String field, Object value) {
        if (value != null) {
            record.put(field, value);
        }
    }

    static void putDecimal(Map<String, Object> record, String field, BigDecimal value) {
        if (value != null) {
            record.put(field, value.toPlainString());
        }
    }

    static void putInstant(Map<String, Object> record, String field, Instant value) {
        if (value != null) {
            record.put(field, value.toString());
        }
    }

    static void putMetadata(Map<String, Object> record, Map<String, Object> metadata) {
        record.put("metadata", metadata != null ? new HashMap<>(metadata) : new HashMap<>());
    }

    static String requireString(String key, Map<String, Object> record, String field) {
        Object value = record.get(field);
        if (value == null) {
            throw new CorruptRecordException(key, "missing field '" + field + "'", null);
        }
        return value.toString();
    }

    static String optionalString(Map<String, Object> record, String field) {
        Object value = record.get(field);
        return value != null ? value.toString() : null;
    }

    static BigDecimal requireDecimal(String key, Map<String, Object> record, String field) {
        return parse(key, field, requireString(key, record, field), BigDecimal::new);
    }

    static BigDecimal optionalDecimal(String key, Map<String, Object> record, String field) {
        String raw = optionalString(record, field);
        return raw != null ? parse(key, field, raw, BigDecimal::new) : null;
    }

    static Instant requireInstant(String key, Map<String, Object> record, String field) {
        return parse(key, field, requireString(key, record, field), Instant::parse);
    }

    static Instant optionalInstant(String key, Map<String, Object> record, String field) {
        String raw = optionalString(record, field);
        return raw != null ? parse(key, field, raw, Instant::parse) : null;
    }

    /** Parses a lowercase token with the enum's {@code fromValue}. */
    static <E extends Enum<E>> E requireEnum(
            String key, Map<String, Object> record, String field, Function<String, E> fromValue) {
        return parse(key, field, requireString(key, record, field), fromValue);
    }

    static boolean optionalBoolean(Map<String, Object> record, String field) {
        Object value = record.get(field);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> metadata(Map<String, Object> record) {
        Object value = record.get("metadata");
        if (value instanceof Map<?, ?> map) {
            return new HashMap<>((Map<String, Object>) map);
        }
        return new HashMap<>();
    }

    private static <T> T parse(String key, String field, String raw, Function<String, T> parser) {
        try {
            return parser.apply(raw);
        } catch (RuntimeException e) {
            throw new CorruptRecordException(key, "bad value for '" + field + "': " + raw, e);
        }
    }
}
