package com.swaptrader.mapper;

import java.util.Map;

/**
 * Converts a domain object to and from the flat record persisted in the state store and
 * carried as an event payload.
 *
 * <p>Record shape: enums as lowercase tokens, timestamps as ISO-8601 UTC strings, decimals as
 * plain strings, null fields omitted, metadata as a nested map.
 */
public interface RecordMapper<T> {

    Map<String, Object> toRecord(T value);

    /**
     * @param key    store key the record was read from, used in error reports
     * @param record the stored fields
     * @throws com.swaptrader.exception.CorruptRecordException if a field is missing or unparseable
     */
    T fromRecord(String key, Map<String, Object> record);
}
