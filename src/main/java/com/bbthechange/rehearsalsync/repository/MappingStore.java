package com.bbthechange.rehearsalsync.repository;

import java.util.Map;
import java.util.Optional;

/**
 * Key-value storage for serialized sync state, one key space per record.
 * Reads of missing keys return empty, writes are last-write-wins.
 */
public interface MappingStore {

    Optional<String> get(MappingRecord record, String key);

    void put(MappingRecord record, String key, String value);

    void delete(MappingRecord record, String key);

    /**
     * All entries of a record keyed by entry key.
     */
    Map<String, String> list(MappingRecord record);

    void clear(MappingRecord record);
}
