package com.bbthechange.rehearsalsync.repository.impl;

import com.bbthechange.rehearsalsync.repository.MappingRecord;
import com.bbthechange.rehearsalsync.repository.MappingStore;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local mapping store. Used when calendar-sync.mapping-store=memory and in tests.
 */
public class InMemoryMappingStore implements MappingStore {

    private final Map<MappingRecord, Map<String, String>> records = new EnumMap<>(MappingRecord.class);

    public InMemoryMappingStore() {
        for (MappingRecord record : MappingRecord.values()) {
            records.put(record, new ConcurrentHashMap<>());
        }
    }

    @Override
    public Optional<String> get(MappingRecord record, String key) {
        return Optional.ofNullable(records.get(record).get(key));
    }

    @Override
    public void put(MappingRecord record, String key, String value) {
        records.get(record).put(key, value);
    }

    @Override
    public void delete(MappingRecord record, String key) {
        records.get(record).remove(key);
    }

    @Override
    public Map<String, String> list(MappingRecord record) {
        return new LinkedHashMap<>(records.get(record));
    }

    @Override
    public void clear(MappingRecord record) {
        records.get(record).clear();
    }
}
