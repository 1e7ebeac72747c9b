package com.bbthechange.rehearsalsync.repository.impl;

import com.bbthechange.rehearsalsync.exception.RepositoryException;
import com.bbthechange.rehearsalsync.model.CalendarSyncSettings;
import com.bbthechange.rehearsalsync.model.EventMapping;
import com.bbthechange.rehearsalsync.model.ImportedEvent;
import com.bbthechange.rehearsalsync.repository.CalendarMappingRepository;
import com.bbthechange.rehearsalsync.repository.MappingRecord;
import com.bbthechange.rehearsalsync.repository.MappingStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stores sync state as JSON documents in the {@link MappingStore}.
 * Values that cannot be parsed are logged and treated as missing.
 */
@Repository
public class CalendarMappingRepositoryImpl implements CalendarMappingRepository {

    private static final Logger logger = LoggerFactory.getLogger(CalendarMappingRepositoryImpl.class);

    static final String SETTINGS_KEY = "settings";
    static final String LAST_EXPORT_TIME_KEY = "last-export-time";
    static final String LAST_IMPORT_TIME_KEY = "last-import-time";

    private final MappingStore mappingStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public CalendarMappingRepositoryImpl(MappingStore mappingStore, ObjectMapper objectMapper, Clock clock) {
        this.mappingStore = mappingStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<EventMapping> findEventMapping(String rehearsalId) {
        return read(MappingRecord.EXPORT_MAPPINGS, rehearsalId, EventMapping.class);
    }

    @Override
    public EventMapping saveEventMapping(String rehearsalId, String eventId, String calendarId) {
        EventMapping mapping = EventMapping.builder()
            .eventId(eventId)
            .calendarId(calendarId)
            .lastSynced(clock.instant())
            .build();
        write(MappingRecord.EXPORT_MAPPINGS, rehearsalId, mapping);
        return mapping;
    }

    @Override
    public void deleteEventMapping(String rehearsalId) {
        mappingStore.delete(MappingRecord.EXPORT_MAPPINGS, rehearsalId);
    }

    @Override
    public Map<String, EventMapping> findAllEventMappings() {
        return readAll(MappingRecord.EXPORT_MAPPINGS, EventMapping.class);
    }

    @Override
    public void clearEventMappings() {
        mappingStore.clear(MappingRecord.EXPORT_MAPPINGS);
    }

    @Override
    public int countEventMappings() {
        return mappingStore.list(MappingRecord.EXPORT_MAPPINGS).size();
    }

    @Override
    public Optional<ImportedEvent> findImportedEvent(String externalEventId) {
        return read(MappingRecord.IMPORT_TRACKING, externalEventId, ImportedEvent.class);
    }

    @Override
    public ImportedEvent saveImportedEvent(String externalEventId, String localSlotId, String calendarId) {
        ImportedEvent importedEvent = ImportedEvent.builder()
            .localSlotId(localSlotId)
            .calendarId(calendarId)
            .lastImported(clock.instant())
            .build();
        write(MappingRecord.IMPORT_TRACKING, externalEventId, importedEvent);
        return importedEvent;
    }

    @Override
    public void deleteImportedEvent(String externalEventId) {
        mappingStore.delete(MappingRecord.IMPORT_TRACKING, externalEventId);
    }

    @Override
    public Map<String, ImportedEvent> findAllImportedEvents() {
        return readAll(MappingRecord.IMPORT_TRACKING, ImportedEvent.class);
    }

    @Override
    public void clearImportedEvents() {
        mappingStore.clear(MappingRecord.IMPORT_TRACKING);
    }

    @Override
    public int countImportedEvents() {
        return mappingStore.list(MappingRecord.IMPORT_TRACKING).size();
    }

    @Override
    public CalendarSyncSettings getSettings() {
        CalendarSyncSettings settings = read(MappingRecord.SYNC_SETTINGS, SETTINGS_KEY, CalendarSyncSettings.class)
            .orElseGet(CalendarSyncSettings::defaults);
        return settings.toBuilder()
            .lastExportTime(latest(settings.getLastExportTime(), LAST_EXPORT_TIME_KEY))
            .lastImportTime(latest(settings.getLastImportTime(), LAST_IMPORT_TIME_KEY))
            .build();
    }

    @Override
    public CalendarSyncSettings saveSettings(CalendarSyncSettings settings) {
        write(MappingRecord.SYNC_SETTINGS, SETTINGS_KEY, settings);
        return settings;
    }

    @Override
    public void recordLastExportTime(Instant time) {
        write(MappingRecord.SYNC_SETTINGS, LAST_EXPORT_TIME_KEY, time);
    }

    @Override
    public void recordLastImportTime(Instant time) {
        write(MappingRecord.SYNC_SETTINGS, LAST_IMPORT_TIME_KEY, time);
    }

    private Instant latest(Instant saved, String stampKey) {
        Instant stamped = read(MappingRecord.SYNC_SETTINGS, stampKey, Instant.class).orElse(null);
        if (saved == null || (stamped != null && stamped.isAfter(saved))) {
            return stamped;
        }
        return saved;
    }

    private <T> Optional<T> read(MappingRecord record, String key, Class<T> type) {
        return mappingStore.get(record, key).flatMap(json -> parse(record, key, json, type));
    }

    private <T> Map<String, T> readAll(MappingRecord record, Class<T> type) {
        Map<String, T> values = new LinkedHashMap<>();
        mappingStore.list(record).forEach((key, json) ->
            parse(record, key, json, type).ifPresent(value -> values.put(key, value)));
        return values;
    }

    private <T> Optional<T> parse(MappingRecord record, String key, String json, Class<T> type) {
        try {
            return Optional.ofNullable(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring unreadable {} entry {}: {}", record.getStoreName(), key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private void write(MappingRecord record, String key, Object value) {
        try {
            mappingStore.put(record, key, objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new RepositoryException("Failed to serialize " + record.getStoreName() + " entry " + key, e);
        }
    }
}
