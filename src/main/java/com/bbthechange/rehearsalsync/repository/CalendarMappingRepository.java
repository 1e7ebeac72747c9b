package com.bbthechange.rehearsalsync.repository;

import com.bbthechange.rehearsalsync.model.CalendarSyncSettings;
import com.bbthechange.rehearsalsync.model.EventMapping;
import com.bbthechange.rehearsalsync.model.ImportedEvent;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to export mappings, import tracking and sync settings.
 */
public interface CalendarMappingRepository {

    // Export mappings, keyed by rehearsal ID
    Optional<EventMapping> findEventMapping(String rehearsalId);

    EventMapping saveEventMapping(String rehearsalId, String eventId, String calendarId);

    void deleteEventMapping(String rehearsalId);

    Map<String, EventMapping> findAllEventMappings();

    void clearEventMappings();

    int countEventMappings();

    // Import tracking, keyed by external event ID
    Optional<ImportedEvent> findImportedEvent(String externalEventId);

    ImportedEvent saveImportedEvent(String externalEventId, String localSlotId, String calendarId);

    void deleteImportedEvent(String externalEventId);

    Map<String, ImportedEvent> findAllImportedEvents();

    void clearImportedEvents();

    int countImportedEvents();

    // Settings
    /**
     * Stored settings, or defaults when none have been saved or the stored value is unreadable.
     * Last export and import times are the latest of the saved settings and the recorded stamps.
     */
    CalendarSyncSettings getSettings();

    CalendarSyncSettings saveSettings(CalendarSyncSettings settings);

    /**
     * Record when an export finished, under its own key so it never rewrites the settings.
     */
    void recordLastExportTime(Instant time);

    void recordLastImportTime(Instant time);
}
