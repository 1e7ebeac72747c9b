package com.bbthechange.rehearsalsync.service;

import com.bbthechange.rehearsalsync.dto.BatchSyncResult;
import com.bbthechange.rehearsalsync.model.RehearsalWithProject;
import com.bbthechange.rehearsalsync.model.SyncState;
import com.bbthechange.rehearsalsync.util.ProgressListener;

import java.util.List;

/**
 * Mirrors rehearsals into a device calendar.
 */
public interface CalendarExportService {

    /**
     * Create the calendar event for a rehearsal, or bind to a matching event already in the
     * calendar, and store the mapping.
     *
     * @return the ID of the event now mapped to the rehearsal
     */
    String createEvent(RehearsalWithProject rehearsal, String calendarId);

    /**
     * Create, update or recreate the event for one rehearsal. Failures propagate.
     *
     * @return the ID of the event now mapped to the rehearsal
     */
    String syncOne(RehearsalWithProject rehearsal, String calendarId);

    /**
     * Sync rehearsals in parallel waves. Per-item failures are counted, not thrown.
     */
    BatchSyncResult syncAll(List<RehearsalWithProject> rehearsals, String calendarId, ProgressListener progress);

    /**
     * Delete the rehearsal's event if it still exists and forget the mapping.
     */
    void unsyncOne(String rehearsalId);

    /**
     * Delete every mapped event, then clear all export mappings whatever the outcome.
     */
    BatchSyncResult removeAll(ProgressListener progress);

    boolean isSynced(String rehearsalId);

    SyncState resolveSyncState(String rehearsalId);
}
