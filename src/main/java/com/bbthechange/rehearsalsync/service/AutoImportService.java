package com.bbthechange.rehearsalsync.service;

import com.bbthechange.rehearsalsync.dto.ImportResult;
import com.bbthechange.rehearsalsync.model.AppState;
import com.bbthechange.rehearsalsync.model.AutoSyncDecision;
import com.bbthechange.rehearsalsync.model.CalendarSyncSettings;
import com.bbthechange.rehearsalsync.util.ProgressListener;

import java.time.Instant;

/**
 * Decides when calendar import runs and keeps at most one import or clear in flight.
 */
public interface AutoImportService {

    /**
     * Record a lifecycle change. A return to the foreground triggers an automatic import.
     */
    AutoSyncDecision handleAppStateChange(AppState appState);

    /**
     * Run an import if the throttle, settings and interval allow it. Never throws.
     */
    AutoSyncDecision performAutoSync();

    /**
     * Import now regardless of the interval.
     *
     * @throws com.bbthechange.rehearsalsync.exception.SyncNotConfiguredException if import is off or has no calendars
     * @throws com.bbthechange.rehearsalsync.exception.SyncInProgressException if a run is in flight
     */
    ImportResult forceImport(ProgressListener progress);

    ImportResult clearImported(ProgressListener progress);

    boolean isImportDue(CalendarSyncSettings settings, Instant now);

    boolean isImportInProgress();
}
