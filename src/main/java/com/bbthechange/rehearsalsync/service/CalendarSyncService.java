package com.bbthechange.rehearsalsync.service;

import com.bbthechange.rehearsalsync.dto.BatchSyncResult;
import com.bbthechange.rehearsalsync.dto.CalendarSyncStatus;
import com.bbthechange.rehearsalsync.dto.ImportResult;
import com.bbthechange.rehearsalsync.dto.UpdateSettingsRequest;
import com.bbthechange.rehearsalsync.model.AppState;
import com.bbthechange.rehearsalsync.model.AutoSyncDecision;
import com.bbthechange.rehearsalsync.model.CalendarSyncSettings;
import com.bbthechange.rehearsalsync.model.DeviceCalendar;
import com.bbthechange.rehearsalsync.model.RehearsalWithProject;
import com.bbthechange.rehearsalsync.util.ProgressListener;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for the app: permission, calendar choice, export, import and settings.
 */
public interface CalendarSyncService {

    boolean requestPermissions();

    List<DeviceCalendar> listCalendars();

    Optional<DeviceCalendar> getDefaultCalendar();

    void syncRehearsal(RehearsalWithProject rehearsal);

    void unsyncRehearsal(String rehearsalId);

    BatchSyncResult syncAllRehearsals(List<RehearsalWithProject> rehearsals, ProgressListener progress);

    BatchSyncResult removeAllExported(ProgressListener progress);

    ImportResult importNow(ProgressListener progress);

    ImportResult clearImported(ProgressListener progress);

    boolean isRehearsalSynced(String rehearsalId);

    CalendarSyncSettings getSettings();

    CalendarSyncSettings updateSettings(UpdateSettingsRequest request);

    CalendarSyncStatus getStatus();

    AutoSyncDecision handleAppStateChange(AppState appState);
}
