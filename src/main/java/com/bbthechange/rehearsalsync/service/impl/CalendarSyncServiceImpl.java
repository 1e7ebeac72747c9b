package com.bbthechange.rehearsalsync.service.impl;

import com.bbthechange.rehearsalsync.dto.BatchSyncResult;
import com.bbthechange.rehearsalsync.dto.CalendarSyncStatus;
import com.bbthechange.rehearsalsync.dto.ImportResult;
import com.bbthechange.rehearsalsync.dto.UpdateSettingsRequest;
import com.bbthechange.rehearsalsync.exception.SyncNotConfiguredException;
import com.bbthechange.rehearsalsync.model.AppState;
import com.bbthechange.rehearsalsync.model.AutoSyncDecision;
import com.bbthechange.rehearsalsync.model.CalendarSyncSettings;
import com.bbthechange.rehearsalsync.model.DeviceCalendar;
import com.bbthechange.rehearsalsync.model.RehearsalWithProject;
import com.bbthechange.rehearsalsync.repository.CalendarMappingRepository;
import com.bbthechange.rehearsalsync.service.AutoImportService;
import com.bbthechange.rehearsalsync.service.CalendarExportService;
import com.bbthechange.rehearsalsync.service.CalendarManagementService;
import com.bbthechange.rehearsalsync.service.CalendarPermissionService;
import com.bbthechange.rehearsalsync.service.CalendarSyncService;
import com.bbthechange.rehearsalsync.util.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

@Service
public class CalendarSyncServiceImpl implements CalendarSyncService {

    private static final Logger logger = LoggerFactory.getLogger(CalendarSyncServiceImpl.class);

    private final CalendarPermissionService permissionService;
    private final CalendarManagementService managementService;
    private final CalendarExportService exportService;
    private final AutoImportService autoImportService;
    private final CalendarMappingRepository mappingRepository;

    @Autowired
    public CalendarSyncServiceImpl(CalendarPermissionService permissionService,
                                   CalendarManagementService managementService,
                                   CalendarExportService exportService,
                                   AutoImportService autoImportService,
                                   CalendarMappingRepository mappingRepository) {
        this.permissionService = permissionService;
        this.managementService = managementService;
        this.exportService = exportService;
        this.autoImportService = autoImportService;
        this.mappingRepository = mappingRepository;
    }

    @Override
    public boolean requestPermissions() {
        boolean granted = permissionService.requestPermission();
        if (!granted) {
            return false;
        }

        CalendarSyncSettings settings = mappingRepository.getSettings();
        if (settings.getExportCalendarId() == null) {
            managementService.getDefaultCalendar().ifPresent(calendar -> {
                logger.info("Using calendar {} ({}) for export", calendar.getTitle(), calendar.getId());
                mappingRepository.saveSettings(settings.toBuilder().exportCalendarId(calendar.getId()).build());
            });
        }
        return true;
    }

    @Override
    public List<DeviceCalendar> listCalendars() {
        return managementService.listWritableCalendars();
    }

    @Override
    public Optional<DeviceCalendar> getDefaultCalendar() {
        return managementService.getDefaultCalendar();
    }

    @Override
    public void syncRehearsal(RehearsalWithProject rehearsal) {
        permissionService.requirePermission();
        exportService.syncOne(rehearsal, requireExportCalendar());
    }

    @Override
    public void unsyncRehearsal(String rehearsalId) {
        permissionService.requirePermission();
        exportService.unsyncOne(rehearsalId);
    }

    @Override
    public BatchSyncResult syncAllRehearsals(List<RehearsalWithProject> rehearsals, ProgressListener progress) {
        permissionService.requirePermission();
        return exportService.syncAll(rehearsals, requireExportCalendar(), progress);
    }

    @Override
    public BatchSyncResult removeAllExported(ProgressListener progress) {
        permissionService.requirePermission();
        return exportService.removeAll(progress);
    }

    @Override
    public ImportResult importNow(ProgressListener progress) {
        return autoImportService.forceImport(progress);
    }

    @Override
    public ImportResult clearImported(ProgressListener progress) {
        return autoImportService.clearImported(progress);
    }

    @Override
    public boolean isRehearsalSynced(String rehearsalId) {
        return exportService.isSynced(rehearsalId);
    }

    @Override
    public CalendarSyncSettings getSettings() {
        return mappingRepository.getSettings();
    }

    @Override
    public CalendarSyncSettings updateSettings(UpdateSettingsRequest request) {
        CalendarSyncSettings.CalendarSyncSettingsBuilder updated = mappingRepository.getSettings().toBuilder();

        if (request.getExportEnabled() != null) {
            updated.exportEnabled(request.getExportEnabled());
        }
        if (request.getExportCalendarId() != null) {
            updated.exportCalendarId(request.getExportCalendarId());
        }
        if (request.getImportEnabled() != null) {
            updated.importEnabled(request.getImportEnabled());
        }
        if (request.getImportCalendarIds() != null) {
            updated.importCalendarIds(new LinkedHashSet<>(request.getImportCalendarIds()));
        }
        if (request.getImportInterval() != null) {
            updated.importInterval(request.getImportInterval());
        }

        CalendarSyncSettings saved = mappingRepository.saveSettings(updated.build());
        logger.info("Calendar sync settings updated: export={}, import={}, interval={}",
            saved.isExportEnabled(), saved.isImportEnabled(), saved.getImportInterval().getValue());
        return saved;
    }

    @Override
    public CalendarSyncStatus getStatus() {
        return CalendarSyncStatus.builder()
            .hasPermission(permissionService.hasPermission())
            .settings(mappingRepository.getSettings())
            .syncedCount(mappingRepository.countEventMappings())
            .importedCount(mappingRepository.countImportedEvents())
            .importInProgress(autoImportService.isImportInProgress())
            .build();
    }

    @Override
    public AutoSyncDecision handleAppStateChange(AppState appState) {
        return autoImportService.handleAppStateChange(appState);
    }

    private String requireExportCalendar() {
        String calendarId = mappingRepository.getSettings().getExportCalendarId();
        if (calendarId == null || calendarId.isBlank()) {
            throw new SyncNotConfiguredException("No calendar selected");
        }
        return calendarId;
    }
}
