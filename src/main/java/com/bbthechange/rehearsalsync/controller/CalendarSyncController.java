package com.bbthechange.rehearsalsync.controller;

import com.bbthechange.rehearsalsync.dto.AppStateRequest;
import com.bbthechange.rehearsalsync.dto.BatchSyncResult;
import com.bbthechange.rehearsalsync.dto.CalendarSyncStatus;
import com.bbthechange.rehearsalsync.dto.ImportResult;
import com.bbthechange.rehearsalsync.dto.SyncAllRehearsalsRequest;
import com.bbthechange.rehearsalsync.dto.UpdateSettingsRequest;
import com.bbthechange.rehearsalsync.model.AutoSyncDecision;
import com.bbthechange.rehearsalsync.model.CalendarSyncSettings;
import com.bbthechange.rehearsalsync.model.DeviceCalendar;
import com.bbthechange.rehearsalsync.model.RehearsalWithProject;
import com.bbthechange.rehearsalsync.service.CalendarSyncService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST surface of the calendar sync engine, for hosts that drive it over HTTP.
 * Batch endpoints report aggregate counts; only precondition failures come back as errors.
 */
@RestController
@RequestMapping("/calendar-sync")
public class CalendarSyncController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(CalendarSyncController.class);

    private final CalendarSyncService calendarSyncService;

    @Autowired
    public CalendarSyncController(CalendarSyncService calendarSyncService) {
        this.calendarSyncService = calendarSyncService;
    }

    /**
     * Ask for calendar access. Picks a default export calendar the first time access is granted.
     *
     * POST /calendar-sync/permissions
     */
    @PostMapping("/permissions")
    public ResponseEntity<Map<String, Boolean>> requestPermissions() {
        boolean granted = calendarSyncService.requestPermissions();
        return ResponseEntity.ok(Map.of("granted", granted));
    }

    @GetMapping("/calendars")
    public ResponseEntity<List<DeviceCalendar>> listCalendars() {
        return ResponseEntity.ok(calendarSyncService.listCalendars());
    }

    /**
     * GET /calendar-sync/calendars/default
     * 204 when no writable calendar exists.
     */
    @GetMapping("/calendars/default")
    public ResponseEntity<DeviceCalendar> getDefaultCalendar() {
        return calendarSyncService.getDefaultCalendar()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/rehearsals/sync")
    public ResponseEntity<Void> syncRehearsal(@Valid @RequestBody RehearsalWithProject rehearsal) {
        logger.info("Syncing rehearsal {}", rehearsal.getId());
        calendarSyncService.syncRehearsal(rehearsal);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/rehearsals/sync-all")
    public ResponseEntity<BatchSyncResult> syncAllRehearsals(@Valid @RequestBody SyncAllRehearsalsRequest request) {
        logger.info("Syncing {} rehearsals", request.getRehearsals().size());
        return ResponseEntity.ok(calendarSyncService.syncAllRehearsals(request.getRehearsals(), null));
    }

    @GetMapping("/rehearsals/{rehearsalId}/sync")
    public ResponseEntity<Map<String, Boolean>> isRehearsalSynced(@PathVariable String rehearsalId) {
        return ResponseEntity.ok(Map.of("synced", calendarSyncService.isRehearsalSynced(rehearsalId)));
    }

    @DeleteMapping("/rehearsals/{rehearsalId}/sync")
    public ResponseEntity<Void> unsyncRehearsal(@PathVariable String rehearsalId) {
        logger.info("Unsyncing rehearsal {}", rehearsalId);
        calendarSyncService.unsyncRehearsal(rehearsalId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/exported")
    public ResponseEntity<BatchSyncResult> removeAllExported() {
        logger.info("Removing all exported rehearsal events");
        return ResponseEntity.ok(calendarSyncService.removeAllExported(null));
    }

    /**
     * Import calendar events now, ignoring the configured interval.
     *
     * POST /calendar-sync/import
     */
    @PostMapping("/import")
    public ResponseEntity<ImportResult> importNow() {
        return ResponseEntity.ok(calendarSyncService.importNow(null));
    }

    @DeleteMapping("/imported")
    public ResponseEntity<ImportResult> clearImported() {
        return ResponseEntity.ok(calendarSyncService.clearImported(null));
    }

    @GetMapping("/settings")
    public ResponseEntity<CalendarSyncSettings> getSettings() {
        return ResponseEntity.ok(calendarSyncService.getSettings());
    }

    @PatchMapping("/settings")
    public ResponseEntity<CalendarSyncSettings> updateSettings(@RequestBody UpdateSettingsRequest request) {
        return ResponseEntity.ok(calendarSyncService.updateSettings(request));
    }

    @GetMapping("/status")
    public ResponseEntity<CalendarSyncStatus> getStatus() {
        return ResponseEntity.ok(calendarSyncService.getStatus());
    }

    /**
     * Report an app lifecycle change. Returning to the foreground may start an import.
     *
     * POST /calendar-sync/app-state
     */
    @PostMapping("/app-state")
    public ResponseEntity<Map<String, AutoSyncDecision>> appStateChanged(@Valid @RequestBody AppStateRequest request) {
        AutoSyncDecision decision = calendarSyncService.handleAppStateChange(request.getState());
        return ResponseEntity.ok(Map.of("decision", decision));
    }
}
