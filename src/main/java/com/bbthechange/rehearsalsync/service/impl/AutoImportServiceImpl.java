package com.bbthechange.rehearsalsync.service.impl;

import com.bbthechange.rehearsalsync.config.CalendarSyncProperties;
import com.bbthechange.rehearsalsync.dto.ImportResult;
import com.bbthechange.rehearsalsync.exception.SyncInProgressException;
import com.bbthechange.rehearsalsync.exception.SyncNotConfiguredException;
import com.bbthechange.rehearsalsync.model.AppState;
import com.bbthechange.rehearsalsync.model.AutoSyncDecision;
import com.bbthechange.rehearsalsync.model.CalendarSyncSettings;
import com.bbthechange.rehearsalsync.model.ImportInterval;
import com.bbthechange.rehearsalsync.repository.CalendarMappingRepository;
import com.bbthechange.rehearsalsync.service.AutoImportService;
import com.bbthechange.rehearsalsync.service.CalendarImportService;
import com.bbthechange.rehearsalsync.service.CalendarPermissionService;
import com.bbthechange.rehearsalsync.util.ProgressListener;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Sync orchestrator. Owns the trigger throttle and the single in-flight slot shared by
 * automatic imports, forced imports and clearing imported slots.
 */
@Service
public class AutoImportServiceImpl implements AutoImportService {

    private static final Logger logger = LoggerFactory.getLogger(AutoImportServiceImpl.class);

    private final CalendarImportService importService;
    private final CalendarMappingRepository mappingRepository;
    private final CalendarPermissionService permissionService;
    private final CalendarSyncProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicBoolean importInFlight = new AtomicBoolean(false);
    private final Object triggerLock = new Object();
    private Instant lastTriggerTime;
    private volatile AppState lastAppState = AppState.ACTIVE;

    @Autowired
    public AutoImportServiceImpl(CalendarImportService importService,
                                 CalendarMappingRepository mappingRepository,
                                 CalendarPermissionService permissionService,
                                 CalendarSyncProperties properties,
                                 MeterRegistry meterRegistry,
                                 Clock clock) {
        this.importService = importService;
        this.mappingRepository = mappingRepository;
        this.permissionService = permissionService;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Override
    public AutoSyncDecision handleAppStateChange(AppState appState) {
        AppState previous = lastAppState;
        lastAppState = appState;

        if (!(previous.isInBackground() && appState == AppState.ACTIVE)) {
            return record(AutoSyncDecision.IGNORED);
        }
        logger.debug("App returned to foreground");
        return performAutoSync();
    }

    @Override
    public AutoSyncDecision performAutoSync() {
        Instant now = clock.instant();
        synchronized (triggerLock) {
            if (lastTriggerTime != null && now.isBefore(lastTriggerTime.plus(properties.getThrottleWindow()))) {
                logger.debug("Auto import throttled, last trigger at {}", lastTriggerTime);
                return record(AutoSyncDecision.THROTTLED);
            }
            lastTriggerTime = now;
        }

        CalendarSyncSettings settings = mappingRepository.getSettings();
        if (!settings.isImportConfigured()) {
            return record(AutoSyncDecision.DISABLED);
        }
        if (!isImportDue(settings, now)) {
            logger.debug("Auto import not due, interval {} last import {}",
                settings.getImportInterval(), settings.getLastImportTime());
            return record(AutoSyncDecision.NOT_DUE);
        }
        if (!permissionService.hasPermission()) {
            logger.info("Auto import skipped, calendar permission not granted");
            return record(AutoSyncDecision.DISABLED);
        }
        if (!importInFlight.compareAndSet(false, true)) {
            logger.info("Auto import skipped, another run is in progress");
            return record(AutoSyncDecision.ALREADY_RUNNING);
        }

        try {
            ImportResult result = importService.reconcile(
                new ArrayList<>(settings.getImportCalendarIds()), ProgressListener.NONE);
            logger.info("Auto import completed: {}", result);
            return record(AutoSyncDecision.IMPORTED);
        } catch (Exception e) {
            logger.error("Auto import failed", e);
            return record(AutoSyncDecision.FAILED);
        } finally {
            importInFlight.set(false);
        }
    }

    @Override
    public ImportResult forceImport(ProgressListener progress) {
        CalendarSyncSettings settings = mappingRepository.getSettings();
        permissionService.requirePermission();
        if (!settings.isImportEnabled()) {
            throw new SyncNotConfiguredException("Calendar import is not enabled");
        }
        if (!settings.isImportConfigured()) {
            throw new SyncNotConfiguredException("No calendars selected for import");
        }

        logger.info("Manual import requested");
        return runExclusive(() -> importService.reconcile(
            new ArrayList<>(settings.getImportCalendarIds()), progress));
    }

    @Override
    public ImportResult clearImported(ProgressListener progress) {
        logger.info("Clearing imported slots");
        return runExclusive(() -> importService.removeAll(progress));
    }

    @Override
    public boolean isImportDue(CalendarSyncSettings settings, Instant now) {
        ImportInterval interval = settings.getImportInterval();
        if (interval == null || !interval.isAutomatic()) {
            return false;
        }
        Instant lastImport = settings.getLastImportTime();
        if (lastImport == null || interval.getPeriod().isZero()) {
            return true;
        }
        return !now.isBefore(lastImport.plus(interval.getPeriod()));
    }

    @Override
    public boolean isImportInProgress() {
        return importInFlight.get();
    }

    private ImportResult runExclusive(Supplier<ImportResult> run) {
        if (!importInFlight.compareAndSet(false, true)) {
            throw new SyncInProgressException();
        }
        try {
            return run.get();
        } finally {
            importInFlight.set(false);
        }
    }

    private AutoSyncDecision record(AutoSyncDecision decision) {
        meterRegistry.counter("calendar_auto_import_decisions",
                "decision", decision.name().toLowerCase(Locale.ROOT))
            .increment();
        return decision;
    }
}
