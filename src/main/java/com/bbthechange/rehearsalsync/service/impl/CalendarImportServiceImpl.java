package com.bbthechange.rehearsalsync.service.impl;

import com.bbthechange.rehearsalsync.client.AvailabilityApiClient;
import com.bbthechange.rehearsalsync.client.DeviceCalendarClient;
import com.bbthechange.rehearsalsync.config.CalendarSyncProperties;
import com.bbthechange.rehearsalsync.dto.ImportPlan;
import com.bbthechange.rehearsalsync.dto.ImportResult;
import com.bbthechange.rehearsalsync.dto.SlotUpdate;
import com.bbthechange.rehearsalsync.exception.RepositoryException;
import com.bbthechange.rehearsalsync.model.AvailabilitySlot;
import com.bbthechange.rehearsalsync.model.DeviceCalendarEvent;
import com.bbthechange.rehearsalsync.model.EventMapping;
import com.bbthechange.rehearsalsync.repository.CalendarMappingRepository;
import com.bbthechange.rehearsalsync.service.CalendarImportService;
import com.bbthechange.rehearsalsync.service.CalendarPermissionService;
import com.bbthechange.rehearsalsync.util.Batches;
import com.bbthechange.rehearsalsync.util.EventTimeNormalizer;
import com.bbthechange.rehearsalsync.util.ImportDiffCalculator;
import com.bbthechange.rehearsalsync.util.ProgressListener;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Import pipeline: turns device calendar events into busy availability slots.
 * <p>
 * Deletes, updates and add chunks are applied in parallel. Each one that fails is counted
 * against its whole batch without stopping the others. Tracking is written only for
 * changes the backend accepted.
 */
@Service
public class CalendarImportServiceImpl implements CalendarImportService {

    private static final Logger logger = LoggerFactory.getLogger(CalendarImportServiceImpl.class);

    private final DeviceCalendarClient deviceCalendarClient;
    private final AvailabilityApiClient availabilityApiClient;
    private final CalendarMappingRepository mappingRepository;
    private final CalendarPermissionService permissionService;
    private final CalendarSyncProperties properties;
    private final ExecutorService executor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final ImportDiffCalculator diffCalculator;

    @Autowired
    public CalendarImportServiceImpl(DeviceCalendarClient deviceCalendarClient,
                                     AvailabilityApiClient availabilityApiClient,
                                     CalendarMappingRepository mappingRepository,
                                     CalendarPermissionService permissionService,
                                     CalendarSyncProperties properties,
                                     @Qualifier("calendarSyncExecutor") ExecutorService executor,
                                     MeterRegistry meterRegistry,
                                     Clock clock) {
        this.deviceCalendarClient = deviceCalendarClient;
        this.availabilityApiClient = availabilityApiClient;
        this.mappingRepository = mappingRepository;
        this.permissionService = permissionService;
        this.properties = properties;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.diffCalculator = new ImportDiffCalculator(
            new EventTimeNormalizer(clock.getZone()),
            properties.getDefaultImportTitle(),
            properties.getImportSource());
    }

    @Override
    public ImportResult reconcile(Collection<String> calendarIds, ProgressListener progress) {
        permissionService.requirePermission();
        ProgressListener listener = ProgressListener.orNone(progress);
        Timer.Sample timer = Timer.start(meterRegistry);
        ImportResult result = new ImportResult();

        Instant now = clock.instant();
        Instant windowStart = LocalDate.now(clock).atStartOfDay(clock.getZone()).toInstant();
        Instant windowEnd = now.plus(Duration.ofDays(properties.getImportWindowDays()));
        logger.info("Importing from {} calendars between {} and {}", calendarIds.size(), windowStart, windowEnd);

        // 1. Fetch calendar events, backend slots and export mappings in parallel
        CompletableFuture<List<DeviceCalendarEvent>> eventsFuture = fetchEvents(calendarIds, windowStart, windowEnd);
        CompletableFuture<List<AvailabilitySlot>> slotsFuture =
            CompletableFuture.supplyAsync(availabilityApiClient::getAllAvailabilitySlots, executor);
        CompletableFuture<Map<String, EventMapping>> mappingsFuture =
            CompletableFuture.supplyAsync(mappingRepository::findAllEventMappings, executor);

        List<DeviceCalendarEvent> events = await(eventsFuture);
        List<AvailabilitySlot> slots = await(slotsFuture);
        Set<String> exportedEventIds = await(mappingsFuture).values().stream()
            .map(EventMapping::getEventId)
            .collect(Collectors.toSet());

        // 2. Diff
        ImportPlan plan = diffCalculator.calculate(events, slots, exportedEventIds, windowStart, windowEnd);
        result.recordSkipped(plan.skipped());

        if (plan.isEmpty()) {
            logger.info("No calendar changes to import");
            stampLastImportTime();
            recordMetrics(timer, result);
            return result;
        }

        // 3. Apply
        int total = plan.changeCount();
        AtomicInteger applied = new AtomicInteger();
        List<CompletableFuture<Void>> operations = new ArrayList<>();

        if (!plan.toDelete().isEmpty()) {
            operations.add(applyAsync(plan.toDelete().size(), "Delete", result, applied, total, listener,
                () -> applyDeletes(plan.toDelete())));
        }
        if (!plan.toUpdate().isEmpty()) {
            operations.add(applyAsync(plan.toUpdate().size(), "Update", result, applied, total, listener,
                () -> applyUpdates(plan)));
        }
        for (List<AvailabilitySlot> chunk : Batches.partition(plan.toAdd(), properties.getImportChunkSize())) {
            operations.add(applyAsync(chunk.size(), "Add", result, applied, total, listener,
                () -> applyAdds(chunk, plan)));
        }

        CompletableFuture.allOf(operations.toArray(new CompletableFuture[0])).join();

        stampLastImportTime();
        recordMetrics(timer, result);
        logger.info("Calendar import finished: {}", result);
        return result;
    }

    @Override
    public ImportResult removeAll(ProgressListener progress) {
        ProgressListener listener = ProgressListener.orNone(progress);
        ImportResult result = new ImportResult();
        int tracked = mappingRepository.countImportedEvents();
        logger.info("Removing all imported slots ({} tracked)", tracked);

        int deleted;
        try {
            deleted = availabilityApiClient.deleteAllImportedSlots();
        } catch (RuntimeException e) {
            logger.error("Failed to delete imported slots, keeping import tracking", e);
            throw e;
        }

        mappingRepository.clearImportedEvents();
        int removed = deleted >= 0 ? deleted : tracked;
        result.recordSuccess(removed);
        listener.onProgress(removed, removed);
        logger.info("Removed imported slots: {}", result);
        return result;
    }

    private CompletableFuture<List<DeviceCalendarEvent>> fetchEvents(Collection<String> calendarIds,
                                                                     Instant start, Instant end) {
        List<CompletableFuture<List<DeviceCalendarEvent>>> perCalendar = calendarIds.stream()
            .map(calendarId -> CompletableFuture
                .supplyAsync(() -> deviceCalendarClient.listEvents(List.of(calendarId), start, end), executor)
                .exceptionally(error -> {
                    logger.error("Failed to read events from calendar {}, skipping it", calendarId, unwrap(error));
                    return List.of();
                }))
            .collect(Collectors.toList());

        return CompletableFuture.allOf(perCalendar.toArray(new CompletableFuture[0]))
            .thenApply(ignored -> perCalendar.stream()
                .flatMap(future -> future.join().stream())
                .collect(Collectors.toList()));
    }

    private void applyDeletes(List<String> externalEventIds) {
        availabilityApiClient.bulkDeleteSlotsByExternalId(externalEventIds);
        logger.info("Deleted {} imported slots", externalEventIds.size());
        for (String externalEventId : externalEventIds) {
            updateTracking(externalEventId, () -> mappingRepository.deleteImportedEvent(externalEventId));
        }
    }

    private void applyUpdates(ImportPlan plan) {
        availabilityApiClient.bulkUpdateSlots(plan.toUpdate());
        logger.info("Updated {} imported slots", plan.toUpdate().size());
        for (SlotUpdate update : plan.toUpdate()) {
            String externalEventId = update.getExternalEventId();
            AvailabilitySlot existing = plan.backendSlots().get(externalEventId);
            String slotId = existing.getId() != null ? existing.getId() : externalEventId;
            String calendarId = plan.calendarEvents().get(externalEventId).getCalendarId();
            updateTracking(externalEventId,
                () -> mappingRepository.saveImportedEvent(externalEventId, slotId, calendarId));
        }
    }

    private void applyAdds(List<AvailabilitySlot> chunk, ImportPlan plan) {
        List<AvailabilitySlot> created = availabilityApiClient.bulkCreateSlots(chunk);
        logger.info("Created {} imported slots", chunk.size());
        for (AvailabilitySlot slot : created) {
            String externalEventId = slot.getExternalEventId();
            DeviceCalendarEvent event = externalEventId != null ? plan.calendarEvents().get(externalEventId) : null;
            if (event == null) {
                continue;
            }
            String slotId = slot.getId() != null ? slot.getId() : externalEventId;
            updateTracking(externalEventId,
                () -> mappingRepository.saveImportedEvent(externalEventId, slotId, event.getCalendarId()));
        }
    }

    private CompletableFuture<Void> applyAsync(int size, String operation, ImportResult result,
                                               AtomicInteger applied, int total, ProgressListener listener,
                                               Runnable action) {
        return CompletableFuture.runAsync(action, executor)
            .handle((ignored, error) -> {
                if (error == null) {
                    result.recordSuccess(size);
                } else {
                    Throwable cause = unwrap(error);
                    logger.error("{} of {} imported slots failed", operation, size, cause);
                    result.recordFailure(size, operation + " failed: " + cause.getMessage());
                }
                listener.onProgress(applied.addAndGet(size), total);
                return null;
            });
    }

    /**
     * The backend already holds the change; a tracking write failure is repaired by the next run.
     */
    private void updateTracking(String externalEventId, Runnable write) {
        try {
            write.run();
        } catch (RepositoryException e) {
            logger.error("Slot for event {} was applied but tracking could not be stored", externalEventId, e);
        }
    }

    private void stampLastImportTime() {
        mappingRepository.recordLastImportTime(clock.instant());
    }

    private void recordMetrics(Timer.Sample timer, ImportResult result) {
        timer.stop(meterRegistry.timer("calendar_import_duration"));
        meterRegistry.counter("calendar_import_items", "outcome", "success").increment(result.getSucceeded());
        meterRegistry.counter("calendar_import_items", "outcome", "failure").increment(result.getFailed());
        meterRegistry.counter("calendar_import_items", "outcome", "skipped").increment(result.getSkipped());
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw e;
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
