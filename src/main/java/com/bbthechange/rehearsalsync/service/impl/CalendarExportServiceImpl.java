package com.bbthechange.rehearsalsync.service.impl;

import com.bbthechange.rehearsalsync.client.DeviceCalendarClient;
import com.bbthechange.rehearsalsync.config.CalendarSyncProperties;
import com.bbthechange.rehearsalsync.dto.BatchSyncResult;
import com.bbthechange.rehearsalsync.dto.CalendarEventDetails;
import com.bbthechange.rehearsalsync.exception.CalendarAccessException;
import com.bbthechange.rehearsalsync.exception.CalendarEventNotFoundException;
import com.bbthechange.rehearsalsync.model.DeviceCalendarEvent;
import com.bbthechange.rehearsalsync.model.EventMapping;
import com.bbthechange.rehearsalsync.model.RehearsalWithProject;
import com.bbthechange.rehearsalsync.model.SyncState;
import com.bbthechange.rehearsalsync.repository.CalendarMappingRepository;
import com.bbthechange.rehearsalsync.service.CalendarExportService;
import com.bbthechange.rehearsalsync.util.Batches;
import com.bbthechange.rehearsalsync.util.ProgressListener;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Export pipeline: keeps one device calendar event per synced rehearsal.
 * <p>
 * A mapped event that no longer exists is recreated. Other update failures are not
 * taken as proof of deletion and propagate to the caller.
 */
@Service
public class CalendarExportServiceImpl implements CalendarExportService {

    private static final Logger logger = LoggerFactory.getLogger(CalendarExportServiceImpl.class);

    private final DeviceCalendarClient deviceCalendarClient;
    private final CalendarMappingRepository mappingRepository;
    private final CalendarSyncProperties properties;
    private final ExecutorService executor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Autowired
    public CalendarExportServiceImpl(DeviceCalendarClient deviceCalendarClient,
                                     CalendarMappingRepository mappingRepository,
                                     CalendarSyncProperties properties,
                                     @Qualifier("calendarSyncExecutor") ExecutorService executor,
                                     MeterRegistry meterRegistry,
                                     Clock clock) {
        this.deviceCalendarClient = deviceCalendarClient;
        this.mappingRepository = mappingRepository;
        this.properties = properties;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Override
    public String createEvent(RehearsalWithProject rehearsal, String calendarId) {
        CalendarEventDetails details = buildEventDetails(rehearsal);

        Optional<DeviceCalendarEvent> duplicate = findDuplicate(rehearsal, calendarId, details.getTitle());
        if (duplicate.isPresent()) {
            String eventId = duplicate.get().getId();
            logger.warn("Found existing event {} matching rehearsal {}, binding instead of creating",
                eventId, rehearsal.getId());
            mappingRepository.saveEventMapping(rehearsal.getId(), eventId, calendarId);
            return eventId;
        }

        String eventId = deviceCalendarClient.createEvent(calendarId, details);
        mappingRepository.saveEventMapping(rehearsal.getId(), eventId, calendarId);
        logger.info("Created event {} for rehearsal {} in calendar {}", eventId, rehearsal.getId(), calendarId);
        return eventId;
    }

    @Override
    public String syncOne(RehearsalWithProject rehearsal, String calendarId) {
        String eventId = syncRehearsal(rehearsal, calendarId);
        stampLastExportTime();
        return eventId;
    }

    @Override
    public BatchSyncResult syncAll(List<RehearsalWithProject> rehearsals, String calendarId,
                                   ProgressListener progress) {
        ProgressListener listener = ProgressListener.orNone(progress);
        BatchSyncResult result = new BatchSyncResult();
        int total = rehearsals.size();
        logger.info("Syncing {} rehearsals to calendar {}", total, calendarId);

        int processed = 0;
        for (List<RehearsalWithProject> batch : Batches.partition(rehearsals, properties.getExportBatchSize())) {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (RehearsalWithProject rehearsal : batch) {
                futures.add(CompletableFuture
                    .runAsync(() -> syncRehearsal(rehearsal, calendarId), executor)
                    .handle((ignored, error) -> {
                        recordOutcome(result, "sync", rehearsal.getId(), error);
                        return null;
                    }));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            processed += batch.size();
            listener.onProgress(processed, total);
        }

        stampLastExportTime();
        logger.info("Rehearsal sync finished: {}", result);
        return result;
    }

    @Override
    public void unsyncOne(String rehearsalId) {
        Optional<EventMapping> mapping = mappingRepository.findEventMapping(rehearsalId);
        if (mapping.isEmpty()) {
            logger.debug("Rehearsal {} is not synced", rehearsalId);
            return;
        }

        String eventId = mapping.get().getEventId();
        try {
            deviceCalendarClient.deleteEvent(eventId);
            logger.info("Deleted event {} for rehearsal {}", eventId, rehearsalId);
        } catch (CalendarEventNotFoundException e) {
            logger.debug("Event {} for rehearsal {} was already gone", eventId, rehearsalId);
        } catch (CalendarAccessException e) {
            logger.warn("Could not delete event {} for rehearsal {}, removing mapping anyway",
                eventId, rehearsalId, e);
        }
        mappingRepository.deleteEventMapping(rehearsalId);
    }

    @Override
    public BatchSyncResult removeAll(ProgressListener progress) {
        ProgressListener listener = ProgressListener.orNone(progress);
        BatchSyncResult result = new BatchSyncResult();
        List<Map.Entry<String, EventMapping>> mappings =
            new ArrayList<>(mappingRepository.findAllEventMappings().entrySet());
        int total = mappings.size();
        logger.info("Removing {} exported events", total);

        int processed = 0;
        for (List<Map.Entry<String, EventMapping>> batch : Batches.partition(mappings, properties.getExportBatchSize())) {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (Map.Entry<String, EventMapping> entry : batch) {
                futures.add(CompletableFuture
                    .runAsync(() -> deleteMappedEvent(entry.getValue().getEventId()), executor)
                    .handle((ignored, error) -> {
                        recordOutcome(result, "remove", entry.getKey(), error);
                        return null;
                    }));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            processed += batch.size();
            listener.onProgress(processed, total);
        }

        // Local state is authoritative, so mappings go even when deletes failed
        mappingRepository.clearEventMappings();
        logger.info("Removed exported events: {}", result);
        return result;
    }

    @Override
    public boolean isSynced(String rehearsalId) {
        return mappingRepository.findEventMapping(rehearsalId).isPresent();
    }

    @Override
    public SyncState resolveSyncState(String rehearsalId) {
        Optional<EventMapping> mapping = mappingRepository.findEventMapping(rehearsalId);
        if (mapping.isEmpty()) {
            return new SyncState.Unsynced();
        }
        try {
            return deviceCalendarClient.getEvent(mapping.get().getEventId()).isPresent()
                ? new SyncState.Synced(mapping.get())
                : new SyncState.Orphaned(mapping.get());
        } catch (CalendarEventNotFoundException e) {
            return new SyncState.Orphaned(mapping.get());
        }
    }

    private String syncRehearsal(RehearsalWithProject rehearsal, String calendarId) {
        SyncState state = resolveSyncState(rehearsal.getId());

        if (state instanceof SyncState.Synced synced) {
            EventMapping mapping = synced.mapping();
            try {
                deviceCalendarClient.updateEvent(mapping.getEventId(), buildEventDetails(rehearsal));
                mappingRepository.saveEventMapping(rehearsal.getId(), mapping.getEventId(), mapping.getCalendarId());
                logger.debug("Updated event {} for rehearsal {}", mapping.getEventId(), rehearsal.getId());
                return mapping.getEventId();
            } catch (CalendarEventNotFoundException e) {
                logger.warn("Event {} for rehearsal {} disappeared during update, recreating",
                    mapping.getEventId(), rehearsal.getId());
                mappingRepository.deleteEventMapping(rehearsal.getId());
                return createEvent(rehearsal, calendarId);
            }
        }

        if (state instanceof SyncState.Orphaned orphaned) {
            logger.warn("Event {} for rehearsal {} no longer exists, recreating",
                orphaned.mapping().getEventId(), rehearsal.getId());
            mappingRepository.deleteEventMapping(rehearsal.getId());
        }
        return createEvent(rehearsal, calendarId);
    }

    private void deleteMappedEvent(String eventId) {
        try {
            deviceCalendarClient.deleteEvent(eventId);
        } catch (CalendarEventNotFoundException e) {
            logger.debug("Event {} was already gone", eventId);
        }
    }

    /**
     * Look for an event created for this rehearsal before its mapping was lost.
     * Search errors count as "no duplicate".
     */
    private Optional<DeviceCalendarEvent> findDuplicate(RehearsalWithProject rehearsal, String calendarId,
                                                        String title) {
        Duration window = properties.getDuplicateSearchWindow();
        Duration tolerance = properties.getDuplicateTolerance();
        try {
            return deviceCalendarClient.listEvents(List.of(calendarId),
                    rehearsal.getStartsAt().minus(window), rehearsal.getEndsAt().plus(window))
                .stream()
                .filter(event -> Objects.equals(event.getTitle(), title))
                .filter(event -> within(event.getStartDate(), rehearsal.getStartsAt(), tolerance))
                .filter(event -> within(event.getEndDate(), rehearsal.getEndsAt(), tolerance))
                .filter(event -> normalizeLocation(event.getLocation()).equals(normalizeLocation(rehearsal.getLocation())))
                .findFirst();
        } catch (Exception e) {
            logger.warn("Duplicate search failed for rehearsal {}, creating a new event", rehearsal.getId(), e);
            return Optional.empty();
        }
    }

    CalendarEventDetails buildEventDetails(RehearsalWithProject rehearsal) {
        return CalendarEventDetails.builder()
            .title(properties.getEventTitlePrefix() + rehearsal.getProjectName())
            .start(rehearsal.getStartsAt())
            .end(rehearsal.getEndsAt())
            .location(rehearsal.getLocation())
            .notes("Project: " + rehearsal.getProjectName() + "\n\nCreated via Rehearsal Calendar app")
            .reminderMinutesBefore(properties.getReminderMinutesBefore())
            .busy(true)
            .build();
    }

    private void recordOutcome(BatchSyncResult result, String action, String rehearsalId, Throwable error) {
        if (error == null) {
            result.recordSuccess();
            meterRegistry.counter("calendar_export_items", "outcome", "success").increment();
            return;
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        logger.error("Calendar {} failed for rehearsal {}", action, rehearsalId, cause);
        result.recordFailure(rehearsalId + ": " + cause.getMessage());
        meterRegistry.counter("calendar_export_items", "outcome", "failure").increment();
    }

    private void stampLastExportTime() {
        mappingRepository.recordLastExportTime(Instant.now(clock));
    }

    private static boolean within(Instant actual, Instant expected, Duration tolerance) {
        return actual != null && Duration.between(actual, expected).abs().compareTo(tolerance) <= 0;
    }

    private static String normalizeLocation(String location) {
        return location == null ? "" : location;
    }
}
