package com.bbthechange.rehearsalsync.service.impl;

import com.bbthechange.rehearsalsync.client.InMemoryDeviceCalendarClient;
import com.bbthechange.rehearsalsync.config.CalendarSyncProperties;
import com.bbthechange.rehearsalsync.dto.BatchSyncResult;
import com.bbthechange.rehearsalsync.dto.CalendarEventDetails;
import com.bbthechange.rehearsalsync.exception.CalendarAccessException;
import com.bbthechange.rehearsalsync.model.EventMapping;
import com.bbthechange.rehearsalsync.model.RehearsalWithProject;
import com.bbthechange.rehearsalsync.model.SyncState;
import com.bbthechange.rehearsalsync.repository.impl.CalendarMappingRepositoryImpl;
import com.bbthechange.rehearsalsync.repository.impl.InMemoryMappingStore;
import com.bbthechange.rehearsalsync.testutil.SyncTestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.bbthechange.rehearsalsync.testutil.RehearsalTestBuilder.aRehearsal;
import static com.bbthechange.rehearsalsync.testutil.SyncTestFixtures.calendar;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalendarExportServiceImplTest {

    private static final Instant NOW = Instant.parse("2025-03-01T08:00:00Z");
    private static final String CALENDAR_ID = "work";

    private InMemoryDeviceCalendarClient deviceCalendarClient;
    private CalendarMappingRepositoryImpl mappingRepository;
    private CalendarSyncProperties properties;
    private ExecutorService executor;
    private SimpleMeterRegistry meterRegistry;
    private CalendarExportServiceImpl exportService;

    @BeforeEach
    void setUp() {
        deviceCalendarClient = new InMemoryDeviceCalendarClient(true, true);
        deviceCalendarClient.addCalendar(calendar(CALENDAR_ID, true, true));
        executor = Executors.newFixedThreadPool(4);
        properties = new CalendarSyncProperties();
        createService();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void createService() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        mappingRepository = new CalendarMappingRepositoryImpl(new InMemoryMappingStore(),
            SyncTestFixtures.objectMapper(), clock);
        meterRegistry = new SimpleMeterRegistry();
        exportService = new CalendarExportServiceImpl(deviceCalendarClient, mappingRepository, properties,
            executor, meterRegistry, clock);
    }

    private List<RehearsalWithProject> rehearsals(int count) {
        List<RehearsalWithProject> rehearsals = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            rehearsals.add(aRehearsal()
                .withId("rehearsal-" + i)
                .forProject("Show " + i)
                .startingAt(Instant.parse("2025-03-10T18:00:00Z").plus(Duration.ofDays(i)))
                .build());
        }
        return rehearsals;
    }

    @Nested
    @DisplayName("syncOne")
    class SyncOneTests {

        @Test
        void syncOne_NewRehearsal_CreatesEventAndMapping() {
            // Given
            RehearsalWithProject rehearsal = aRehearsal().build();

            // When
            String eventId = exportService.syncOne(rehearsal, CALENDAR_ID);

            // Then
            assertThat(deviceCalendarClient.getEvent(eventId)).hasValueSatisfying(event -> {
                assertThat(event.getTitle()).isEqualTo("Rehearsal: Hamlet");
                assertThat(event.getStartDate()).isEqualTo(rehearsal.getStartsAt());
                assertThat(event.getLocation()).isEqualTo("Main Stage");
            });
            assertThat(mappingRepository.findEventMapping("rehearsal-1")).get()
                .extracting(EventMapping::getEventId).isEqualTo(eventId);
            assertThat(mappingRepository.getSettings().getLastExportTime()).isEqualTo(NOW);
        }

        @Test
        void syncOne_AlreadySynced_UpdatesInPlace() {
            // Given
            String eventId = exportService.syncOne(aRehearsal().build(), CALENDAR_ID);

            // When
            String again = exportService.syncOne(aRehearsal().forProject("Macbeth").build(), CALENDAR_ID);

            // Then
            assertThat(again).isEqualTo(eventId);
            assertThat(deviceCalendarClient.eventCount()).isEqualTo(1);
            assertThat(deviceCalendarClient.getEvent(eventId).orElseThrow().getTitle())
                .isEqualTo("Rehearsal: Macbeth");
        }

        @Test
        void syncOne_EventDeletedExternally_RecreatesAndRemaps() {
            // Given
            String eventId = exportService.syncOne(aRehearsal().build(), CALENDAR_ID);
            deviceCalendarClient.removeEvent(eventId);
            assertThat(exportService.resolveSyncState("rehearsal-1")).isInstanceOf(SyncState.Orphaned.class);

            // When
            String recreated = exportService.syncOne(aRehearsal().build(), CALENDAR_ID);

            // Then
            assertThat(recreated).isNotEqualTo(eventId);
            assertThat(deviceCalendarClient.getEvent(recreated)).isPresent();
            assertThat(mappingRepository.findEventMapping("rehearsal-1")).get()
                .extracting(EventMapping::getEventId).isEqualTo(recreated);
            assertThat(exportService.resolveSyncState("rehearsal-1")).isInstanceOf(SyncState.Synced.class);
        }

        @Test
        void syncOne_UpdateFailsWithAccessError_PropagatesAndKeepsMapping() {
            // Given
            deviceCalendarClient = new InMemoryDeviceCalendarClient(true, true) {
                @Override
                public void updateEvent(String eventId, CalendarEventDetails details) {
                    throw new CalendarAccessException("calendar store busy");
                }
            };
            deviceCalendarClient.addCalendar(calendar(CALENDAR_ID, true, true));
            createService();
            String eventId = exportService.syncOne(aRehearsal().build(), CALENDAR_ID);

            // When/Then
            assertThatThrownBy(() -> exportService.syncOne(aRehearsal().build(), CALENDAR_ID))
                .isInstanceOf(CalendarAccessException.class);
            assertThat(deviceCalendarClient.eventCount()).isEqualTo(1);
            assertThat(mappingRepository.findEventMapping("rehearsal-1")).get()
                .extracting(EventMapping::getEventId).isEqualTo(eventId);
        }
    }

    @Nested
    @DisplayName("duplicate detection")
    class DuplicateDetectionTests {

        @Test
        void createEvent_MatchingEventWithinTolerance_BindsToExisting() {
            // Given
            RehearsalWithProject rehearsal = aRehearsal().build();
            deviceCalendarClient.putEvent(SyncTestFixtures.event("existing", CALENDAR_ID, "Rehearsal: Hamlet",
                    "2025-03-10T18:00:30Z", "2025-03-10T19:59:30Z").toBuilder()
                .location("Main Stage")
                .build());

            // When
            String eventId = exportService.createEvent(rehearsal, CALENDAR_ID);

            // Then
            assertThat(eventId).isEqualTo("existing");
            assertThat(deviceCalendarClient.eventCount()).isEqualTo(1);
            assertThat(exportService.isSynced("rehearsal-1")).isTrue();
        }

        @Test
        void syncOne_MappingLost_BindsToPreviouslyCreatedEvent() {
            // Given
            String eventId = exportService.syncOne(aRehearsal().build(), CALENDAR_ID);
            mappingRepository.clearEventMappings();

            // When
            String again = exportService.syncOne(aRehearsal().build(), CALENDAR_ID);

            // Then
            assertThat(again).isEqualTo(eventId);
            assertThat(deviceCalendarClient.eventCount()).isEqualTo(1);
        }

        @Test
        void createEvent_NoLocationOnEitherSide_BindsToExisting() {
            // Given
            RehearsalWithProject rehearsal = aRehearsal().at(null).build();
            deviceCalendarClient.putEvent(SyncTestFixtures.event("existing", CALENDAR_ID, "Rehearsal: Hamlet",
                "2025-03-10T18:00:00Z", "2025-03-10T20:00:00Z"));

            // When/Then
            assertThat(exportService.createEvent(rehearsal, CALENDAR_ID)).isEqualTo("existing");
        }

        @Test
        void createEvent_StartOutsideTolerance_CreatesNewEvent() {
            // Given
            deviceCalendarClient.putEvent(SyncTestFixtures.event("existing", CALENDAR_ID, "Rehearsal: Hamlet",
                    "2025-03-10T18:02:00Z", "2025-03-10T20:00:00Z").toBuilder()
                .location("Main Stage")
                .build());

            // When
            String eventId = exportService.createEvent(aRehearsal().build(), CALENDAR_ID);

            // Then
            assertThat(eventId).isNotEqualTo("existing");
            assertThat(deviceCalendarClient.eventCount()).isEqualTo(2);
        }

        @Test
        void createEvent_DifferentLocation_CreatesNewEvent() {
            // Given
            deviceCalendarClient.putEvent(SyncTestFixtures.event("existing", CALENDAR_ID, "Rehearsal: Hamlet",
                    "2025-03-10T18:00:00Z", "2025-03-10T20:00:00Z").toBuilder()
                .location("Studio B")
                .build());

            // When/Then
            assertThat(exportService.createEvent(aRehearsal().build(), CALENDAR_ID)).isNotEqualTo("existing");
        }
    }

    @Nested
    @DisplayName("syncAll")
    class SyncAllTests {

        @Test
        void syncAll_OneCreateFails_OthersStillSynced() {
            // Given
            deviceCalendarClient = new InMemoryDeviceCalendarClient(true, true) {
                @Override
                public String createEvent(String calendarId, CalendarEventDetails details) {
                    if (details.getTitle().equals("Rehearsal: Show 4")) {
                        throw new CalendarAccessException("write rejected");
                    }
                    return super.createEvent(calendarId, details);
                }
            };
            deviceCalendarClient.addCalendar(calendar(CALENDAR_ID, true, true));
            createService();

            // When
            BatchSyncResult result = exportService.syncAll(rehearsals(10), CALENDAR_ID, null);

            // Then
            assertThat(result.getSucceeded()).isEqualTo(9);
            assertThat(result.getFailed()).isEqualTo(1);
            assertThat(result.getErrors()).hasSize(1);
            assertThat(result.getErrors().get(0)).startsWith("rehearsal-4");
            assertThat(mappingRepository.findAllEventMappings()).hasSize(9).doesNotContainKey("rehearsal-4");
            assertThat(meterRegistry.counter("calendar_export_items", "outcome", "failure").count()).isEqualTo(1.0);
            assertThat(mappingRepository.getSettings().getLastExportTime()).isEqualTo(NOW);
        }

        @Test
        void syncAll_ReportsCumulativeProgressPerBatch() {
            // Given
            properties.setExportBatchSize(3);
            List<Integer> progress = Collections.synchronizedList(new ArrayList<>());

            // When
            BatchSyncResult result = exportService.syncAll(rehearsals(7), CALENDAR_ID,
                (current, total) -> progress.add(current));

            // Then
            assertThat(result.getSucceeded()).isEqualTo(7);
            assertThat(progress).containsExactly(3, 6, 7);
        }

        @Test
        void syncAll_Twice_DoesNotDuplicateEvents() {
            // Given
            List<RehearsalWithProject> rehearsals = rehearsals(5);
            exportService.syncAll(rehearsals, CALENDAR_ID, null);

            // When
            BatchSyncResult second = exportService.syncAll(rehearsals, CALENDAR_ID, null);

            // Then
            assertThat(second.getSucceeded()).isEqualTo(5);
            assertThat(deviceCalendarClient.eventCount()).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("unsync and removeAll")
    class RemovalTests {

        @Test
        void unsyncOne_DeletesEventAndMapping() {
            // Given
            exportService.syncOne(aRehearsal().build(), CALENDAR_ID);

            // When
            exportService.unsyncOne("rehearsal-1");

            // Then
            assertThat(deviceCalendarClient.eventCount()).isZero();
            assertThat(exportService.isSynced("rehearsal-1")).isFalse();
        }

        @Test
        void unsyncOne_EventAlreadyGone_StillRemovesMapping() {
            // Given
            String eventId = exportService.syncOne(aRehearsal().build(), CALENDAR_ID);
            deviceCalendarClient.removeEvent(eventId);

            // When
            exportService.unsyncOne("rehearsal-1");

            // Then
            assertThat(exportService.isSynced("rehearsal-1")).isFalse();
        }

        @Test
        void unsyncOne_DeleteFailsWithAccessError_StillRemovesMapping() {
            // Given
            deviceCalendarClient = new InMemoryDeviceCalendarClient(true, true) {
                @Override
                public void deleteEvent(String eventId) {
                    throw new CalendarAccessException("calendar store busy");
                }
            };
            deviceCalendarClient.addCalendar(calendar(CALENDAR_ID, true, true));
            createService();
            exportService.syncOne(aRehearsal().build(), CALENDAR_ID);

            // When
            exportService.unsyncOne("rehearsal-1");

            // Then
            assertThat(exportService.isSynced("rehearsal-1")).isFalse();
            assertThat(deviceCalendarClient.eventCount()).isEqualTo(1);
        }

        @Test
        void unsyncOne_NotSynced_NoOp() {
            // When
            exportService.unsyncOne("never-synced");

            // Then
            assertThat(mappingRepository.countEventMappings()).isZero();
        }

        @Test
        void removeAll_SomeEventsGone_CountsThemAsRemovedAndClearsMappings() {
            // Given
            exportService.syncAll(rehearsals(3), CALENDAR_ID, null);
            String firstEvent = mappingRepository.findEventMapping("rehearsal-1").orElseThrow().getEventId();
            deviceCalendarClient.removeEvent(firstEvent);

            // When
            BatchSyncResult result = exportService.removeAll(null);

            // Then
            assertThat(result.getSucceeded()).isEqualTo(3);
            assertThat(result.getFailed()).isZero();
            assertThat(deviceCalendarClient.eventCount()).isZero();
            assertThat(mappingRepository.findAllEventMappings()).isEmpty();
        }

        @Test
        void removeAll_OneDeleteFails_CountsFailureAndStillClearsMappings() {
            // Given
            Set<String> lockedEvents = ConcurrentHashMap.newKeySet();
            deviceCalendarClient = new InMemoryDeviceCalendarClient(true, true) {
                @Override
                public void deleteEvent(String eventId) {
                    if (lockedEvents.contains(eventId)) {
                        throw new CalendarAccessException("event is locked");
                    }
                    super.deleteEvent(eventId);
                }
            };
            deviceCalendarClient.addCalendar(calendar(CALENDAR_ID, true, true));
            createService();
            exportService.syncAll(rehearsals(3), CALENDAR_ID, null);
            lockedEvents.add(mappingRepository.findEventMapping("rehearsal-2").orElseThrow().getEventId());

            // When
            BatchSyncResult result = exportService.removeAll(null);

            // Then
            assertThat(result.getSucceeded()).isEqualTo(2);
            assertThat(result.getFailed()).isEqualTo(1);
            assertThat(deviceCalendarClient.eventCount()).isEqualTo(1);
            assertThat(mappingRepository.findAllEventMappings()).isEmpty();
        }
    }

    @Test
    void buildEventDetails_UsesPrefixNotesAndReminder() {
        // When
        CalendarEventDetails details = exportService.buildEventDetails(aRehearsal().build());

        // Then
        assertThat(details.getTitle()).isEqualTo("Rehearsal: Hamlet");
        assertThat(details.getNotes()).isEqualTo("Project: Hamlet\n\nCreated via Rehearsal Calendar app");
        assertThat(details.getReminderMinutesBefore()).isEqualTo(30);
        assertThat(details.getBusy()).isTrue();
    }
}
