package com.bbthechange.rehearsalsync.service.impl;

import com.bbthechange.rehearsalsync.dto.CalendarSyncStatus;
import com.bbthechange.rehearsalsync.dto.UpdateSettingsRequest;
import com.bbthechange.rehearsalsync.exception.CalendarPermissionException;
import com.bbthechange.rehearsalsync.exception.SyncNotConfiguredException;
import com.bbthechange.rehearsalsync.model.CalendarSyncSettings;
import com.bbthechange.rehearsalsync.model.ImportInterval;
import com.bbthechange.rehearsalsync.model.RehearsalWithProject;
import com.bbthechange.rehearsalsync.repository.impl.CalendarMappingRepositoryImpl;
import com.bbthechange.rehearsalsync.repository.impl.InMemoryMappingStore;
import com.bbthechange.rehearsalsync.service.AutoImportService;
import com.bbthechange.rehearsalsync.service.CalendarExportService;
import com.bbthechange.rehearsalsync.service.CalendarManagementService;
import com.bbthechange.rehearsalsync.service.CalendarPermissionService;
import com.bbthechange.rehearsalsync.testutil.SyncTestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.bbthechange.rehearsalsync.testutil.RehearsalTestBuilder.aRehearsal;
import static com.bbthechange.rehearsalsync.testutil.SyncTestFixtures.calendar;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CalendarSyncServiceImplTest {

    @Mock
    private CalendarPermissionService permissionService;

    @Mock
    private CalendarManagementService managementService;

    @Mock
    private CalendarExportService exportService;

    @Mock
    private AutoImportService autoImportService;

    private CalendarMappingRepositoryImpl mappingRepository;
    private CalendarSyncServiceImpl syncService;

    @BeforeEach
    void setUp() {
        mappingRepository = new CalendarMappingRepositoryImpl(new InMemoryMappingStore(),
            SyncTestFixtures.objectMapper(), Clock.fixed(Instant.parse("2025-03-10T12:00:00Z"), ZoneOffset.UTC));
        syncService = new CalendarSyncServiceImpl(permissionService, managementService, exportService,
            autoImportService, mappingRepository);
    }

    @Nested
    @DisplayName("requestPermissions")
    class RequestPermissionsTests {

        @Test
        void requestPermissions_GrantedWithoutExportCalendar_SelectsDefault() {
            // Given
            when(permissionService.requestPermission()).thenReturn(true);
            when(managementService.getDefaultCalendar()).thenReturn(Optional.of(calendar("personal", true, true)));

            // When
            boolean granted = syncService.requestPermissions();

            // Then
            assertThat(granted).isTrue();
            assertThat(mappingRepository.getSettings().getExportCalendarId()).isEqualTo("personal");
        }

        @Test
        void requestPermissions_ExportCalendarAlreadyChosen_KeepsIt() {
            // Given
            mappingRepository.saveSettings(CalendarSyncSettings.builder().exportCalendarId("work").build());
            when(permissionService.requestPermission()).thenReturn(true);

            // When
            syncService.requestPermissions();

            // Then
            assertThat(mappingRepository.getSettings().getExportCalendarId()).isEqualTo("work");
            verify(managementService, never()).getDefaultCalendar();
        }

        @Test
        void requestPermissions_Denied_ReturnsFalse() {
            // Given
            when(permissionService.requestPermission()).thenReturn(false);

            // When/Then
            assertThat(syncService.requestPermissions()).isFalse();
            assertThat(mappingRepository.getSettings().getExportCalendarId()).isNull();
        }
    }

    @Nested
    @DisplayName("export operations")
    class ExportTests {

        @Test
        void syncRehearsal_UsesSelectedCalendar() {
            // Given
            mappingRepository.saveSettings(CalendarSyncSettings.builder().exportCalendarId("work").build());
            RehearsalWithProject rehearsal = aRehearsal().build();

            // When
            syncService.syncRehearsal(rehearsal);

            // Then
            verify(exportService).syncOne(rehearsal, "work");
        }

        @Test
        void syncRehearsal_NoCalendarSelected_Throws() {
            // When/Then
            assertThatThrownBy(() -> syncService.syncRehearsal(aRehearsal().build()))
                .isInstanceOf(SyncNotConfiguredException.class)
                .hasMessage("No calendar selected");
            verify(exportService, never()).syncOne(any(), anyString());
        }

        @Test
        void syncAllRehearsals_NoPermission_Throws() {
            // Given
            doThrow(new CalendarPermissionException()).when(permissionService).requirePermission();

            // When/Then
            assertThatThrownBy(() -> syncService.syncAllRehearsals(List.of(aRehearsal().build()), null))
                .isInstanceOf(CalendarPermissionException.class);
            verify(exportService, never()).syncAll(any(), any(), any());
        }

        @Test
        void removeAllExported_DelegatesToExport() {
            // When
            syncService.removeAllExported(null);

            // Then
            verify(permissionService).requirePermission();
            verify(exportService).removeAll(null);
        }
    }

    @Nested
    @DisplayName("settings")
    class SettingsTests {

        @Test
        void updateSettings_PartialRequest_KeepsOtherFields() {
            // Given
            mappingRepository.saveSettings(CalendarSyncSettings.builder()
                .exportEnabled(true)
                .exportCalendarId("work")
                .build());
            UpdateSettingsRequest request = UpdateSettingsRequest.builder()
                .importEnabled(true)
                .importCalendarIds(Set.of("family"))
                .importInterval(ImportInterval.HOURLY)
                .build();

            // When
            CalendarSyncSettings updated = syncService.updateSettings(request);

            // Then
            assertThat(updated.isExportEnabled()).isTrue();
            assertThat(updated.getExportCalendarId()).isEqualTo("work");
            assertThat(updated.isImportEnabled()).isTrue();
            assertThat(updated.getImportCalendarIds()).containsExactly("family");
            assertThat(updated.getImportInterval()).isEqualTo(ImportInterval.HOURLY);
            assertThat(mappingRepository.getSettings()).isEqualTo(updated);
        }

        @Test
        void getStatus_ReportsCounts() {
            // Given
            mappingRepository.saveEventMapping("r1", "evt-1", "work");
            mappingRepository.saveEventMapping("r2", "evt-2", "work");
            mappingRepository.saveImportedEvent("e1", "slot-1", "family");
            when(permissionService.hasPermission()).thenReturn(true);
            when(autoImportService.isImportInProgress()).thenReturn(false);

            // When
            CalendarSyncStatus status = syncService.getStatus();

            // Then
            assertThat(status.isHasPermission()).isTrue();
            assertThat(status.getSyncedCount()).isEqualTo(2);
            assertThat(status.getImportedCount()).isEqualTo(1);
            assertThat(status.isImportInProgress()).isFalse();
        }
    }
}
