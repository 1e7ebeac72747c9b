package com.bbthechange.rehearsalsync.service.impl;

import com.bbthechange.rehearsalsync.client.InMemoryDeviceCalendarClient;
import com.bbthechange.rehearsalsync.model.DeviceCalendar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.bbthechange.rehearsalsync.testutil.SyncTestFixtures.calendar;
import static org.assertj.core.api.Assertions.assertThat;

class CalendarManagementServiceImplTest {

    private InMemoryDeviceCalendarClient deviceCalendarClient;
    private CalendarManagementServiceImpl managementService;

    @BeforeEach
    void setUp() {
        deviceCalendarClient = new InMemoryDeviceCalendarClient(true, true);
        managementService = new CalendarManagementServiceImpl(deviceCalendarClient,
            new CalendarPermissionServiceImpl(deviceCalendarClient));
    }

    @Test
    void listWritableCalendars_FiltersReadOnly() {
        // Given
        deviceCalendarClient.addCalendar(calendar("work", true, false));
        deviceCalendarClient.addCalendar(calendar("holidays", false, false));

        // When/Then
        assertThat(managementService.listWritableCalendars())
            .extracting(DeviceCalendar::getId)
            .containsExactly("work");
    }

    @Test
    void listWritableCalendars_NoPermission_ReturnsEmpty() {
        // Given
        deviceCalendarClient.addCalendar(calendar("work", true, false));
        deviceCalendarClient.setPermissionGranted(false);

        // When/Then
        assertThat(managementService.listWritableCalendars()).isEmpty();
        assertThat(managementService.getDefaultCalendar()).isEmpty();
    }

    @Test
    void getDefaultCalendar_PrefersPrimary() {
        // Given
        deviceCalendarClient.addCalendar(calendar("work", true, false));
        deviceCalendarClient.addCalendar(calendar("personal", true, true));

        // When/Then
        assertThat(managementService.getDefaultCalendar()).get()
            .extracting(DeviceCalendar::getId).isEqualTo("personal");
    }

    @Test
    void getDefaultCalendar_NoPrimary_FallsBackToFirstWritable() {
        // Given
        deviceCalendarClient.addCalendar(calendar("holidays", false, true));
        deviceCalendarClient.addCalendar(calendar("work", true, false));
        deviceCalendarClient.addCalendar(calendar("personal", true, false));

        // When/Then
        assertThat(managementService.getDefaultCalendar()).get()
            .extracting(DeviceCalendar::getId).isEqualTo("work");
    }
}
