package com.bbthechange.rehearsalsync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An event instance read from a device calendar.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DeviceCalendarEvent {

    private String id;
    private String calendarId;
    private String title;
    private Instant startDate;
    private Instant endDate;
    private boolean allDay;
    private String location;
    private String notes;
}
