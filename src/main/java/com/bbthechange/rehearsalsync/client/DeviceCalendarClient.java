package com.bbthechange.rehearsalsync.client;

import com.bbthechange.rehearsalsync.dto.CalendarEventDetails;
import com.bbthechange.rehearsalsync.exception.CalendarAccessException;
import com.bbthechange.rehearsalsync.exception.CalendarEventNotFoundException;
import com.bbthechange.rehearsalsync.exception.CalendarPermissionException;
import com.bbthechange.rehearsalsync.model.DeviceCalendar;
import com.bbthechange.rehearsalsync.model.DeviceCalendarEvent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Access to the calendars of the device the engine runs for.
 * <p>
 * Operations other than the permission calls throw {@link CalendarPermissionException}
 * when access has not been granted and {@link CalendarAccessException} on other failures.
 */
public interface DeviceCalendarClient {

    boolean hasPermission();

    /**
     * Ask the user for calendar access.
     *
     * @return whether access is granted afterwards
     */
    boolean requestPermission();

    List<DeviceCalendar> listCalendars();

    /**
     * Events of the given calendars overlapping [start, end].
     */
    List<DeviceCalendarEvent> listEvents(List<String> calendarIds, Instant start, Instant end);

    /**
     * @return the ID of the new event
     */
    String createEvent(String calendarId, CalendarEventDetails details);

    /**
     * Apply the non-null fields of {@code details} to an existing event.
     *
     * @throws CalendarEventNotFoundException if the event no longer exists
     */
    void updateEvent(String eventId, CalendarEventDetails details);

    /**
     * @throws CalendarEventNotFoundException if the event no longer exists
     */
    void deleteEvent(String eventId);

    Optional<DeviceCalendarEvent> getEvent(String eventId);
}
