package com.bbthechange.rehearsalsync.client;

import com.bbthechange.rehearsalsync.dto.CalendarEventDetails;
import com.bbthechange.rehearsalsync.exception.CalendarAccessException;
import com.bbthechange.rehearsalsync.exception.CalendarEventNotFoundException;
import com.bbthechange.rehearsalsync.exception.CalendarPermissionException;
import com.bbthechange.rehearsalsync.model.DeviceCalendar;
import com.bbthechange.rehearsalsync.model.DeviceCalendarEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Device calendar kept in memory.
 * Backs hosts that drive the engine over HTTP without a native calendar, and tests.
 */
public class InMemoryDeviceCalendarClient implements DeviceCalendarClient {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryDeviceCalendarClient.class);

    private final Map<String, DeviceCalendar> calendars = new LinkedHashMap<>();
    private final Map<String, DeviceCalendarEvent> events = new ConcurrentHashMap<>();
    private final AtomicLong eventSequence = new AtomicLong();

    private volatile boolean permissionGranted;
    private volatile boolean grantOnRequest;

    public InMemoryDeviceCalendarClient() {
        this(false, true);
    }

    public InMemoryDeviceCalendarClient(boolean permissionGranted, boolean grantOnRequest) {
        this.permissionGranted = permissionGranted;
        this.grantOnRequest = grantOnRequest;
    }

    @Override
    public boolean hasPermission() {
        return permissionGranted;
    }

    @Override
    public boolean requestPermission() {
        if (!permissionGranted && grantOnRequest) {
            permissionGranted = true;
            logger.info("Calendar permission granted");
        }
        return permissionGranted;
    }

    @Override
    public List<DeviceCalendar> listCalendars() {
        checkPermission();
        synchronized (calendars) {
            return new ArrayList<>(calendars.values());
        }
    }

    @Override
    public List<DeviceCalendarEvent> listEvents(List<String> calendarIds, Instant start, Instant end) {
        checkPermission();
        return events.values().stream()
            .filter(event -> calendarIds.contains(event.getCalendarId()))
            .filter(event -> !event.getStartDate().isAfter(end) && !event.getEndDate().isBefore(start))
            .sorted(Comparator.comparing(DeviceCalendarEvent::getStartDate))
            .map(event -> event.toBuilder().build())
            .collect(Collectors.toList());
    }

    @Override
    public String createEvent(String calendarId, CalendarEventDetails details) {
        checkPermission();
        DeviceCalendar calendar = findCalendar(calendarId);
        if (!calendar.isWritable()) {
            throw new CalendarAccessException("Calendar is read-only: " + calendarId);
        }

        String eventId = "evt-" + eventSequence.incrementAndGet();
        events.put(eventId, DeviceCalendarEvent.builder()
            .id(eventId)
            .calendarId(calendarId)
            .title(details.getTitle())
            .startDate(details.getStart())
            .endDate(details.getEnd())
            .location(details.getLocation())
            .notes(details.getNotes())
            .build());
        return eventId;
    }

    @Override
    public void updateEvent(String eventId, CalendarEventDetails details) {
        checkPermission();
        DeviceCalendarEvent current = events.get(eventId);
        if (current == null) {
            throw new CalendarEventNotFoundException(eventId);
        }

        DeviceCalendarEvent.DeviceCalendarEventBuilder updated = current.toBuilder();
        if (details.getTitle() != null) {
            updated.title(details.getTitle());
        }
        if (details.getStart() != null) {
            updated.startDate(details.getStart());
        }
        if (details.getEnd() != null) {
            updated.endDate(details.getEnd());
        }
        if (details.getLocation() != null) {
            updated.location(details.getLocation());
        }
        if (details.getNotes() != null) {
            updated.notes(details.getNotes());
        }
        events.put(eventId, updated.build());
    }

    @Override
    public void deleteEvent(String eventId) {
        checkPermission();
        if (events.remove(eventId) == null) {
            throw new CalendarEventNotFoundException(eventId);
        }
    }

    @Override
    public Optional<DeviceCalendarEvent> getEvent(String eventId) {
        checkPermission();
        return Optional.ofNullable(events.get(eventId)).map(event -> event.toBuilder().build());
    }

    public void addCalendar(DeviceCalendar calendar) {
        synchronized (calendars) {
            calendars.put(calendar.getId(), calendar);
        }
    }

    /**
     * Put an event into a calendar as if the user had created it outside the app.
     */
    public void putEvent(DeviceCalendarEvent event) {
        events.put(event.getId(), event);
    }

    /**
     * Remove an event as if the user had deleted it outside the app.
     */
    public void removeEvent(String eventId) {
        events.remove(eventId);
    }

    public int eventCount() {
        return events.size();
    }

    public void setPermissionGranted(boolean permissionGranted) {
        this.permissionGranted = permissionGranted;
    }

    public void setGrantOnRequest(boolean grantOnRequest) {
        this.grantOnRequest = grantOnRequest;
    }

    private DeviceCalendar findCalendar(String calendarId) {
        synchronized (calendars) {
            DeviceCalendar calendar = calendars.get(calendarId);
            if (calendar == null) {
                throw new CalendarAccessException("Calendar not found: " + calendarId);
            }
            return calendar;
        }
    }

    private void checkPermission() {
        if (!permissionGranted) {
            throw new CalendarPermissionException();
        }
    }
}
