package com.bbthechange.rehearsalsync.exception;

/**
 * Exception thrown when a calendar event no longer exists on the device.
 */
public class CalendarEventNotFoundException extends RuntimeException {

    private final String eventId;

    public CalendarEventNotFoundException(String eventId) {
        super("Calendar event not found: " + eventId);
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}
