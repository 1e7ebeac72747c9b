package com.bbthechange.rehearsalsync.exception;

/**
 * Exception thrown when an operation needs calendar access that the device has not granted.
 * Never retried automatically.
 */
public class CalendarPermissionException extends RuntimeException {

    public CalendarPermissionException() {
        super("Calendar permission not granted");
    }

    public CalendarPermissionException(String message) {
        super(message);
    }
}
