package com.bbthechange.rehearsalsync.exception;

/**
 * Exception thrown when a device calendar call fails for a reason other than
 * a missing event or missing permission. Treated as transient.
 */
public class CalendarAccessException extends RuntimeException {

    public CalendarAccessException(String message) {
        super(message);
    }

    public CalendarAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
