package com.bbthechange.rehearsalsync.model;

/**
 * Outcome of an automatic import trigger.
 */
public enum AutoSyncDecision {
    /** Not a foreground transition. */
    IGNORED,
    /** Fired within the throttle window of the previous trigger. */
    THROTTLED,
    /** Import is switched off or has no calendars. */
    DISABLED,
    /** The configured interval has not elapsed yet. */
    NOT_DUE,
    /** Another import or clear is already running. */
    ALREADY_RUNNING,
    IMPORTED,
    FAILED
}
