package com.bbthechange.rehearsalsync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of an availability slot. Only the external calendar sources are
 * ever created, updated or deleted by calendar import. Unrecognised sources
 * read as {@link #UNKNOWN} and are left alone.
 */
public enum SlotSource {
    MANUAL("manual", false),
    REHEARSAL("rehearsal", false),
    APPLE_CALENDAR("apple_calendar", true),
    GOOGLE_CALENDAR("google_calendar", true),
    UNKNOWN("unknown", false);

    private final String value;
    private final boolean externalCalendar;

    SlotSource(String value, boolean externalCalendar) {
        this.value = value;
        this.externalCalendar = externalCalendar;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isExternalCalendar() {
        return externalCalendar;
    }

    @JsonCreator
    public static SlotSource fromValue(String value) {
        for (SlotSource source : values()) {
            if (source.value.equalsIgnoreCase(value) || source.name().equalsIgnoreCase(value)) {
                return source;
            }
        }
        return UNKNOWN;
    }
}
