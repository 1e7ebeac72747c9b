package com.bbthechange.rehearsalsync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

/**
 * How often automatic import may run.
 */
public enum ImportInterval {
    MANUAL("manual", null),
    ALWAYS("always", Duration.ZERO),
    FIFTEEN_MINUTES("15min", Duration.ofMinutes(15)),
    HOURLY("hourly", Duration.ofHours(1)),
    SIX_HOURS("6hours", Duration.ofHours(6)),
    DAILY("daily", Duration.ofDays(1));

    private final String value;
    private final Duration period;

    ImportInterval(String value, Duration period) {
        this.value = value;
        this.period = period;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Minimum time between automatic imports, or null when imports never run automatically.
     */
    public Duration getPeriod() {
        return period;
    }

    public boolean isAutomatic() {
        return period != null;
    }

    @JsonCreator
    public static ImportInterval fromValue(String value) {
        for (ImportInterval interval : values()) {
            if (interval.value.equalsIgnoreCase(value) || interval.name().equalsIgnoreCase(value)) {
                return interval;
            }
        }
        throw new IllegalArgumentException("Unknown import interval: " + value);
    }
}
