package com.bbthechange.rehearsalsync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Host application lifecycle state, as reported by the client.
 */
public enum AppState {
    ACTIVE,
    INACTIVE,
    BACKGROUND;

    public boolean isInBackground() {
        return this == INACTIVE || this == BACKGROUND;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static AppState fromValue(String value) {
        return AppState.valueOf(value.trim().toUpperCase());
    }
}
