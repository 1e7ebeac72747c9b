package com.bbthechange.rehearsalsync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SlotType {
    BUSY("busy"),
    AVAILABLE("available"),
    TENTATIVE("tentative"),
    /** Any type this client does not recognise, such as "free". */
    UNKNOWN("unknown");

    private final String value;

    SlotType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SlotType fromValue(String value) {
        for (SlotType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
