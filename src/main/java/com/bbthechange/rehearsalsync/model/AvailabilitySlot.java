package com.bbthechange.rehearsalsync.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Availability slot as owned by the backend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AvailabilitySlot {

    private String id;

    @JsonAlias("starts_at")
    private Instant startsAt;

    @JsonAlias("ends_at")
    private Instant endsAt;

    private SlotType type;

    private SlotSource source;

    @JsonAlias("external_event_id")
    private String externalEventId;

    private String title;

    @JsonProperty("isAllDay")
    @JsonAlias("is_all_day")
    private boolean allDay;

    /**
     * Whether calendar import is allowed to touch this slot.
     */
    @JsonIgnore
    public boolean isImportOwned() {
        return source != null && source.isExternalCalendar()
            && externalEventId != null && !externalEventId.isBlank();
    }
}
