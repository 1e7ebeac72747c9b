package com.bbthechange.rehearsalsync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * New field values for an imported slot, addressed by external event ID.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotUpdate {

    private String externalEventId;
    private Instant startsAt;
    private Instant endsAt;
    private String title;

    @JsonProperty("isAllDay")
    private boolean allDay;
}
