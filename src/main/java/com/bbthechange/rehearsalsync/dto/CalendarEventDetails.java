package com.bbthechange.rehearsalsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Fields written to a device calendar event on create or update.
 * Null fields are left untouched on update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalendarEventDetails {

    private String title;
    private Instant start;
    private Instant end;
    private String location;
    private String notes;
    private Integer reminderMinutesBefore;
    private Boolean busy;
}
