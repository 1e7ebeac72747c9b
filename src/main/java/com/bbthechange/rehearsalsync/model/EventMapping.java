package com.bbthechange.rehearsalsync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Association between an exported rehearsal and the device calendar event mirroring it.
 * Keyed by rehearsal ID in the export mapping record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventMapping {

    private String eventId;
    private String calendarId;
    private Instant lastSynced;
}
