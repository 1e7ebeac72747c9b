package com.bbthechange.rehearsalsync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Tracking entry for a device calendar event that was turned into an availability slot.
 * Keyed by external event ID in the import tracking record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportedEvent {

    private String localSlotId;
    private String calendarId;
    private Instant lastImported;
}
