package com.bbthechange.rehearsalsync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * User-editable calendar sync settings. A single instance exists per installation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CalendarSyncSettings {

    // Export (app -> calendar)
    private boolean exportEnabled;
    private String exportCalendarId;
    private Instant lastExportTime;

    // Import (calendar -> app)
    private boolean importEnabled;
    @Builder.Default
    private Set<String> importCalendarIds = new LinkedHashSet<>();
    @Builder.Default
    private ImportInterval importInterval = ImportInterval.MANUAL;
    private Instant lastImportTime;

    /**
     * Settings used when nothing has been stored yet.
     */
    public static CalendarSyncSettings defaults() {
        return CalendarSyncSettings.builder().build();
    }

    /**
     * Whether import is switched on and has at least one calendar to read from.
     */
    @JsonIgnore
    public boolean isImportConfigured() {
        return importEnabled && importCalendarIds != null && !importCalendarIds.isEmpty();
    }
}
