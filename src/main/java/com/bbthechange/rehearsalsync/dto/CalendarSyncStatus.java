package com.bbthechange.rehearsalsync.dto;

import com.bbthechange.rehearsalsync.model.CalendarSyncSettings;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of the sync state shown on the settings screen.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalendarSyncStatus {

    private boolean hasPermission;
    private CalendarSyncSettings settings;
    private int syncedCount;
    private int importedCount;
    private boolean importInProgress;
}
