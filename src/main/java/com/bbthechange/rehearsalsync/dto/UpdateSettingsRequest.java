package com.bbthechange.rehearsalsync.dto;

import com.bbthechange.rehearsalsync.model.ImportInterval;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Partial update of the sync settings. Null fields keep their current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSettingsRequest {

    private Boolean exportEnabled;
    private String exportCalendarId;
    private Boolean importEnabled;
    private Set<String> importCalendarIds;
    private ImportInterval importInterval;
}
