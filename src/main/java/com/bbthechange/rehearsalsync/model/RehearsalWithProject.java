package com.bbthechange.rehearsalsync.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Read-only view of a rehearsal together with its project, as needed for export.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RehearsalWithProject {

    @NotBlank
    private String id;

    private String projectId;

    @NotBlank
    private String projectName;

    @NotNull
    private Instant startsAt;

    @NotNull
    private Instant endsAt;

    private String location;
    private String title;
    private String description;
}
