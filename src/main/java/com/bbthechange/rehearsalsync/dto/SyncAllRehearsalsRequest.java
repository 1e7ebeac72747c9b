package com.bbthechange.rehearsalsync.dto;

import com.bbthechange.rehearsalsync.model.RehearsalWithProject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncAllRehearsalsRequest {

    @NotNull
    private List<@Valid RehearsalWithProject> rehearsals;
}
