package com.bbthechange.rehearsalsync.dto;

import com.bbthechange.rehearsalsync.model.AppState;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AppStateRequest {

    @NotNull
    private AppState state;
}
