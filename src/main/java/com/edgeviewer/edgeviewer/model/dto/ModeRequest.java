package com.edgeviewer.edgeviewer.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class ModeRequest {

    // true shows the camera image, false the edge overlay
    @NotNull
    private Boolean showRaw;
}
