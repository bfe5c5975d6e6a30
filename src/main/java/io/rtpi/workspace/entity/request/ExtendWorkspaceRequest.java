package io.rtpi.workspace.entity.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class ExtendWorkspaceRequest {
    @NotNull(message = "hours is required")
    @Positive(message = "hours must be positive")
    private Integer hours;
}
