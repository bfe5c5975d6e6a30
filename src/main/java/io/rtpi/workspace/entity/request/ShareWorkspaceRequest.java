package io.rtpi.workspace.entity.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ShareWorkspaceRequest {
    @NotBlank(message = "targetUserId is required")
    private String targetUserId;
}
