package io.rtpi.workspace.entity.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.util.Map;

@Data
public class CreateSnapshotRequest {
    @NotBlank(message = "snapshotName is required")
    @Pattern(regexp = "^[A-Za-z0-9._-]{1,128}$", message = "snapshotName may only contain letters, digits, '.', '_' and '-'")
    private String snapshotName;

    private Map<String, Object> metadata;
}
