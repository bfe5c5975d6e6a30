package io.rtpi.workspace.entity.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.Map;

@Data
@Schema(description = "申请 workspace")
public class ProvisionWorkspaceRequest {
    @NotBlank(message = "workspaceType is required")
    @Schema(description = "vscode / burp / kali / firefox / empire", example = "kali")
    private String workspaceType;

    @Schema(description = "名称，缺省为 {type}-{sessionId}")
    private String workspaceName;

    @Schema(description = "关联的 operation")
    private String operationId;

    @Schema(description = "CPU 核数", example = "2")
    private String cpuLimit;

    @Schema(description = "内存，支持 M/Mi/G/Gi", example = "4096M")
    private String memoryLimit;

    @Positive(message = "expiryHours must be positive")
    @Schema(description = "有效期（小时），缺省 24", example = "24")
    private Integer expiryHours;

    private Map<String, Object> metadata;
}
