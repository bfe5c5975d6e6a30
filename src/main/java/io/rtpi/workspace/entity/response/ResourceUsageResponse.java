package io.rtpi.workspace.entity.response;

import io.rtpi.workspace.workspace.WorkspaceProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "用户资源占用（仅统计未终止的 workspace）")
public class ResourceUsageResponse {
    @Schema(description = "活跃 workspace 数量")
    private int workspaceCount;
    @Schema(description = "CPU 合计（核）")
    private double totalCpu;
    @Schema(description = "内存合计（MB）")
    private long totalMemory;
    @Schema(description = "配额上限")
    private WorkspaceProperties.Quota quota;
}
