package io.rtpi.workspace.workspace;

import lombok.Data;

import java.util.Map;

/**
 * 申请 workspace 的入参（userId 由调用方显式传入）。
 * cpuLimit / memoryLimit / expiryHours 为空时使用配置默认值。
 */
@Data
public class WorkspaceConfig {
    private String userId;
    private String operationId;
    private String workspaceType;
    private String workspaceName;
    private String cpuLimit;
    private String memoryLimit;
    private Integer expiryHours;
    private Map<String, Object> metadata;
    private String createdBy;
}
