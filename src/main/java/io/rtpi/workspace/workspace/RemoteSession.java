package io.rtpi.workspace.workspace;

import lombok.Data;

/**
 * 编排 API 创建会话后返回的远端标识。
 */
@Data
public class RemoteSession {
    private String sessionId;
    private String containerId;
    private String remoteUserId;
    private String internalIp;
    private String status;
}
