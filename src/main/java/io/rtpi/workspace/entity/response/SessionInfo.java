package io.rtpi.workspace.entity.response;

import lombok.Data;

import java.time.LocalDateTime;

@Data
public class SessionInfo {
    private String id;
    private String sessionToken;
    private String workspaceId;
    private String userId;
    private LocalDateTime expiresAt;
}
