package io.rtpi.workspace.entity.response;

import lombok.Data;

import java.time.LocalDateTime;

@Data
public class ExpiringWorkspace {
    private String id;
    private String userId;
    private String workspaceName;
    private LocalDateTime expiresAt;
    private long minutesUntilExpiry;
}
