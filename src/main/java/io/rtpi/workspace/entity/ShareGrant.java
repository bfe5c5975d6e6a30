package io.rtpi.workspace.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ShareGrant {
    private String userId;
    private LocalDateTime sharedAt;
    /**
     * 共享时为目标用户创建的会话 id
     */
    private String sessionId;
}
