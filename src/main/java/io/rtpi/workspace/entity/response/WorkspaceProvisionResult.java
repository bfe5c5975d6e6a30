package io.rtpi.workspace.entity.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Schema(description = "申请结果（此时 status 为 starting，后台继续轮询启动状态）")
public class WorkspaceProvisionResult {
    private String id;
    private String externalSessionId;
    private String accessUrl;
    private String status;
    private LocalDateTime expiresAt;
}
