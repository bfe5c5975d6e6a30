package io.rtpi.workspace.controller.admin;

import io.rtpi.workspace.common.Result;
import io.rtpi.workspace.entity.response.CleanupResult;
import io.rtpi.workspace.scheduled.WorkspaceCleanupScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 管理接口：手动触发过期回收（IP 白名单 + X-Admin-Token）
 */
@RestController
@RequestMapping("/api/rtpi/admin/workspaces")
@Tag(name = "RTPI Workspace 管理", description = "运维接口，鉴权：Header X-Admin-Token，来源 IP 需在 rtpi.admin.allowed-ips 白名单内")
public class AdminWorkspaceController {

    private final WorkspaceCleanupScheduler cleanupScheduler;

    public AdminWorkspaceController(WorkspaceCleanupScheduler cleanupScheduler) {
        this.cleanupScheduler = cleanupScheduler;
    }

    @PostMapping("/cleanup")
    @Operation(summary = "立即执行一次过期回收", description = "返回 workspacesTerminated / sessionsTerminated")
    public Result<CleanupResult> cleanup() {
        return Result.success(cleanupScheduler.runOnce());
    }
}
