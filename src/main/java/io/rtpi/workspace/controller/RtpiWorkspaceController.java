package io.rtpi.workspace.controller;

import io.rtpi.workspace.common.Result;
import io.rtpi.workspace.common.WorkspaceForbiddenException;
import io.rtpi.workspace.entity.RtpiWorkspace;
import io.rtpi.workspace.entity.RtpiWorkspaceSession;
import io.rtpi.workspace.entity.SnapshotRecord;
import io.rtpi.workspace.entity.request.CreateSnapshotRequest;
import io.rtpi.workspace.entity.request.ExtendWorkspaceRequest;
import io.rtpi.workspace.entity.request.ProvisionWorkspaceRequest;
import io.rtpi.workspace.entity.request.ShareWorkspaceRequest;
import io.rtpi.workspace.entity.response.ExpiringWorkspace;
import io.rtpi.workspace.entity.response.ResourceUsageResponse;
import io.rtpi.workspace.entity.response.SessionInfo;
import io.rtpi.workspace.entity.response.WorkspaceProvisionResult;
import io.rtpi.workspace.service.WorkspaceLifecycleService;
import io.rtpi.workspace.workspace.WorkspaceConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Workspace 生命周期接口。调用方（上层鉴权网关）通过 userId 参数显式传入当前用户。
 */
@RestController
@RequestMapping("/api/rtpi/workspaces")
@Tag(name = "RTPI Workspace", description = "临时容器工作区：申请 / 续期 / 终止 / 会话 / 共享 / 快照")
public class RtpiWorkspaceController {

    private final WorkspaceLifecycleService lifecycleService;

    public RtpiWorkspaceController(WorkspaceLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @GetMapping
    @Operation(summary = "我的 workspace 列表", description = "按创建时间倒序；includeTerminated=true 时包含已终止的")
    public Result<List<RtpiWorkspace>> list(
            @Parameter(description = "用户ID", required = true) @RequestParam String userId,
            @RequestParam(defaultValue = "false") boolean includeTerminated
    ) {
        return Result.success(lifecycleService.listUserWorkspaces(userId, includeTerminated));
    }

    @GetMapping("/{id}")
    @Operation(summary = "workspace 详情", description = "owner 或被共享者可见")
    public Result<RtpiWorkspace> get(@PathVariable String id, @RequestParam String userId) {
        return Result.success(lifecycleService.getWorkspace(id, userId));
    }

    @PostMapping
    @Operation(summary = "申请 workspace", description = "配额检查后创建远端会话，立即返回 status=starting，后台轮询直到 running/failed")
    public Result<WorkspaceProvisionResult> provision(@RequestParam String userId,
                                                      @Valid @RequestBody ProvisionWorkspaceRequest req) {
        WorkspaceConfig config = new WorkspaceConfig();
        config.setUserId(userId);
        config.setOperationId(req.getOperationId());
        config.setWorkspaceType(req.getWorkspaceType());
        config.setWorkspaceName(req.getWorkspaceName());
        config.setCpuLimit(req.getCpuLimit());
        config.setMemoryLimit(req.getMemoryLimit());
        config.setExpiryHours(req.getExpiryHours());
        config.setMetadata(req.getMetadata());
        config.setCreatedBy(userId);
        return Result.success("Workspace is starting", lifecycleService.provisionWorkspace(config));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "终止 workspace（owner）", description = "幂等；远端删除失败不影响本地终止")
    public Result<String> terminate(@PathVariable String id, @RequestParam String userId) {
        lifecycleService.terminateWorkspace(id, userId);
        return Result.success("Workspace terminated", "ok");
    }

    @PostMapping("/{id}/extend")
    @Operation(summary = "续期（owner）", description = "新的到期时间 = 原到期时间 + hours")
    public Result<LocalDateTime> extend(@PathVariable String id, @RequestParam String userId,
                                        @Valid @RequestBody ExtendWorkspaceRequest req) {
        return Result.success(lifecycleService.extendWorkspaceExpiry(id, userId, req.getHours()));
    }

    // ---------------- sessions ----------------

    @PostMapping("/{id}/sessions")
    @Operation(summary = "创建访问会话", description = "owner 或被共享者")
    public Result<SessionInfo> createSession(@PathVariable String id, @RequestParam String userId,
                                             HttpServletRequest request) {
        lifecycleService.getWorkspace(id, userId);
        String ip = request == null ? null : clientIp(request);
        String ua = request == null ? null : request.getHeader("User-Agent");
        return Result.success(lifecycleService.createSession(id, userId, ip, ua));
    }

    @GetMapping("/{id}/sessions")
    @Operation(summary = "活跃会话列表（owner）", description = "按最近活动时间倒序")
    public Result<List<RtpiWorkspaceSession>> sessions(@PathVariable String id, @RequestParam String userId) {
        RtpiWorkspace ws = lifecycleService.getWorkspace(id);
        if (!userId.equals(ws.getUserId())) {
            throw new WorkspaceForbiddenException("Access denied");
        }
        return Result.success(lifecycleService.getActiveSessions(id));
    }

    @PostMapping("/sessions/{token}/heartbeat")
    @Operation(summary = "会话心跳", description = "更新 lastActivity，activityCount+1")
    public Result<String> heartbeat(@PathVariable String token) {
        lifecycleService.updateSessionActivity(token);
        return Result.success("ok");
    }

    @DeleteMapping("/sessions/{token}")
    @Operation(summary = "终止会话", description = "幂等")
    public Result<String> terminateSession(@PathVariable String token) {
        lifecycleService.terminateSession(token);
        return Result.success("ok");
    }

    // ---------------- quota / queries ----------------

    @GetMapping("/usage")
    @Operation(summary = "资源占用与配额")
    public Result<ResourceUsageResponse> usage(@RequestParam String userId) {
        return Result.success(lifecycleService.getUserResourceUsage(userId));
    }

    @GetMapping("/expiring")
    @Operation(summary = "即将到期（1 小时内）", description = "只返回当前用户自己的")
    public Result<List<ExpiringWorkspace>> expiring(@RequestParam String userId) {
        return Result.success(lifecycleService.getExpiringSoonWorkspaces().stream()
                .filter(w -> userId.equals(w.getUserId()))
                .toList());
    }

    // ---------------- sharing ----------------

    @PostMapping("/{id}/share")
    @Operation(summary = "共享给其他用户（owner）", description = "为目标用户创建一个会话；重复共享会替换旧会话")
    public Result<SessionInfo> share(@PathVariable String id, @RequestParam String userId,
                                     @Valid @RequestBody ShareWorkspaceRequest req) {
        return Result.success(lifecycleService.shareWorkspace(id, userId, req.getTargetUserId()));
    }

    @DeleteMapping("/{id}/share/{targetUserId}")
    @Operation(summary = "取消共享（owner）", description = "终止目标用户在该 workspace 上的全部会话")
    public Result<String> revoke(@PathVariable String id, @PathVariable String targetUserId,
                                 @RequestParam String userId) {
        lifecycleService.revokeWorkspaceSharing(id, userId, targetUserId);
        return Result.success("ok");
    }

    // ---------------- snapshots ----------------

    @PostMapping("/{id}/snapshots")
    @Operation(summary = "创建快照（owner）")
    public Result<SnapshotRecord> createSnapshot(@PathVariable String id, @RequestParam String userId,
                                                 @Valid @RequestBody CreateSnapshotRequest req) {
        Map<String, Object> md = req.getMetadata();
        return Result.success(lifecycleService.createSnapshot(id, userId, req.getSnapshotName(), md));
    }

    @GetMapping("/{id}/snapshots")
    @Operation(summary = "快照列表", description = "owner 或被共享者")
    public Result<List<SnapshotRecord>> listSnapshots(@PathVariable String id, @RequestParam String userId) {
        return Result.success(lifecycleService.listSnapshots(id, userId));
    }

    @PostMapping("/{id}/snapshots/{snapshotName}/restore")
    @Operation(summary = "从快照恢复（owner）", description = "不改变本地状态与到期时间")
    public Result<String> restore(@PathVariable String id, @PathVariable String snapshotName,
                                  @RequestParam String userId) {
        lifecycleService.restoreFromSnapshot(id, userId, snapshotName);
        return Result.success("ok");
    }

    private String clientIp(HttpServletRequest request) {
        String xff = request.getHeader("X-Forwarded-For");
        if (StringUtils.hasText(xff)) {
            return xff.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
