package io.rtpi.workspace.service;

import io.rtpi.workspace.entity.RtpiWorkspace;
import io.rtpi.workspace.entity.RtpiWorkspaceSession;
import io.rtpi.workspace.entity.SnapshotRecord;
import io.rtpi.workspace.entity.response.ExpiringWorkspace;
import io.rtpi.workspace.entity.response.ResourceUsageResponse;
import io.rtpi.workspace.entity.response.SessionInfo;
import io.rtpi.workspace.entity.response.WorkspaceProvisionResult;
import io.rtpi.workspace.workspace.WorkspaceConfig;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * workspace 生命周期：申请、启动监控、续期、终止、会话、共享、快照、过期回收。
 *
 * 带 actingUserId 的重载会先做 owner 校验（非 owner 抛 WorkspaceForbiddenException）。
 */
public interface WorkspaceLifecycleService {

    /**
     * 配额检查 -> 远端创建会话 -> 落库 starting -> 异步启动监控。
     * 返回时 status 为 starting。
     */
    WorkspaceProvisionResult provisionWorkspace(WorkspaceConfig config);

    /**
     * 幂等：已终止的再次调用直接成功，terminatedAt 不变。远端删除失败只记日志。
     */
    void terminateWorkspace(String workspaceId);

    void terminateWorkspace(String workspaceId, String actingUserId);

    LocalDateTime extendWorkspaceExpiry(String workspaceId, int additionalHours);

    LocalDateTime extendWorkspaceExpiry(String workspaceId, String actingUserId, int additionalHours);

    RtpiWorkspace getWorkspace(String workspaceId);

    /**
     * owner 或被共享者可见
     */
    RtpiWorkspace getWorkspace(String workspaceId, String userId);

    List<RtpiWorkspace> listUserWorkspaces(String userId, boolean includeTerminated);

    boolean hasAccess(RtpiWorkspace workspace, String userId);

    // ---------------- sessions ----------------

    SessionInfo createSession(String workspaceId, String userId, String ipAddress, String userAgent);

    void updateSessionActivity(String sessionToken);

    void terminateSession(String sessionToken);

    List<RtpiWorkspaceSession> getActiveSessions(String workspaceId);

    // ---------------- quota / queries ----------------

    ResourceUsageResponse getUserResourceUsage(String userId);

    /**
     * 1 小时内到期（含已过期未回收）的 workspace
     */
    List<ExpiringWorkspace> getExpiringSoonWorkspaces();

    // ---------------- sharing ----------------

    SessionInfo shareWorkspace(String workspaceId, String ownerUserId, String targetUserId);

    void revokeWorkspaceSharing(String workspaceId, String ownerUserId, String targetUserId);

    // ---------------- snapshots ----------------

    SnapshotRecord createSnapshot(String workspaceId, String ownerUserId, String snapshotName, Map<String, Object> metadata);

    List<SnapshotRecord> listSnapshots(String workspaceId, String userId);

    void restoreFromSnapshot(String workspaceId, String ownerUserId, String snapshotName);

    // ---------------- reclamation ----------------

    int cleanupExpiredWorkspaces();

    int cleanupExpiredSessions();

    /**
     * 启动时：远端鉴权 + 补跑一次回收。未启用时只记录日志。
     */
    void initialize();
}
