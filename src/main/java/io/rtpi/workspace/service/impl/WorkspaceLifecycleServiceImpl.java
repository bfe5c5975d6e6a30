package io.rtpi.workspace.service.impl;

import io.rtpi.workspace.common.OrchestrationUnavailableException;
import io.rtpi.workspace.common.WorkspaceForbiddenException;
import io.rtpi.workspace.common.WorkspaceNotFoundException;
import io.rtpi.workspace.config.OrchestrationProperties;
import io.rtpi.workspace.entity.RtpiWorkspace;
import io.rtpi.workspace.entity.RtpiWorkspaceSession;
import io.rtpi.workspace.entity.ShareGrant;
import io.rtpi.workspace.entity.SnapshotRecord;
import io.rtpi.workspace.entity.WorkspaceMetadata;
import io.rtpi.workspace.entity.response.ExpiringWorkspace;
import io.rtpi.workspace.entity.response.ResourceUsageResponse;
import io.rtpi.workspace.entity.response.SessionInfo;
import io.rtpi.workspace.entity.response.WorkspaceProvisionResult;
import io.rtpi.workspace.enums.WorkspaceStatus;
import io.rtpi.workspace.enums.WorkspaceType;
import io.rtpi.workspace.service.RtpiWorkspaceService;
import io.rtpi.workspace.service.RtpiWorkspaceSessionService;
import io.rtpi.workspace.service.WorkspaceLifecycleService;
import io.rtpi.workspace.workspace.OrchestrationClient;
import io.rtpi.workspace.workspace.RemoteSession;
import io.rtpi.workspace.workspace.WorkspaceConfig;
import io.rtpi.workspace.workspace.WorkspaceProperties;
import io.rtpi.workspace.workspace.WorkspaceQuotaEvaluator;
import io.rtpi.workspace.workspace.WorkspaceStartupMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

@Service
public class WorkspaceLifecycleServiceImpl implements WorkspaceLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(WorkspaceLifecycleServiceImpl.class);

    private static final int EXTEND_MAX_TRIES = 3;
    private static final long EXPIRING_SOON_MINUTES = 60;

    private final RtpiWorkspaceService workspaceService;
    private final RtpiWorkspaceSessionService sessionService;
    private final OrchestrationClient orchestrationClient;
    private final WorkspaceStartupMonitor startupMonitor;
    private final WorkspaceProperties props;
    private final OrchestrationProperties orchestrationProps;
    private final Clock clock;

    public WorkspaceLifecycleServiceImpl(RtpiWorkspaceService workspaceService,
                                         RtpiWorkspaceSessionService sessionService,
                                         OrchestrationClient orchestrationClient,
                                         WorkspaceStartupMonitor startupMonitor,
                                         WorkspaceProperties props,
                                         OrchestrationProperties orchestrationProps,
                                         Clock clock) {
        this.workspaceService = workspaceService;
        this.sessionService = sessionService;
        this.orchestrationClient = orchestrationClient;
        this.startupMonitor = startupMonitor;
        this.props = props;
        this.orchestrationProps = orchestrationProps;
        this.clock = clock;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    @Override
    public WorkspaceProvisionResult provisionWorkspace(WorkspaceConfig config) {
        if (!props.isEnabled()) {
            throw new OrchestrationUnavailableException("Workspace manager is not enabled");
        }
        if (config == null || !StringUtils.hasText(config.getUserId())) {
            throw new IllegalArgumentException("userId is required");
        }
        WorkspaceType type = WorkspaceType.fromCode(config.getWorkspaceType());
        int expiryHours = config.getExpiryHours() == null ? props.getDefaultExpiryHours() : config.getExpiryHours();
        if (expiryHours <= 0) {
            throw new IllegalArgumentException("expiryHours must be positive");
        }
        String userId = config.getUserId().trim();
        String cpu = StringUtils.hasText(config.getCpuLimit()) ? config.getCpuLimit().trim() : props.getDefaultCpuLimit();
        String memory = StringUtils.hasText(config.getMemoryLimit()) ? config.getMemoryLimit().trim() : props.getDefaultMemoryLimit();

        // 1) 配额（不预占，检查与落库之间不是原子的）
        new WorkspaceQuotaEvaluator(props.getQuota()).check(workspaceService.listActiveByUser(userId), cpu, memory);

        // 2) 远端创建；失败直接抛出，本地不落任何记录
        RemoteSession remote = orchestrationClient.createSession(props.resolveImage(type), cpu, memory);

        // 3) 落库 starting
        LocalDateTime now = now();
        RtpiWorkspace ws = new RtpiWorkspace();
        ws.setUserId(userId);
        ws.setOperationId(config.getOperationId());
        ws.setWorkspaceType(type.code());
        ws.setWorkspaceName(StringUtils.hasText(config.getWorkspaceName())
                ? config.getWorkspaceName().trim()
                : type.code() + "-" + remote.getSessionId());
        ws.setExternalSessionId(remote.getSessionId());
        ws.setExternalContainerId(remote.getContainerId());
        ws.setExternalUserId(remote.getRemoteUserId());
        ws.setInternalIp(remote.getInternalIp());
        ws.setStatus(WorkspaceStatus.STARTING.code());
        ws.setAccessUrl(accessUrl(remote.getSessionId()));
        ws.setCpuLimit(cpu);
        ws.setMemoryLimit(memory);
        ws.setExpiresAt(now.plusHours(expiryHours));
        ws.setMetadata(WorkspaceMetadata.of(config.getMetadata()));
        ws.setCreatedBy(StringUtils.hasText(config.getCreatedBy()) ? config.getCreatedBy() : userId);
        try {
            workspaceService.save(ws);
        } catch (RuntimeException e) {
            log.error("persist workspace failed, rollback remote session: userId={}, sessionId={}",
                    userId, remote.getSessionId(), e);
            try {
                orchestrationClient.deleteSession(remote.getSessionId());
            } catch (Exception ex) {
                log.warn("rollback remote session failed: sessionId={}, error={}", remote.getSessionId(), ex.getMessage());
            }
            throw e;
        }

        // 4) 异步启动监控
        startupMonitor.watch(ws.getId());
        log.info("workspace provisioned: workspaceId={}, userId={}, type={}, sessionId={}, expiresAt={}",
                ws.getId(), userId, type.code(), remote.getSessionId(), ws.getExpiresAt());

        WorkspaceProvisionResult result = new WorkspaceProvisionResult();
        result.setId(ws.getId());
        result.setExternalSessionId(ws.getExternalSessionId());
        result.setAccessUrl(ws.getAccessUrl());
        result.setStatus(ws.getStatus());
        result.setExpiresAt(ws.getExpiresAt());
        return result;
    }

    private String accessUrl(String sessionId) {
        return "https://" + orchestrationProps.getAccessDomain() + ":" + orchestrationProps.getAccessPort()
                + "/#/session/" + sessionId;
    }

    @Override
    public void terminateWorkspace(String workspaceId) {
        doTerminate(getWorkspace(workspaceId));
    }

    @Override
    public void terminateWorkspace(String workspaceId, String actingUserId) {
        RtpiWorkspace ws = getWorkspace(workspaceId);
        requireOwner(ws, actingUserId);
        doTerminate(ws);
    }

    /**
     * @return true 表示本次完成终止
     */
    private boolean doTerminate(RtpiWorkspace ws) {
        // 已终止的记录也重发一次远端删除（best-effort），本地只在 terminated_at 为空时落时间
        if (StringUtils.hasText(ws.getExternalSessionId())) {
            try {
                orchestrationClient.deleteSession(ws.getExternalSessionId());
            } catch (Exception e) {
                // 远端失败不阻断本地终止
                log.warn("destroy remote session failed: workspaceId={}, sessionId={}, error={}",
                        ws.getId(), ws.getExternalSessionId(), e.getMessage());
            }
        }
        boolean changed = workspaceService.terminateLocal(ws.getId(), now());
        if (changed) {
            log.info("workspace terminated: workspaceId={}, userId={}", ws.getId(), ws.getUserId());
        }
        return changed;
    }

    @Override
    public LocalDateTime extendWorkspaceExpiry(String workspaceId, int additionalHours) {
        if (additionalHours <= 0) {
            throw new IllegalArgumentException("additionalHours must be positive");
        }
        return doExtend(getWorkspace(workspaceId), additionalHours);
    }

    @Override
    public LocalDateTime extendWorkspaceExpiry(String workspaceId, String actingUserId, int additionalHours) {
        if (additionalHours <= 0) {
            throw new IllegalArgumentException("additionalHours must be positive");
        }
        RtpiWorkspace ws = getWorkspace(workspaceId);
        requireOwner(ws, actingUserId);
        return doExtend(ws, additionalHours);
    }

    private LocalDateTime doExtend(RtpiWorkspace ws, int additionalHours) {
        RtpiWorkspace cur = ws;
        for (int i = 0; i < EXTEND_MAX_TRIES; i++) {
            if (cur.getTerminatedAt() != null) {
                throw new IllegalStateException("Workspace " + cur.getId() + " is already terminated");
            }
            LocalDateTime newExpiry = cur.getExpiresAt().plusHours(additionalHours);
            if (workspaceService.extendExpiry(cur.getId(), cur.getExpiresAt(), newExpiry)) {
                log.info("workspace expiry extended: workspaceId={}, hours={}, expiresAt={}", cur.getId(), additionalHours, newExpiry);
                return newExpiry;
            }
            // 并发续期/终止：重读后重试
            cur = getWorkspace(cur.getId());
        }
        throw new IllegalStateException("Workspace " + ws.getId() + " was modified concurrently, please retry");
    }

    @Override
    public RtpiWorkspace getWorkspace(String workspaceId) {
        if (!StringUtils.hasText(workspaceId)) {
            throw new IllegalArgumentException("workspaceId is required");
        }
        RtpiWorkspace ws = workspaceService.getById(workspaceId);
        if (ws == null) {
            throw WorkspaceNotFoundException.workspace(workspaceId);
        }
        return ws;
    }

    @Override
    public RtpiWorkspace getWorkspace(String workspaceId, String userId) {
        RtpiWorkspace ws = getWorkspace(workspaceId);
        if (!hasAccess(ws, userId)) {
            throw new WorkspaceForbiddenException("Access denied");
        }
        return ws;
    }

    @Override
    public List<RtpiWorkspace> listUserWorkspaces(String userId, boolean includeTerminated) {
        if (!StringUtils.hasText(userId)) {
            throw new IllegalArgumentException("userId is required");
        }
        return workspaceService.listByUser(userId, includeTerminated);
    }

    @Override
    public boolean hasAccess(RtpiWorkspace workspace, String userId) {
        if (workspace == null || !StringUtils.hasText(userId)) return false;
        if (userId.equals(workspace.getUserId())) return true;
        return workspace.getMetadata() != null && workspace.getMetadata().isSharedWith(userId);
    }

    private void requireOwner(RtpiWorkspace ws, String userId) {
        if (!StringUtils.hasText(userId) || !userId.equals(ws.getUserId())) {
            throw new WorkspaceForbiddenException("Access denied");
        }
    }

    // ---------------- sessions ----------------

    @Override
    public SessionInfo createSession(String workspaceId, String userId, String ipAddress, String userAgent) {
        if (!StringUtils.hasText(userId)) {
            throw new IllegalArgumentException("userId is required");
        }
        RtpiWorkspace ws = getWorkspace(workspaceId);
        if (ws.getTerminatedAt() != null) {
            throw new IllegalStateException("Workspace " + workspaceId + " is already terminated");
        }
        LocalDateTime now = now();
        RtpiWorkspaceSession s = new RtpiWorkspaceSession();
        s.setWorkspaceId(workspaceId);
        s.setUserId(userId);
        s.setSessionToken(UUID.randomUUID().toString());
        s.setLastActivity(now);
        s.setActivityCount(0);
        s.setIpAddress(ipAddress);
        s.setUserAgent(userAgent);
        s.setExpiresAt(now.plusHours(props.getSessionExpiryHours()));
        sessionService.save(s);

        // 插入期间 workspace 可能被并发终止，级联已经跑过，这条会话要自己收掉
        RtpiWorkspace latest = workspaceService.getById(workspaceId);
        if (latest == null || latest.getTerminatedAt() != null) {
            sessionService.terminateById(s.getId(), now);
            log.info("workspace terminated during session create, session dropped: workspaceId={}, sessionId={}",
                    workspaceId, s.getId());
            throw new IllegalStateException("Workspace " + workspaceId + " is already terminated");
        }
        workspaceService.touchLastAccessed(workspaceId, now);
        log.info("workspace session created: workspaceId={}, userId={}, sessionId={}", workspaceId, userId, s.getId());
        return toSessionInfo(s);
    }

    private SessionInfo toSessionInfo(RtpiWorkspaceSession s) {
        SessionInfo info = new SessionInfo();
        info.setId(s.getId());
        info.setSessionToken(s.getSessionToken());
        info.setWorkspaceId(s.getWorkspaceId());
        info.setUserId(s.getUserId());
        info.setExpiresAt(s.getExpiresAt());
        return info;
    }

    @Override
    public void updateSessionActivity(String sessionToken) {
        if (!sessionService.touchByToken(sessionToken, now())) {
            throw WorkspaceNotFoundException.session();
        }
    }

    @Override
    public void terminateSession(String sessionToken) {
        RtpiWorkspaceSession s = sessionService.getByToken(sessionToken);
        if (s == null) {
            throw WorkspaceNotFoundException.session();
        }
        if (sessionService.terminateByToken(sessionToken, now())) {
            log.info("workspace session terminated: workspaceId={}, sessionId={}", s.getWorkspaceId(), s.getId());
        }
    }

    @Override
    public List<RtpiWorkspaceSession> getActiveSessions(String workspaceId) {
        return sessionService.listActiveByWorkspace(workspaceId);
    }

    // ---------------- quota / queries ----------------

    @Override
    public ResourceUsageResponse getUserResourceUsage(String userId) {
        if (!StringUtils.hasText(userId)) {
            throw new IllegalArgumentException("userId is required");
        }
        return new WorkspaceQuotaEvaluator(props.getQuota()).usage(workspaceService.listActiveByUser(userId));
    }

    @Override
    public List<ExpiringWorkspace> getExpiringSoonWorkspaces() {
        LocalDateTime now = now();
        List<ExpiringWorkspace> out = new ArrayList<>();
        for (RtpiWorkspace w : workspaceService.listExpiringBefore(now.plusMinutes(EXPIRING_SOON_MINUTES))) {
            ExpiringWorkspace e = new ExpiringWorkspace();
            e.setId(w.getId());
            e.setUserId(w.getUserId());
            e.setWorkspaceName(w.getWorkspaceName());
            e.setExpiresAt(w.getExpiresAt());
            e.setMinutesUntilExpiry(Math.floorDiv(Duration.between(now, w.getExpiresAt()).toMillis(), 60_000L));
            out.add(e);
        }
        return out;
    }

    // ---------------- sharing ----------------

    @Override
    public SessionInfo shareWorkspace(String workspaceId, String ownerUserId, String targetUserId) {
        if (!StringUtils.hasText(targetUserId)) {
            throw new IllegalArgumentException("targetUserId is required");
        }
        RtpiWorkspace ws = getWorkspace(workspaceId);
        requireOwner(ws, ownerUserId);
        if (targetUserId.equals(ws.getUserId())) {
            throw new IllegalArgumentException("Cannot share a workspace with its owner");
        }
        if (ws.getTerminatedAt() != null) {
            throw new IllegalStateException("Workspace " + workspaceId + " is already terminated");
        }

        WorkspaceMetadata md = WorkspaceMetadata.copyOf(ws.getMetadata());
        LocalDateTime now = now();
        // 重复共享：替换旧授权，旧会话失效
        for (ShareGrant g : md.getSharedWith()) {
            if (g != null && targetUserId.equals(g.getUserId()) && StringUtils.hasText(g.getSessionId())) {
                sessionService.terminateById(g.getSessionId(), now);
            }
        }
        md.getSharedWith().removeIf(g -> g == null || targetUserId.equals(g.getUserId()));

        SessionInfo session = createSession(workspaceId, targetUserId, null, null);
        md.getSharedWith().add(new ShareGrant(targetUserId, now, session.getId()));
        if (!workspaceService.updateMetadata(workspaceId, md)) {
            sessionService.terminateById(session.getId(), now);
            throw new IllegalStateException("Workspace " + workspaceId + " is already terminated");
        }
        log.info("workspace shared: workspaceId={}, owner={}, target={}", workspaceId, ownerUserId, targetUserId);
        return session;
    }

    @Override
    public void revokeWorkspaceSharing(String workspaceId, String ownerUserId, String targetUserId) {
        if (!StringUtils.hasText(targetUserId)) {
            throw new IllegalArgumentException("targetUserId is required");
        }
        RtpiWorkspace ws = getWorkspace(workspaceId);
        requireOwner(ws, ownerUserId);

        int n = sessionService.terminateActiveByWorkspaceAndUser(workspaceId, targetUserId, now());
        WorkspaceMetadata md = WorkspaceMetadata.copyOf(ws.getMetadata());
        boolean removed = md.getSharedWith().removeIf(g -> g == null || targetUserId.equals(g.getUserId()));
        if (removed && ws.getTerminatedAt() == null) {
            workspaceService.updateMetadata(workspaceId, md);
        }
        log.info("workspace sharing revoked: workspaceId={}, target={}, sessionsTerminated={}", workspaceId, targetUserId, n);
    }

    // ---------------- snapshots ----------------

    @Override
    public SnapshotRecord createSnapshot(String workspaceId, String ownerUserId, String snapshotName, Map<String, Object> metadata) {
        if (!StringUtils.hasText(snapshotName)) {
            throw new IllegalArgumentException("snapshotName is required");
        }
        RtpiWorkspace ws = getWorkspace(workspaceId);
        requireOwner(ws, ownerUserId);
        if (ws.getTerminatedAt() != null) {
            throw new IllegalStateException("Workspace " + workspaceId + " is already terminated");
        }

        // 远端失败直接抛出，本地不变
        long size = orchestrationClient.createSnapshot(ws.getExternalSessionId(), snapshotName);

        SnapshotRecord record = new SnapshotRecord(workspaceId, snapshotName, now(), size,
                metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata));
        WorkspaceMetadata md = WorkspaceMetadata.copyOf(ws.getMetadata());
        md.getSnapshots().add(record);
        if (!workspaceService.updateMetadata(workspaceId, md)) {
            log.warn("snapshot created but workspace terminated meanwhile: workspaceId={}, snapshot={}", workspaceId, snapshotName);
        }
        log.info("workspace snapshot created: workspaceId={}, snapshot={}, size={}", workspaceId, snapshotName, size);
        return record;
    }

    @Override
    public List<SnapshotRecord> listSnapshots(String workspaceId, String userId) {
        RtpiWorkspace ws = getWorkspace(workspaceId, userId);
        if (ws.getMetadata() == null || ws.getMetadata().getSnapshots() == null) {
            return List.of();
        }
        return new ArrayList<>(ws.getMetadata().getSnapshots());
    }

    @Override
    public void restoreFromSnapshot(String workspaceId, String ownerUserId, String snapshotName) {
        if (!StringUtils.hasText(snapshotName)) {
            throw new IllegalArgumentException("snapshotName is required");
        }
        RtpiWorkspace ws = getWorkspace(workspaceId);
        requireOwner(ws, ownerUserId);
        if (ws.getTerminatedAt() != null) {
            throw new IllegalStateException("Workspace " + workspaceId + " is already terminated");
        }
        boolean known = ws.getMetadata() != null && ws.getMetadata().getSnapshots() != null
                && ws.getMetadata().getSnapshots().stream()
                .anyMatch(s -> s != null && Objects.equals(snapshotName, s.getSnapshotName()));
        if (!known) {
            throw new WorkspaceNotFoundException("Snapshot " + snapshotName + " not found");
        }
        orchestrationClient.restoreSnapshot(ws.getExternalSessionId(), snapshotName);
        log.info("workspace restored from snapshot: workspaceId={}, snapshot={}", workspaceId, snapshotName);
    }

    // ---------------- reclamation ----------------

    @Override
    public int cleanupExpiredWorkspaces() {
        List<RtpiWorkspace> expired;
        try {
            expired = workspaceService.listExpired(now());
        } catch (Exception e) {
            log.error("list expired workspaces failed", e);
            return 0;
        }
        int cleaned = 0;
        for (RtpiWorkspace ws : expired) {
            try {
                if (doTerminate(ws)) {
                    cleaned++;
                }
            } catch (Exception e) {
                log.error("cleanup workspace failed: workspaceId={}", ws.getId(), e);
            }
        }
        if (cleaned > 0) {
            log.info("cleaned up expired workspaces: count={}", cleaned);
        }
        return cleaned;
    }

    @Override
    public int cleanupExpiredSessions() {
        LocalDateTime now = now();
        int cleaned = 0;
        try {
            cleaned += sessionService.terminateExpired(now);
            if (props.getSessionIdleTimeoutMinutes() > 0) {
                cleaned += sessionService.terminateIdle(now.minusMinutes(props.getSessionIdleTimeoutMinutes()), now);
            }
        } catch (Exception e) {
            log.error("cleanup expired sessions failed", e);
        }
        if (cleaned > 0) {
            log.info("cleaned up expired sessions: count={}", cleaned);
        }
        return cleaned;
    }

    @Override
    @EventListener(ApplicationReadyEvent.class)
    public void initialize() {
        if (!props.isEnabled()) {
            log.info("workspace manager disabled (rtpi.workspace.enabled=false)");
            return;
        }
        try {
            orchestrationClient.authenticate();
        } catch (OrchestrationUnavailableException e) {
            log.warn("orchestration authenticate failed on startup: error={}", e.getMessage());
        }
        int ws = cleanupExpiredWorkspaces();
        int ss = cleanupExpiredSessions();
        log.info("workspace manager initialized: catchUpWorkspaces={}, catchUpSessions={}", ws, ss);
    }
}
