package io.rtpi.workspace.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.UpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import io.rtpi.workspace.entity.RtpiWorkspace;
import io.rtpi.workspace.entity.WorkspaceMetadata;
import io.rtpi.workspace.enums.WorkspaceStatus;
import io.rtpi.workspace.mapper.RtpiWorkspaceMapper;
import io.rtpi.workspace.service.RtpiWorkspaceService;
import io.rtpi.workspace.service.RtpiWorkspaceSessionService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.List;

@Service
public class RtpiWorkspaceServiceImpl extends ServiceImpl<RtpiWorkspaceMapper, RtpiWorkspace>
        implements RtpiWorkspaceService {

    private final RtpiWorkspaceSessionService sessionService;

    public RtpiWorkspaceServiceImpl(RtpiWorkspaceSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @Override
    public List<RtpiWorkspace> listActiveByUser(String userId) {
        if (!StringUtils.hasText(userId)) return List.of();
        QueryWrapper<RtpiWorkspace> qw = new QueryWrapper<>();
        qw.eq("user_id", userId).isNull("terminated_at");
        return list(qw);
    }

    @Override
    public List<RtpiWorkspace> listByUser(String userId, boolean includeTerminated) {
        if (!StringUtils.hasText(userId)) return List.of();
        QueryWrapper<RtpiWorkspace> qw = new QueryWrapper<>();
        qw.eq("user_id", userId);
        if (!includeTerminated) {
            qw.isNull("terminated_at");
        }
        qw.orderByDesc("create_time");
        return list(qw);
    }

    @Override
    public List<RtpiWorkspace> listExpired(LocalDateTime now) {
        QueryWrapper<RtpiWorkspace> qw = new QueryWrapper<>();
        qw.lt("expires_at", now).isNull("terminated_at").orderByAsc("expires_at");
        return list(qw);
    }

    @Override
    public List<RtpiWorkspace> listExpiringBefore(LocalDateTime threshold) {
        QueryWrapper<RtpiWorkspace> qw = new QueryWrapper<>();
        qw.le("expires_at", threshold).isNull("terminated_at").orderByAsc("expires_at");
        return list(qw);
    }

    @Override
    public boolean markRunning(String id, LocalDateTime startedAt) {
        RtpiWorkspace upd = new RtpiWorkspace();
        upd.setStatus(WorkspaceStatus.RUNNING.code());
        upd.setStartedAt(startedAt);
        return getBaseMapper().update(upd, startingGuard(id)) > 0;
    }

    @Override
    public boolean markFailed(String id, String errorMessage) {
        RtpiWorkspace upd = new RtpiWorkspace();
        upd.setStatus(WorkspaceStatus.FAILED.code());
        upd.setErrorMessage(errorMessage);
        return getBaseMapper().update(upd, startingGuard(id)) > 0;
    }

    private UpdateWrapper<RtpiWorkspace> startingGuard(String id) {
        UpdateWrapper<RtpiWorkspace> uw = new UpdateWrapper<>();
        uw.eq("id", id).eq("status", WorkspaceStatus.STARTING.code()).isNull("terminated_at");
        return uw;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public boolean terminateLocal(String id, LocalDateTime now) {
        // starting/running -> stopped
        RtpiWorkspace upd = new RtpiWorkspace();
        upd.setStatus(WorkspaceStatus.STOPPED.code());
        upd.setTerminatedAt(now);
        UpdateWrapper<RtpiWorkspace> uw = new UpdateWrapper<>();
        uw.eq("id", id).isNull("terminated_at")
                .in("status", WorkspaceStatus.STARTING.code(), WorkspaceStatus.RUNNING.code());
        int n = getBaseMapper().update(upd, uw);

        if (n == 0) {
            // failed 等终态：保留 status，只补 terminated_at
            RtpiWorkspace onlyTs = new RtpiWorkspace();
            onlyTs.setTerminatedAt(now);
            UpdateWrapper<RtpiWorkspace> uw2 = new UpdateWrapper<>();
            uw2.eq("id", id).isNull("terminated_at");
            n = getBaseMapper().update(onlyTs, uw2);
        }

        sessionService.terminateActiveByWorkspace(id, now);
        return n > 0;
    }

    @Override
    public boolean extendExpiry(String id, LocalDateTime expected, LocalDateTime newExpiry) {
        RtpiWorkspace upd = new RtpiWorkspace();
        upd.setExpiresAt(newExpiry);
        UpdateWrapper<RtpiWorkspace> uw = new UpdateWrapper<>();
        uw.eq("id", id).isNull("terminated_at").eq("expires_at", expected);
        return getBaseMapper().update(upd, uw) > 0;
    }

    @Override
    public boolean updateMetadata(String id, WorkspaceMetadata metadata) {
        RtpiWorkspace upd = new RtpiWorkspace();
        upd.setMetadata(metadata == null ? new WorkspaceMetadata() : metadata);
        UpdateWrapper<RtpiWorkspace> uw = new UpdateWrapper<>();
        uw.eq("id", id).isNull("terminated_at");
        return getBaseMapper().update(upd, uw) > 0;
    }

    @Override
    public void touchLastAccessed(String id, LocalDateTime at) {
        if (!StringUtils.hasText(id)) return;
        RtpiWorkspace upd = new RtpiWorkspace();
        upd.setLastAccessedAt(at);
        UpdateWrapper<RtpiWorkspace> uw = new UpdateWrapper<>();
        uw.eq("id", id).isNull("terminated_at");
        getBaseMapper().update(upd, uw);
    }
}
