package io.rtpi.workspace.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.UpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import io.rtpi.workspace.entity.RtpiWorkspaceSession;
import io.rtpi.workspace.mapper.RtpiWorkspaceSessionMapper;
import io.rtpi.workspace.service.RtpiWorkspaceSessionService;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.List;

@Service
public class RtpiWorkspaceSessionServiceImpl extends ServiceImpl<RtpiWorkspaceSessionMapper, RtpiWorkspaceSession>
        implements RtpiWorkspaceSessionService {

    @Override
    public RtpiWorkspaceSession getByToken(String sessionToken) {
        if (!StringUtils.hasText(sessionToken)) return null;
        QueryWrapper<RtpiWorkspaceSession> qw = new QueryWrapper<>();
        qw.eq("session_token", sessionToken).last("limit 1");
        return getBaseMapper().selectOne(qw);
    }

    @Override
    public boolean touchByToken(String sessionToken, LocalDateTime at) {
        if (!StringUtils.hasText(sessionToken)) return false;
        RtpiWorkspaceSession upd = new RtpiWorkspaceSession();
        upd.setLastActivity(at);
        UpdateWrapper<RtpiWorkspaceSession> uw = new UpdateWrapper<>();
        uw.eq("session_token", sessionToken).isNull("terminated_at")
                .setSql("activity_count = activity_count + 1");
        return getBaseMapper().update(upd, uw) > 0;
    }

    @Override
    public boolean terminateByToken(String sessionToken, LocalDateTime now) {
        if (!StringUtils.hasText(sessionToken)) return false;
        UpdateWrapper<RtpiWorkspaceSession> uw = activeOnly();
        uw.eq("session_token", sessionToken);
        return terminate(uw, now) > 0;
    }

    @Override
    public List<RtpiWorkspaceSession> listActiveByWorkspace(String workspaceId) {
        if (!StringUtils.hasText(workspaceId)) return List.of();
        QueryWrapper<RtpiWorkspaceSession> qw = new QueryWrapper<>();
        qw.eq("workspace_id", workspaceId).isNull("terminated_at").orderByDesc("last_activity");
        return list(qw);
    }

    @Override
    public int terminateActiveByWorkspace(String workspaceId, LocalDateTime now) {
        if (!StringUtils.hasText(workspaceId)) return 0;
        UpdateWrapper<RtpiWorkspaceSession> uw = activeOnly();
        uw.eq("workspace_id", workspaceId);
        return terminate(uw, now);
    }

    @Override
    public int terminateActiveByWorkspaceAndUser(String workspaceId, String userId, LocalDateTime now) {
        if (!StringUtils.hasText(workspaceId) || !StringUtils.hasText(userId)) return 0;
        UpdateWrapper<RtpiWorkspaceSession> uw = activeOnly();
        uw.eq("workspace_id", workspaceId).eq("user_id", userId);
        return terminate(uw, now);
    }

    @Override
    public int terminateById(String id, LocalDateTime now) {
        if (!StringUtils.hasText(id)) return 0;
        UpdateWrapper<RtpiWorkspaceSession> uw = activeOnly();
        uw.eq("id", id);
        return terminate(uw, now);
    }

    @Override
    public int terminateExpired(LocalDateTime now) {
        UpdateWrapper<RtpiWorkspaceSession> uw = activeOnly();
        uw.lt("expires_at", now);
        return terminate(uw, now);
    }

    @Override
    public int terminateIdle(LocalDateTime cutoff, LocalDateTime now) {
        UpdateWrapper<RtpiWorkspaceSession> uw = activeOnly();
        uw.lt("last_activity", cutoff);
        return terminate(uw, now);
    }

    private UpdateWrapper<RtpiWorkspaceSession> activeOnly() {
        UpdateWrapper<RtpiWorkspaceSession> uw = new UpdateWrapper<>();
        uw.isNull("terminated_at");
        return uw;
    }

    private int terminate(UpdateWrapper<RtpiWorkspaceSession> uw, LocalDateTime now) {
        RtpiWorkspaceSession upd = new RtpiWorkspaceSession();
        upd.setTerminatedAt(now);
        return getBaseMapper().update(upd, uw);
    }
}
