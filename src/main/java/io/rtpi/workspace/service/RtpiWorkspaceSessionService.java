package io.rtpi.workspace.service;

import com.baomidou.mybatisplus.extension.service.IService;
import io.rtpi.workspace.entity.RtpiWorkspaceSession;

import java.time.LocalDateTime;
import java.util.List;

public interface RtpiWorkspaceSessionService extends IService<RtpiWorkspaceSession> {

    RtpiWorkspaceSession getByToken(String sessionToken);

    /**
     * last_activity = at, activity_count + 1；只对未终止会话生效
     */
    boolean touchByToken(String sessionToken, LocalDateTime at);

    /**
     * @return true 表示本次终止；false 表示已终止过
     */
    boolean terminateByToken(String sessionToken, LocalDateTime now);

    /**
     * 按 last_activity 倒序
     */
    List<RtpiWorkspaceSession> listActiveByWorkspace(String workspaceId);

    int terminateActiveByWorkspace(String workspaceId, LocalDateTime now);

    int terminateActiveByWorkspaceAndUser(String workspaceId, String userId, LocalDateTime now);

    int terminateById(String id, LocalDateTime now);

    /**
     * expires_at &lt; now 的活跃会话
     */
    int terminateExpired(LocalDateTime now);

    /**
     * last_activity &lt; cutoff 的活跃会话
     */
    int terminateIdle(LocalDateTime cutoff, LocalDateTime now);
}
