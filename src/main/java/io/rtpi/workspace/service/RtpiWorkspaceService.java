package io.rtpi.workspace.service;

import com.baomidou.mybatisplus.extension.service.IService;
import io.rtpi.workspace.entity.RtpiWorkspace;
import io.rtpi.workspace.entity.WorkspaceMetadata;

import java.time.LocalDateTime;
import java.util.List;

/**
 * workspace 记录的持久化。所有状态写入都是按 id 的条件单行更新，返回是否真正命中。
 */
public interface RtpiWorkspaceService extends IService<RtpiWorkspace> {

    /**
     * 未终止（terminated_at IS NULL）的 workspace
     */
    List<RtpiWorkspace> listActiveByUser(String userId);

    /**
     * newest first
     */
    List<RtpiWorkspace> listByUser(String userId, boolean includeTerminated);

    /**
     * expires_at &lt; now 且未终止
     */
    List<RtpiWorkspace> listExpired(LocalDateTime now);

    /**
     * expires_at &lt;= threshold 且未终止
     */
    List<RtpiWorkspace> listExpiringBefore(LocalDateTime threshold);

    /**
     * starting -> running；仅当 status=starting 且未终止时生效
     */
    boolean markRunning(String id, LocalDateTime startedAt);

    /**
     * starting -> failed；仅当 status=starting 且未终止时生效
     */
    boolean markFailed(String id, String errorMessage);

    /**
     * 标记终止并级联终止其全部活跃会话。terminated_at 只在为空时写入。
     *
     * @return true 表示本次调用完成了终止；false 表示此前已终止
     */
    boolean terminateLocal(String id, LocalDateTime now);

    /**
     * 仅当未终止时把 expires_at 从 expected 改为 newExpiry
     */
    boolean extendExpiry(String id, LocalDateTime expected, LocalDateTime newExpiry);

    /**
     * 仅当未终止时写入 metadata
     */
    boolean updateMetadata(String id, WorkspaceMetadata metadata);

    void touchLastAccessed(String id, LocalDateTime at);
}
