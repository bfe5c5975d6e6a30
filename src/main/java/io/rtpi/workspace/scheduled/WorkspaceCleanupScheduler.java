package io.rtpi.workspace.scheduled;

import io.rtpi.workspace.config.SchedulerLockConfig;
import io.rtpi.workspace.entity.response.CleanupResult;
import io.rtpi.workspace.service.WorkspaceLifecycleService;
import io.rtpi.workspace.workspace.WorkspaceProperties;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 过期回收调度器：定期终止过期 workspace 与过期 / 空闲会话。
 *
 * 多实例部署时通过 ShedLock 保证同一时刻只有一个实例在跑；
 * 进程启动时的补跑由 WorkspaceLifecycleService#initialize 完成。
 */
@Component
public class WorkspaceCleanupScheduler {
    private static final Logger log = LoggerFactory.getLogger(WorkspaceCleanupScheduler.class);

    private final WorkspaceLifecycleService lifecycleService;
    private final WorkspaceProperties props;

    public WorkspaceCleanupScheduler(WorkspaceLifecycleService lifecycleService, WorkspaceProperties props) {
        this.lifecycleService = lifecycleService;
        this.props = props;
    }

    @Scheduled(fixedDelayString = "${rtpi.workspace.cleanup-interval-ms:300000}",
            initialDelayString = "${rtpi.workspace.cleanup-interval-ms:300000}")
    @SchedulerLock(name = SchedulerLockConfig.CLEANUP_LOCK, lockAtLeastFor = "PT10S", lockAtMostFor = "PT10M")
    public void cleanup() {
        if (!props.isEnabled()) {
            log.debug("workspace cleanup skipped: disabled");
            return;
        }
        runOnce();
    }

    /**
     * 单个环节失败不影响另一个；返回本次回收数量
     */
    public CleanupResult runOnce() {
        long start = System.currentTimeMillis();
        int workspaces = 0;
        int sessions = 0;
        try {
            workspaces = lifecycleService.cleanupExpiredWorkspaces();
        } catch (Exception e) {
            log.error("workspace cleanup failed", e);
        }
        try {
            sessions = lifecycleService.cleanupExpiredSessions();
        } catch (Exception e) {
            log.error("session cleanup failed", e);
        }
        if (workspaces > 0 || sessions > 0) {
            log.info("workspace cleanup done: workspaces={}, sessions={}, costMs={}",
                    workspaces, sessions, System.currentTimeMillis() - start);
        }
        return new CleanupResult(workspaces, sessions);
    }
}
