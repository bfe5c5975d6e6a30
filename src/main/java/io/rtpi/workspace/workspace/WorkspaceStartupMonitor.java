package io.rtpi.workspace.workspace;

import io.rtpi.workspace.common.OrchestrationUnavailableException;
import io.rtpi.workspace.entity.RtpiWorkspace;
import io.rtpi.workspace.enums.WorkspaceStatus;
import io.rtpi.workspace.service.RtpiWorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * workspace 启动监控：provision 之后脱离请求线程，按固定间隔轮询远端会话状态，直到 running / failed / 超时。
 *
 * <p>约束：</p>
 * <ul>
 *   <li>每个 workspace 一条独立的轮询链，不共享内存状态</li>
 *   <li>每次写入前重新读库；写入本身带 status=starting 且未终止 的条件，不会覆盖并发的终止</li>
 *   <li>单次轮询的异常只记录日志，不会向外传播</li>
 * </ul>
 */
@Component
public class WorkspaceStartupMonitor {
    private static final Logger log = LoggerFactory.getLogger(WorkspaceStartupMonitor.class);

    static final String MSG_FAILED = "Failed to start";
    static final String MSG_TIMEOUT = "Startup timeout exceeded";

    private final OrchestrationClient orchestrationClient;
    private final RtpiWorkspaceService workspaceService;
    private final WorkspaceProperties props;
    private final TaskScheduler scheduler;
    private final Clock clock;

    public WorkspaceStartupMonitor(OrchestrationClient orchestrationClient,
                                   RtpiWorkspaceService workspaceService,
                                   WorkspaceProperties props,
                                   @Qualifier("workspaceMonitorScheduler") TaskScheduler scheduler,
                                   Clock clock) {
        this.orchestrationClient = orchestrationClient;
        this.workspaceService = workspaceService;
        this.props = props;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * 立即发起第一次轮询（异步），调用方不等待结果。
     */
    public void watch(String workspaceId) {
        scheduler.schedule(() -> checkOnce(workspaceId, 1), clock.instant());
    }

    void checkOnce(String workspaceId, int attempt) {
        try {
            RtpiWorkspace ws = workspaceService.getById(workspaceId);
            if (ws == null) {
                log.warn("startup monitor: workspace gone, workspaceId={}", workspaceId);
                return;
            }
            if (ws.getTerminatedAt() != null || WorkspaceStatus.fromCode(ws.getStatus()) != WorkspaceStatus.STARTING) {
                log.debug("startup monitor stop: workspaceId={}, status={}", workspaceId, ws.getStatus());
                return;
            }

            String remoteStatus;
            try {
                remoteStatus = orchestrationClient.getSessionStatus(ws.getExternalSessionId());
            } catch (OrchestrationUnavailableException e) {
                log.warn("startup monitor status query failed: workspaceId={}, attempt={}, error={}",
                        workspaceId, attempt, e.getMessage());
                remoteStatus = "unknown";
            }

            if (WorkspaceStatus.RUNNING.code().equals(remoteStatus)) {
                if (workspaceService.markRunning(workspaceId, LocalDateTime.now(clock))) {
                    log.info("workspace running: workspaceId={}, attempt={}", workspaceId, attempt);
                } else {
                    log.info("workspace terminated while starting, keep it: workspaceId={}", workspaceId);
                }
                return;
            }

            int maxAttempts = Math.max(1, props.getMonitorMaxAttempts());
            if (WorkspaceStatus.FAILED.code().equals(remoteStatus) || attempt >= maxAttempts) {
                String reason = WorkspaceStatus.FAILED.code().equals(remoteStatus) ? MSG_FAILED : MSG_TIMEOUT;
                if (workspaceService.markFailed(workspaceId, reason)) {
                    log.warn("workspace failed to start: workspaceId={}, attempt={}, reason={}", workspaceId, attempt, reason);
                }
                return;
            }

            scheduleNext(workspaceId, attempt + 1);
        } catch (Exception e) {
            log.error("startup monitor error: workspaceId={}, attempt={}", workspaceId, attempt, e);
            if (attempt < Math.max(1, props.getMonitorMaxAttempts())) {
                scheduleNext(workspaceId, attempt + 1);
            } else {
                failOnTimeout(workspaceId, attempt);
            }
        }
    }

    /**
     * 最后一次轮询异常时兜底写 failed，避免记录停在 starting 直到过期清理。
     */
    private void failOnTimeout(String workspaceId, int attempt) {
        try {
            if (workspaceService.markFailed(workspaceId, MSG_TIMEOUT)) {
                log.warn("workspace failed to start: workspaceId={}, attempt={}, reason={}", workspaceId, attempt, MSG_TIMEOUT);
            }
        } catch (Exception e) {
            log.error("startup monitor give up, workspace left starting: workspaceId={}, attempt={}", workspaceId, attempt, e);
        }
    }

    private void scheduleNext(String workspaceId, int nextAttempt) {
        long delay = Math.max(0L, props.getMonitorPollIntervalMs());
        scheduler.schedule(() -> checkOnce(workspaceId, nextAttempt), clock.instant().plusMillis(delay));
    }
}
