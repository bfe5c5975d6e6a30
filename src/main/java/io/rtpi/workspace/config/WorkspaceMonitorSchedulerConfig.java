package io.rtpi.workspace.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class WorkspaceMonitorSchedulerConfig {

    /**
     * 启动监控的轮询任务（每个 provision 一条独立的轮询链）。
     * - 不占用 Web 线程，调用方不等待 running
     * - 每次轮询都很短（一次状态查询 + 一次单行更新），小线程池即可
     */
    @Bean(name = "workspaceMonitorScheduler")
    public ThreadPoolTaskScheduler workspaceMonitorScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(4);
        s.setThreadNamePrefix("ws-monitor-");
        s.setWaitForTasksToCompleteOnShutdown(false);
        s.setRemoveOnCancelPolicy(true);
        s.initialize();
        return s;
    }

    /**
     * 过期判断 / 时间戳写入统一使用的时钟（测试中可替换）。
     */
    @Bean
    public Clock workspaceClock() {
        return Clock.systemDefaultZone();
    }
}
