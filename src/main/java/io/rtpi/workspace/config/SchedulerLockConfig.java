package io.rtpi.workspace.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * 过期回收任务多实例互斥（ShedLock，锁记录在 {@value #LOCK_TABLE} 表，建表见 db/schema.sql）。
 * 锁过期时间取 DB 时间，不依赖各实例的本机时钟。
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "PT10M")
public class SchedulerLockConfig {

    public static final String LOCK_TABLE = "shedlock";

    public static final String CLEANUP_LOCK = "workspaceCleanup";

    @Bean
    public LockProvider lockProvider(JdbcTemplate jdbcTemplate) {
        JdbcTemplateLockProvider.Configuration cfg = JdbcTemplateLockProvider.Configuration.builder()
                .withJdbcTemplate(jdbcTemplate)
                .withTableName(LOCK_TABLE)
                .usingDbTime()
                .build();
        return new JdbcTemplateLockProvider(cfg);
    }
}
