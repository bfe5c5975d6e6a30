package io.rtpi.workspace.workspace;

import io.rtpi.workspace.enums.WorkspaceType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * Workspace（临时容器工作区）生命周期配置
 *
 * <pre>
 * rtpi.workspace.enabled=true
 * rtpi.workspace.default-expiry-hours=24
 * rtpi.workspace.cleanup-interval-ms=300000
 * rtpi.workspace.quota.max-workspaces=5
 * rtpi.workspace.images.kali=registry.local/kali:2024.1
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "rtpi.workspace")
public class WorkspaceProperties {

    /**
     * 是否启用 workspace 功能（关闭时 provision 直接拒绝，回收任务不执行）
     */
    private boolean enabled = false;

    /**
     * 申请时未指定 expiryHours 的默认有效期
     */
    private int defaultExpiryHours = 24;

    /**
     * 访问会话有效期
     */
    private int sessionExpiryHours = 12;

    /**
     * 会话无心跳多少分钟后由回收任务终止；0 表示不按空闲回收，只按 expiresAt
     */
    private int sessionIdleTimeoutMinutes = 0;

    /**
     * 过期回收任务间隔（默认 5 分钟）
     */
    private long cleanupIntervalMs = 5 * 60 * 1000L;

    /**
     * 启动监控：轮询间隔 / 最大次数（默认 3s * 20 = 60s 超时）
     */
    private long monitorPollIntervalMs = 3000;
    private int monitorMaxAttempts = 20;

    private String defaultCpuLimit = "2";
    private String defaultMemoryLimit = "4096M";

    /**
     * workspaceType code -> 镜像，未配置时使用 WorkspaceType 自带的默认镜像
     */
    private Map<String, String> images = new HashMap<>();

    private Quota quota = new Quota();

    public String resolveImage(WorkspaceType type) {
        String override = images == null ? null : images.get(type.code());
        return StringUtils.hasText(override) ? override.trim() : type.defaultImage();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getDefaultExpiryHours() {
        return defaultExpiryHours;
    }

    public void setDefaultExpiryHours(int defaultExpiryHours) {
        this.defaultExpiryHours = defaultExpiryHours;
    }

    public int getSessionExpiryHours() {
        return sessionExpiryHours;
    }

    public void setSessionExpiryHours(int sessionExpiryHours) {
        this.sessionExpiryHours = sessionExpiryHours;
    }

    public int getSessionIdleTimeoutMinutes() {
        return sessionIdleTimeoutMinutes;
    }

    public void setSessionIdleTimeoutMinutes(int sessionIdleTimeoutMinutes) {
        this.sessionIdleTimeoutMinutes = sessionIdleTimeoutMinutes;
    }

    public long getCleanupIntervalMs() {
        return cleanupIntervalMs;
    }

    public void setCleanupIntervalMs(long cleanupIntervalMs) {
        this.cleanupIntervalMs = cleanupIntervalMs;
    }

    public long getMonitorPollIntervalMs() {
        return monitorPollIntervalMs;
    }

    public void setMonitorPollIntervalMs(long monitorPollIntervalMs) {
        this.monitorPollIntervalMs = monitorPollIntervalMs;
    }

    public int getMonitorMaxAttempts() {
        return monitorMaxAttempts;
    }

    public void setMonitorMaxAttempts(int monitorMaxAttempts) {
        this.monitorMaxAttempts = monitorMaxAttempts;
    }

    public String getDefaultCpuLimit() {
        return defaultCpuLimit;
    }

    public void setDefaultCpuLimit(String defaultCpuLimit) {
        this.defaultCpuLimit = defaultCpuLimit;
    }

    public String getDefaultMemoryLimit() {
        return defaultMemoryLimit;
    }

    public void setDefaultMemoryLimit(String defaultMemoryLimit) {
        this.defaultMemoryLimit = defaultMemoryLimit;
    }

    public Map<String, String> getImages() {
        return images;
    }

    public void setImages(Map<String, String> images) {
        this.images = images;
    }

    public Quota getQuota() {
        return quota;
    }

    public void setQuota(Quota quota) {
        this.quota = quota;
    }

    /**
     * 每个用户的资源上限（部署级配置，运行期只读）。内存单位 MB。
     */
    public static class Quota {
        private int maxWorkspaces = 5;
        private double maxCpuPerWorkspace = 4;
        private long maxMemoryPerWorkspace = 8192;
        private double maxTotalCpu = 16;
        private long maxTotalMemory = 32768;

        public int getMaxWorkspaces() {
            return maxWorkspaces;
        }

        public void setMaxWorkspaces(int maxWorkspaces) {
            this.maxWorkspaces = maxWorkspaces;
        }

        public double getMaxCpuPerWorkspace() {
            return maxCpuPerWorkspace;
        }

        public void setMaxCpuPerWorkspace(double maxCpuPerWorkspace) {
            this.maxCpuPerWorkspace = maxCpuPerWorkspace;
        }

        public long getMaxMemoryPerWorkspace() {
            return maxMemoryPerWorkspace;
        }

        public void setMaxMemoryPerWorkspace(long maxMemoryPerWorkspace) {
            this.maxMemoryPerWorkspace = maxMemoryPerWorkspace;
        }

        public double getMaxTotalCpu() {
            return maxTotalCpu;
        }

        public void setMaxTotalCpu(double maxTotalCpu) {
            this.maxTotalCpu = maxTotalCpu;
        }

        public long getMaxTotalMemory() {
            return maxTotalMemory;
        }

        public void setMaxTotalMemory(long maxTotalMemory) {
            this.maxTotalMemory = maxTotalMemory;
        }
    }
}
