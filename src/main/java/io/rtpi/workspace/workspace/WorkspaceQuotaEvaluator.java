package io.rtpi.workspace.workspace;

import io.rtpi.workspace.common.QuotaExceededException;
import io.rtpi.workspace.entity.RtpiWorkspace;
import io.rtpi.workspace.entity.response.ResourceUsageResponse;

import java.util.List;

/**
 * 配额判定（纯函数，无 IO）。
 *
 * <p>输入是该用户当前未终止的 workspace 列表（调用方每次现查），按以下顺序判定，返回第一个不满足的原因：</p>
 * <ol>
 *   <li>活跃数量 &gt;= maxWorkspaces</li>
 *   <li>单个 workspace 的 CPU / 内存上限</li>
 *   <li>已占用 + 本次申请 的 CPU / 内存总量上限</li>
 * </ol>
 * 不做预占：检查与落库之间没有原子性。
 */
public class WorkspaceQuotaEvaluator {

    private final WorkspaceProperties.Quota quota;

    public WorkspaceQuotaEvaluator(WorkspaceProperties.Quota quota) {
        this.quota = quota == null ? new WorkspaceProperties.Quota() : quota;
    }

    public WorkspaceProperties.Quota getQuota() {
        return quota;
    }

    public void check(List<RtpiWorkspace> activeWorkspaces, String requestedCpu, String requestedMemory) {
        int count = activeWorkspaces == null ? 0 : activeWorkspaces.size();
        if (count >= quota.getMaxWorkspaces()) {
            throw new QuotaExceededException(
                    "User has reached maximum workspace limit (" + quota.getMaxWorkspaces() + ")");
        }

        double newCpu = ResourceSizes.parseCpu(requestedCpu);
        long newMemory = ResourceSizes.parseMemoryMb(requestedMemory);

        if (newCpu > quota.getMaxCpuPerWorkspace()) {
            throw new QuotaExceededException("Requested CPU (" + ResourceSizes.formatCpu(newCpu)
                    + ") exceeds max per workspace (" + ResourceSizes.formatCpu(quota.getMaxCpuPerWorkspace()) + ")");
        }
        if (newMemory > quota.getMaxMemoryPerWorkspace()) {
            throw new QuotaExceededException("Requested memory (" + newMemory
                    + "M) exceeds max per workspace (" + quota.getMaxMemoryPerWorkspace() + "M)");
        }

        double totalCpu = sumCpu(activeWorkspaces);
        long totalMemory = sumMemory(activeWorkspaces);
        if (totalCpu + newCpu > quota.getMaxTotalCpu()) {
            throw new QuotaExceededException("Total CPU usage (" + ResourceSizes.formatCpu(totalCpu + newCpu)
                    + ") would exceed quota (" + ResourceSizes.formatCpu(quota.getMaxTotalCpu()) + ")");
        }
        if (totalMemory + newMemory > quota.getMaxTotalMemory()) {
            throw new QuotaExceededException("Total memory usage (" + (totalMemory + newMemory)
                    + "M) would exceed quota (" + quota.getMaxTotalMemory() + "M)");
        }
    }

    public ResourceUsageResponse usage(List<RtpiWorkspace> activeWorkspaces) {
        ResourceUsageResponse resp = new ResourceUsageResponse();
        resp.setWorkspaceCount(activeWorkspaces == null ? 0 : activeWorkspaces.size());
        resp.setTotalCpu(sumCpu(activeWorkspaces));
        resp.setTotalMemory(sumMemory(activeWorkspaces));
        resp.setQuota(quota);
        return resp;
    }

    // 已落库的限额在创建时校验过；历史脏数据按 0 计，不阻断判定
    static double sumCpu(List<RtpiWorkspace> workspaces) {
        double total = 0;
        if (workspaces == null) return total;
        for (RtpiWorkspace w : workspaces) {
            if (w == null || w.getCpuLimit() == null) continue;
            try {
                total += ResourceSizes.parseCpu(w.getCpuLimit());
            } catch (IllegalArgumentException ignore) {
                // 按 0 计
            }
        }
        return total;
    }

    static long sumMemory(List<RtpiWorkspace> workspaces) {
        long total = 0;
        if (workspaces == null) return total;
        for (RtpiWorkspace w : workspaces) {
            if (w == null || w.getMemoryLimit() == null) continue;
            try {
                total += ResourceSizes.parseMemoryMb(w.getMemoryLimit());
            } catch (IllegalArgumentException ignore) {
                // 按 0 计
            }
        }
        return total;
    }
}
