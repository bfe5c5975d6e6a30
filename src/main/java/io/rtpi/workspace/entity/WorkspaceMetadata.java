package io.rtpi.workspace.entity;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * rtpi_workspace.metadata 列（JSON）。共享列表与快照列表是强类型的，
 * 申请时调用方传入的自定义属性放在 extra 里。
 */
@Data
public class WorkspaceMetadata {

    private List<ShareGrant> sharedWith = new ArrayList<>();

    private List<SnapshotRecord> snapshots = new ArrayList<>();

    private Map<String, Object> extra = new LinkedHashMap<>();

    public static WorkspaceMetadata of(Map<String, Object> extra) {
        WorkspaceMetadata m = new WorkspaceMetadata();
        if (extra != null) {
            m.getExtra().putAll(extra);
        }
        return m;
    }

    /**
     * 复制一份（列表是新的），避免修改已加载实体上的对象。
     */
    public static WorkspaceMetadata copyOf(WorkspaceMetadata src) {
        WorkspaceMetadata m = new WorkspaceMetadata();
        if (src == null) return m;
        if (src.getSharedWith() != null) m.getSharedWith().addAll(src.getSharedWith());
        if (src.getSnapshots() != null) m.getSnapshots().addAll(src.getSnapshots());
        if (src.getExtra() != null) m.getExtra().putAll(src.getExtra());
        return m;
    }

    public boolean isSharedWith(String userId) {
        if (userId == null || sharedWith == null) return false;
        for (ShareGrant g : sharedWith) {
            if (g != null && userId.equals(g.getUserId())) return true;
        }
        return false;
    }
}
