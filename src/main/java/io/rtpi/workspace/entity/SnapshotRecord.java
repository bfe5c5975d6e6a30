package io.rtpi.workspace.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotRecord {
    private String workspaceId;
    private String snapshotName;
    private LocalDateTime createdAt;
    /**
     * 编排 API 返回的快照大小（字节），缺省 0
     */
    private long size;
    private Map<String, Object> metadata;
}
