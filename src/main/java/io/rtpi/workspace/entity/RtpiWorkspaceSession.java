package io.rtpi.workspace.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 用户访问某个 workspace 的会话（token）。过期时间独立于 workspace：
 * workspace 仍在运行时会话也可能先过期；workspace 终止时其所有会话级联终止。
 */
@Data
@TableName("rtpi_workspace_session")
public class RtpiWorkspaceSession {

    @TableId(value = "id", type = IdType.ASSIGN_UUID)
    private String id;

    @TableField("user_id")
    private String userId;

    @TableField("workspace_id")
    private String workspaceId;

    @TableField("session_token")
    @Schema(description = "随机 token，客户端用它代替 id")
    private String sessionToken;

    @TableField("last_activity")
    @Schema(description = "最近一次心跳时间")
    private LocalDateTime lastActivity;

    @TableField("activity_count")
    private Integer activityCount;

    @TableField("ip_address")
    private String ipAddress;

    @TableField("user_agent")
    private String userAgent;

    @TableField("expires_at")
    private LocalDateTime expiresAt;

    @TableField("terminated_at")
    private LocalDateTime terminatedAt;

    @TableField(value = "create_time", fill = FieldFill.INSERT)
    private LocalDateTime createTime;

    @TableField(value = "update_time", fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updateTime;
}
