package io.rtpi.workspace.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 一个已申请的 workspace（远端容器会话）的期望状态 + 观测状态。
 *
 * 注意：
 * - DB 是唯一的协调点：启动监控、过期回收、API 请求都只通过按 id 的单行更新写入
 * - terminatedAt 一旦非空即永久终止：不计入配额，也不会再被回收任务扫描
 */
@Data
@TableName(value = "rtpi_workspace", autoResultMap = true)
public class RtpiWorkspace {

    @TableId(value = "id", type = IdType.ASSIGN_UUID)
    private String id;

    @TableField("user_id")
    @Schema(description = "owner 用户ID")
    private String userId;

    @TableField("operation_id")
    @Schema(description = "所属 operation（可为空）")
    private String operationId;

    @TableField("workspace_type")
    @Schema(description = "类型：vscode/burp/kali/firefox/empire")
    private String workspaceType;

    @TableField("workspace_name")
    private String workspaceName;

    @TableField("external_session_id")
    @Schema(description = "编排 API 分配的会话ID")
    private String externalSessionId;

    @TableField("external_container_id")
    private String externalContainerId;

    @TableField("external_user_id")
    private String externalUserId;

    @TableField("status")
    @Schema(description = "状态：starting/running/stopped/failed")
    private String status;

    @TableField("access_url")
    @Schema(description = "浏览器访问地址")
    private String accessUrl;

    @TableField("internal_ip")
    private String internalIp;

    @TableField("cpu_limit")
    @Schema(description = "CPU 核数，例如 2")
    private String cpuLimit;

    @TableField("memory_limit")
    @Schema(description = "内存上限，例如 4096M")
    private String memoryLimit;

    @TableField("started_at")
    @Schema(description = "变为 running 的时间")
    private LocalDateTime startedAt;

    @TableField("last_accessed_at")
    private LocalDateTime lastAccessedAt;

    @TableField("expires_at")
    @Schema(description = "过期时间（可延期），过期后由回收任务终止")
    private LocalDateTime expiresAt;

    @TableField("terminated_at")
    @Schema(description = "终止时间：非空即已回收（只写一次）")
    private LocalDateTime terminatedAt;

    @TableField(value = "metadata", typeHandler = JacksonTypeHandler.class)
    @Schema(description = "共享列表 / 快照列表 / 自定义属性")
    private WorkspaceMetadata metadata;

    @TableField("error_message")
    @Schema(description = "失败原因（status=failed 时）")
    private String errorMessage;

    @TableField("created_by")
    private String createdBy;

    @TableField(value = "create_time", fill = FieldFill.INSERT)
    private LocalDateTime createTime;

    @TableField(value = "update_time", fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updateTime;
}
