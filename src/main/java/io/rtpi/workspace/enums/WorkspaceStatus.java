package io.rtpi.workspace.enums;

import java.util.Locale;

/**
 * Workspace 状态机（4态）
 *
 * starting : 远端会话已创建，等待启动监控确认 running
 * running  : 远端会话已就绪，可访问
 * stopped  : 已终止（主动终止或过期回收），终态
 * failed   : 启动失败/启动超时（见 errorMessage），终态
 *
 * 合法迁移：starting -> running -> stopped；starting -> failed；starting -> stopped。
 * 终态记录永不复活，重新申请会创建新的 workspace。
 */
public enum WorkspaceStatus {
    STARTING("starting", "启动中"),
    RUNNING("running", "运行中"),
    STOPPED("stopped", "已终止"),
    FAILED("failed", "启动失败");

    private final String code;
    private final String desc;

    WorkspaceStatus(String code, String desc) {
        this.code = code;
        this.desc = desc;
    }

    public String code() {
        return code;
    }

    public String desc() {
        return desc;
    }

    public static WorkspaceStatus fromCode(String code) {
        if (code == null) return null;
        String c = code.trim().toLowerCase(Locale.ROOT);
        for (WorkspaceStatus s : values()) {
            if (s.code.equals(c)) return s;
        }
        return null;
    }
}
