package io.rtpi.workspace.enums;

import java.util.Locale;

/**
 * 可申请的 workspace 类型，及其默认镜像（可通过 rtpi.workspace.images.{code} 覆盖）。
 */
public enum WorkspaceType {
    VSCODE("vscode", "代码编辑器", "kasmweb/vscode:1.17.0"),
    BURP("burp", "代理抓包工具", "kasmweb/burp-suite:1.17.0"),
    KALI("kali", "完整桌面", "kasmweb/kali-rolling-desktop:1.17.0"),
    FIREFOX("firefox", "浏览器", "kasmweb/firefox:1.17.0"),
    EMPIRE("empire", "C2 客户端", "kasmweb/empire-client:1.17.0");

    private final String code;
    private final String desc;
    private final String defaultImage;

    WorkspaceType(String code, String desc, String defaultImage) {
        this.code = code;
        this.desc = desc;
        this.defaultImage = defaultImage;
    }

    public String code() {
        return code;
    }

    public String desc() {
        return desc;
    }

    public String defaultImage() {
        return defaultImage;
    }

    public static WorkspaceType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("workspaceType is required");
        }
        String c = code.trim().toLowerCase(Locale.ROOT);
        for (WorkspaceType t : values()) {
            if (t.code.equals(c)) return t;
        }
        throw new IllegalArgumentException("Invalid workspaceType. Must be one of: vscode, burp, kali, firefox, empire");
    }
}
