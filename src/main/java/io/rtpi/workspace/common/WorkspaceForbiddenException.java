package io.rtpi.workspace.common;

/**
 * 非 owner 调用 owner 专属操作（终止/延期/共享/快照）。
 * 上层鉴权之外，核心服务自身也做一次 owner 校验。
 */
public class WorkspaceForbiddenException extends RuntimeException {
    public WorkspaceForbiddenException(String message) {
        super(message);
    }
}
