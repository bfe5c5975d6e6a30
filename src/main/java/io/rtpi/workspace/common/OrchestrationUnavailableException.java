package io.rtpi.workspace.common;

/**
 * 远端容器编排 API（会话创建/删除/快照/状态查询）不可用或返回异常时抛出。
 * 调用方自行决定重试或放弃，客户端内部不做重试。
 */
public class OrchestrationUnavailableException extends RuntimeException {
    public OrchestrationUnavailableException(String message) {
        super(message);
    }

    public OrchestrationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
