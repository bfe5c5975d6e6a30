package io.rtpi.workspace.common;

/**
 * 用户资源配额不足（workspace 数量 / 单个 workspace 上限 / 用户总量）。
 * 由调用方处理（释放资源或减少申请），不会自动重试。
 */
public class QuotaExceededException extends RuntimeException {
    public QuotaExceededException(String message) {
        super(message);
    }
}
