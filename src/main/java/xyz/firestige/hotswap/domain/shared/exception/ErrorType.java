package xyz.firestige.hotswap.domain.shared.exception;

/**
 * 错误类型枚举
 * 流水线中每一种失败路径对应一个类型，便于告警分级和审计
 */
public enum ErrorType {

    /**
     * 请求校验错误（提交时同步返回，流水线不会启动）
     */
    VALIDATION_ERROR("校验错误", false),

    /**
     * 部署锁竞争（超时未获取到锁）
     */
    LOCK_CONTENTION("锁竞争", true),

    /**
     * 审批被拒绝
     */
    APPROVAL_REJECTED("审批拒绝", false),

    /**
     * 审批超时
     */
    APPROVAL_EXPIRED("审批超时", false),

    /**
     * 健康阈值越界
     */
    HEALTH_BREACH("健康检查越界", false),

    /**
     * 回滚失败（需要人工介入）
     */
    ROLLBACK_FAILURE("回滚失败", false),

    /**
     * 已取消
     */
    CANCELLED("已取消", false),

    /**
     * 系统错误
     */
    SYSTEM_ERROR("系统错误", false);

    private final String description;
    private final boolean retryable;

    ErrorType(String description, boolean retryable) {
        this.description = description;
        this.retryable = retryable;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 调用方是否可以稍后重新提交整个部署
     */
    public boolean isRetryable() {
        return retryable;
    }
}
