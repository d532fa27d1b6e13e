package xyz.firestige.hotswap.domain.audit;

/**
 * 审计事件级别
 */
public enum AuditSeverity {

    INFO,

    WARNING,

    /**
     * 需要值班介入（回滚失败等）
     */
    CRITICAL
}
