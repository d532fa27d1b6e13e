package xyz.firestige.hotswap.domain.audit;

/**
 * 审计事件类型
 */
public enum AuditEventType {

    PIPELINE_STARTED(AuditSeverity.INFO),
    PIPELINE_COMPLETED(AuditSeverity.INFO),
    PIPELINE_FAILED(AuditSeverity.WARNING),

    STAGE_STARTED(AuditSeverity.INFO),
    STAGE_COMPLETED(AuditSeverity.INFO),
    STAGE_FAILED(AuditSeverity.WARNING),

    LOCK_ACQUIRED(AuditSeverity.INFO),
    LOCK_CONTENDED(AuditSeverity.WARNING),
    LOCK_RELEASED(AuditSeverity.INFO),

    APPROVAL_REQUESTED(AuditSeverity.INFO),
    APPROVAL_APPROVED(AuditSeverity.INFO),
    APPROVAL_REJECTED(AuditSeverity.WARNING),
    APPROVAL_EXPIRED(AuditSeverity.WARNING),

    ROLLBACK_STARTED(AuditSeverity.WARNING),
    ROLLBACK_SUCCEEDED(AuditSeverity.INFO),
    ROLLBACK_FAILED(AuditSeverity.CRITICAL);

    private final AuditSeverity defaultSeverity;

    AuditEventType(AuditSeverity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public AuditSeverity getDefaultSeverity() {
        return defaultSeverity;
    }
}
