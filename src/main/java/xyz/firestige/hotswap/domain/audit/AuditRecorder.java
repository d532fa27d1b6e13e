package xyz.firestige.hotswap.domain.audit;

/**
 * 审计记录器（只写外部接收端）
 * <p>
 * 接收阶段、审批、锁、回滚事件形成合规审计轨迹。
 * 实现不得抛出异常影响流水线；持久化由外部负责。
 */
public interface AuditRecorder {

    void record(AuditEvent event);
}
