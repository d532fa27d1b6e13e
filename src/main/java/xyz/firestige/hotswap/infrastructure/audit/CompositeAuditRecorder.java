package xyz.firestige.hotswap.infrastructure.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.hotswap.domain.audit.AuditEvent;
import xyz.firestige.hotswap.domain.audit.AuditRecorder;

import java.util.List;

/**
 * 组合审计出口
 * <p>
 * 单个出口失败只记录告警，不影响其他出口，更不会中断流水线。
 */
public class CompositeAuditRecorder implements AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(CompositeAuditRecorder.class);

    private final List<AuditRecorder> delegates;

    public CompositeAuditRecorder(List<AuditRecorder> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void record(AuditEvent event) {
        for (AuditRecorder delegate : delegates) {
            try {
                delegate.record(event);
            } catch (RuntimeException e) {
                log.warn("[AuditRecorder] 审计出口写入失败: {}, event: {}",
                        delegate.getClass().getSimpleName(), event.getType(), e);
            }
        }
    }

    public List<AuditRecorder> getDelegates() {
        return delegates;
    }
}
