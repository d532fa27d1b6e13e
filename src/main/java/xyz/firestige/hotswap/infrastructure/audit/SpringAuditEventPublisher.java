package xyz.firestige.hotswap.infrastructure.audit;

import org.springframework.context.ApplicationEventPublisher;
import xyz.firestige.hotswap.domain.audit.AuditEvent;
import xyz.firestige.hotswap.domain.audit.AuditRecorder;

/**
 * 把审计事件转发为 Spring 应用事件，供宿主应用的 @EventListener 持久化或告警
 */
public class SpringAuditEventPublisher implements AuditRecorder {

    private final ApplicationEventPublisher publisher;

    public SpringAuditEventPublisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void record(AuditEvent event) {
        publisher.publishEvent(event);
    }
}
