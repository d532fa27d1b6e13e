package xyz.firestige.hotswap.domain.audit;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 审计事件
 * <p>
 * 记录谁（actor）在什么流水线/环境上把什么从 oldStatus 改成了 newStatus。
 */
public class AuditEvent {

    private final String eventId;
    private final LocalDateTime timestamp;
    private final AuditEventType type;
    private final AuditSeverity severity;
    private final String executionId;
    private final String moduleName;
    private final String environment;
    private final String actor;
    private final String oldStatus;
    private final String newStatus;
    private final String message;

    private AuditEvent(Builder b) {
        this.eventId = UUID.randomUUID().toString();
        this.timestamp = b.timestamp != null ? b.timestamp : LocalDateTime.now();
        this.type = b.type;
        this.severity = b.severity != null ? b.severity : b.type.getDefaultSeverity();
        this.executionId = b.executionId;
        this.moduleName = b.moduleName;
        this.environment = b.environment;
        this.actor = b.actor != null ? b.actor : "system";
        this.oldStatus = b.oldStatus;
        this.newStatus = b.newStatus;
        this.message = b.message != null ? b.message : "";
    }

    public static Builder builder(AuditEventType type) {
        return new Builder(type);
    }

    public String getEventId() { return eventId; }
    public LocalDateTime getTimestamp() { return timestamp; }
    public AuditEventType getType() { return type; }
    public AuditSeverity getSeverity() { return severity; }
    public String getExecutionId() { return executionId; }
    public String getModuleName() { return moduleName; }
    public String getEnvironment() { return environment; }
    public String getActor() { return actor; }
    public String getOldStatus() { return oldStatus; }
    public String getNewStatus() { return newStatus; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return "AuditEvent{" +
                "type=" + type +
                ", severity=" + severity +
                ", executionId='" + executionId + '\'' +
                ", environment='" + environment + '\'' +
                ", actor='" + actor + '\'' +
                ", " + oldStatus + " -> " + newStatus +
                ", message='" + message + '\'' +
                '}';
    }

    public static class Builder {
        private final AuditEventType type;
        private AuditSeverity severity;
        private String executionId;
        private String moduleName;
        private String environment;
        private String actor;
        private String oldStatus;
        private String newStatus;
        private String message;
        private LocalDateTime timestamp;

        private Builder(AuditEventType type) {
            this.type = type;
        }

        public Builder severity(AuditSeverity v) { this.severity = v; return this; }
        public Builder executionId(Object v) { this.executionId = v != null ? v.toString() : null; return this; }
        public Builder moduleName(String v) { this.moduleName = v; return this; }
        public Builder environment(Object v) { this.environment = v != null ? v.toString() : null; return this; }
        public Builder actor(String v) { this.actor = v; return this; }
        public Builder transition(Object from, Object to) {
            this.oldStatus = from != null ? from.toString() : null;
            this.newStatus = to != null ? to.toString() : null;
            return this;
        }
        public Builder message(String v) { this.message = v; return this; }
        public Builder timestamp(LocalDateTime v) { this.timestamp = v; return this; }

        public AuditEvent build() {
            return new AuditEvent(this);
        }
    }
}
