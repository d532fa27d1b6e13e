package xyz.firestige.hotswap.infrastructure.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.hotswap.domain.audit.AuditEvent;
import xyz.firestige.hotswap.domain.audit.AuditRecorder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 审计日志出口：每个事件一行 JSON，写入 HOTSWAP_AUDIT logger
 * <p>
 * 由 logback 配置决定落地位置（文件、采集器），编排器只保证写出。
 */
public class LoggingAuditRecorder implements AuditRecorder {

    private static final Logger audit = LoggerFactory.getLogger("HOTSWAP_AUDIT");
    private static final Logger log = LoggerFactory.getLogger(LoggingAuditRecorder.class);

    private final ObjectMapper objectMapper;

    public LoggingAuditRecorder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void record(AuditEvent event) {
        try {
            String line = objectMapper.writeValueAsString(toDocument(event));
            switch (event.getSeverity()) {
                case CRITICAL -> audit.error(line);
                case WARNING -> audit.warn(line);
                default -> audit.info(line);
            }
        } catch (JsonProcessingException e) {
            log.warn("[AuditRecorder] 审计事件序列化失败: {}", event, e);
        }
    }

    private Map<String, Object> toDocument(AuditEvent event) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("eventId", event.getEventId());
        doc.put("timestamp", event.getTimestamp().toString());
        doc.put("type", event.getType().name());
        doc.put("severity", event.getSeverity().name());
        doc.put("executionId", event.getExecutionId());
        doc.put("module", event.getModuleName());
        doc.put("environment", event.getEnvironment());
        doc.put("actor", event.getActor());
        doc.put("oldStatus", event.getOldStatus());
        doc.put("newStatus", event.getNewStatus());
        doc.put("message", event.getMessage());
        return doc;
    }
}
