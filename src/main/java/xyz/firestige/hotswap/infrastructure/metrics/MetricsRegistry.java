package xyz.firestige.hotswap.infrastructure.metrics;

/**
 * 指标出口（计数器 + 仪表）
 * <p>
 * 标签以 key、value 交替传入，例如 {@code incrementCounter(LOCK_CONTENTION, TAG_ENVIRONMENT, "PRODUCTION")}。
 */
public interface MetricsRegistry {

    String PIPELINE_STARTED = "hotswap_pipeline_started";
    String PIPELINE_SUCCEEDED = "hotswap_pipeline_succeeded";
    String PIPELINE_FAILED = "hotswap_pipeline_failed";
    String PIPELINE_ACTIVE = "hotswap_pipeline_active";
    String LOCK_CONTENTION = "hotswap_lock_contention";
    String ROLLBACK_SUCCEEDED = "hotswap_rollback_succeeded";
    String ROLLBACK_ESCALATED = "hotswap_rollback_escalated";
    String APPROVAL_EXPIRED = "hotswap_approval_expired";

    String TAG_ENVIRONMENT = "environment";

    default void incrementCounter(String name) {
        incrementCounter(name, new String[0]);
    }

    void incrementCounter(String name, String... tags);

    void setGauge(String name, double value);
}
