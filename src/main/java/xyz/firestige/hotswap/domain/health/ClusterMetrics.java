package xyz.firestige.hotswap.domain.health;

/**
 * 集群指标采样（只读）
 *
 * @param avgCpu            平均 CPU 使用率（%）
 * @param avgMemory         平均内存使用率（%）
 * @param avgLatency        平均延迟（ms）
 * @param avgErrorRate      平均错误率（%）
 * @param requestsPerSecond 每秒请求数
 */
public record ClusterMetrics(double avgCpu,
                             double avgMemory,
                             double avgLatency,
                             double avgErrorRate,
                             double requestsPerSecond) {

    public static ClusterMetrics of(double avgCpu, double avgMemory, double avgLatency, double avgErrorRate) {
        return new ClusterMetrics(avgCpu, avgMemory, avgLatency, avgErrorRate, 0.0);
    }
}
