package xyz.firestige.hotswap.infrastructure.metrics;

/**
 * 容器中没有 MeterRegistry 时使用
 */
public class NoopMetricsRegistry implements MetricsRegistry {
    @Override
    public void incrementCounter(String name, String... tags) { }

    @Override
    public void setGauge(String name, double value) { }
}
