package xyz.firestige.hotswap.domain.health;

/**
 * 一次健康评估的结论
 * <p>
 * 越界时携带哪个指标、观测值与阈值，供回滚协调与审计使用。
 */
public final class HealthVerdict {

    private static final HealthVerdict HEALTHY = new HealthVerdict(true, null, 0.0, 0.0);

    private final boolean healthy;
    private final String metric;
    private final double observed;
    private final double threshold;

    private HealthVerdict(boolean healthy, String metric, double observed, double threshold) {
        this.healthy = healthy;
        this.metric = metric;
        this.observed = observed;
        this.threshold = threshold;
    }

    public static HealthVerdict healthy() {
        return HEALTHY;
    }

    public static HealthVerdict breach(String metric, double observed, double threshold) {
        return new HealthVerdict(false, metric, observed, threshold);
    }

    public boolean isHealthy() { return healthy; }
    public String getMetric() { return metric; }
    public double getObserved() { return observed; }
    public double getThreshold() { return threshold; }

    public String describe() {
        if (healthy) {
            return "健康";
        }
        return String.format("%s 越界: 观测值 %.2f, 阈值 %.2f", metric, observed, threshold);
    }

    @Override
    public String toString() {
        return "HealthVerdict{" + describe() + '}';
    }
}
