package xyz.firestige.hotswap.domain.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 健康评估器：把当前采样与基线对比，判断是否越过配置阈值
 * <p>
 * 检查顺序：健康节点占比 → 错误率 → 延迟 → CPU → 内存，命中第一个即返回。
 */
public class HealthEvaluator {

    private static final Logger log = LoggerFactory.getLogger(HealthEvaluator.class);

    /**
     * 错误率基线下限，避免基线为 0 时增幅无穷大
     */
    private static final double MIN_ERROR_RATE_BASELINE = 0.1;

    public HealthVerdict evaluate(ClusterMetrics baseline,
                                  ClusterMetrics current,
                                  ClusterHealthSnapshot snapshot,
                                  HealthThresholds thresholds) {
        if (snapshot != null && snapshot.healthyRatio() < thresholds.minHealthyRatio()) {
            return HealthVerdict.breach("healthyNodeRatio", snapshot.healthyRatio(), thresholds.minHealthyRatio());
        }
        if (baseline == null || current == null) {
            return HealthVerdict.healthy();
        }

        double errorRateIncrease = (current.avgErrorRate() - baseline.avgErrorRate())
                / Math.max(baseline.avgErrorRate(), MIN_ERROR_RATE_BASELINE) * 100;
        double latencyIncrease = increase(baseline.avgLatency(), current.avgLatency());
        double cpuIncrease = increase(baseline.avgCpu(), current.avgCpu());
        double memoryIncrease = increase(baseline.avgMemory(), current.avgMemory());

        log.debug("[HealthEvaluator] 指标变化 errorRate={}%, latency={}%, cpu={}%, memory={}%",
                errorRateIncrease, latencyIncrease, cpuIncrease, memoryIncrease);

        if (errorRateIncrease > thresholds.maxErrorRateIncrease()) {
            return HealthVerdict.breach("errorRate", errorRateIncrease, thresholds.maxErrorRateIncrease());
        }
        if (latencyIncrease > thresholds.maxLatencyIncrease()) {
            return HealthVerdict.breach("latency", latencyIncrease, thresholds.maxLatencyIncrease());
        }
        if (cpuIncrease > thresholds.maxCpuIncrease()) {
            return HealthVerdict.breach("cpu", cpuIncrease, thresholds.maxCpuIncrease());
        }
        if (memoryIncrease > thresholds.maxMemoryIncrease()) {
            return HealthVerdict.breach("memory", memoryIncrease, thresholds.maxMemoryIncrease());
        }
        return HealthVerdict.healthy();
    }

    private static double increase(double baseline, double current) {
        if (baseline <= 0) {
            return 0.0;
        }
        return (current - baseline) / baseline * 100;
    }
}
