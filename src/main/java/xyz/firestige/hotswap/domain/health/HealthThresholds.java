package xyz.firestige.hotswap.domain.health;

/**
 * 健康越界阈值（配置而非代码）
 * <p>
 * 增幅均以相对基线的百分比表示。
 *
 * @param maxErrorRateIncrease 错误率最大增幅（%）
 * @param maxLatencyIncrease   延迟最大增幅（%）
 * @param maxCpuIncrease       CPU 最大增幅（%）
 * @param maxMemoryIncrease    内存最大增幅（%）
 * @param minHealthyRatio      最低健康节点占比（0-1）
 */
public record HealthThresholds(double maxErrorRateIncrease,
                               double maxLatencyIncrease,
                               double maxCpuIncrease,
                               double maxMemoryIncrease,
                               double minHealthyRatio) {

    public static HealthThresholds defaults() {
        return new HealthThresholds(50.0, 100.0, 30.0, 30.0, 1.0);
    }
}
