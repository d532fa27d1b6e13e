package xyz.firestige.hotswap.domain.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
@Tag("fast")
@DisplayName("HealthEvaluator 单元测试")
class HealthEvaluatorTest {

    private static final ClusterMetrics BASELINE = ClusterMetrics.of(40.0, 50.0, 100.0, 1.0);
    private static final ClusterHealthSnapshot ALL_HEALTHY = ClusterHealthSnapshot.of(4, 4);

    private final HealthEvaluator evaluator = new HealthEvaluator();
    private final HealthThresholds thresholds = HealthThresholds.defaults();

    @Test
    @DisplayName("场景: 指标在阈值内判定为健康")
    void withinThresholds_isHealthy() {
        ClusterMetrics current = ClusterMetrics.of(44.0, 55.0, 150.0, 1.4);

        HealthVerdict verdict = evaluator.evaluate(BASELINE, current, ALL_HEALTHY, thresholds);

        assertThat(verdict.isHealthy()).isTrue();
    }

    @Test
    @DisplayName("场景: 存在不健康节点时先于指标判定越界")
    void unhealthyNode_breachesFirst() {
        ClusterMetrics current = ClusterMetrics.of(90.0, 90.0, 900.0, 50.0);

        HealthVerdict verdict = evaluator.evaluate(BASELINE, current, ClusterHealthSnapshot.of(4, 3), thresholds);

        assertThat(verdict.isHealthy()).isFalse();
        assertThat(verdict.getMetric()).isEqualTo("healthyNodeRatio");
        assertThat(verdict.getObserved()).isCloseTo(0.75, within(0.001));
    }

    @Test
    @DisplayName("场景: 错误率增幅超过 50% 越界")
    void errorRateSpike_breaches() {
        HealthVerdict verdict = evaluator.evaluate(BASELINE, ClusterMetrics.of(40.0, 50.0, 100.0, 1.6),
                ALL_HEALTHY, thresholds);

        assertThat(verdict.getMetric()).isEqualTo("errorRate");
        assertThat(verdict.getObserved()).isCloseTo(60.0, within(0.001));
        assertThat(verdict.describe()).contains("errorRate");
    }

    @Test
    @DisplayName("场景: 基线错误率为 0 时按下限计算增幅")
    void zeroErrorBaseline_usesFloor() {
        ClusterMetrics zeroBaseline = ClusterMetrics.of(40.0, 50.0, 100.0, 0.0);

        assertThat(evaluator.evaluate(zeroBaseline, ClusterMetrics.of(40.0, 50.0, 100.0, 0.04),
                ALL_HEALTHY, thresholds).isHealthy()).isTrue();
        assertThat(evaluator.evaluate(zeroBaseline, ClusterMetrics.of(40.0, 50.0, 100.0, 0.2),
                ALL_HEALTHY, thresholds).getMetric()).isEqualTo("errorRate");
    }

    @Test
    @DisplayName("场景: 按 延迟 → CPU → 内存 顺序报告第一个越界项")
    void reportsFirstBreachInOrder() {
        assertThat(evaluator.evaluate(BASELINE, ClusterMetrics.of(80.0, 90.0, 250.0, 1.0), ALL_HEALTHY, thresholds)
                .getMetric()).isEqualTo("latency");
        assertThat(evaluator.evaluate(BASELINE, ClusterMetrics.of(80.0, 90.0, 150.0, 1.0), ALL_HEALTHY, thresholds)
                .getMetric()).isEqualTo("cpu");
        assertThat(evaluator.evaluate(BASELINE, ClusterMetrics.of(44.0, 90.0, 150.0, 1.0), ALL_HEALTHY, thresholds)
                .getMetric()).isEqualTo("memory");
    }

    @Test
    @DisplayName("场景: 没有基线时只看节点健康")
    void missingBaseline_onlyChecksNodes() {
        assertThat(evaluator.evaluate(null, ClusterMetrics.of(99.0, 99.0, 999.0, 99.0), ALL_HEALTHY, thresholds)
                .isHealthy()).isTrue();
    }
}
