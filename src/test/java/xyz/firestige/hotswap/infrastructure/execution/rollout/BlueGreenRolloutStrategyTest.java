package xyz.firestige.hotswap.infrastructure.execution.rollout;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.hotswap.domain.health.HealthEvaluator;
import xyz.firestige.hotswap.domain.pipeline.RolloutStrategyType;
import xyz.firestige.hotswap.domain.pipeline.StageResult;
import xyz.firestige.hotswap.domain.shared.exception.ErrorType;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.shared.vo.ExecutionId;
import xyz.firestige.hotswap.domain.shared.vo.ModuleDescriptor;
import xyz.firestige.hotswap.infrastructure.cluster.InMemoryClusterSimulator;
import xyz.firestige.hotswap.util.TestDataFactory;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@DisplayName("蓝绿发布策略测试")
class BlueGreenRolloutStrategyTest {

    private InMemoryClusterSimulator cluster;
    private BlueGreenRolloutStrategy strategy;

    @BeforeEach
    void setUp() {
        cluster = new InMemoryClusterSimulator(TestDataFactory.nodeCounts());
        strategy = new BlueGreenRolloutStrategy(cluster, cluster, new HealthEvaluator());
    }

    private RolloutContext context(String version) {
        StageResult stage = StageResult.pending(EnvironmentType.STAGING, RolloutStrategyType.BLUE_GREEN, version);
        stage.start(null);
        return RolloutContext.builder()
                .executionId(ExecutionId.generate())
                .module(ModuleDescriptor.of("pricing", version))
                .environment(EnvironmentType.STAGING)
                .stage(stage)
                .smokeTestTimeout(Duration.ofMillis(100))
                .build();
    }

    @Test
    @DisplayName("场景: 绿环境健康后一次性切流")
    void healthyStandby_switchesTraffic() {
        strategy.execute(context("1.0.0"));
        RolloutContext ctx = context("1.1.0");

        StageOutcome outcome = strategy.execute(ctx);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getNodesDeployed()).isEqualTo(4);
        assertThat(ctx.getStage().getShiftSteps()).containsExactly(100);
        assertThat(cluster.countNodesRunning(EnvironmentType.STAGING, "pricing", "1.1.0")).isEqualTo(4);
        assertThat(cluster.countNodesRunning(EnvironmentType.STAGING, "pricing", "1.0.0")).isZero();
    }

    @Test
    @DisplayName("场景: 冒烟超时丢弃绿环境，蓝环境保持不变")
    void smokeTimeout_discardsStandby() {
        strategy.execute(context("1.0.0"));
        cluster.markVersionUnhealthy("1.1.0");

        StageOutcome outcome = strategy.execute(context("1.1.0"));

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.isLiveTrafficAffected()).isFalse();
        assertThat(outcome.getFailureInfo().getErrorType()).isEqualTo(ErrorType.HEALTH_BREACH);
        assertThat(cluster.countNodesRunning(EnvironmentType.STAGING, "pricing", "1.0.0")).isEqualTo(4);
        assertThat(cluster.verifyStandby(EnvironmentType.STAGING, "pricing").getTotalNodes()).isZero();
    }

    @Test
    @DisplayName("场景: 备用槽位部署失败，不影响线上")
    void standbyDeployFailure_isNotLive() {
        cluster.failDeployOn(EnvironmentType.STAGING, "stg-node-2");

        StageOutcome outcome = strategy.execute(context("1.0.0"));

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.isLiveTrafficAffected()).isFalse();
        assertThat(outcome.getNodesFailed()).isEqualTo(1);
        assertThat(cluster.verifyStandby(EnvironmentType.STAGING, "pricing").getTotalNodes()).isZero();
    }
}
