package xyz.firestige.hotswap.autoconfigure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import xyz.firestige.hotswap.application.approval.ApprovalGate;
import xyz.firestige.hotswap.application.approval.ApprovalTimeoutSweeper;
import xyz.firestige.hotswap.application.orchestration.PipelineOrchestrator;
import xyz.firestige.hotswap.application.orchestration.PipelineSettings;
import xyz.firestige.hotswap.config.properties.HotSwapPipelineProperties;
import xyz.firestige.hotswap.domain.pipeline.ApprovalMode;
import xyz.firestige.hotswap.domain.pipeline.RolloutStrategyType;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.version.EnvironmentVersionRegistry;
import xyz.firestige.hotswap.facade.DeploymentFacade;
import xyz.firestige.hotswap.health.PipelineOrchestratorHealthIndicator;
import xyz.firestige.hotswap.infrastructure.cluster.InMemoryClusterSimulator;
import xyz.firestige.hotswap.infrastructure.lock.DistributedLock;
import xyz.firestige.hotswap.infrastructure.lock.memory.InMemoryDistributedLock;
import xyz.firestige.hotswap.infrastructure.lock.redis.RedisDistributedLock;
import xyz.firestige.hotswap.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.hotswap.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.hotswap.infrastructure.persistence.PipelineResultStore;
import xyz.firestige.hotswap.infrastructure.persistence.memory.InMemoryPipelineResultStore;
import xyz.firestige.hotswap.infrastructure.persistence.redis.RedisPipelineResultStore;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * 自动配置测试：默认 InMemory 装配、Redis 装配与属性绑定
 */
@Tag("integration")
@DisplayName("HotSwap 自动配置测试")
class HotSwapAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    HotSwapPersistenceAutoConfiguration.class,
                    HotSwapOrchestratorAutoConfiguration.class));

    @Test
    @DisplayName("场景: 默认装配内存实现与模拟集群")
    void defaults_wireInMemoryBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(PipelineOrchestrator.class);
            assertThat(context).hasSingleBean(DeploymentFacade.class);
            assertThat(context).hasSingleBean(ApprovalGate.class);
            assertThat(context).hasSingleBean(InMemoryClusterSimulator.class);
            assertThat(context.getBean(DistributedLock.class)).isInstanceOf(InMemoryDistributedLock.class);
            assertThat(context.getBean(PipelineResultStore.class)).isInstanceOf(InMemoryPipelineResultStore.class);
            assertThat(context.getBean(MetricsRegistry.class)).isInstanceOf(NoopMetricsRegistry.class);
            assertThat(context.getBean(ApprovalTimeoutSweeper.class).isRunning()).isTrue();
        });
    }

    @Test
    @DisplayName("场景: store-type=redis 时装配 Redis 锁和结果存储")
    void redisStoreType_wiresRedisBeans() {
        contextRunner
                .withBean(RedisConnectionFactory.class, () -> mock(RedisConnectionFactory.class))
                .withPropertyValues("hotswap.persistence.store-type=redis", "hotswap.persistence.namespace=ci")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(DistributedLock.class)).isInstanceOf(RedisDistributedLock.class);
                    assertThat(context.getBean(PipelineResultStore.class)).isInstanceOf(RedisPipelineResultStore.class);
                    assertThat(context).hasBean("hotswapRedisTemplate");
                });
    }

    @Test
    @DisplayName("场景: 宿主应用提供的部署锁优先")
    void customLock_backsOff() {
        InMemoryDistributedLock custom = new InMemoryDistributedLock();
        contextRunner
                .withBean(DistributedLock.class, () -> custom)
                .run(context -> assertThat(context.getBean(DistributedLock.class)).isSameAs(custom));
    }

    @Test
    @DisplayName("场景: 环境策略覆盖绑定到流水线配置")
    void environmentOverrides_bindToSettings() {
        contextRunner
                .withPropertyValues(
                        "hotswap.pipeline.canary-wait-duration=2m",
                        "hotswap.pipeline.approval-mode=per-stage",
                        "hotswap.pipeline.environments.production.strategy=progressive",
                        "hotswap.pipeline.environments.production.batches[0]=25",
                        "hotswap.pipeline.environments.production.batches[1]=50",
                        "hotswap.pipeline.environments.production.batches[2]=100",
                        "hotswap.pipeline.environments.staging.require-approval=false",
                        "hotswap.cluster.nodes.production=6")
                .run(context -> {
                    PipelineSettings settings = context.getBean(HotSwapPipelineProperties.class).toSettings();
                    assertThat(settings.getCanaryWaitDuration()).isEqualTo(Duration.ofMinutes(2));
                    assertThat(settings.getApprovalMode()).isEqualTo(ApprovalMode.PER_STAGE);
                    assertThat(settings.policyFor(EnvironmentType.PRODUCTION).strategy())
                            .isEqualTo(RolloutStrategyType.PROGRESSIVE);
                    assertThat(settings.policyFor(EnvironmentType.PRODUCTION).batches()).containsExactly(25, 50, 100);
                    assertThat(settings.policyFor(EnvironmentType.PRODUCTION).requireApproval()).isTrue();
                    assertThat(settings.policyFor(EnvironmentType.STAGING).requireApproval()).isFalse();
                    assertThat(settings.policyFor(EnvironmentType.STAGING).strategy())
                            .isEqualTo(RolloutStrategyType.BLUE_GREEN);
                    assertThat(context.getBean(InMemoryClusterSimulator.class)
                            .nodeIds(EnvironmentType.PRODUCTION)).hasSize(6);
                });
    }

    @Test
    @DisplayName("场景: 存在降级环境时健康检查为 DOWN")
    void healthIndicator_reportsDegradedEnvironment() {
        contextRunner.run(context -> {
            PipelineOrchestratorHealthIndicator indicator = context.getBean(PipelineOrchestratorHealthIndicator.class);
            assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);

            context.getBean(EnvironmentVersionRegistry.class)
                    .markDegraded("billing-service", EnvironmentType.PRODUCTION, true);

            assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
            assertThat(indicator.health().getDetails()).containsKeys("activePipelines", "pendingApprovals");
        });
    }
}
