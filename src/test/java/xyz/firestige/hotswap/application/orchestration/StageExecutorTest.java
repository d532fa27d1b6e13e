package xyz.firestige.hotswap.application.orchestration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import xyz.firestige.hotswap.application.approval.ApprovalGate;
import xyz.firestige.hotswap.domain.audit.AuditEventType;
import xyz.firestige.hotswap.domain.health.HealthEvaluator;
import xyz.firestige.hotswap.domain.pipeline.PipelineExecutionResult;
import xyz.firestige.hotswap.domain.pipeline.RollingPartialFailurePolicy;
import xyz.firestige.hotswap.domain.pipeline.StageResult;
import xyz.firestige.hotswap.domain.pipeline.StageStatus;
import xyz.firestige.hotswap.domain.shared.exception.ErrorType;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.infrastructure.cluster.InMemoryClusterSimulator;
import xyz.firestige.hotswap.infrastructure.execution.rollout.RolloutStrategyFactory;
import xyz.firestige.hotswap.infrastructure.lock.DistributedLock;
import xyz.firestige.hotswap.infrastructure.lock.LockHandle;
import xyz.firestige.hotswap.infrastructure.lock.LockRenewalScheduler;
import xyz.firestige.hotswap.infrastructure.lock.memory.InMemoryDistributedLock;
import xyz.firestige.hotswap.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.hotswap.infrastructure.persistence.approval.InMemoryApprovalRequestRepository;
import xyz.firestige.hotswap.infrastructure.persistence.version.InMemoryEnvironmentVersionRegistry;
import xyz.firestige.hotswap.util.FakeClusterHealthProbe;
import xyz.firestige.hotswap.util.RecordingAuditRecorder;
import xyz.firestige.hotswap.util.TestDataFactory;
import xyz.firestige.hotswap.util.TimingExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 阶段执行器测试：锁在每条退出路径上释放，失败后按策略决定是否回滚
 */
@Tag("unit")
@ExtendWith(TimingExtension.class)
@DisplayName("StageExecutor 单元测试")
class StageExecutorTest {

    private InMemoryClusterSimulator cluster;
    private FakeClusterHealthProbe probe;
    private InMemoryDistributedLock lock;
    private LockRenewalScheduler renewalScheduler;
    private InMemoryEnvironmentVersionRegistry versionRegistry;
    private RecordingAuditRecorder audit;
    private RollbackAlertNotifier alertNotifier;
    private RolloutStrategyFactory strategyFactory;
    private RollbackCoordinator rollbackCoordinator;
    private StageExecutor executor;

    @BeforeEach
    void setUp() {
        cluster = new InMemoryClusterSimulator(TestDataFactory.nodeCounts());
        probe = new FakeClusterHealthProbe(cluster);
        HealthEvaluator evaluator = new HealthEvaluator();
        strategyFactory = new RolloutStrategyFactory(cluster, probe, evaluator);
        NoopMetricsRegistry metrics = new NoopMetricsRegistry();
        lock = new InMemoryDistributedLock();
        renewalScheduler = new LockRenewalScheduler();
        versionRegistry = new InMemoryEnvironmentVersionRegistry();
        audit = new RecordingAuditRecorder();
        alertNotifier = mock(RollbackAlertNotifier.class);

        rollbackCoordinator = new RollbackCoordinator(strategyFactory, cluster, probe,
                versionRegistry, audit, metrics, alertNotifier);
        executor = new StageExecutor(lock, renewalScheduler,
                new ApprovalGate(new InMemoryApprovalRequestRepository(), audit, metrics),
                strategyFactory, rollbackCoordinator, versionRegistry, audit, metrics);
    }

    @AfterEach
    void tearDown() {
        renewalScheduler.shutdown();
    }

    private StageResult run(String module, String version, EnvironmentType environment, PipelineSettings settings) {
        PipelineExecutionResult result = new PipelineExecutionResult(
                TestDataFactory.request(module, version, List.of(environment)));
        result.start();
        PipelineRuntimeContext runtime = new PipelineRuntimeContext(result, settings, null, null);
        return executor.execute(runtime, environment, null);
    }

    private boolean locked(String module, EnvironmentType environment) {
        return lock.isLocked(StageExecutor.lockResource(module, environment));
    }

    @Test
    @DisplayName("场景: 成功阶段登记版本并释放锁")
    void success_recordsVersionAndReleasesLock() {
        StageResult stage = run("orders", "1.0.0", EnvironmentType.QA, TestDataFactory.fastSettings().build());

        assertThat(stage.getStatus()).isEqualTo(StageStatus.SUCCEEDED);
        assertThat(stage.getNodesDeployed()).isEqualTo(2);
        assertThat(stage.getPreviousVersion()).isNull();
        assertThat(versionRegistry.currentVersion("orders", EnvironmentType.QA)).contains("1.0.0");
        assertThat(locked("orders", EnvironmentType.QA)).isFalse();
        assertThat(audit.contains(AuditEventType.LOCK_ACQUIRED)).isTrue();
        assertThat(audit.contains(AuditEventType.LOCK_RELEASED)).isTrue();
    }

    @Test
    @DisplayName("场景: 部署锁被他人持有，超时失败且不释放他人的锁")
    void lockHeldElsewhere_failsWithContention() {
        LockHandle foreign = lock.acquire(StageExecutor.lockResource("orders", EnvironmentType.QA), Duration.ofSeconds(1));
        PipelineSettings settings = TestDataFactory.fastSettings().lockTimeout(Duration.ofMillis(50)).build();

        StageResult stage = run("orders", "1.0.0", EnvironmentType.QA, settings);

        assertThat(stage.getStatus()).isEqualTo(StageStatus.FAILED);
        assertThat(stage.getFailureInfo().getErrorType()).isEqualTo(ErrorType.LOCK_CONTENTION);
        assertThat(stage.getMessage()).startsWith("部署锁被占用");
        assertThat(cluster.countNodesRunning(EnvironmentType.QA, "orders", "1.0.0")).isZero();
        assertThat(locked("orders", EnvironmentType.QA)).isTrue();
        foreign.release();
    }

    @Test
    @DisplayName("场景: 滚动发布第二批失败，HALT 策略保留已确认节点")
    void rollingPartialFailure_haltKeepsConfirmedNodes() {
        cluster.failDeployOn(EnvironmentType.QA, "qa-node-2");

        StageResult stage = run("orders", "1.0.0", EnvironmentType.QA, TestDataFactory.fastSettings().build());

        assertThat(stage.getStatus()).isEqualTo(StageStatus.PARTIALLY_SUCCEEDED);
        assertThat(stage.getNodesDeployed()).isEqualTo(1);
        assertThat(stage.getNodesFailed()).isEqualTo(1);
        assertThat(cluster.versionOn(EnvironmentType.QA, "qa-node-1", "orders")).contains("1.0.0");
        assertThat(versionRegistry.currentVersion("orders", EnvironmentType.QA)).isEmpty();
        assertThat(locked("orders", EnvironmentType.QA)).isFalse();
    }

    @Test
    @DisplayName("场景: 滚动发布部分失败，AUTO_ROLLBACK 策略回滚已更新节点")
    void rollingPartialFailure_autoRollbackRemovesUpdatedNodes() {
        cluster.failDeployOn(EnvironmentType.QA, "qa-node-2");
        PipelineSettings settings = TestDataFactory.fastSettings()
                .rollingPartialFailurePolicy(RollingPartialFailurePolicy.AUTO_ROLLBACK)
                .build();

        StageResult stage = run("orders", "1.0.0", EnvironmentType.QA, settings);

        assertThat(stage.getStatus()).isEqualTo(StageStatus.ROLLED_BACK);
        assertThat(cluster.versionOn(EnvironmentType.QA, "qa-node-1", "orders")).isEmpty();
        assertThat(locked("orders", EnvironmentType.QA)).isFalse();
    }

    @Test
    @DisplayName("场景: 关闭自动回滚时，失败阶段保留现场")
    void autoRollbackDisabled_leavesFailedStageInPlace() {
        probe.script(EnvironmentType.PRODUCTION, FakeClusterHealthProbe.NOMINAL, FakeClusterHealthProbe.ERROR_SPIKE);
        PipelineSettings settings = TestDataFactory.fastSettings().autoRollbackOnFailure(false).build();

        StageResult stage = run("orders", "1.0.0", EnvironmentType.PRODUCTION, settings);

        assertThat(stage.getStatus()).isEqualTo(StageStatus.FAILED);
        assertThat(stage.getFailureInfo().getErrorType()).isEqualTo(ErrorType.HEALTH_BREACH);
        assertThat(stage.getShiftSteps()).containsExactly(10);
        assertThat(cluster.countNodesRunning(EnvironmentType.PRODUCTION, "orders", "1.0.0")).isEqualTo(1);
        assertThat(audit.contains(AuditEventType.ROLLBACK_STARTED)).isFalse();
        assertThat(locked("orders", EnvironmentType.PRODUCTION)).isFalse();
    }

    @Test
    @DisplayName("场景: 回滚重试耗尽，阶段标记为回滚失败并告警")
    void rollbackExhausted_marksDegradedAndAlerts() {
        PipelineSettings settings = TestDataFactory.fastSettings()
                .rollingPartialFailurePolicy(RollingPartialFailurePolicy.AUTO_ROLLBACK)
                .build();
        assertThat(run("orders", "1.0.0", EnvironmentType.QA, settings).getStatus()).isEqualTo(StageStatus.SUCCEEDED);

        // 新版本第一批即不健康；回滚时第二个节点无法部署
        cluster.markVersionUnhealthy("2.0.0");
        cluster.failDeployOn(EnvironmentType.QA, "qa-node-2");
        StageResult stage = run("orders", "2.0.0", EnvironmentType.QA, settings);

        assertThat(stage.getStatus()).isEqualTo(StageStatus.ROLLBACK_FAILED);
        assertThat(stage.getFailureInfo().getErrorType()).isEqualTo(ErrorType.ROLLBACK_FAILURE);
        assertThat(versionRegistry.isDegraded("orders", EnvironmentType.QA)).isTrue();
        assertThat(versionRegistry.hasDegradedEnvironment()).isTrue();
        verify(alertNotifier, times(1)).alert(any(RollbackFailureException.class));
        assertThat(audit.ofType(AuditEventType.ROLLBACK_FAILED)).hasSize(1);
        assertThat(locked("orders", EnvironmentType.QA)).isFalse();
    }

    @Test
    @DisplayName("场景: 蓝绿切流前失败不触发回滚")
    void blueGreenFailureBeforeSwitch_needsNoRollback() {
        cluster.failDeployOn(EnvironmentType.STAGING, "stg-node-3");

        StageResult stage = run("orders", "1.0.0", EnvironmentType.STAGING, TestDataFactory.fastSettings().build());

        assertThat(stage.getStatus()).isEqualTo(StageStatus.FAILED);
        assertThat(stage.getNodesDeployed()).isZero();
        assertThat(cluster.countNodesRunning(EnvironmentType.STAGING, "orders", "1.0.0")).isZero();
        verify(alertNotifier, never()).alert(any());
        assertThat(audit.contains(AuditEventType.ROLLBACK_STARTED)).isFalse();
    }

    @Test
    @DisplayName("场景: 锁后端异常时阶段定型为 FAILED，不停留在 PENDING")
    void lockBackendError_failsStageWithSystemError() {
        // Given: 锁后端不可用
        DistributedLock brokenLock = mock(DistributedLock.class);
        when(brokenLock.acquire(anyString(), any(Duration.class), any()))
                .thenThrow(new IllegalStateException("redis down"));
        NoopMetricsRegistry metrics = new NoopMetricsRegistry();
        executor = new StageExecutor(brokenLock, renewalScheduler,
                new ApprovalGate(new InMemoryApprovalRequestRepository(), audit, metrics),
                strategyFactory, rollbackCoordinator, versionRegistry, audit, metrics);

        // When
        StageResult stage = run("orders", "1.0.0", EnvironmentType.QA, TestDataFactory.fastSettings().build());

        // Then
        assertThat(stage.getStatus()).isEqualTo(StageStatus.FAILED);
        assertThat(stage.getFailureInfo().getErrorType()).isEqualTo(ErrorType.SYSTEM_ERROR);
        assertThat(stage.getMessage()).contains("redis down");
        assertThat(stage.getEndTime()).isNotNull();
        assertThat(audit.contains(AuditEventType.STAGE_FAILED)).isTrue();
        assertThat(audit.contains(AuditEventType.LOCK_ACQUIRED)).isFalse();
        assertThat(cluster.countNodesRunning(EnvironmentType.QA, "orders", "1.0.0")).isZero();
    }
}
