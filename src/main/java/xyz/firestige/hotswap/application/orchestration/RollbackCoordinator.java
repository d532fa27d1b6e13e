package xyz.firestige.hotswap.application.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.hotswap.domain.audit.AuditEvent;
import xyz.firestige.hotswap.domain.audit.AuditEventType;
import xyz.firestige.hotswap.domain.audit.AuditRecorder;
import xyz.firestige.hotswap.domain.cluster.ModuleDeployer;
import xyz.firestige.hotswap.domain.cluster.NodeDeploymentResult;
import xyz.firestige.hotswap.domain.health.ClusterHealthProbe;
import xyz.firestige.hotswap.domain.health.ClusterHealthSnapshot;
import xyz.firestige.hotswap.domain.health.NodeHealth;
import xyz.firestige.hotswap.domain.shared.CancellationToken;
import xyz.firestige.hotswap.domain.shared.exception.ErrorType;
import xyz.firestige.hotswap.domain.shared.exception.FailureInfo;
import xyz.firestige.hotswap.domain.version.EnvironmentVersionRegistry;
import xyz.firestige.hotswap.infrastructure.execution.rollout.RolloutContext;
import xyz.firestige.hotswap.infrastructure.execution.rollout.RolloutStrategyFactory;
import xyz.firestige.hotswap.infrastructure.execution.rollout.StageOutcome;
import xyz.firestige.hotswap.infrastructure.metrics.MetricsRegistry;

/**
 * 回滚协调器
 * <p>
 * 以上一个已知良好版本重新执行同一发布策略（restore 模式：不等待、不做步骤间健康门禁），
 * 完成后确认环境健康并把登记簿恢复为该版本。
 * <p>
 * 回滚运行在已经降级的窗口里，瞬时失败会以递增退避重试，次数有上限；
 * 重试耗尽后升级为致命告警并把环境标记为降级，绝不无限重试，也不静默吞掉。
 * <p>
 * 调用方必须已经持有该 (模块, 环境) 的部署锁。
 */
public class RollbackCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RollbackCoordinator.class);

    private final RolloutStrategyFactory strategyFactory;
    private final ModuleDeployer deployer;
    private final ClusterHealthProbe probe;
    private final EnvironmentVersionRegistry versionRegistry;
    private final AuditRecorder auditRecorder;
    private final MetricsRegistry metrics;
    private final RollbackAlertNotifier alertNotifier;

    public RollbackCoordinator(RolloutStrategyFactory strategyFactory,
                               ModuleDeployer deployer,
                               ClusterHealthProbe probe,
                               EnvironmentVersionRegistry versionRegistry,
                               AuditRecorder auditRecorder,
                               MetricsRegistry metrics,
                               RollbackAlertNotifier alertNotifier) {
        this.strategyFactory = strategyFactory;
        this.deployer = deployer;
        this.probe = probe;
        this.versionRegistry = versionRegistry;
        this.auditRecorder = auditRecorder;
        this.metrics = metrics;
        this.alertNotifier = alertNotifier;
    }

    public RollbackReport rollback(RollbackTarget target, PipelineSettings settings) {
        String moduleName = target.failedModule().getName();
        String restoreDesc = target.restoreVersion() != null ? target.restoreVersion() : "（移除模块）";
        log.warn("[RollbackCoordinator] 开始回滚: {} {} {} -> {}",
                moduleName, target.environment(), target.failedModule().getVersion(), restoreDesc);
        audit(AuditEventType.ROLLBACK_STARTED, target, String.format("回滚 %s@%s 到 %s",
                moduleName, target.failedModule().getVersion(), restoreDesc));

        int maxAttempts = settings.getRollbackMaxAttempts();
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                restore(target, settings);
                versionRegistry.recordRestored(moduleName, target.environment(), target.restoreVersion());
                metrics.incrementCounter(MetricsRegistry.ROLLBACK_SUCCEEDED,
                        MetricsRegistry.TAG_ENVIRONMENT, target.environment().name());
                String message = target.restoreVersion() != null
                        ? String.format("已回滚到版本 %s（第 %d 次尝试）", target.restoreVersion(), attempt)
                        : String.format("已移除模块 %s（第 %d 次尝试）", moduleName, attempt);
                audit(AuditEventType.ROLLBACK_SUCCEEDED, target, message);
                log.info("[RollbackCoordinator] 回滚成功: {} {}, {}", moduleName, target.environment(), message);
                return RollbackReport.succeeded(attempt, message);
            } catch (RuntimeException e) {
                lastError = e;
                log.warn("[RollbackCoordinator] 第 {}/{} 次回滚失败: {} {}, 原因: {}",
                        attempt, maxAttempts, moduleName, target.environment(), e.getMessage());
                if (attempt < maxAttempts) {
                    // 回滚必须跑完，不观察流水线取消
                    CancellationToken.none().await(settings.getRollbackRetryBackoff().multipliedBy(attempt));
                }
            }
        }
        return escalate(target, maxAttempts, lastError);
    }

    private void restore(RollbackTarget target, PipelineSettings settings) {
        if (target.restoreVersion() == null) {
            removeModule(target);
            return;
        }
        RolloutContext ctx = RolloutContext.builder()
                .executionId(target.executionId())
                .module(target.failedModule().withVersion(target.restoreVersion()))
                .environment(target.environment())
                .stage(target.record())
                .token(CancellationToken.none())
                .thresholds(settings.getThresholds())
                .smokeTestTimeout(settings.smokeTestTimeoutFor(target.environment()))
                .rollingBatchSize(settings.getRollingBatchSize())
                .restore(true)
                .build();
        StageOutcome outcome = strategyFactory.create(target.strategy()).execute(ctx);
        if (!outcome.isSuccess()) {
            throw new IllegalStateException("回滚发布失败: " + outcome.getMessage());
        }
        ClusterHealthSnapshot snapshot = probe.getHealth(target.environment());
        if (snapshot.healthyRatio() < settings.getThresholds().minHealthyRatio()) {
            throw new IllegalStateException(String.format("回滚后环境仍不健康: 健康节点 %d/%d",
                    snapshot.getHealthyNodes(), snapshot.getTotalNodes()));
        }
    }

    private void removeModule(RollbackTarget target) {
        for (NodeHealth node : probe.getNodes(target.environment())) {
            NodeDeploymentResult result = deployer.undeploy(target.environment(), node.nodeId(),
                    target.failedModule().getName());
            if (!result.success()) {
                throw new IllegalStateException("节点 " + node.nodeId() + " 移除模块失败: " + result.message());
            }
        }
        target.record().recordShift(100);
    }

    private RollbackReport escalate(RollbackTarget target, int attempts, RuntimeException cause) {
        String moduleName = target.failedModule().getName();
        String reason = String.format("回滚 %d 次后仍失败, 环境 %s 处于降级状态: %s",
                attempts, target.environment(), cause != null ? cause.getMessage() : "未知原因");
        RollbackFailureException failure = new RollbackFailureException(
                target.executionId().getValue(), target.environment(), attempts, reason, cause);
        log.error("[RollbackCoordinator] {}", reason, failure);

        versionRegistry.markDegraded(moduleName, target.environment(), true);
        metrics.incrementCounter(MetricsRegistry.ROLLBACK_ESCALATED,
                MetricsRegistry.TAG_ENVIRONMENT, target.environment().name());
        audit(AuditEventType.ROLLBACK_FAILED, target, reason);
        try {
            alertNotifier.alert(failure);
        } catch (RuntimeException e) {
            log.error("[RollbackCoordinator] 告警发送失败: {}", target.executionId(), e);
        }
        return RollbackReport.failed(attempts,
                FailureInfo.of(ErrorType.ROLLBACK_FAILURE, reason, target.environment().name()));
    }

    private void audit(AuditEventType type, RollbackTarget target, String message) {
        try {
            auditRecorder.record(AuditEvent.builder(type)
                    .executionId(target.executionId())
                    .moduleName(target.failedModule().getName())
                    .environment(target.environment())
                    .actor(target.actor())
                    .message(message)
                    .build());
        } catch (RuntimeException e) {
            log.warn("[RollbackCoordinator] 审计写入失败: {}", type, e);
        }
    }
}
