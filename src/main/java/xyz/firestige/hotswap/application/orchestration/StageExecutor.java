package xyz.firestige.hotswap.application.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.hotswap.application.approval.ApprovalGate;
import xyz.firestige.hotswap.domain.approval.ApprovalRequest;
import xyz.firestige.hotswap.domain.audit.AuditEvent;
import xyz.firestige.hotswap.domain.audit.AuditEventType;
import xyz.firestige.hotswap.domain.audit.AuditRecorder;
import xyz.firestige.hotswap.domain.pipeline.PipelineExecutionResult;
import xyz.firestige.hotswap.domain.pipeline.RollingPartialFailurePolicy;
import xyz.firestige.hotswap.domain.pipeline.StageResult;
import xyz.firestige.hotswap.domain.pipeline.StageStatus;
import xyz.firestige.hotswap.domain.shared.exception.ErrorType;
import xyz.firestige.hotswap.domain.shared.exception.FailureInfo;
import xyz.firestige.hotswap.domain.shared.exception.PipelineCancelledException;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.shared.vo.ModuleDescriptor;
import xyz.firestige.hotswap.domain.version.EnvironmentVersionRegistry;
import xyz.firestige.hotswap.infrastructure.execution.rollout.RolloutContext;
import xyz.firestige.hotswap.infrastructure.execution.rollout.RolloutStrategy;
import xyz.firestige.hotswap.infrastructure.execution.rollout.RolloutStrategyFactory;
import xyz.firestige.hotswap.infrastructure.execution.rollout.StageOutcome;
import xyz.firestige.hotswap.infrastructure.lock.DistributedLock;
import xyz.firestige.hotswap.infrastructure.lock.LockHandle;
import xyz.firestige.hotswap.infrastructure.lock.LockRenewalScheduler;
import xyz.firestige.hotswap.infrastructure.metrics.MetricsRegistry;

/**
 * 阶段执行器：端到端执行一个环境阶段
 * <pre>
 * 获取部署锁 deploy:{module}:{env}
 *     ↓ 超时 → FAILED（锁竞争），流水线停止
 * （可选）审批闸门
 *     ↓ 拒绝/过期/取消 → FAILED，不做任何发布
 * 执行发布策略
 *     ↓ 成功 → SUCCEEDED
 *     ↓ 滚动部分成功且策略为 HALT → PARTIALLY_SUCCEEDED
 *     ↓ 失败且影响了线上流量 → 回滚 → ROLLED_BACK / ROLLBACK_FAILED
 * 释放部署锁（所有退出路径）
 * </pre>
 */
public class StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    private final DistributedLock distributedLock;
    private final LockRenewalScheduler renewalScheduler;
    private final ApprovalGate approvalGate;
    private final RolloutStrategyFactory strategyFactory;
    private final RollbackCoordinator rollbackCoordinator;
    private final EnvironmentVersionRegistry versionRegistry;
    private final AuditRecorder auditRecorder;
    private final MetricsRegistry metrics;

    public StageExecutor(DistributedLock distributedLock,
                         LockRenewalScheduler renewalScheduler,
                         ApprovalGate approvalGate,
                         RolloutStrategyFactory strategyFactory,
                         RollbackCoordinator rollbackCoordinator,
                         EnvironmentVersionRegistry versionRegistry,
                         AuditRecorder auditRecorder,
                         MetricsRegistry metrics) {
        this.distributedLock = distributedLock;
        this.renewalScheduler = renewalScheduler;
        this.approvalGate = approvalGate;
        this.strategyFactory = strategyFactory;
        this.rollbackCoordinator = rollbackCoordinator;
        this.versionRegistry = versionRegistry;
        this.auditRecorder = auditRecorder;
        this.metrics = metrics;
    }

    public static String lockResource(String moduleName, EnvironmentType environment) {
        return "deploy:" + moduleName + ":" + environment.name();
    }

    /**
     * 执行一个阶段
     *
     * @param runtime     流水线运行时上下文
     * @param environment 阶段环境
     * @param approvalFor 需要在本阶段审批时为审批针对的环境，否则为 null
     * @return 已定型的阶段结果（终态）
     */
    public StageResult execute(PipelineRuntimeContext runtime, EnvironmentType environment, EnvironmentType approvalFor) {
        PipelineExecutionResult result = runtime.getResult();
        PipelineSettings settings = runtime.getSettings();
        ModuleDescriptor module = result.getModule();
        EnvironmentPolicy policy = settings.policyFor(environment);

        StageResult stage = StageResult.pending(environment, policy.strategy(), module.getVersion());
        result.appendStage(stage);
        runtime.injectMdc(stage.getStageName());
        runtime.persist();
        audit(AuditEventType.STAGE_STARTED, runtime, environment, null, StageStatus.PENDING,
                String.format("阶段开始: %s, 策略: %s", environment, policy.strategy()));

        String resource = lockResource(module.getName(), environment);
        LockHandle handle;
        try {
            handle = distributedLock.acquire(resource, settings.getLockTimeout(), runtime.getToken());
        } catch (PipelineCancelledException e) {
            stage.start(null);
            stage.fail(FailureInfo.of(ErrorType.CANCELLED, "等待部署锁时被取消: " + e.getMessage(), stage.getStageName()), 0, 0);
            finishStage(runtime, stage);
            return stage;
        } catch (RuntimeException e) {
            log.error("[StageExecutor] 获取部署锁异常: {}", resource, e);
            stage.start(null);
            stage.fail(FailureInfo.fromException(e, ErrorType.SYSTEM_ERROR, stage.getStageName()), 0, 0);
            finishStage(runtime, stage);
            return stage;
        }
        if (handle == null) {
            metrics.incrementCounter(MetricsRegistry.LOCK_CONTENTION, MetricsRegistry.TAG_ENVIRONMENT, environment.name());
            String message = String.format("部署锁被占用: %s, 等待 %s 后超时, 同一模块正在部署到该环境, 请稍后重试",
                    resource, settings.getLockTimeout());
            log.warn("[StageExecutor] {}", message);
            audit(AuditEventType.LOCK_CONTENDED, runtime, environment, null, null, message);
            stage.start(null);
            stage.fail(FailureInfo.of(ErrorType.LOCK_CONTENTION, message, stage.getStageName()), 0, 0);
            finishStage(runtime, stage);
            return stage;
        }

        log.info("[StageExecutor] 获取部署锁成功: {}", resource);
        audit(AuditEventType.LOCK_ACQUIRED, runtime, environment, null, null, resource);
        LockRenewalScheduler.Renewal renewal = renewalScheduler.start(handle, settings.getLockTtl());
        try {
            stage.start(versionRegistry.currentVersion(module.getName(), environment).orElse(null));
            runtime.persist();
            if (approvalFor != null && !passApproval(runtime, stage, approvalFor)) {
                return stage;
            }
            runRollout(runtime, stage, policy);
            return stage;
        } catch (PipelineCancelledException e) {
            log.warn("[StageExecutor] 阶段被取消: {}, {}", environment, e.getMessage());
            if (stage.getStatus() == StageStatus.RUNNING) {
                stage.fail(FailureInfo.of(ErrorType.CANCELLED, e.getMessage(), stage.getStageName()), 0, 0);
            }
            return stage;
        } catch (RuntimeException e) {
            log.error("[StageExecutor] 阶段执行异常: {}", environment, e);
            if (stage.getStatus() == StageStatus.RUNNING) {
                stage.fail(FailureInfo.fromException(e, ErrorType.SYSTEM_ERROR, stage.getStageName()),
                        stage.getNodesDeployed(), stage.getNodesFailed());
            }
            return stage;
        } finally {
            renewal.stop();
            release(handle);
            audit(AuditEventType.LOCK_RELEASED, runtime, environment, null, null, resource);
            finishStage(runtime, stage);
        }
    }

    /**
     * @return 是否获批
     */
    private boolean passApproval(PipelineRuntimeContext runtime, StageResult stage, EnvironmentType approvalFor) {
        PipelineExecutionResult result = runtime.getResult();
        PipelineSettings settings = runtime.getSettings();
        ApprovalRequest request = approvalGate.requestApproval(result.getExecutionId(), result.getModule(),
                approvalFor, result.getRequest().getRequesterEmail(),
                settings.getApprovers(), settings.getApprovalTimeout());
        stage.updateProgress(String.format("等待审批: %s, 截止 %s", approvalFor, request.getTimeoutAt()));
        runtime.persist();
        log.info("[StageExecutor] 等待审批: {}, 截止 {}", result.getExecutionId(), request.getTimeoutAt());

        ApprovalRequest resolved = approvalGate.pollUntilResolved(result.getExecutionId(), runtime.getToken());
        String decision = resolved.describeDecision();
        switch (resolved.getStatus()) {
            case APPROVED:
                stage.updateProgress(decision);
                runtime.persist();
                return true;
            case REJECTED:
                stage.fail(FailureInfo.of(ErrorType.APPROVAL_REJECTED, decision, stage.getStageName()), 0, 0);
                return false;
            case EXPIRED:
                stage.fail(FailureInfo.of(ErrorType.APPROVAL_EXPIRED, decision, stage.getStageName()), 0, 0);
                return false;
            default:
                throw new IllegalStateException("审批未决却结束等待: " + resolved);
        }
    }

    private void runRollout(PipelineRuntimeContext runtime, StageResult stage, EnvironmentPolicy policy) {
        PipelineExecutionResult result = runtime.getResult();
        PipelineSettings settings = runtime.getSettings();
        EnvironmentType environment = stage.getEnvironment();
        ModuleDescriptor module = result.getModule();

        RolloutStrategy strategy = strategyFactory.create(policy.strategy());
        RolloutContext ctx = RolloutContext.builder()
                .executionId(result.getExecutionId())
                .module(module)
                .environment(environment)
                .stage(stage)
                .token(runtime.getToken())
                .thresholds(settings.getThresholds())
                .canaryInitialPercentage(settings.getCanaryInitialPercentage())
                .canaryIncrementPercentage(settings.getCanaryIncrementPercentage())
                .batches(policy.batches())
                .waitDuration(settings.waitDurationFor(environment))
                .smokeTestTimeout(settings.smokeTestTimeoutFor(environment))
                .rollingBatchSize(settings.getRollingBatchSize())
                .progressListener(runtime::persist)
                .build();

        StageOutcome outcome = strategy.execute(ctx);
        log.info("[StageExecutor] 发布策略结束: {} {}", environment, outcome);

        if (outcome.isSuccess()) {
            stage.succeed(outcome.getNodesDeployed(), outcome.getNodesFailed(), outcome.getMessage());
            versionRegistry.recordDeployed(module.getName(), environment, module.getVersion());
            return;
        }
        if (outcome.isPartial() && settings.getRollingPartialFailurePolicy() == RollingPartialFailurePolicy.HALT) {
            stage.partiallySucceed(outcome.getNodesDeployed(), outcome.getNodesFailed(), outcome.getMessage());
            log.warn("[StageExecutor] 滚动发布部分成功, 已更新节点保留在线, 等待人工决定: {}", outcome.getMessage());
            return;
        }

        stage.fail(outcome.getFailureInfo(), outcome.getNodesDeployed(), outcome.getNodesFailed());
        if (!outcome.isLiveTrafficAffected()) {
            log.info("[StageExecutor] 失败前未影响线上流量, 无需回滚: {}", environment);
            return;
        }
        if (!settings.isAutoRollbackOnFailure()) {
            log.warn("[StageExecutor] 自动回滚已关闭, 环境保持失败现场: {}", environment);
            return;
        }

        StageResult scratch = StageResult.rollback(environment, stage.getStrategy(), stage.getPreviousVersion());
        scratch.start(module.getVersion());
        RollbackReport report = rollbackCoordinator.rollback(new RollbackTarget(result.getExecutionId(), module,
                environment, stage.getStrategy(), stage.getPreviousVersion(), scratch, "system"), settings);
        if (report.isSucceeded()) {
            stage.markRolledBack(report.getMessage());
        } else {
            stage.markRollbackFailed(report.getFailureInfo());
        }
    }

    private void release(LockHandle handle) {
        try {
            handle.release();
            log.info("[StageExecutor] 释放部署锁: {}", handle.getResource());
        } catch (RuntimeException e) {
            // TTL 兜底过期，不阻断阶段收尾
            log.error("[StageExecutor] 释放部署锁失败: {}", handle.getResource(), e);
        }
    }

    private void finishStage(PipelineRuntimeContext runtime, StageResult stage) {
        runtime.persist();
        AuditEventType type = stage.getStatus().isSuccess() ? AuditEventType.STAGE_COMPLETED : AuditEventType.STAGE_FAILED;
        audit(type, runtime, stage.getEnvironment(), StageStatus.RUNNING, stage.getStatus(), stage.getMessage());
    }

    private void audit(AuditEventType type, PipelineRuntimeContext runtime, EnvironmentType environment,
                       Object from, Object to, String message) {
        try {
            auditRecorder.record(AuditEvent.builder(type)
                    .executionId(runtime.getExecutionId())
                    .moduleName(runtime.getResult().getModule().getName())
                    .environment(environment)
                    .transition(from, to)
                    .message(message)
                    .build());
        } catch (RuntimeException e) {
            log.warn("[StageExecutor] 审计写入失败: {}", type, e);
        }
    }
}
