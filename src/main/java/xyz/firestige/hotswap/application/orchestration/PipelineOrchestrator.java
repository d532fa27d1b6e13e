package xyz.firestige.hotswap.application.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.hotswap.domain.audit.AuditEvent;
import xyz.firestige.hotswap.domain.audit.AuditEventType;
import xyz.firestige.hotswap.domain.audit.AuditRecorder;
import xyz.firestige.hotswap.domain.pipeline.ApprovalMode;
import xyz.firestige.hotswap.domain.pipeline.DeploymentRequest;
import xyz.firestige.hotswap.domain.pipeline.PipelineExecutionResult;
import xyz.firestige.hotswap.domain.pipeline.PipelineStatus;
import xyz.firestige.hotswap.domain.pipeline.StageResult;
import xyz.firestige.hotswap.domain.shared.CancellationToken;
import xyz.firestige.hotswap.domain.shared.exception.ErrorType;
import xyz.firestige.hotswap.domain.shared.exception.FailureInfo;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.shared.vo.ExecutionId;
import xyz.firestige.hotswap.domain.version.EnvironmentVersionRegistry;
import xyz.firestige.hotswap.infrastructure.lock.DistributedLock;
import xyz.firestige.hotswap.infrastructure.lock.LockHandle;
import xyz.firestige.hotswap.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.hotswap.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.hotswap.infrastructure.persistence.PipelineResultStore;
import xyz.firestige.hotswap.infrastructure.persistence.projection.PipelineExecutionView;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 流水线编排器
 * <p>
 * 职责：
 * - 把部署请求提交到有界工作池，立即返回 executionId（句柄），流水线在后台跑完
 * - 按环境链顺序逐个委托 {@link StageExecutor}，遇到第一个非成功阶段即停止
 * - 聚合阶段结果为 {@link PipelineExecutionResult}，每次变更后保存投影供状态轮询
 * - 通过与 executionId 关联的协作式取消令牌传递取消，不杀线程
 * - 对外提供整条流水线的回滚（手动或部署后监控触发）
 * <p>
 * 状态机：CREATED → RUNNING → {SUCCEEDED, PARTIALLY_SUCCEEDED, FAILED, ROLLED_BACK, ROLLBACK_FAILED}；
 * 重新部署同一模块/环境永远是新的 executionId。
 * <p>
 * 终态流水线的句柄在保留期（{@link PipelineSettings#getLiveRetention()}）后从内存回收，
 * 之后的查询、取消和回滚都经由结果存储完成。
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final StageExecutor stageExecutor;
    private final RollbackCoordinator rollbackCoordinator;
    private final DistributedLock distributedLock;
    private final EnvironmentVersionRegistry versionRegistry;
    private final PipelineResultStore resultStore;
    private final AuditRecorder auditRecorder;
    private final MetricsRegistry metrics;
    private final Supplier<PipelineSettings> settingsSupplier;
    private final PostDeploymentHealthMonitor healthMonitor;

    private final int capacity;
    private final ExecutorService pipelinePool;
    private final ExecutorService rollbackPool;
    private final ScheduledExecutorService housekeeping;
    private final Map<ExecutionId, PipelineHandle> handles = new ConcurrentHashMap<>();
    private final AtomicInteger running = new AtomicInteger();

    public PipelineOrchestrator(StageExecutor stageExecutor,
                                RollbackCoordinator rollbackCoordinator,
                                DistributedLock distributedLock,
                                EnvironmentVersionRegistry versionRegistry,
                                PipelineResultStore resultStore,
                                AuditRecorder auditRecorder,
                                MetricsRegistry metrics,
                                Supplier<PipelineSettings> settingsSupplier,
                                PostDeploymentHealthMonitor healthMonitor) {
        this.stageExecutor = stageExecutor;
        this.rollbackCoordinator = rollbackCoordinator;
        this.distributedLock = distributedLock;
        this.versionRegistry = versionRegistry;
        this.resultStore = resultStore;
        this.auditRecorder = auditRecorder;
        this.metrics = metrics != null ? metrics : new NoopMetricsRegistry();
        this.settingsSupplier = settingsSupplier;
        this.healthMonitor = healthMonitor;
        this.capacity = settingsSupplier.get().getMaxConcurrentPipelines();
        this.pipelinePool = Executors.newFixedThreadPool(capacity, namedFactory("hotswap-pipeline-"));
        this.rollbackPool = Executors.newCachedThreadPool(namedFactory("hotswap-rollback-"));
        this.housekeeping = Executors.newSingleThreadScheduledExecutor(namedFactory("hotswap-housekeeping-"));
        log.info("[PipelineOrchestrator] 初始化完成, 最大并发流水线: {}", capacity);
    }

    // ========== 提交与执行 ==========

    /**
     * 提交到工作池，立即返回 executionId；池满时排队，状态保持 CREATED
     */
    public ExecutionId submit(DeploymentRequest request) {
        PipelineHandle handle = register(request);
        handle.future = pipelinePool.submit(() -> run(handle));
        log.info("[PipelineOrchestrator] 流水线已提交: {}, 模块: {}, 环境链: {}",
                request.getExecutionId(), request.getModule(), request.getEnvironmentChain());
        return request.getExecutionId();
    }

    /**
     * 在调用线程上同步执行整条流水线
     */
    public PipelineExecutionResult executePipeline(DeploymentRequest request) {
        PipelineHandle handle = register(request);
        run(handle);
        return handle.result;
    }

    private PipelineHandle register(DeploymentRequest request) {
        PipelineExecutionResult result = new PipelineExecutionResult(request);
        PipelineHandle handle = new PipelineHandle(result, new CancellationToken(request.getExecutionId().getValue()));
        if (handles.putIfAbsent(request.getExecutionId(), handle) != null) {
            throw new DeploymentOperationException("executionId 已存在: " + request.getExecutionId(),
                    FailureInfo.of(ErrorType.VALIDATION_ERROR, "重复的 executionId"));
        }
        resultStore.save(result);
        return handle;
    }

    private void run(PipelineHandle handle) {
        PipelineExecutionResult result = handle.result;
        PipelineSettings settings = settingsSupplier.get();
        handle.settings = settings;
        PipelineRuntimeContext runtime = new PipelineRuntimeContext(result, settings, handle.token,
                () -> resultStore.save(result));
        runtime.injectMdc(null);
        metrics.setGauge(MetricsRegistry.PIPELINE_ACTIVE, running.incrementAndGet());
        try {
            if (handle.token.isCancelled()) {
                result.start();
                result.fail("流水线在启动前已取消: " + handle.token.getReason());
                return;
            }
            result.start();
            metrics.incrementCounter(MetricsRegistry.PIPELINE_STARTED);
            audit(AuditEventType.PIPELINE_STARTED, result, "system", PipelineStatus.CREATED, "流水线开始执行");
            runtime.persist();

            Map<EnvironmentType, EnvironmentType> approvals = planApprovals(result.getRequest(), settings);
            for (EnvironmentType environment : result.getRequest().getEnvironmentChain()) {
                if (handle.token.isCancelled()) {
                    result.fail("流水线已取消: " + handle.token.getReason());
                    break;
                }
                StageResult stage = stageExecutor.execute(runtime, environment, approvals.get(environment));
                runtime.injectMdc(null);
                if (!applyStageOutcome(result, stage)) {
                    break;
                }
            }
            if (result.getStatus() == PipelineStatus.RUNNING) {
                result.complete();
            }
        } catch (RuntimeException e) {
            log.error("[PipelineOrchestrator] 流水线执行异常: {}", result.getExecutionId(), e);
            if (result.getStatus() == PipelineStatus.RUNNING) {
                result.fail("流水线执行异常: " + e.getMessage());
            }
        } finally {
            metrics.setGauge(MetricsRegistry.PIPELINE_ACTIVE, running.decrementAndGet());
            finish(handle, settings);
            runtime.clearMdc();
        }
    }

    /**
     * @return 是否继续下一个阶段
     */
    private boolean applyStageOutcome(PipelineExecutionResult result, StageResult stage) {
        String reason = String.format("阶段 %s %s: %s", stage.getStageName(), stage.getStatus(), stage.getMessage());
        switch (stage.getStatus()) {
            case SUCCEEDED:
                return true;
            case PARTIALLY_SUCCEEDED:
                result.partiallySucceed(reason);
                return false;
            case ROLLED_BACK:
                result.markRolledBack(reason);
                return false;
            case ROLLBACK_FAILED:
                result.markRollbackFailed(reason);
                return false;
            default:
                result.fail(reason);
                return false;
        }
    }

    private void finish(PipelineHandle handle, PipelineSettings settings) {
        PipelineExecutionResult result = handle.result;
        try {
            resultStore.save(result);
        } catch (RuntimeException e) {
            log.error("[PipelineOrchestrator] 保存最终结果失败: {}", result.getExecutionId(), e);
        }
        if (result.getStatus() == PipelineStatus.SUCCEEDED) {
            metrics.incrementCounter(MetricsRegistry.PIPELINE_SUCCEEDED);
            audit(AuditEventType.PIPELINE_COMPLETED, result, "system", PipelineStatus.RUNNING, result.getMessage());
            log.info("[PipelineOrchestrator] 流水线成功: {}, 耗时 {}", result.getExecutionId(), result.getDuration());
            if (settings.isMonitorEnabled() && healthMonitor != null) {
                healthMonitor.watch(result, settings,
                        (id, reason) -> rollbackDeployment(id, "health-monitor", reason));
            }
        } else {
            metrics.incrementCounter(MetricsRegistry.PIPELINE_FAILED);
            audit(AuditEventType.PIPELINE_FAILED, result, "system", PipelineStatus.RUNNING, result.getMessage());
            log.warn("[PipelineOrchestrator] 流水线结束: {}, 状态: {}, 原因: {}",
                    result.getExecutionId(), result.getStatus(), result.getMessage());
        }
        scheduleEviction(handle, settings);
    }

    // ========== 句柄回收 ==========

    private void scheduleEviction(PipelineHandle handle, PipelineSettings settings) {
        Duration retention = settings.getLiveRetention();
        try {
            housekeeping.schedule(() -> evict(handle), retention.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[PipelineOrchestrator] 编排器已关闭, 不再安排回收: {}", handle.result.getExecutionId());
        }
    }

    private void evict(PipelineHandle handle) {
        ExecutionId id = handle.result.getExecutionId();
        if (!handle.result.getStatus().isTerminal()) {
            return;
        }
        if (handles.remove(id, handle)) {
            log.debug("[PipelineOrchestrator] 回收终态流水线句柄: {}, 状态: {}", id, handle.result.getStatus());
        }
    }

    /**
     * 内存中的句柄；已回收时从结果存储恢复终态记录
     */
    private Optional<PipelineHandle> lookup(ExecutionId executionId) {
        PipelineHandle handle = handles.get(executionId);
        if (handle != null) {
            return Optional.of(handle);
        }
        return resultStore.find(executionId.getValue())
                .filter(view -> view.getStatus() != null && view.getStatus().isTerminal())
                .map(view -> {
                    PipelineExecutionResult restored = PipelineResultRestorer.restore(view);
                    PipelineHandle fresh = new PipelineHandle(restored, new CancellationToken(executionId.getValue()));
                    PipelineHandle existing = handles.putIfAbsent(executionId, fresh);
                    if (existing != null) {
                        return existing;
                    }
                    log.info("[PipelineOrchestrator] 从结果存储恢复流水线: {}, 状态: {}", executionId, view.getStatus());
                    scheduleEviction(fresh, settingsSupplier.get());
                    return fresh;
                });
    }

    /**
     * 计算每个阶段的审批闸门：key 为在哪个阶段审批，value 为审批针对的环境
     * <p>
     * 只有请求要求审批时才设闸门；环境策略的 requireApproval 只决定哪些环境纳入审批
     * （默认 STAGING、PRODUCTION）。不要求审批的请求、或链路中没有需审批环境的请求，直接放行。
     */
    Map<EnvironmentType, EnvironmentType> planApprovals(DeploymentRequest request, PipelineSettings settings) {
        Map<EnvironmentType, EnvironmentType> plan = new EnumMap<>(EnvironmentType.class);
        if (!request.isRequireApproval()) {
            return plan;
        }
        List<EnvironmentType> chain = request.getEnvironmentChain();
        List<EnvironmentType> gated = chain.stream()
                .filter(env -> settings.policyFor(env).requireApproval())
                .collect(Collectors.toList());
        if (gated.isEmpty()) {
            return plan;
        }
        if (settings.getApprovalMode() == ApprovalMode.UPFRONT) {
            plan.put(chain.get(0), gated.get(gated.size() - 1));
        } else {
            gated.forEach(env -> plan.put(env, env));
        }
        return plan;
    }

    // ========== 取消 ==========

    /**
     * 发送协作式取消信号；在下一个挂起点（锁等待、审批等待、步骤间等待）生效
     *
     * @return false 表示流水线已结束，无需取消
     */
    public boolean cancel(ExecutionId executionId, String reason) {
        PipelineHandle handle = handles.get(executionId);
        if (handle == null) {
            if (resultStore.find(executionId.getValue()).isPresent()) {
                return false;
            }
            throw new DeploymentNotFoundException(executionId.getValue());
        }
        if (handle.result.getStatus().isTerminal()) {
            return false;
        }
        log.warn("[PipelineOrchestrator] 取消流水线: {}, 原因: {}", executionId, reason);
        handle.token.cancel(reason);
        return true;
    }

    // ========== 回滚 ==========

    /**
     * 异步回滚整条流水线最后一个发生过发布的阶段
     *
     * @throws DeploymentNotFoundException   未知 executionId
     * @throws DeploymentOperationException 流水线状态不允许回滚
     */
    public CompletableFuture<PipelineStatus> rollbackDeployment(ExecutionId executionId, String actor, String reason) {
        PipelineHandle handle = requireRollbackable(executionId);
        return CompletableFuture.supplyAsync(() -> rollbackNow(handle, actor, reason), rollbackPool);
    }

    /**
     * 同步回滚
     */
    public PipelineStatus rollbackDeploymentSync(ExecutionId executionId, String actor, String reason) {
        return rollbackNow(requireRollbackable(executionId), actor, reason);
    }

    private PipelineHandle requireRollbackable(ExecutionId executionId) {
        PipelineHandle handle = lookup(executionId)
                .orElseThrow(() -> new DeploymentNotFoundException(executionId.getValue()));
        PipelineStatus status = handle.result.getStatus();
        if (!status.canRollback()) {
            throw new DeploymentOperationException(
                    String.format("当前状态不允许回滚: %s, executionId: %s", status, executionId),
                    FailureInfo.of(ErrorType.VALIDATION_ERROR, "状态不允许回滚: " + status));
        }
        if (handle.result.findLastDeployedStage().isEmpty()) {
            throw new DeploymentOperationException("没有发生过发布的阶段, 无需回滚: " + executionId,
                    FailureInfo.of(ErrorType.VALIDATION_ERROR, "没有可回滚的阶段"));
        }
        return handle;
    }

    private PipelineStatus rollbackNow(PipelineHandle handle, String actor, String reason) {
        PipelineExecutionResult result = handle.result;
        if (healthMonitor != null) {
            healthMonitor.stop(result.getExecutionId());
        }
        PipelineSettings settings = handle.settings != null ? handle.settings : settingsSupplier.get();
        PipelineRuntimeContext runtime = new PipelineRuntimeContext(result, settings, CancellationToken.none(),
                () -> resultStore.save(result));
        Optional<StageResult> lastDeployed = result.findLastDeployedStage();
        if (lastDeployed.isEmpty()) {
            return result.getStatus();
        }
        StageResult target = lastDeployed.get();
        EnvironmentType environment = target.getEnvironment();
        String moduleName = result.getModule().getName();
        String resource = StageExecutor.lockResource(moduleName, environment);
        runtime.injectMdc(environment.name());

        LockHandle lock = null;
        try {
            lock = distributedLock.acquire(resource, settings.getLockTimeout());
            if (lock == null) {
                metrics.incrementCounter(MetricsRegistry.LOCK_CONTENTION, MetricsRegistry.TAG_ENVIRONMENT, environment.name());
                String message = "回滚跳过: 部署锁被占用, 可能有新的部署正在进行: " + resource;
                log.warn("[PipelineOrchestrator] {}", message);
                audit(AuditEventType.LOCK_CONTENDED, result, actor, null, message);
                // 留下失败的回滚阶段，状态查询可见；流水线状态不变，可稍后重试
                synchronized (handle) {
                    StageResult skipped = StageResult.rollback(environment, target.getStrategy(),
                            target.getPreviousVersion());
                    result.appendStage(skipped);
                    skipped.start(versionRegistry.currentVersion(moduleName, environment).orElse(null));
                    skipped.fail(FailureInfo.of(ErrorType.LOCK_CONTENTION, message, skipped.getStageName()), 0, 0);
                }
                return result.getStatus();
            }
            synchronized (handle) {
                if (!result.getStatus().canRollback()) {
                    log.warn("[PipelineOrchestrator] 回滚跳过, 状态已变为: {}", result.getStatus());
                    return result.getStatus();
                }
                Optional<String> current = versionRegistry.currentVersion(moduleName, environment);
                if (current.isPresent()
                        && !current.get().equals(target.getAttemptedVersion())
                        && !current.get().equals(target.getPreviousVersion())) {
                    String message = String.format("回滚跳过: 环境 %s 已被更新的部署接管, 当前版本 %s",
                            environment, current.get());
                    log.warn("[PipelineOrchestrator] {}", message);
                    audit(AuditEventType.ROLLBACK_FAILED, result, actor, null, message);
                    return result.getStatus();
                }

                StageResult record = StageResult.rollback(environment, target.getStrategy(), target.getPreviousVersion());
                result.appendStage(record);
                record.start(current.orElse(null));
                runtime.persist();
                RollbackReport report = rollbackCoordinator.rollback(new RollbackTarget(result.getExecutionId(),
                        result.getModule(), environment, target.getStrategy(), target.getPreviousVersion(),
                        record, actor), settings);
                PipelineStatus before = result.getStatus();
                if (report.isSucceeded()) {
                    record.markRolledBack(report.getMessage());
                    result.markRolledBack(String.format("%s 发起回滚 (%s): %s", actor, reason, report.getMessage()));
                } else {
                    record.markRollbackFailed(report.getFailureInfo());
                    result.markRollbackFailed(report.getMessage());
                }
                audit(report.isSucceeded() ? AuditEventType.PIPELINE_COMPLETED : AuditEventType.PIPELINE_FAILED,
                        result, actor, before, result.getMessage());
                return result.getStatus();
            }
        } catch (RuntimeException e) {
            log.error("[PipelineOrchestrator] 回滚执行异常: {}", result.getExecutionId(), e);
            throw e;
        } finally {
            if (lock != null) {
                try {
                    lock.release();
                } catch (RuntimeException e) {
                    log.error("[PipelineOrchestrator] 释放部署锁失败: {}", resource, e);
                }
            }
            resultStore.save(result);
            runtime.clearMdc();
        }
    }

    // ========== 查询 ==========

    public Optional<PipelineExecutionView> getResult(ExecutionId executionId) {
        return resultStore.find(executionId.getValue());
    }

    /**
     * 进程内的活结果（仅本实例提交的流水线）
     */
    public Optional<PipelineExecutionResult> getLiveResult(ExecutionId executionId) {
        PipelineHandle handle = handles.get(executionId);
        return handle != null ? Optional.of(handle.result) : Optional.empty();
    }

    /**
     * 等待后台流水线结束
     */
    public PipelineExecutionResult awaitCompletion(ExecutionId executionId, Duration timeout) {
        PipelineHandle handle = lookup(executionId)
                .orElseThrow(() -> new DeploymentNotFoundException(executionId.getValue()));
        Future<?> future = handle.future;
        if (future != null) {
            try {
                future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                throw new DeploymentOperationException("等待流水线结束超时: " + executionId,
                        FailureInfo.of(ErrorType.SYSTEM_ERROR, "等待超时"), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DeploymentOperationException("等待流水线结束被中断: " + executionId,
                        FailureInfo.of(ErrorType.CANCELLED, "等待被中断"), e);
            } catch (ExecutionException e) {
                throw new DeploymentOperationException("流水线任务异常: " + executionId,
                        FailureInfo.of(ErrorType.SYSTEM_ERROR, String.valueOf(e.getCause())), e);
            }
        }
        return handle.result;
    }

    public int getActiveCount() {
        return running.get();
    }

    /**
     * 内存中保留的句柄数（运行中 + 保留期内的终态流水线）
     */
    public int getLiveCount() {
        return handles.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public void shutdown() {
        log.info("[PipelineOrchestrator] 关闭中, 取消所有活跃流水线");
        handles.values().stream()
                .filter(h -> !h.result.getStatus().isTerminal())
                .forEach(h -> h.token.cancel("编排器关闭"));
        if (healthMonitor != null) {
            healthMonitor.shutdown();
        }
        housekeeping.shutdownNow();
        pipelinePool.shutdown();
        rollbackPool.shutdown();
        try {
            if (!pipelinePool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("[PipelineOrchestrator] 流水线线程池未能在 30 秒内结束");
                pipelinePool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pipelinePool.shutdownNow();
        }
    }

    private void audit(AuditEventType type, PipelineExecutionResult result, String actor,
                       PipelineStatus from, String message) {
        try {
            auditRecorder.record(AuditEvent.builder(type)
                    .executionId(result.getExecutionId())
                    .moduleName(result.getModule().getName())
                    .environment(result.getRequest().getTargetEnvironment())
                    .actor(actor)
                    .transition(from, result.getStatus())
                    .message(message)
                    .build());
        } catch (RuntimeException e) {
            log.warn("[PipelineOrchestrator] 审计写入失败: {}", type, e);
        }
    }

    private static ThreadFactory namedFactory(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class PipelineHandle {
        private final PipelineExecutionResult result;
        private final CancellationToken token;
        private volatile PipelineSettings settings;
        private volatile Future<?> future;

        private PipelineHandle(PipelineExecutionResult result, CancellationToken token) {
            this.result = result;
            this.token = token;
        }
    }
}
