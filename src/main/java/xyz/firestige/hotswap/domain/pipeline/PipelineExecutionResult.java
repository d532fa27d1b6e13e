package xyz.firestige.hotswap.domain.pipeline;

import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.shared.vo.ExecutionId;
import xyz.firestige.hotswap.domain.shared.vo.ModuleDescriptor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 流水线执行结果（聚合根）
 * <p>
 * 部署发生了什么的权威记录：流水线启动时创建，每个阶段追加一条 {@link StageResult}，
 * 结束或中止时定型。所属流水线任务是唯一写入者，状态轮询并发读取。
 * <p>
 * 状态转换非法时抛出 {@link IllegalStateException}。
 */
public class PipelineExecutionResult {

    private final ExecutionId executionId;
    private final DeploymentRequest request;
    private final String traceId;
    private final List<StageResult> stageResults = new CopyOnWriteArrayList<>();

    private volatile PipelineStatus status;
    private volatile LocalDateTime startTime;
    private volatile LocalDateTime endTime;
    private volatile String currentStage;
    private volatile String message;
    private volatile boolean degraded;

    public PipelineExecutionResult(DeploymentRequest request) {
        this(request, UUID.randomUUID().toString().replace("-", ""));
    }

    private PipelineExecutionResult(DeploymentRequest request, String traceId) {
        this.request = request;
        this.executionId = request.getExecutionId();
        this.traceId = traceId;
        this.status = PipelineStatus.CREATED;
        this.message = "";
    }

    /**
     * 从已结束流水线的持久化记录恢复，进程内结果被回收后仍可发起回滚
     *
     * @throws IllegalArgumentException 记录不是终态
     */
    public static PipelineExecutionResult restore(DeploymentRequest request, String traceId, PipelineStatus status,
                                                  String message, boolean degraded, LocalDateTime startTime,
                                                  LocalDateTime endTime, List<StageResult> stages) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("只能恢复已结束的流水线, 当前状态: " + status);
        }
        PipelineExecutionResult result = new PipelineExecutionResult(request,
                traceId != null ? traceId : UUID.randomUUID().toString().replace("-", ""));
        result.stageResults.addAll(stages);
        result.status = status;
        result.message = message != null ? message : "";
        result.degraded = degraded;
        result.startTime = startTime;
        result.endTime = endTime;
        result.currentStage = stages.isEmpty() ? null : stages.get(stages.size() - 1).getStageName();
        return result;
    }

    // ========== 状态转换 ==========

    public void start() {
        if (status != PipelineStatus.CREATED) {
            throw new IllegalStateException(String.format(
                    "只有 CREATED 状态的流水线可以启动, 当前状态: %s, executionId: %s", status, executionId));
        }
        this.startTime = LocalDateTime.now();
        this.status = PipelineStatus.RUNNING;
        this.message = "流水线执行中";
    }

    public void appendStage(StageResult stage) {
        stageResults.add(stage);
        this.currentStage = stage.getStageName();
    }

    public void complete() {
        requireRunning("完成");
        finish(PipelineStatus.SUCCEEDED, String.format("模块 %s 已成功部署到 %d 个环境", request.getModule(), stageResults.size()));
    }

    public void partiallySucceed(String reason) {
        requireRunning("部分成功");
        finish(PipelineStatus.PARTIALLY_SUCCEEDED, reason);
    }

    public void fail(String reason) {
        requireRunning("失败");
        finish(PipelineStatus.FAILED, reason);
    }

    /**
     * 阶段失败后自动回滚成功，或终态后的手动/监控回滚成功
     */
    public void markRolledBack(String reason) {
        if (status != PipelineStatus.RUNNING && !status.canRollback()) {
            throw new IllegalStateException(String.format(
                    "当前状态不允许标记为已回滚, 当前状态: %s, executionId: %s", status, executionId));
        }
        finish(PipelineStatus.ROLLED_BACK, reason);
    }

    /**
     * 回滚重试耗尽：环境被标记为降级，永不报告为健康
     */
    public void markRollbackFailed(String reason) {
        if (status != PipelineStatus.RUNNING && !status.canRollback()) {
            throw new IllegalStateException(String.format(
                    "当前状态不允许标记为回滚失败, 当前状态: %s, executionId: %s", status, executionId));
        }
        this.degraded = true;
        finish(PipelineStatus.ROLLBACK_FAILED, reason);
    }

    private void requireRunning(String action) {
        if (status != PipelineStatus.RUNNING) {
            throw new IllegalStateException(String.format(
                    "只有 RUNNING 状态的流水线可以%s, 当前状态: %s, executionId: %s", action, status, executionId));
        }
    }

    private void finish(PipelineStatus finalStatus, String reason) {
        this.status = finalStatus;
        this.message = reason != null ? reason : "";
        if (this.startTime == null) {
            this.startTime = LocalDateTime.now();
        }
        this.endTime = LocalDateTime.now();
    }

    // ========== 查询 ==========

    /**
     * 只有所有配置的阶段都成功才为 true
     */
    public boolean isSuccess() {
        return status == PipelineStatus.SUCCEEDED
                && stageResults.size() == request.getEnvironmentChain().size()
                && stageResults.stream().allMatch(s -> s.getStatus().isSuccess());
    }

    /**
     * 最后一个真正发生过发布的阶段（回滚目标）
     */
    public Optional<StageResult> findLastDeployedStage() {
        for (int i = stageResults.size() - 1; i >= 0; i--) {
            StageResult stage = stageResults.get(i);
            if (stage.isRollbackStage()) {
                continue;
            }
            StageStatus s = stage.getStatus();
            if (s == StageStatus.SUCCEEDED || s == StageStatus.PARTIALLY_SUCCEEDED
                    || (s == StageStatus.FAILED && stage.getNodesDeployed() > 0)) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }

    public Optional<StageResult> findStage(EnvironmentType environment) {
        return stageResults.stream()
                .filter(s -> !s.isRollbackStage() && s.getEnvironment() == environment)
                .findFirst();
    }

    public Duration getDuration() {
        if (startTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, endTime != null ? endTime : LocalDateTime.now());
    }

    public ExecutionId getExecutionId() { return executionId; }
    public DeploymentRequest getRequest() { return request; }
    public ModuleDescriptor getModule() { return request.getModule(); }
    public String getTraceId() { return traceId; }
    public List<StageResult> getStageResults() { return List.copyOf(stageResults); }
    public PipelineStatus getStatus() { return status; }
    public LocalDateTime getStartTime() { return startTime; }
    public LocalDateTime getEndTime() { return endTime; }
    public String getCurrentStage() { return currentStage; }
    public String getMessage() { return message; }
    public boolean isDegraded() { return degraded; }

    @Override
    public String toString() {
        return "PipelineExecutionResult{" +
                "executionId=" + executionId +
                ", module=" + request.getModule() +
                ", status=" + status +
                ", stages=" + stageResults.size() +
                ", degraded=" + degraded +
                '}';
    }
}
