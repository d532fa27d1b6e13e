package xyz.firestige.hotswap.domain.pipeline;

import xyz.firestige.hotswap.domain.shared.exception.FailureInfo;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 阶段执行结果（每个被遍历的环境一条）
 * <p>
 * 由所属流水线任务单线程写入，状态查询线程并发读取。
 */
public class StageResult {

    private final String stageName;
    private final EnvironmentType environment;
    private final RolloutStrategyType strategy;
    private final String attemptedVersion;
    private final boolean rollbackStage;
    private final List<Integer> shiftSteps = new CopyOnWriteArrayList<>();

    private volatile StageStatus status;
    private volatile LocalDateTime startTime;
    private volatile LocalDateTime endTime;
    private volatile int nodesDeployed;
    private volatile int nodesFailed;
    private volatile String message;
    private volatile String previousVersion;
    private volatile FailureInfo failureInfo;

    private StageResult(EnvironmentType environment, RolloutStrategyType strategy,
                        String attemptedVersion, boolean rollbackStage) {
        this.stageName = environment.name();
        this.environment = environment;
        this.strategy = strategy;
        this.attemptedVersion = attemptedVersion;
        this.rollbackStage = rollbackStage;
        this.status = StageStatus.PENDING;
        this.message = "";
    }

    public static StageResult pending(EnvironmentType environment, RolloutStrategyType strategy, String attemptedVersion) {
        return new StageResult(environment, strategy, attemptedVersion, false);
    }

    /**
     * 回滚阶段：以上一个已知良好版本重新执行同一策略
     */
    public static StageResult rollback(EnvironmentType environment, RolloutStrategyType strategy, String restoreVersion) {
        return new StageResult(environment, strategy, restoreVersion, true);
    }

    /**
     * 从已结束阶段的持久化记录恢复
     */
    public static StageResult restore(EnvironmentType environment, RolloutStrategyType strategy,
                                      String attemptedVersion, boolean rollbackStage, StageStatus status,
                                      String previousVersion, int nodesDeployed, int nodesFailed, String message,
                                      FailureInfo failureInfo, LocalDateTime startTime, LocalDateTime endTime) {
        StageResult stage = new StageResult(environment, strategy, attemptedVersion, rollbackStage);
        stage.status = status;
        stage.previousVersion = previousVersion;
        stage.nodesDeployed = nodesDeployed;
        stage.nodesFailed = nodesFailed;
        stage.message = message != null ? message : "";
        stage.failureInfo = failureInfo;
        stage.startTime = startTime;
        stage.endTime = endTime;
        return stage;
    }

    // ========== 状态转换 ==========

    public void start(String previousVersion) {
        if (status != StageStatus.PENDING) {
            throw new IllegalStateException(String.format(
                    "只有 PENDING 状态的阶段可以启动, 当前状态: %s, stage: %s", status, stageName));
        }
        this.previousVersion = previousVersion;
        this.startTime = LocalDateTime.now();
        this.status = StageStatus.RUNNING;
    }

    public void recordShift(int percentage) {
        shiftSteps.add(percentage);
    }

    public void updateProgress(String progressMessage) {
        this.message = progressMessage;
    }

    public void succeed(int deployed, int failed, String resultMessage) {
        requireRunning("成功");
        this.nodesDeployed = deployed;
        this.nodesFailed = failed;
        finish(StageStatus.SUCCEEDED, resultMessage, null);
    }

    public void partiallySucceed(int deployed, int failed, String resultMessage) {
        requireRunning("部分成功");
        this.nodesDeployed = deployed;
        this.nodesFailed = failed;
        finish(StageStatus.PARTIALLY_SUCCEEDED, resultMessage, null);
    }

    public void fail(FailureInfo failure, int deployed, int failed) {
        requireRunning("失败");
        this.nodesDeployed = deployed;
        this.nodesFailed = failed;
        finish(StageStatus.FAILED, failure.getErrorMessage(), failure);
    }

    /**
     * 失败后回滚成功
     */
    public void markRolledBack(String rollbackMessage) {
        if (status != StageStatus.FAILED && status != StageStatus.RUNNING && status != StageStatus.PARTIALLY_SUCCEEDED) {
            throw new IllegalStateException(String.format(
                    "只有 RUNNING/FAILED/PARTIALLY_SUCCEEDED 状态的阶段可以标记为已回滚, 当前状态: %s, stage: %s", status, stageName));
        }
        finish(StageStatus.ROLLED_BACK, joinMessage(rollbackMessage), failureInfo);
    }

    public void markRollbackFailed(FailureInfo failure) {
        if (status != StageStatus.FAILED && status != StageStatus.RUNNING && status != StageStatus.PARTIALLY_SUCCEEDED) {
            throw new IllegalStateException(String.format(
                    "只有 RUNNING/FAILED/PARTIALLY_SUCCEEDED 状态的阶段可以标记为回滚失败, 当前状态: %s, stage: %s", status, stageName));
        }
        finish(StageStatus.ROLLBACK_FAILED, joinMessage(failure.getErrorMessage()), failure);
    }

    private String joinMessage(String addition) {
        if (message == null || message.isBlank() || rollbackStage) {
            return addition;
        }
        return message + "; " + addition;
    }

    private void requireRunning(String action) {
        if (status != StageStatus.RUNNING) {
            throw new IllegalStateException(String.format(
                    "只有 RUNNING 状态的阶段可以标记为%s, 当前状态: %s, stage: %s", action, status, stageName));
        }
    }

    private void finish(StageStatus finalStatus, String finalMessage, FailureInfo failure) {
        this.status = finalStatus;
        this.message = finalMessage != null ? finalMessage : "";
        this.failureInfo = failure;
        if (this.startTime == null) {
            this.startTime = LocalDateTime.now();
        }
        this.endTime = LocalDateTime.now();
    }

    // ========== 查询 ==========

    public Duration getDuration() {
        if (startTime == null) {
            return Duration.ZERO;
        }
        LocalDateTime end = endTime != null ? endTime : LocalDateTime.now();
        return Duration.between(startTime, end);
    }

    public String getStageName() { return stageName; }
    public EnvironmentType getEnvironment() { return environment; }
    public RolloutStrategyType getStrategy() { return strategy; }
    public String getAttemptedVersion() { return attemptedVersion; }
    public boolean isRollbackStage() { return rollbackStage; }
    public List<Integer> getShiftSteps() { return List.copyOf(shiftSteps); }
    public StageStatus getStatus() { return status; }
    public LocalDateTime getStartTime() { return startTime; }
    public LocalDateTime getEndTime() { return endTime; }
    public int getNodesDeployed() { return nodesDeployed; }
    public int getNodesFailed() { return nodesFailed; }
    public String getMessage() { return message; }
    public String getPreviousVersion() { return previousVersion; }
    public FailureInfo getFailureInfo() { return failureInfo; }

    @Override
    public String toString() {
        return "StageResult{" +
                "stage='" + stageName + '\'' +
                ", status=" + status +
                ", strategy=" + strategy +
                ", nodesDeployed=" + nodesDeployed +
                ", nodesFailed=" + nodesFailed +
                ", message='" + message + '\'' +
                '}';
    }
}
