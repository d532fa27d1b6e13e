package xyz.firestige.hotswap.infrastructure.persistence.projection;

import xyz.firestige.hotswap.domain.pipeline.StageResult;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 阶段投影（纯数据 DTO，无行为）
 */
public class StageView {
    private String stageName;
    private String status;
    private String strategy;
    private LocalDateTime startTime;
    private long durationMillis;
    private int nodesDeployed;
    private int nodesFailed;
    private String message;
    private String attemptedVersion;
    private String previousVersion;
    private boolean rollbackStage;
    private List<Integer> shiftSteps;
    private String errorType;

    public StageView() {}

    public static StageView from(StageResult stage) {
        StageView v = new StageView();
        v.stageName = stage.getStageName();
        v.status = stage.getStatus().name();
        v.strategy = stage.getStrategy() != null ? stage.getStrategy().name() : null;
        v.startTime = stage.getStartTime();
        v.durationMillis = stage.getDuration().toMillis();
        v.nodesDeployed = stage.getNodesDeployed();
        v.nodesFailed = stage.getNodesFailed();
        v.message = stage.getMessage();
        v.attemptedVersion = stage.getAttemptedVersion();
        v.previousVersion = stage.getPreviousVersion();
        v.rollbackStage = stage.isRollbackStage();
        v.shiftSteps = stage.getShiftSteps();
        v.errorType = stage.getFailureInfo() != null ? stage.getFailureInfo().getErrorType().name() : null;
        return v;
    }

    public String getStageName() { return stageName; }
    public void setStageName(String stageName) { this.stageName = stageName; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getStrategy() { return strategy; }
    public void setStrategy(String strategy) { this.strategy = strategy; }
    public LocalDateTime getStartTime() { return startTime; }
    public void setStartTime(LocalDateTime startTime) { this.startTime = startTime; }
    public long getDurationMillis() { return durationMillis; }
    public void setDurationMillis(long durationMillis) { this.durationMillis = durationMillis; }
    public int getNodesDeployed() { return nodesDeployed; }
    public void setNodesDeployed(int nodesDeployed) { this.nodesDeployed = nodesDeployed; }
    public int getNodesFailed() { return nodesFailed; }
    public void setNodesFailed(int nodesFailed) { this.nodesFailed = nodesFailed; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public String getAttemptedVersion() { return attemptedVersion; }
    public void setAttemptedVersion(String attemptedVersion) { this.attemptedVersion = attemptedVersion; }
    public String getPreviousVersion() { return previousVersion; }
    public void setPreviousVersion(String previousVersion) { this.previousVersion = previousVersion; }
    public boolean isRollbackStage() { return rollbackStage; }
    public void setRollbackStage(boolean rollbackStage) { this.rollbackStage = rollbackStage; }
    public List<Integer> getShiftSteps() { return shiftSteps; }
    public void setShiftSteps(List<Integer> shiftSteps) { this.shiftSteps = shiftSteps; }
    public String getErrorType() { return errorType; }
    public void setErrorType(String errorType) { this.errorType = errorType; }
}
