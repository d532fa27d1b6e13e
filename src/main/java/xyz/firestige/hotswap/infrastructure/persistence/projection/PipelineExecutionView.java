package xyz.firestige.hotswap.infrastructure.persistence.projection;

import xyz.firestige.hotswap.domain.pipeline.PipelineExecutionResult;
import xyz.firestige.hotswap.domain.pipeline.PipelineStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 流水线状态投影（纯数据 DTO，无行为）
 * <p>
 * GET /deployments/{executionId} 返回的读模型，总是反映真实终态，包括部分成功与降级。
 */
public class PipelineExecutionView {
    private String executionId;
    private String moduleName;
    private String version;
    private String targetEnvironment;
    private String requesterEmail;
    private PipelineStatus status;
    private boolean success;
    private boolean degraded;
    private String currentStage;
    private String message;
    private String traceId;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private LocalDateTime updatedAt;
    private List<StageView> stages;

    public PipelineExecutionView() {}

    public static PipelineExecutionView from(PipelineExecutionResult result) {
        PipelineExecutionView v = new PipelineExecutionView();
        v.executionId = result.getExecutionId().getValue();
        v.moduleName = result.getModule().getName();
        v.version = result.getModule().getVersion();
        v.targetEnvironment = result.getRequest().getTargetEnvironment().name();
        v.requesterEmail = result.getRequest().getRequesterEmail();
        v.status = result.getStatus();
        v.success = result.isSuccess();
        v.degraded = result.isDegraded();
        v.currentStage = result.getCurrentStage();
        v.message = result.getMessage();
        v.traceId = result.getTraceId();
        v.startTime = result.getStartTime();
        v.endTime = result.getEndTime();
        v.updatedAt = LocalDateTime.now();
        v.stages = result.getStageResults().stream().map(StageView::from).collect(Collectors.toList());
        return v;
    }

    public String getExecutionId() { return executionId; }
    public void setExecutionId(String executionId) { this.executionId = executionId; }
    public String getModuleName() { return moduleName; }
    public void setModuleName(String moduleName) { this.moduleName = moduleName; }
    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }
    public String getTargetEnvironment() { return targetEnvironment; }
    public void setTargetEnvironment(String targetEnvironment) { this.targetEnvironment = targetEnvironment; }
    public String getRequesterEmail() { return requesterEmail; }
    public void setRequesterEmail(String requesterEmail) { this.requesterEmail = requesterEmail; }
    public PipelineStatus getStatus() { return status; }
    public void setStatus(PipelineStatus status) { this.status = status; }
    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }
    public boolean isDegraded() { return degraded; }
    public void setDegraded(boolean degraded) { this.degraded = degraded; }
    public String getCurrentStage() { return currentStage; }
    public void setCurrentStage(String currentStage) { this.currentStage = currentStage; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public String getTraceId() { return traceId; }
    public void setTraceId(String traceId) { this.traceId = traceId; }
    public LocalDateTime getStartTime() { return startTime; }
    public void setStartTime(LocalDateTime startTime) { this.startTime = startTime; }
    public LocalDateTime getEndTime() { return endTime; }
    public void setEndTime(LocalDateTime endTime) { this.endTime = endTime; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }
    public List<StageView> getStages() { return stages; }
    public void setStages(List<StageView> stages) { this.stages = stages; }

    @Override
    public String toString() {
        return "PipelineExecutionView{" +
                "executionId='" + executionId + '\'' +
                ", module='" + moduleName + '@' + version + '\'' +
                ", status=" + status +
                ", stages=" + (stages != null ? stages.size() : 0) +
                '}';
    }
}
