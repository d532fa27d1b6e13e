package xyz.firestige.hotswap.application.orchestration;

/**
 * 未知的 executionId
 */
public class DeploymentNotFoundException extends RuntimeException {

    private final String executionId;

    public DeploymentNotFoundException(String executionId) {
        super("部署不存在: " + executionId);
        this.executionId = executionId;
    }

    public String getExecutionId() {
        return executionId;
    }
}
