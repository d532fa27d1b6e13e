package xyz.firestige.hotswap.domain.shared.exception;

/**
 * 流水线在挂起点（锁等待、审批等待、步骤间等待）观察到取消信号
 */
public class PipelineCancelledException extends RuntimeException {

    private final String executionId;

    public PipelineCancelledException(String executionId, String message) {
        super(message);
        this.executionId = executionId;
    }

    public String getExecutionId() {
        return executionId;
    }
}
