package xyz.firestige.hotswap.application.approval;

/**
 * 审批请求不存在（NotFound）
 */
public class ApprovalNotFoundException extends RuntimeException {

    private final String executionId;

    public ApprovalNotFoundException(String executionId, String message) {
        super(message);
        this.executionId = executionId;
    }

    public String getExecutionId() {
        return executionId;
    }
}
