package xyz.firestige.hotswap.application.approval;

/**
 * 审批人无权决定该审批（非管理员或不在审批人白名单内）
 */
public class ApprovalAuthorizationException extends RuntimeException {

    private final String executionId;

    public ApprovalAuthorizationException(String executionId, String message) {
        super(message);
        this.executionId = executionId;
    }

    public String getExecutionId() {
        return executionId;
    }
}
