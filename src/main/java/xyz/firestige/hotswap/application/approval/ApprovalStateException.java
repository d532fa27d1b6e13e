package xyz.firestige.hotswap.application.approval;

/**
 * 审批请求已处于终态，不能再次决定（InvalidState）
 */
public class ApprovalStateException extends RuntimeException {

    private final String executionId;

    public ApprovalStateException(String executionId, String message) {
        super(message);
        this.executionId = executionId;
    }

    public String getExecutionId() {
        return executionId;
    }
}
