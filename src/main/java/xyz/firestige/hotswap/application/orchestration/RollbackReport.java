package xyz.firestige.hotswap.application.orchestration;

import xyz.firestige.hotswap.domain.shared.exception.FailureInfo;

/**
 * 回滚结论
 */
public final class RollbackReport {

    private final boolean succeeded;
    private final int attempts;
    private final String message;
    private final FailureInfo failureInfo;

    private RollbackReport(boolean succeeded, int attempts, String message, FailureInfo failureInfo) {
        this.succeeded = succeeded;
        this.attempts = attempts;
        this.message = message;
        this.failureInfo = failureInfo;
    }

    public static RollbackReport succeeded(int attempts, String message) {
        return new RollbackReport(true, attempts, message, null);
    }

    public static RollbackReport failed(int attempts, FailureInfo failure) {
        return new RollbackReport(false, attempts, failure.getErrorMessage(), failure);
    }

    public boolean isSucceeded() { return succeeded; }
    public int getAttempts() { return attempts; }
    public String getMessage() { return message; }
    public FailureInfo getFailureInfo() { return failureInfo; }

    @Override
    public String toString() {
        return "RollbackReport{succeeded=" + succeeded + ", attempts=" + attempts + ", message='" + message + "'}";
    }
}
