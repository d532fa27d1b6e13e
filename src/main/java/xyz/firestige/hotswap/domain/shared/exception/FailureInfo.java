package xyz.firestige.hotswap.domain.shared.exception;

import java.time.LocalDateTime;

/**
 * 失败信息封装类
 * 统一封装阶段执行过程中的失败信息
 */
public class FailureInfo {

    private String errorCode;

    private String errorMessage;

    private ErrorType errorType;

    /**
     * 失败位置（阶段名称或步骤）
     */
    private String failedAt;

    private LocalDateTime timestamp;

    private boolean retryable;

    public FailureInfo() {
        this.timestamp = LocalDateTime.now();
    }

    public FailureInfo(ErrorType errorType, String errorMessage, String failedAt) {
        this.errorCode = errorType.name();
        this.errorMessage = errorMessage;
        this.errorType = errorType;
        this.failedAt = failedAt;
        this.retryable = errorType.isRetryable();
        this.timestamp = LocalDateTime.now();
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage) {
        return new FailureInfo(errorType, errorMessage, null);
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage, String failedAt) {
        return new FailureInfo(errorType, errorMessage, failedAt);
    }

    public static FailureInfo fromException(Exception e, ErrorType errorType, String failedAt) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new FailureInfo(errorType, message, failedAt);
    }

    // Getters and Setters

    public String getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(String errorCode) {
        this.errorCode = errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public void setErrorType(ErrorType errorType) {
        this.errorType = errorType;
    }

    public String getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(String failedAt) {
        this.failedAt = failedAt;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(LocalDateTime timestamp) {
        this.timestamp = timestamp;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public void setRetryable(boolean retryable) {
        this.retryable = retryable;
    }

    @Override
    public String toString() {
        return "FailureInfo{" +
                "errorCode='" + errorCode + '\'' +
                ", errorMessage='" + errorMessage + '\'' +
                ", errorType=" + errorType +
                ", failedAt='" + failedAt + '\'' +
                ", timestamp=" + timestamp +
                ", retryable=" + retryable +
                '}';
    }
}
