package xyz.firestige.hotswap.application.orchestration;

import xyz.firestige.hotswap.domain.shared.exception.FailureInfo;

/**
 * 部署操作（回滚/取消/等待）在当前状态下不可执行
 */
public class DeploymentOperationException extends RuntimeException {

    private final FailureInfo failureInfo;

    public DeploymentOperationException(String message, FailureInfo failureInfo) {
        super(message);
        this.failureInfo = failureInfo;
    }

    public DeploymentOperationException(String message, FailureInfo failureInfo, Throwable cause) {
        super(message, cause);
        this.failureInfo = failureInfo;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }
}
