package xyz.firestige.hotswap.facade.exception;

import xyz.firestige.hotswap.domain.shared.exception.ErrorType;
import xyz.firestige.hotswap.domain.shared.exception.FailureInfo;

import java.util.List;

/**
 * 部署请求校验失败
 * 同步抛出，一次性列出所有违规项
 */
public class DeploymentValidationException extends RuntimeException {

    private final List<String> violations;
    private final FailureInfo failureInfo;

    public DeploymentValidationException(List<String> violations) {
        super("部署请求校验失败: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
        this.failureInfo = FailureInfo.of(ErrorType.VALIDATION_ERROR, getMessage());
    }

    public List<String> getViolations() {
        return violations;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }
}
