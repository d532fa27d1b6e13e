package xyz.firestige.hotswap.application.orchestration;

import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;

/**
 * 回滚在有限次重试后仍未完成，环境处于未知/降级状态
 * <p>
 * 不会被吞掉：经 {@link RollbackAlertNotifier} 走告警通道升级。
 */
public class RollbackFailureException extends RuntimeException {

    private final String executionId;
    private final EnvironmentType environment;
    private final int attempts;

    public RollbackFailureException(String executionId, EnvironmentType environment, int attempts,
                                    String message, Throwable cause) {
        super(message, cause);
        this.executionId = executionId;
        this.environment = environment;
        this.attempts = attempts;
    }

    public String getExecutionId() { return executionId; }
    public EnvironmentType getEnvironment() { return environment; }
    public int getAttempts() { return attempts; }
}
