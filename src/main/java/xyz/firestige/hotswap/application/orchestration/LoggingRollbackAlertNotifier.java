package xyz.firestige.hotswap.application.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 默认告警：ERROR 日志，由日志告警规则接入值班系统
 */
public class LoggingRollbackAlertNotifier implements RollbackAlertNotifier {

    private static final Logger log = LoggerFactory.getLogger("HOTSWAP_ALERT");

    @Override
    public void alert(RollbackFailureException failure) {
        log.error("[ALERT] 回滚失败, 环境处于降级状态需要人工介入: executionId={}, environment={}, attempts={}, reason={}",
                failure.getExecutionId(), failure.getEnvironment(), failure.getAttempts(), failure.getMessage(), failure);
    }
}
