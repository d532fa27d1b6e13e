package xyz.firestige.hotswap.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import xyz.firestige.hotswap.application.approval.ApprovalGate;
import xyz.firestige.hotswap.application.orchestration.PipelineOrchestrator;
import xyz.firestige.hotswap.domain.version.EnvironmentVersionRegistry;

/**
 * 流水线编排器健康检查
 * <p>
 * 回滚失败后有环境被标记为降级时返回 DOWN，直到人工恢复。
 */
public class PipelineOrchestratorHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestratorHealthIndicator.class);

    private final PipelineOrchestrator orchestrator;
    private final ApprovalGate approvalGate;
    private final EnvironmentVersionRegistry versionRegistry;

    public PipelineOrchestratorHealthIndicator(PipelineOrchestrator orchestrator,
                                               ApprovalGate approvalGate,
                                               EnvironmentVersionRegistry versionRegistry) {
        this.orchestrator = orchestrator;
        this.approvalGate = approvalGate;
        this.versionRegistry = versionRegistry;
    }

    @Override
    public Health health() {
        try {
            Health.Builder builder = versionRegistry.hasDegradedEnvironment()
                    ? Health.down().withDetail("message", "存在回滚失败的降级环境, 需要人工介入")
                    : Health.up();
            return builder
                    .withDetail("activePipelines", orchestrator.getActiveCount())
                    .withDetail("capacity", orchestrator.getCapacity())
                    .withDetail("pendingApprovals", approvalGate.listPending().size())
                    .build();
        } catch (Exception e) {
            log.error("[HealthIndicator] 健康检查异常", e);
            return Health.down()
                    .withException(e)
                    .withDetail("message", "健康检查异常")
                    .build();
        }
    }
}
