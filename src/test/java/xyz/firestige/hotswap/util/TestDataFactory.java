package xyz.firestige.hotswap.util;

import xyz.firestige.hotswap.application.orchestration.EnvironmentPolicy;
import xyz.firestige.hotswap.application.orchestration.PipelineSettings;
import xyz.firestige.hotswap.domain.pipeline.DeploymentRequest;
import xyz.firestige.hotswap.domain.pipeline.RolloutStrategyType;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.shared.vo.ExecutionId;
import xyz.firestige.hotswap.domain.shared.vo.ModuleDescriptor;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 测试数据工厂
 */
public final class TestDataFactory {

    public static final String REQUESTER = "dev@example.com";
    public static final String ADMIN = "ops-admin@example.com";

    private TestDataFactory() {
    }

    public static Map<EnvironmentType, Integer> nodeCounts() {
        Map<EnvironmentType, Integer> counts = new EnumMap<>(EnvironmentType.class);
        counts.put(EnvironmentType.DEVELOPMENT, 1);
        counts.put(EnvironmentType.QA, 2);
        counts.put(EnvironmentType.STAGING, 4);
        counts.put(EnvironmentType.PRODUCTION, 10);
        return counts;
    }

    public static DeploymentRequest request(String module, String version, EnvironmentType target) {
        return DeploymentRequest.builder()
                .executionId(ExecutionId.generate())
                .module(ModuleDescriptor.of(module, version))
                .targetEnvironment(target)
                .requesterEmail(REQUESTER)
                .build();
    }

    public static DeploymentRequest request(String module, String version, List<EnvironmentType> chain) {
        return DeploymentRequest.builder()
                .executionId(ExecutionId.generate())
                .module(ModuleDescriptor.of(module, version))
                .environmentChain(chain)
                .requesterEmail(REQUESTER)
                .build();
    }

    public static DeploymentRequest approvalRequest(String module, String version, List<EnvironmentType> chain) {
        return DeploymentRequest.builder()
                .executionId(ExecutionId.generate())
                .module(ModuleDescriptor.of(module, version))
                .environmentChain(chain)
                .requesterEmail(REQUESTER)
                .requireApproval(true)
                .build();
    }

    /**
     * 毫秒级等待的设置，STAGING/PRODUCTION 纳入审批；各测试按需覆盖环境策略
     */
    public static PipelineSettings.Builder fastSettings() {
        return PipelineSettings.builder()
                .maxConcurrentPipelines(4)
                .canaryWaitDuration(Duration.ofMillis(5))
                .approvalTimeout(Duration.ofMinutes(5))
                .lockTimeout(Duration.ofSeconds(2))
                .lockTtl(Duration.ofSeconds(30))
                .rollbackMaxAttempts(3)
                .rollbackRetryBackoff(Duration.ofMillis(5))
                .smokeTestTimeout(Duration.ofMillis(200))
                .environment(EnvironmentType.DEVELOPMENT, EnvironmentPolicy.of(RolloutStrategyType.DIRECT, false))
                .environment(EnvironmentType.QA, EnvironmentPolicy.of(RolloutStrategyType.ROLLING, false))
                .environment(EnvironmentType.STAGING, EnvironmentPolicy.of(RolloutStrategyType.BLUE_GREEN, true))
                .environment(EnvironmentType.PRODUCTION, EnvironmentPolicy.of(RolloutStrategyType.CANARY, true));
    }
}
