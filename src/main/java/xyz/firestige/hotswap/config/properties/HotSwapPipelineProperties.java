package xyz.firestige.hotswap.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import xyz.firestige.hotswap.application.orchestration.EnvironmentPolicy;
import xyz.firestige.hotswap.application.orchestration.PipelineSettings;
import xyz.firestige.hotswap.domain.health.HealthThresholds;
import xyz.firestige.hotswap.domain.pipeline.ApprovalMode;
import xyz.firestige.hotswap.domain.pipeline.RollingPartialFailurePolicy;
import xyz.firestige.hotswap.domain.pipeline.RolloutStrategyType;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 流水线配置属性
 * <p>
 * 配置示例（application.yml）：
 * <pre>
 * hotswap:
 *   pipeline:
 *     max-concurrent-pipelines: 5
 *     canary-wait-duration: 15m
 *     approval-mode: upfront
 *     environments:
 *       production:
 *         strategy: progressive
 *         require-approval: true
 *         batches: [10, 30, 50, 100]
 * </pre>
 * 流水线启动时通过 {@link #toSettings()} 取不可变快照，执行中不会热更新。
 */
@ConfigurationProperties(prefix = "hotswap.pipeline")
public class HotSwapPipelineProperties {

    private int maxConcurrentPipelines = 5;
    private int canaryInitialPercentage = 10;
    private int canaryIncrementPercentage = 20;
    private Duration canaryWaitDuration = Duration.ofMinutes(15);
    private boolean autoRollbackOnFailure = true;
    private Duration approvalTimeout = Duration.ofHours(4);
    private Duration approvalSweepInterval = Duration.ofMinutes(5);
    private ApprovalMode approvalMode = ApprovalMode.UPFRONT;
    private List<String> approvers = new ArrayList<>();
    private Duration lockTimeout = Duration.ofSeconds(30);
    private Duration lockTtl = Duration.ofMinutes(5);
    private int rollbackMaxAttempts = 3;
    private Duration rollbackRetryBackoff = Duration.ofSeconds(2);
    private int rollingBatchSize = 1;
    private RollingPartialFailurePolicy rollingPartialFailurePolicy = RollingPartialFailurePolicy.HALT;
    private Duration smokeTestTimeout = Duration.ofMinutes(5);
    private Thresholds thresholds = new Thresholds();
    private Monitor monitor = new Monitor();

    /**
     * 终态流水线在进程内保留多久，之后只能从结果存储查询
     */
    private Duration liveRetention = Duration.ofHours(1);

    /**
     * 环境级策略覆盖，未配置的环境使用内置默认
     */
    private Map<EnvironmentType, EnvironmentPolicyProperties> environments = new EnumMap<>(EnvironmentType.class);

    public PipelineSettings toSettings() {
        PipelineSettings.Builder builder = PipelineSettings.builder()
                .maxConcurrentPipelines(maxConcurrentPipelines)
                .canaryInitialPercentage(canaryInitialPercentage)
                .canaryIncrementPercentage(canaryIncrementPercentage)
                .canaryWaitDuration(canaryWaitDuration)
                .autoRollbackOnFailure(autoRollbackOnFailure)
                .approvalTimeout(approvalTimeout)
                .approvalMode(approvalMode)
                .approvers(List.copyOf(approvers))
                .lockTimeout(lockTimeout)
                .lockTtl(lockTtl)
                .rollbackMaxAttempts(rollbackMaxAttempts)
                .rollbackRetryBackoff(rollbackRetryBackoff)
                .rollingBatchSize(rollingBatchSize)
                .rollingPartialFailurePolicy(rollingPartialFailurePolicy)
                .smokeTestTimeout(smokeTestTimeout)
                .thresholds(thresholds.toThresholds())
                .monitorEnabled(monitor.isEnabled())
                .monitorInterval(monitor.getInterval())
                .monitorWindow(monitor.getWindow())
                .liveRetention(liveRetention);
        Map<EnvironmentType, EnvironmentPolicy> defaults = PipelineSettings.defaultPolicies();
        environments.forEach((env, props) -> builder.environment(env, props.merge(defaults.get(env))));
        return builder.build();
    }

    public int getMaxConcurrentPipelines() { return maxConcurrentPipelines; }
    public void setMaxConcurrentPipelines(int v) { this.maxConcurrentPipelines = v; }

    public int getCanaryInitialPercentage() { return canaryInitialPercentage; }
    public void setCanaryInitialPercentage(int v) { this.canaryInitialPercentage = v; }

    public int getCanaryIncrementPercentage() { return canaryIncrementPercentage; }
    public void setCanaryIncrementPercentage(int v) { this.canaryIncrementPercentage = v; }

    public Duration getCanaryWaitDuration() { return canaryWaitDuration; }
    public void setCanaryWaitDuration(Duration v) { this.canaryWaitDuration = v; }

    public boolean isAutoRollbackOnFailure() { return autoRollbackOnFailure; }
    public void setAutoRollbackOnFailure(boolean v) { this.autoRollbackOnFailure = v; }

    public Duration getApprovalTimeout() { return approvalTimeout; }
    public void setApprovalTimeout(Duration v) { this.approvalTimeout = v; }

    public Duration getApprovalSweepInterval() { return approvalSweepInterval; }
    public void setApprovalSweepInterval(Duration v) { this.approvalSweepInterval = v; }

    public ApprovalMode getApprovalMode() { return approvalMode; }
    public void setApprovalMode(ApprovalMode v) { this.approvalMode = v; }

    public List<String> getApprovers() { return approvers; }
    public void setApprovers(List<String> approvers) { this.approvers = approvers; }

    public Duration getLockTimeout() { return lockTimeout; }
    public void setLockTimeout(Duration v) { this.lockTimeout = v; }

    public Duration getLockTtl() { return lockTtl; }
    public void setLockTtl(Duration v) { this.lockTtl = v; }

    public int getRollbackMaxAttempts() { return rollbackMaxAttempts; }
    public void setRollbackMaxAttempts(int v) { this.rollbackMaxAttempts = v; }

    public Duration getRollbackRetryBackoff() { return rollbackRetryBackoff; }
    public void setRollbackRetryBackoff(Duration v) { this.rollbackRetryBackoff = v; }

    public int getRollingBatchSize() { return rollingBatchSize; }
    public void setRollingBatchSize(int v) { this.rollingBatchSize = v; }

    public RollingPartialFailurePolicy getRollingPartialFailurePolicy() { return rollingPartialFailurePolicy; }
    public void setRollingPartialFailurePolicy(RollingPartialFailurePolicy v) { this.rollingPartialFailurePolicy = v; }

    public Duration getSmokeTestTimeout() { return smokeTestTimeout; }
    public void setSmokeTestTimeout(Duration v) { this.smokeTestTimeout = v; }

    public Thresholds getThresholds() { return thresholds; }
    public void setThresholds(Thresholds thresholds) { this.thresholds = thresholds; }

    public Monitor getMonitor() { return monitor; }
    public void setMonitor(Monitor monitor) { this.monitor = monitor; }

    public Duration getLiveRetention() { return liveRetention; }
    public void setLiveRetention(Duration v) { this.liveRetention = v; }

    public Map<EnvironmentType, EnvironmentPolicyProperties> getEnvironments() { return environments; }
    public void setEnvironments(Map<EnvironmentType, EnvironmentPolicyProperties> environments) { this.environments = environments; }

    /**
     * 健康越界阈值，增幅为相对基线的百分比
     */
    public static class Thresholds {
        private double maxErrorRateIncrease = 50.0;
        private double maxLatencyIncrease = 100.0;
        private double maxCpuIncrease = 30.0;
        private double maxMemoryIncrease = 30.0;
        private double minHealthyRatio = 1.0;

        HealthThresholds toThresholds() {
            return new HealthThresholds(maxErrorRateIncrease, maxLatencyIncrease,
                    maxCpuIncrease, maxMemoryIncrease, minHealthyRatio);
        }

        public double getMaxErrorRateIncrease() { return maxErrorRateIncrease; }
        public void setMaxErrorRateIncrease(double v) { this.maxErrorRateIncrease = v; }

        public double getMaxLatencyIncrease() { return maxLatencyIncrease; }
        public void setMaxLatencyIncrease(double v) { this.maxLatencyIncrease = v; }

        public double getMaxCpuIncrease() { return maxCpuIncrease; }
        public void setMaxCpuIncrease(double v) { this.maxCpuIncrease = v; }

        public double getMaxMemoryIncrease() { return maxMemoryIncrease; }
        public void setMaxMemoryIncrease(double v) { this.maxMemoryIncrease = v; }

        public double getMinHealthyRatio() { return minHealthyRatio; }
        public void setMinHealthyRatio(double v) { this.minHealthyRatio = v; }
    }

    /**
     * 部署后健康监控
     */
    public static class Monitor {
        private boolean enabled = false;
        private Duration interval = Duration.ofSeconds(30);
        private Duration window = Duration.ofMinutes(10);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
    }

    /**
     * 单环境策略覆盖；未设置的字段沿用该环境的内置默认
     */
    public static class EnvironmentPolicyProperties {
        private RolloutStrategyType strategy;
        private Boolean requireApproval;
        private List<Integer> batches = new ArrayList<>();
        private Duration waitDuration;
        private Duration smokeTestTimeout;

        EnvironmentPolicy merge(EnvironmentPolicy fallback) {
            return new EnvironmentPolicy(
                    strategy != null ? strategy : fallback.strategy(),
                    requireApproval != null ? requireApproval : fallback.requireApproval(),
                    batches.isEmpty() ? fallback.batches() : batches,
                    waitDuration != null ? waitDuration : fallback.waitDuration(),
                    smokeTestTimeout != null ? smokeTestTimeout : fallback.smokeTestTimeout());
        }

        public RolloutStrategyType getStrategy() { return strategy; }
        public void setStrategy(RolloutStrategyType strategy) { this.strategy = strategy; }

        public Boolean getRequireApproval() { return requireApproval; }
        public void setRequireApproval(Boolean requireApproval) { this.requireApproval = requireApproval; }

        public List<Integer> getBatches() { return batches; }
        public void setBatches(List<Integer> batches) { this.batches = batches; }

        public Duration getWaitDuration() { return waitDuration; }
        public void setWaitDuration(Duration waitDuration) { this.waitDuration = waitDuration; }

        public Duration getSmokeTestTimeout() { return smokeTestTimeout; }
        public void setSmokeTestTimeout(Duration smokeTestTimeout) { this.smokeTestTimeout = smokeTestTimeout; }
    }
}
