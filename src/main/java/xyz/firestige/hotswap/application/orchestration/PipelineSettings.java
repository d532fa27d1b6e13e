package xyz.firestige.hotswap.application.orchestration;

import xyz.firestige.hotswap.domain.health.HealthThresholds;
import xyz.firestige.hotswap.domain.pipeline.ApprovalMode;
import xyz.firestige.hotswap.domain.pipeline.RollingPartialFailurePolicy;
import xyz.firestige.hotswap.domain.pipeline.RolloutStrategyType;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 流水线配置快照
 * <p>
 * 流水线启动时从配置中取一次，之后整条流水线都使用这份快照，不会中途热更新。
 */
public final class PipelineSettings {

    private final int maxConcurrentPipelines;
    private final int canaryInitialPercentage;
    private final int canaryIncrementPercentage;
    private final Duration canaryWaitDuration;
    private final boolean autoRollbackOnFailure;
    private final Duration approvalTimeout;
    private final ApprovalMode approvalMode;
    private final List<String> approvers;
    private final Duration lockTimeout;
    private final Duration lockTtl;
    private final int rollbackMaxAttempts;
    private final Duration rollbackRetryBackoff;
    private final int rollingBatchSize;
    private final RollingPartialFailurePolicy rollingPartialFailurePolicy;
    private final Duration smokeTestTimeout;
    private final HealthThresholds thresholds;
    private final boolean monitorEnabled;
    private final Duration monitorInterval;
    private final Duration monitorWindow;
    private final Duration liveRetention;
    private final Map<EnvironmentType, EnvironmentPolicy> environments;

    private PipelineSettings(Builder b) {
        this.maxConcurrentPipelines = b.maxConcurrentPipelines;
        this.canaryInitialPercentage = b.canaryInitialPercentage;
        this.canaryIncrementPercentage = b.canaryIncrementPercentage;
        this.canaryWaitDuration = b.canaryWaitDuration;
        this.autoRollbackOnFailure = b.autoRollbackOnFailure;
        this.approvalTimeout = b.approvalTimeout;
        this.approvalMode = b.approvalMode;
        this.approvers = List.copyOf(b.approvers);
        this.lockTimeout = b.lockTimeout;
        this.lockTtl = b.lockTtl;
        this.rollbackMaxAttempts = b.rollbackMaxAttempts;
        this.rollbackRetryBackoff = b.rollbackRetryBackoff;
        this.rollingBatchSize = b.rollingBatchSize;
        this.rollingPartialFailurePolicy = b.rollingPartialFailurePolicy;
        this.smokeTestTimeout = b.smokeTestTimeout;
        this.thresholds = b.thresholds;
        this.monitorEnabled = b.monitorEnabled;
        this.monitorInterval = b.monitorInterval;
        this.monitorWindow = b.monitorWindow;
        this.liveRetention = b.liveRetention;
        Map<EnvironmentType, EnvironmentPolicy> envs = new EnumMap<>(EnvironmentType.class);
        envs.putAll(defaultPolicies());
        envs.putAll(b.environments);
        this.environments = Map.copyOf(envs);
    }

    public static PipelineSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 默认环境策略：DEV 直接发布，QA 滚动，STAGING 蓝绿 + 审批，PRODUCTION 金丝雀 + 审批
     */
    public static Map<EnvironmentType, EnvironmentPolicy> defaultPolicies() {
        Map<EnvironmentType, EnvironmentPolicy> map = new EnumMap<>(EnvironmentType.class);
        map.put(EnvironmentType.DEVELOPMENT, EnvironmentPolicy.of(RolloutStrategyType.DIRECT, false));
        map.put(EnvironmentType.QA, EnvironmentPolicy.of(RolloutStrategyType.ROLLING, false));
        map.put(EnvironmentType.STAGING, EnvironmentPolicy.of(RolloutStrategyType.BLUE_GREEN, true));
        map.put(EnvironmentType.PRODUCTION, EnvironmentPolicy.of(RolloutStrategyType.CANARY, true));
        return map;
    }

    public EnvironmentPolicy policyFor(EnvironmentType environment) {
        return environments.get(environment);
    }

    /**
     * 环境的步骤等待时长：环境级覆盖优先，金丝雀/渐进式默认取 canaryWaitDuration，其余策略不等待
     */
    public Duration waitDurationFor(EnvironmentType environment) {
        EnvironmentPolicy policy = policyFor(environment);
        if (policy.waitDuration() != null) {
            return policy.waitDuration();
        }
        return switch (policy.strategy()) {
            case CANARY, PROGRESSIVE -> canaryWaitDuration;
            default -> Duration.ZERO;
        };
    }

    public Duration smokeTestTimeoutFor(EnvironmentType environment) {
        EnvironmentPolicy policy = policyFor(environment);
        return policy.smokeTestTimeout() != null ? policy.smokeTestTimeout() : smokeTestTimeout;
    }

    public int getMaxConcurrentPipelines() { return maxConcurrentPipelines; }
    public int getCanaryInitialPercentage() { return canaryInitialPercentage; }
    public int getCanaryIncrementPercentage() { return canaryIncrementPercentage; }
    public Duration getCanaryWaitDuration() { return canaryWaitDuration; }
    public boolean isAutoRollbackOnFailure() { return autoRollbackOnFailure; }
    public Duration getApprovalTimeout() { return approvalTimeout; }
    public ApprovalMode getApprovalMode() { return approvalMode; }
    public List<String> getApprovers() { return approvers; }
    public Duration getLockTimeout() { return lockTimeout; }
    public Duration getLockTtl() { return lockTtl; }
    public int getRollbackMaxAttempts() { return rollbackMaxAttempts; }
    public Duration getRollbackRetryBackoff() { return rollbackRetryBackoff; }
    public int getRollingBatchSize() { return rollingBatchSize; }
    public RollingPartialFailurePolicy getRollingPartialFailurePolicy() { return rollingPartialFailurePolicy; }
    public Duration getSmokeTestTimeout() { return smokeTestTimeout; }
    public HealthThresholds getThresholds() { return thresholds; }
    public boolean isMonitorEnabled() { return monitorEnabled; }
    public Duration getMonitorInterval() { return monitorInterval; }
    public Duration getMonitorWindow() { return monitorWindow; }

    /**
     * 终态流水线在进程内保留的时长；开启部署后监控时至少覆盖监控窗口
     */
    public Duration getLiveRetention() {
        if (monitorEnabled && monitorWindow.compareTo(liveRetention) > 0) {
            return monitorWindow;
        }
        return liveRetention;
    }
    public Map<EnvironmentType, EnvironmentPolicy> getEnvironments() { return environments; }

    public static class Builder {
        private int maxConcurrentPipelines = 5;
        private int canaryInitialPercentage = 10;
        private int canaryIncrementPercentage = 20;
        private Duration canaryWaitDuration = Duration.ofMinutes(15);
        private boolean autoRollbackOnFailure = true;
        private Duration approvalTimeout = Duration.ofHours(4);
        private ApprovalMode approvalMode = ApprovalMode.UPFRONT;
        private List<String> approvers = List.of();
        private Duration lockTimeout = Duration.ofSeconds(30);
        private Duration lockTtl = Duration.ofMinutes(5);
        private int rollbackMaxAttempts = 3;
        private Duration rollbackRetryBackoff = Duration.ofSeconds(2);
        private int rollingBatchSize = 1;
        private RollingPartialFailurePolicy rollingPartialFailurePolicy = RollingPartialFailurePolicy.HALT;
        private Duration smokeTestTimeout = Duration.ofMinutes(5);
        private HealthThresholds thresholds = HealthThresholds.defaults();
        private boolean monitorEnabled = false;
        private Duration monitorInterval = Duration.ofSeconds(30);
        private Duration monitorWindow = Duration.ofMinutes(10);
        private Duration liveRetention = Duration.ofHours(1);
        private final Map<EnvironmentType, EnvironmentPolicy> environments = new EnumMap<>(EnvironmentType.class);

        public Builder maxConcurrentPipelines(int v) { this.maxConcurrentPipelines = v; return this; }
        public Builder canaryInitialPercentage(int v) { this.canaryInitialPercentage = v; return this; }
        public Builder canaryIncrementPercentage(int v) { this.canaryIncrementPercentage = v; return this; }
        public Builder canaryWaitDuration(Duration v) { this.canaryWaitDuration = v; return this; }
        public Builder autoRollbackOnFailure(boolean v) { this.autoRollbackOnFailure = v; return this; }
        public Builder approvalTimeout(Duration v) { this.approvalTimeout = v; return this; }
        public Builder approvalMode(ApprovalMode v) { this.approvalMode = v; return this; }
        public Builder approvers(List<String> v) { this.approvers = v != null ? v : List.of(); return this; }
        public Builder lockTimeout(Duration v) { this.lockTimeout = v; return this; }
        public Builder lockTtl(Duration v) { this.lockTtl = v; return this; }
        public Builder rollbackMaxAttempts(int v) { this.rollbackMaxAttempts = v; return this; }
        public Builder rollbackRetryBackoff(Duration v) { this.rollbackRetryBackoff = v; return this; }
        public Builder rollingBatchSize(int v) { this.rollingBatchSize = v; return this; }
        public Builder rollingPartialFailurePolicy(RollingPartialFailurePolicy v) { this.rollingPartialFailurePolicy = v; return this; }
        public Builder smokeTestTimeout(Duration v) { this.smokeTestTimeout = v; return this; }
        public Builder thresholds(HealthThresholds v) { this.thresholds = v; return this; }
        public Builder monitorEnabled(boolean v) { this.monitorEnabled = v; return this; }
        public Builder monitorInterval(Duration v) { this.monitorInterval = v; return this; }
        public Builder monitorWindow(Duration v) { this.monitorWindow = v; return this; }
        public Builder liveRetention(Duration v) { this.liveRetention = v; return this; }
        public Builder environment(EnvironmentType env, EnvironmentPolicy policy) { this.environments.put(env, policy); return this; }

        public PipelineSettings build() {
            if (maxConcurrentPipelines < 1) {
                throw new IllegalArgumentException("maxConcurrentPipelines 必须 >= 1");
            }
            if (canaryInitialPercentage < 1 || canaryInitialPercentage > 100) {
                throw new IllegalArgumentException("canaryInitialPercentage 必须在 1-100 之间");
            }
            if (canaryIncrementPercentage < 1) {
                throw new IllegalArgumentException("canaryIncrementPercentage 必须 >= 1");
            }
            if (rollbackMaxAttempts < 1) {
                throw new IllegalArgumentException("rollbackMaxAttempts 必须 >= 1");
            }
            if (liveRetention == null || liveRetention.isNegative()) {
                throw new IllegalArgumentException("liveRetention 不能为负");
            }
            if (rollingBatchSize < 1) {
                throw new IllegalArgumentException("rollingBatchSize 必须 >= 1");
            }
            return new PipelineSettings(this);
        }
    }
}
