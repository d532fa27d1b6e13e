package xyz.firestige.hotswap.infrastructure.execution.rollout;

import xyz.firestige.hotswap.domain.health.HealthThresholds;
import xyz.firestige.hotswap.domain.pipeline.StageResult;
import xyz.firestige.hotswap.domain.shared.CancellationToken;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.shared.vo.ExecutionId;
import xyz.firestige.hotswap.domain.shared.vo.ModuleDescriptor;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 发布策略执行上下文
 * <p>
 * restore 模式用于回滚：跳过步骤间等待和健康门禁，尽快把已知良好版本铺满环境。
 */
public final class RolloutContext {

    private final ExecutionId executionId;
    private final ModuleDescriptor module;
    private final EnvironmentType environment;
    private final StageResult stage;
    private final CancellationToken token;
    private final HealthThresholds thresholds;
    private final int canaryInitialPercentage;
    private final int canaryIncrementPercentage;
    private final List<Integer> batches;
    private final Duration waitDuration;
    private final Duration smokeTestTimeout;
    private final int rollingBatchSize;
    private final boolean restore;
    private final Runnable progressListener;

    private RolloutContext(Builder b) {
        this.executionId = Objects.requireNonNull(b.executionId, "executionId");
        this.module = Objects.requireNonNull(b.module, "module");
        this.environment = Objects.requireNonNull(b.environment, "environment");
        this.stage = Objects.requireNonNull(b.stage, "stage");
        this.token = b.token != null ? b.token : CancellationToken.none();
        this.thresholds = b.thresholds != null ? b.thresholds : HealthThresholds.defaults();
        this.canaryInitialPercentage = b.canaryInitialPercentage;
        this.canaryIncrementPercentage = b.canaryIncrementPercentage;
        this.batches = b.batches != null ? List.copyOf(b.batches) : List.of();
        this.waitDuration = b.waitDuration != null ? b.waitDuration : Duration.ZERO;
        this.smokeTestTimeout = b.smokeTestTimeout != null ? b.smokeTestTimeout : Duration.ofMinutes(5);
        this.rollingBatchSize = Math.max(1, b.rollingBatchSize);
        this.restore = b.restore;
        this.progressListener = b.progressListener != null ? b.progressListener : () -> { };
    }

    public static Builder builder() {
        return new Builder();
    }

    public void reportProgress(String message) {
        stage.updateProgress(message);
        progressListener.run();
    }

    public ExecutionId getExecutionId() { return executionId; }
    public ModuleDescriptor getModule() { return module; }
    public EnvironmentType getEnvironment() { return environment; }
    public StageResult getStage() { return stage; }
    public CancellationToken getToken() { return token; }
    public HealthThresholds getThresholds() { return thresholds; }
    public int getCanaryInitialPercentage() { return canaryInitialPercentage; }
    public int getCanaryIncrementPercentage() { return canaryIncrementPercentage; }
    public List<Integer> getBatches() { return batches; }
    public Duration getWaitDuration() { return restore ? Duration.ZERO : waitDuration; }
    public Duration getSmokeTestTimeout() { return smokeTestTimeout; }
    public int getRollingBatchSize() { return rollingBatchSize; }
    public boolean isRestore() { return restore; }

    public static class Builder {
        private ExecutionId executionId;
        private ModuleDescriptor module;
        private EnvironmentType environment;
        private StageResult stage;
        private CancellationToken token;
        private HealthThresholds thresholds;
        private int canaryInitialPercentage = 10;
        private int canaryIncrementPercentage = 20;
        private List<Integer> batches;
        private Duration waitDuration;
        private Duration smokeTestTimeout;
        private int rollingBatchSize = 1;
        private boolean restore;
        private Runnable progressListener;

        public Builder executionId(ExecutionId v) { this.executionId = v; return this; }
        public Builder module(ModuleDescriptor v) { this.module = v; return this; }
        public Builder environment(EnvironmentType v) { this.environment = v; return this; }
        public Builder stage(StageResult v) { this.stage = v; return this; }
        public Builder token(CancellationToken v) { this.token = v; return this; }
        public Builder thresholds(HealthThresholds v) { this.thresholds = v; return this; }
        public Builder canaryInitialPercentage(int v) { this.canaryInitialPercentage = v; return this; }
        public Builder canaryIncrementPercentage(int v) { this.canaryIncrementPercentage = v; return this; }
        public Builder batches(List<Integer> v) { this.batches = v; return this; }
        public Builder waitDuration(Duration v) { this.waitDuration = v; return this; }
        public Builder smokeTestTimeout(Duration v) { this.smokeTestTimeout = v; return this; }
        public Builder rollingBatchSize(int v) { this.rollingBatchSize = v; return this; }
        public Builder restore(boolean v) { this.restore = v; return this; }
        public Builder progressListener(Runnable v) { this.progressListener = v; return this; }

        public RolloutContext build() {
            return new RolloutContext(this);
        }
    }
}
