package xyz.firestige.hotswap.application.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.hotswap.domain.health.ClusterHealthProbe;
import xyz.firestige.hotswap.domain.health.ClusterMetrics;
import xyz.firestige.hotswap.domain.health.HealthEvaluator;
import xyz.firestige.hotswap.domain.health.HealthVerdict;
import xyz.firestige.hotswap.domain.pipeline.PipelineExecutionResult;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.shared.vo.ExecutionId;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 部署后健康监控
 * <p>
 * 流水线成功后在监控窗口内按间隔采样最终环境，与阶段完成时的基线比较；
 * 发现延迟出现的退化时异步触发回滚。回滚走与手动回滚相同的加锁流程，
 * 不会和之后开始的新部署竞争。
 */
public class PostDeploymentHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(PostDeploymentHealthMonitor.class);

    @FunctionalInterface
    public interface RollbackTrigger {
        void trigger(ExecutionId executionId, String reason);
    }

    private final ClusterHealthProbe probe;
    private final HealthEvaluator evaluator;
    private final ScheduledExecutorService scheduler;
    private final Map<ExecutionId, ScheduledFuture<?>> watches = new ConcurrentHashMap<>();

    public PostDeploymentHealthMonitor(ClusterHealthProbe probe, HealthEvaluator evaluator) {
        this.probe = probe;
        this.evaluator = evaluator;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "hotswap-health-monitor");
            t.setDaemon(true);
            return t;
        });
    }

    public void watch(PipelineExecutionResult result, PipelineSettings settings, RollbackTrigger trigger) {
        ExecutionId executionId = result.getExecutionId();
        EnvironmentType environment = result.getRequest().getTargetEnvironment();
        ClusterMetrics baseline = probe.getMetrics(environment);
        Instant deadline = Instant.now().plus(settings.getMonitorWindow());
        long intervalMillis = Math.max(1, settings.getMonitorInterval().toMillis());

        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(
                () -> sample(executionId, environment, baseline, deadline, settings, trigger),
                intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = watches.put(executionId, future);
        if (previous != null) {
            previous.cancel(false);
        }
        log.info("[HealthMonitor] 开始部署后监控: {} {}, 窗口 {}", executionId, environment, settings.getMonitorWindow());
    }

    private void sample(ExecutionId executionId, EnvironmentType environment, ClusterMetrics baseline,
                        Instant deadline, PipelineSettings settings, RollbackTrigger trigger) {
        if (!watches.containsKey(executionId)) {
            return;
        }
        if (Instant.now().isAfter(deadline)) {
            stop(executionId);
            log.info("[HealthMonitor] 监控窗口结束, 未发现退化: {}", executionId);
            return;
        }
        try {
            HealthVerdict verdict = evaluator.evaluate(baseline, probe.getMetrics(environment),
                    probe.getHealth(environment), settings.getThresholds());
            if (!verdict.isHealthy()) {
                stop(executionId);
                String reason = "部署后健康监控检测到退化: " + verdict.describe();
                log.warn("[HealthMonitor] {}, 触发回滚: {}", reason, executionId);
                trigger.trigger(executionId, reason);
            }
        } catch (RuntimeException e) {
            log.warn("[HealthMonitor] 健康采样失败: {} {}", executionId, environment, e);
        }
    }

    public boolean isWatching(ExecutionId executionId) {
        return watches.containsKey(executionId);
    }

    public void stop(ExecutionId executionId) {
        ScheduledFuture<?> future = watches.remove(executionId);
        if (future != null) {
            future.cancel(false);
        }
    }

    public void shutdown() {
        watches.values().forEach(f -> f.cancel(false));
        watches.clear();
        scheduler.shutdownNow();
    }
}
