package xyz.firestige.hotswap.infrastructure.execution.rollout;

import xyz.firestige.hotswap.domain.cluster.ModuleDeployer;
import xyz.firestige.hotswap.domain.cluster.NodeDeploymentResult;
import xyz.firestige.hotswap.domain.health.ClusterHealthProbe;
import xyz.firestige.hotswap.domain.health.ClusterHealthSnapshot;
import xyz.firestige.hotswap.domain.health.HealthBreachException;
import xyz.firestige.hotswap.domain.health.HealthEvaluator;
import xyz.firestige.hotswap.domain.health.HealthVerdict;
import xyz.firestige.hotswap.domain.pipeline.RolloutStrategyType;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 蓝绿发布
 * <p>
 * 先把所有节点的备用（绿）槽位部署好，在冒烟超时内确认整个绿环境健康，然后一次性原子切流。
 * 切流前任何失败都丢弃绿环境，蓝环境保持不变，因此不需要回滚。
 */
public class BlueGreenRolloutStrategy extends AbstractRolloutStrategy {

    private static final Duration MAX_POLL_INTERVAL = Duration.ofSeconds(1);

    public BlueGreenRolloutStrategy(ModuleDeployer deployer, ClusterHealthProbe probe, HealthEvaluator evaluator) {
        super(deployer, probe, evaluator);
    }

    @Override
    public RolloutStrategyType getType() {
        return RolloutStrategyType.BLUE_GREEN;
    }

    @Override
    protected StageOutcome doExecute(RolloutContext ctx, List<String> nodes, RolloutProgress progress) {
        String moduleName = ctx.getModule().getName();
        try {
            for (String nodeId : nodes) {
                ctx.getToken().throwIfCancelled();
                NodeDeploymentResult result = deployer.deployStandby(ctx.getEnvironment(), nodeId, ctx.getModule());
                if (!result.success()) {
                    progress.failed++;
                    throw new NodeDeploymentException(nodeId, result.message());
                }
                progress.deployed++;
            }
            ctx.reportProgress(String.format("绿环境部署完成: %d/%d 节点, 冒烟检查中", progress.deployed, nodes.size()));

            awaitStandbyHealthy(ctx, nodes.size());

            ctx.getToken().throwIfCancelled();
            deployer.switchTraffic(ctx.getEnvironment(), moduleName);
        } catch (RuntimeException e) {
            // 切流前失败：蓝环境未受影响
            discardQuietly(ctx, moduleName, e);
            progress.liveTraffic = false;
            throw e;
        }
        progress.liveTraffic = true;
        ctx.getStage().recordShift(100);
        ctx.reportProgress(String.format("流量已切换到绿环境: %d 节点", progress.deployed));
        return StageOutcome.succeeded(progress.deployed,
                String.format("蓝绿发布完成: %s, %d 个节点", ctx.getModule(), progress.deployed));
    }

    private void awaitStandbyHealthy(RolloutContext ctx, int expected) {
        Duration timeout = ctx.getSmokeTestTimeout();
        Duration poll = timeout.dividedBy(5).compareTo(MAX_POLL_INTERVAL) > 0 ? MAX_POLL_INTERVAL : timeout.dividedBy(5);
        if (poll.isZero()) {
            poll = Duration.ofMillis(1);
        }
        Instant deadline = Instant.now().plus(timeout);
        ClusterHealthSnapshot snapshot = deployer.verifyStandby(ctx.getEnvironment(), ctx.getModule().getName());
        while (!(snapshot.isAllHealthy() && snapshot.getTotalNodes() >= expected)) {
            if (!Instant.now().isBefore(deadline)) {
                throw new HealthBreachException(
                        String.format("绿环境冒烟检查超时: 健康节点 %d/%d, 超时 %s",
                                snapshot.getHealthyNodes(), expected, timeout),
                        HealthVerdict.breach("standbyHealthyRatio", snapshot.healthyRatio(), 1.0));
            }
            pause(ctx, poll);
            snapshot = deployer.verifyStandby(ctx.getEnvironment(), ctx.getModule().getName());
        }
    }

    private void discardQuietly(RolloutContext ctx, String moduleName, RuntimeException cause) {
        try {
            deployer.discardStandby(ctx.getEnvironment(), moduleName);
            log.info("[BLUE_GREEN] 已丢弃绿环境, 蓝环境保持不变: {} {}", ctx.getEnvironment(), moduleName);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.error("[BLUE_GREEN] 丢弃绿环境失败: {} {}", ctx.getEnvironment(), moduleName, e);
        }
    }

    @Override
    protected StageOutcome onBreach(RolloutContext ctx, RolloutProgress progress, HealthBreachException e) {
        StageOutcome outcome = super.onBreach(ctx, progress, e);
        return StageOutcome.failed(outcome.getFailureInfo(), 0, progress.deployed, false, e.getVerdict());
    }

    @Override
    protected StageOutcome onNodeFailure(RolloutContext ctx, RolloutProgress progress, NodeDeploymentException e) {
        StageOutcome outcome = super.onNodeFailure(ctx, progress, e);
        return StageOutcome.failed(outcome.getFailureInfo(), 0, progress.failed, false, null);
    }
}
