package xyz.firestige.hotswap.infrastructure.execution.rollout;

import xyz.firestige.hotswap.domain.cluster.ModuleDeployer;
import xyz.firestige.hotswap.domain.health.ClusterHealthProbe;
import xyz.firestige.hotswap.domain.health.ClusterMetrics;
import xyz.firestige.hotswap.domain.health.HealthBreachException;
import xyz.firestige.hotswap.domain.health.HealthEvaluator;
import xyz.firestige.hotswap.domain.health.HealthVerdict;
import xyz.firestige.hotswap.domain.health.NodeHealth;
import xyz.firestige.hotswap.domain.pipeline.RolloutStrategyType;
import xyz.firestige.hotswap.domain.shared.exception.ErrorType;
import xyz.firestige.hotswap.domain.shared.exception.FailureInfo;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 滚动发布：按节点 ID 顺序逐批替换，每批替换并确认健康后再进行下一批
 * <p>
 * 第一个不健康的批次停止后续推进；此前已确认健康的批次保留在线，
 * 以部分成功返回（是否自动回滚由上层策略决定）。一个批次都没确认时按失败处理。
 */
public class RollingRolloutStrategy extends AbstractRolloutStrategy {

    public RollingRolloutStrategy(ModuleDeployer deployer, ClusterHealthProbe probe, HealthEvaluator evaluator) {
        super(deployer, probe, evaluator);
    }

    @Override
    public RolloutStrategyType getType() {
        return RolloutStrategyType.ROLLING;
    }

    @Override
    protected StageOutcome doExecute(RolloutContext ctx, List<String> nodes, RolloutProgress progress) {
        ClusterMetrics baseline = baseline(ctx);
        int total = nodes.size();
        int batchSize = ctx.getRollingBatchSize();
        int step = 0;

        for (int from = 0; from < total; from += batchSize) {
            ctx.getToken().throwIfCancelled();
            step++;
            List<String> batch = nodes.subList(from, Math.min(from + batchSize, total));
            for (String nodeId : batch) {
                deployLive(ctx, nodeId, progress);
            }
            if (!ctx.isRestore()) {
                pause(ctx, ctx.getWaitDuration());
                checkBatch(ctx, batch, step, progress.deployed * 100 / total);
                checkHealth(ctx, baseline, step, progress.deployed * 100 / total);
            }
            progress.confirmed = progress.deployed;
            ctx.getStage().recordShift(progress.deployed * 100 / total);
            ctx.reportProgress(String.format("滚动发布第 %d 批完成: %d/%d 节点", step, progress.deployed, total));
        }
        return StageOutcome.succeeded(progress.deployed,
                String.format("滚动发布完成: %s, %d 个节点", ctx.getModule(), progress.deployed));
    }

    private void checkBatch(RolloutContext ctx, List<String> batch, int step, int percentage) {
        Set<String> batchIds = new HashSet<>(batch);
        for (NodeHealth node : probe.getNodes(ctx.getEnvironment())) {
            if (batchIds.contains(node.nodeId()) && !node.healthy()) {
                throw new HealthBreachException(
                        String.format("第 %d 批 (%d%%) 节点 %s 不健康", step, percentage, node.nodeId()),
                        HealthVerdict.breach("nodeHealthy:" + node.nodeId(), 0.0, 1.0));
            }
        }
    }

    @Override
    protected StageOutcome onBreach(RolloutContext ctx, RolloutProgress progress, HealthBreachException e) {
        if (progress.confirmed == 0) {
            return super.onBreach(ctx, progress, e);
        }
        FailureInfo failure = FailureInfo.of(ErrorType.HEALTH_BREACH,
                String.format("滚动发布在第 %d 个节点后停止: %s", progress.confirmed, e.getMessage()),
                ctx.getStage().getStageName());
        int unhealthy = progress.deployed - progress.confirmed;
        return StageOutcome.partial(progress.deployed, unhealthy, failure, e.getVerdict());
    }

    @Override
    protected StageOutcome onNodeFailure(RolloutContext ctx, RolloutProgress progress, NodeDeploymentException e) {
        if (progress.confirmed == 0) {
            return super.onNodeFailure(ctx, progress, e);
        }
        FailureInfo failure = FailureInfo.of(ErrorType.SYSTEM_ERROR,
                String.format("滚动发布在第 %d 个节点后停止: %s", progress.confirmed, e.getMessage()),
                ctx.getStage().getStageName());
        return StageOutcome.partial(progress.deployed, progress.failed, failure, null);
    }
}
