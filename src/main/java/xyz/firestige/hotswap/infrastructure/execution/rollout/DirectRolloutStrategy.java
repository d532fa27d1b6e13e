package xyz.firestige.hotswap.infrastructure.execution.rollout;

import xyz.firestige.hotswap.domain.cluster.ModuleDeployer;
import xyz.firestige.hotswap.domain.health.ClusterHealthProbe;
import xyz.firestige.hotswap.domain.health.HealthEvaluator;
import xyz.firestige.hotswap.domain.pipeline.RolloutStrategyType;

import java.util.List;

/**
 * 直接发布：一次切到 100%，中间不做健康检查
 */
public class DirectRolloutStrategy extends AbstractRolloutStrategy {

    public DirectRolloutStrategy(ModuleDeployer deployer, ClusterHealthProbe probe, HealthEvaluator evaluator) {
        super(deployer, probe, evaluator);
    }

    @Override
    public RolloutStrategyType getType() {
        return RolloutStrategyType.DIRECT;
    }

    @Override
    protected StageOutcome doExecute(RolloutContext ctx, List<String> nodes, RolloutProgress progress) {
        for (String nodeId : nodes) {
            deployLive(ctx, nodeId, progress);
        }
        ctx.getStage().recordShift(100);
        ctx.reportProgress(String.format("直接发布完成: %d/%d 节点", progress.deployed, nodes.size()));
        return StageOutcome.succeeded(progress.deployed,
                String.format("模块 %s 已直接发布到 %d 个节点", ctx.getModule(), progress.deployed));
    }
}
