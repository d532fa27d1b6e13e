package xyz.firestige.hotswap.infrastructure.execution.rollout;

import xyz.firestige.hotswap.domain.cluster.ModuleDeployer;
import xyz.firestige.hotswap.domain.health.ClusterHealthProbe;
import xyz.firestige.hotswap.domain.health.ClusterMetrics;
import xyz.firestige.hotswap.domain.health.HealthEvaluator;
import xyz.firestige.hotswap.domain.pipeline.RolloutStrategyType;

import java.util.ArrayList;
import java.util.List;

/**
 * 金丝雀 / 渐进式发布
 * <p>
 * 两者机制相同，只是百分比序列来源不同：
 * <ul>
 *   <li>CANARY：initial, initial + increment, ... 直到 100</li>
 *   <li>PROGRESSIVE：调用方给出的批次（如 [10, 30, 50, 100]），末尾不是 100 时补齐</li>
 * </ul>
 * 每一步把节点数扩到 ceil(total * pct / 100)，等待后采样健康并与基线比较。
 * 100% 之后不再检查健康，所以中止时记录的百分比序列一定小于 100。
 */
public class CanaryRolloutStrategy extends AbstractRolloutStrategy {

    private final RolloutStrategyType type;

    public CanaryRolloutStrategy(RolloutStrategyType type,
                                 ModuleDeployer deployer,
                                 ClusterHealthProbe probe,
                                 HealthEvaluator evaluator) {
        super(deployer, probe, evaluator);
        if (type != RolloutStrategyType.CANARY && type != RolloutStrategyType.PROGRESSIVE) {
            throw new IllegalArgumentException("CanaryRolloutStrategy 只支持 CANARY/PROGRESSIVE: " + type);
        }
        this.type = type;
    }

    @Override
    public RolloutStrategyType getType() {
        return type;
    }

    @Override
    protected StageOutcome doExecute(RolloutContext ctx, List<String> nodes, RolloutProgress progress) {
        List<Integer> steps = steps(ctx);
        ClusterMetrics baseline = baseline(ctx);
        int total = nodes.size();

        for (int i = 0; i < steps.size(); i++) {
            int percentage = steps.get(i);
            ctx.getToken().throwIfCancelled();

            int target = (int) Math.ceil(total * percentage / 100.0);
            while (progress.deployed < target) {
                deployLive(ctx, nodes.get(progress.deployed), progress);
            }
            ctx.getStage().recordShift(percentage);
            ctx.reportProgress(String.format("%s %d%%: %d/%d 节点", type, percentage, progress.deployed, total));

            if (percentage >= 100) {
                break;
            }
            pause(ctx, ctx.getWaitDuration());
            checkHealth(ctx, baseline, i + 1, percentage);
            progress.confirmed = progress.deployed;
        }
        return StageOutcome.succeeded(progress.deployed,
                String.format("%s 发布完成: %s, %d 步, %d 个节点", type, ctx.getModule(), steps.size(), progress.deployed));
    }

    /**
     * 计算百分比序列（严格递增，以 100 结尾）
     */
    List<Integer> steps(RolloutContext ctx) {
        List<Integer> steps = new ArrayList<>();
        if (type == RolloutStrategyType.PROGRESSIVE && !ctx.getBatches().isEmpty()) {
            int last = 0;
            for (Integer pct : ctx.getBatches()) {
                if (pct == null || pct <= last || pct > 100) {
                    throw new IllegalArgumentException("渐进式批次必须严格递增且在 1-100 之间: " + ctx.getBatches());
                }
                steps.add(pct);
                last = pct;
            }
        } else {
            int pct = ctx.getCanaryInitialPercentage();
            while (pct < 100) {
                steps.add(pct);
                pct += Math.max(1, ctx.getCanaryIncrementPercentage());
            }
        }
        if (steps.isEmpty() || steps.get(steps.size() - 1) != 100) {
            steps.add(100);
        }
        return steps;
    }
}
