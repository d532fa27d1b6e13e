package xyz.firestige.hotswap.infrastructure.execution.rollout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.hotswap.domain.cluster.ModuleDeployer;
import xyz.firestige.hotswap.domain.cluster.NodeDeploymentResult;
import xyz.firestige.hotswap.domain.health.ClusterHealthProbe;
import xyz.firestige.hotswap.domain.health.ClusterMetrics;
import xyz.firestige.hotswap.domain.health.HealthBreachException;
import xyz.firestige.hotswap.domain.health.HealthEvaluator;
import xyz.firestige.hotswap.domain.health.HealthVerdict;
import xyz.firestige.hotswap.domain.health.NodeHealth;
import xyz.firestige.hotswap.domain.shared.exception.ErrorType;
import xyz.firestige.hotswap.domain.shared.exception.FailureInfo;
import xyz.firestige.hotswap.domain.shared.exception.PipelineCancelledException;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 发布策略模板
 * <p>
 * 子类只描述步骤如何推进，并通过 {@link RolloutProgress} 记录进度；
 * 模板负责把取消、健康越界、节点部署失败和意外异常统一转换为 {@link StageOutcome}。
 */
public abstract class AbstractRolloutStrategy implements RolloutStrategy {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final ModuleDeployer deployer;
    protected final ClusterHealthProbe probe;
    protected final HealthEvaluator evaluator;

    protected AbstractRolloutStrategy(ModuleDeployer deployer, ClusterHealthProbe probe, HealthEvaluator evaluator) {
        this.deployer = deployer;
        this.probe = probe;
        this.evaluator = evaluator;
    }

    @Override
    public final StageOutcome execute(RolloutContext ctx) {
        RolloutProgress progress = new RolloutProgress();
        String stageName = ctx.getStage().getStageName();
        try {
            List<String> nodes = nodeIds(ctx);
            if (nodes.isEmpty()) {
                return StageOutcome.failed(FailureInfo.of(ErrorType.SYSTEM_ERROR,
                        "环境 " + ctx.getEnvironment() + " 没有可部署节点", stageName), 0, 0, false, null);
            }
            log.info("[{}] 开始发布: {} -> {}, 节点数: {}, restore: {}",
                    getType(), ctx.getModule(), ctx.getEnvironment(), nodes.size(), ctx.isRestore());
            return doExecute(ctx, nodes, progress);
        } catch (HealthBreachException e) {
            log.warn("[{}] 健康越界，中止发布: {}", getType(), e.getMessage());
            return onBreach(ctx, progress, e);
        } catch (PipelineCancelledException e) {
            log.warn("[{}] 发布被取消: {}", getType(), e.getMessage());
            return StageOutcome.failed(FailureInfo.of(ErrorType.CANCELLED, e.getMessage(), stageName),
                    progress.deployed, progress.failed, progress.liveTraffic, null);
        } catch (NodeDeploymentException e) {
            log.warn("[{}] 节点部署失败，中止发布: {}", getType(), e.getMessage());
            return onNodeFailure(ctx, progress, e);
        } catch (RuntimeException e) {
            log.error("[{}] 发布过程异常: {} -> {}", getType(), ctx.getModule(), ctx.getEnvironment(), e);
            return StageOutcome.failed(FailureInfo.fromException(e, ErrorType.SYSTEM_ERROR, stageName),
                    progress.deployed, progress.failed, progress.liveTraffic, null);
        }
    }

    /**
     * 推进发布；成功时返回成功结论，中止时抛出 {@link HealthBreachException}/{@link PipelineCancelledException}
     */
    protected abstract StageOutcome doExecute(RolloutContext ctx, List<String> nodes, RolloutProgress progress);

    protected StageOutcome onBreach(RolloutContext ctx, RolloutProgress progress, HealthBreachException e) {
        FailureInfo failure = FailureInfo.of(ErrorType.HEALTH_BREACH, e.getMessage(), ctx.getStage().getStageName());
        return StageOutcome.failed(failure, progress.deployed, progress.failed, progress.liveTraffic, e.getVerdict());
    }

    protected StageOutcome onNodeFailure(RolloutContext ctx, RolloutProgress progress, NodeDeploymentException e) {
        FailureInfo failure = FailureInfo.of(ErrorType.SYSTEM_ERROR, e.getMessage(), ctx.getStage().getStageName());
        return StageOutcome.failed(failure, progress.deployed, progress.failed, progress.liveTraffic, null);
    }

    // ========== 子类可用的步骤原语 ==========

    /**
     * 节点清单，按节点 ID 排序保证顺序确定
     */
    protected List<String> nodeIds(RolloutContext ctx) {
        return probe.getNodes(ctx.getEnvironment()).stream()
                .map(NodeHealth::nodeId)
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * 在线节点就地部署；失败时抛出 {@link NodeDeploymentException}
     */
    protected void deployLive(RolloutContext ctx, String nodeId, RolloutProgress progress) {
        ctx.getToken().throwIfCancelled();
        NodeDeploymentResult result = deployer.deploy(ctx.getEnvironment(), nodeId, ctx.getModule());
        if (!result.success()) {
            progress.failed++;
            throw new NodeDeploymentException(nodeId, result.message());
        }
        progress.deployed++;
        progress.liveTraffic = true;
    }

    /**
     * 可取消的步骤间等待
     */
    protected void pause(RolloutContext ctx, Duration duration) {
        if (!ctx.getToken().await(duration)) {
            ctx.getToken().throwIfCancelled();
        }
    }

    protected ClusterMetrics baseline(RolloutContext ctx) {
        return ctx.isRestore() ? null : probe.getMetrics(ctx.getEnvironment());
    }

    /**
     * 采样并与基线比较；越界抛出 {@link HealthBreachException}
     */
    protected void checkHealth(RolloutContext ctx, ClusterMetrics baseline, int step, int percentage) {
        if (ctx.isRestore()) {
            return;
        }
        HealthVerdict verdict = evaluator.evaluate(baseline,
                probe.getMetrics(ctx.getEnvironment()),
                probe.getHealth(ctx.getEnvironment()),
                ctx.getThresholds());
        if (!verdict.isHealthy()) {
            throw new HealthBreachException(verdict, step, percentage);
        }
        log.debug("[{}] 第 {} 步 ({}%) 健康检查通过", getType(), step, percentage);
    }

    /**
     * 策略执行过程中的进度计数
     */
    protected static final class RolloutProgress {
        int deployed;
        int failed;
        /** 已确认健康的节点（滚动发布部分成功的判断依据） */
        int confirmed;
        boolean liveTraffic;
    }

    /**
     * 单节点部署失败
     */
    protected static final class NodeDeploymentException extends RuntimeException {
        private final String nodeId;

        NodeDeploymentException(String nodeId, String message) {
            super("节点 " + nodeId + " 部署失败: " + message);
            this.nodeId = nodeId;
        }

        public String getNodeId() {
            return nodeId;
        }
    }
}
