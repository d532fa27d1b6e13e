package xyz.firestige.hotswap.infrastructure.execution.rollout;

import xyz.firestige.hotswap.domain.health.HealthVerdict;
import xyz.firestige.hotswap.domain.shared.exception.FailureInfo;

/**
 * 一次发布策略执行的结论
 * <p>
 * 失败时携带足够的细节（哪一步、哪个指标、观测值与阈值）供回滚协调与审计使用。
 */
public final class StageOutcome {

    private final boolean success;
    private final boolean partial;
    private final boolean liveTrafficAffected;
    private final int nodesDeployed;
    private final int nodesFailed;
    private final String message;
    private final FailureInfo failureInfo;
    private final HealthVerdict verdict;

    private StageOutcome(boolean success, boolean partial, boolean liveTrafficAffected,
                         int nodesDeployed, int nodesFailed, String message,
                         FailureInfo failureInfo, HealthVerdict verdict) {
        this.success = success;
        this.partial = partial;
        this.liveTrafficAffected = liveTrafficAffected;
        this.nodesDeployed = nodesDeployed;
        this.nodesFailed = nodesFailed;
        this.message = message;
        this.failureInfo = failureInfo;
        this.verdict = verdict;
    }

    public static StageOutcome succeeded(int nodesDeployed, String message) {
        return new StageOutcome(true, false, true, nodesDeployed, 0, message, null, HealthVerdict.healthy());
    }

    /**
     * 滚动发布中途停止：已更新的节点保留在线
     */
    public static StageOutcome partial(int nodesDeployed, int nodesFailed, FailureInfo failure, HealthVerdict verdict) {
        return new StageOutcome(false, true, true, nodesDeployed, nodesFailed,
                failure.getErrorMessage(), failure, verdict);
    }

    public static StageOutcome failed(FailureInfo failure, int nodesDeployed, int nodesFailed,
                                      boolean liveTrafficAffected, HealthVerdict verdict) {
        return new StageOutcome(false, false, liveTrafficAffected, nodesDeployed, nodesFailed,
                failure.getErrorMessage(), failure, verdict);
    }

    public boolean isSuccess() { return success; }
    public boolean isPartial() { return partial; }

    /**
     * 是否有线上流量受到影响（决定是否需要回滚）
     */
    public boolean isLiveTrafficAffected() { return liveTrafficAffected; }
    public int getNodesDeployed() { return nodesDeployed; }
    public int getNodesFailed() { return nodesFailed; }
    public String getMessage() { return message; }
    public FailureInfo getFailureInfo() { return failureInfo; }
    public HealthVerdict getVerdict() { return verdict; }

    @Override
    public String toString() {
        return "StageOutcome{" +
                "success=" + success +
                ", partial=" + partial +
                ", nodesDeployed=" + nodesDeployed +
                ", nodesFailed=" + nodesFailed +
                ", message='" + message + '\'' +
                '}';
    }
}
