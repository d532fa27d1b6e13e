package xyz.firestige.hotswap.domain.health;

import java.util.Objects;

/**
 * 集群健康快照（只读）
 */
public final class ClusterHealthSnapshot {

    private final int totalNodes;
    private final int healthyNodes;
    private final int unhealthyNodes;

    private ClusterHealthSnapshot(int totalNodes, int healthyNodes) {
        this.totalNodes = totalNodes;
        this.healthyNodes = healthyNodes;
        this.unhealthyNodes = totalNodes - healthyNodes;
    }

    public static ClusterHealthSnapshot of(int totalNodes, int healthyNodes) {
        if (totalNodes < 0 || healthyNodes < 0 || healthyNodes > totalNodes) {
            throw new IllegalArgumentException(String.format(
                    "节点数量非法: total=%d, healthy=%d", totalNodes, healthyNodes));
        }
        return new ClusterHealthSnapshot(totalNodes, healthyNodes);
    }

    /**
     * 健康节点占比；空集群视为 0
     */
    public double healthyRatio() {
        return totalNodes == 0 ? 0.0 : (double) healthyNodes / totalNodes;
    }

    public boolean isAllHealthy() {
        return totalNodes > 0 && healthyNodes == totalNodes;
    }

    public int getTotalNodes() { return totalNodes; }
    public int getHealthyNodes() { return healthyNodes; }
    public int getUnhealthyNodes() { return unhealthyNodes; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClusterHealthSnapshot that = (ClusterHealthSnapshot) o;
        return totalNodes == that.totalNodes && healthyNodes == that.healthyNodes;
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalNodes, healthyNodes);
    }

    @Override
    public String toString() {
        return "ClusterHealthSnapshot{healthy=" + healthyNodes + "/" + totalNodes + '}';
    }
}
