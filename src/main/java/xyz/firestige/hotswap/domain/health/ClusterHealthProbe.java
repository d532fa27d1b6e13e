package xyz.firestige.hotswap.domain.health;

import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;

import java.util.List;

/**
 * 集群健康探针（只读外部协作者）
 * <p>
 * 数据由外部采集器持续刷新，编排器只做时间点采样，视为最终一致。
 */
public interface ClusterHealthProbe {

    ClusterHealthSnapshot getHealth(EnvironmentType environment);

    ClusterMetrics getMetrics(EnvironmentType environment);

    /**
     * 环境内节点清单及各自健康状态
     */
    List<NodeHealth> getNodes(EnvironmentType environment);
}
