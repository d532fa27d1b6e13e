package xyz.firestige.hotswap.domain.cluster;

import xyz.firestige.hotswap.domain.health.ClusterHealthSnapshot;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.shared.vo.ModuleDescriptor;

/**
 * 模块部署执行者（外部协作者）
 * <p>
 * 编排器不关心容器如何启动、流量如何切换，只通过该接口下发动作。
 */
public interface ModuleDeployer {

    /**
     * 在单个节点上部署指定版本（就地替换）
     */
    NodeDeploymentResult deploy(EnvironmentType environment, String nodeId, ModuleDescriptor module);

    /**
     * 从节点移除模块（没有已知良好版本时的回滚手段）
     */
    NodeDeploymentResult undeploy(EnvironmentType environment, String nodeId, String moduleName);

    // ========== 蓝绿 ==========

    /**
     * 在节点对应的备用（绿）槽位部署，不接流量
     */
    NodeDeploymentResult deployStandby(EnvironmentType environment, String nodeId, ModuleDescriptor module);

    /**
     * 检查整个绿环境健康
     */
    ClusterHealthSnapshot verifyStandby(EnvironmentType environment, String moduleName);

    /**
     * 原子切流：绿 → 活跃
     */
    void switchTraffic(EnvironmentType environment, String moduleName);

    /**
     * 丢弃绿环境，蓝环境保持不变
     */
    void discardStandby(EnvironmentType environment, String moduleName);
}
