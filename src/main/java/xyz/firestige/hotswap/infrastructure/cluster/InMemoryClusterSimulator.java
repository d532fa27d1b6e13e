package xyz.firestige.hotswap.infrastructure.cluster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.hotswap.domain.cluster.ModuleDeployer;
import xyz.firestige.hotswap.domain.cluster.NodeDeploymentResult;
import xyz.firestige.hotswap.domain.health.ClusterHealthProbe;
import xyz.firestige.hotswap.domain.health.ClusterHealthSnapshot;
import xyz.firestige.hotswap.domain.health.ClusterMetrics;
import xyz.firestige.hotswap.domain.health.NodeHealth;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.shared.vo.ModuleDescriptor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内集群模拟器
 * <p>
 * 宿主应用没有提供真实的 {@link ModuleDeployer}/{@link ClusterHealthProbe} 时使用，
 * 同时是测试中的故障注入点：
 * <ul>
 *   <li>{@link #failDeployOn(EnvironmentType, String)} 让指定节点部署失败</li>
 *   <li>{@link #markVersionUnhealthy(String)} 运行该版本的节点报告不健康</li>
 *   <li>{@link #injectMetrics(EnvironmentType, ClusterMetrics)} 覆盖环境指标</li>
 * </ul>
 * 节点 ID 形如 {@code prod-node-1}，按编号排序。
 */
public class InMemoryClusterSimulator implements ModuleDeployer, ClusterHealthProbe {

    private static final Logger log = LoggerFactory.getLogger(InMemoryClusterSimulator.class);

    private static final ClusterMetrics NOMINAL = new ClusterMetrics(40.0, 50.0, 100.0, 0.5, 1000.0);

    private final Map<EnvironmentType, List<String>> nodes = new EnumMap<>(EnvironmentType.class);
    /** env:node → (module → 活跃版本) */
    private final Map<String, Map<String, String>> active = new ConcurrentHashMap<>();
    /** env:node → (module → 备用版本) */
    private final Map<String, Map<String, String>> standby = new ConcurrentHashMap<>();
    private final Set<String> failingNodes = ConcurrentHashMap.newKeySet();
    private final Set<String> unhealthyVersions = ConcurrentHashMap.newKeySet();
    private final Map<EnvironmentType, ClusterMetrics> injectedMetrics = new ConcurrentHashMap<>();

    public InMemoryClusterSimulator(Map<EnvironmentType, Integer> nodeCounts) {
        for (EnvironmentType env : EnvironmentType.values()) {
            int count = nodeCounts.getOrDefault(env, 0);
            List<String> ids = new ArrayList<>(count);
            for (int i = 1; i <= count; i++) {
                ids.add(prefix(env) + "-node-" + i);
            }
            nodes.put(env, List.copyOf(ids));
        }
        log.info("[ClusterSimulator] 初始化模拟集群: {}", nodeCounts);
    }

    // ========== ModuleDeployer ==========

    @Override
    public NodeDeploymentResult deploy(EnvironmentType environment, String nodeId, ModuleDescriptor module) {
        if (failingNodes.contains(key(environment, nodeId))) {
            log.warn("[ClusterSimulator] 节点部署失败（注入）: {} {}", nodeId, module);
            return NodeDeploymentResult.failed(nodeId, "节点部署失败: " + nodeId);
        }
        active.computeIfAbsent(key(environment, nodeId), k -> new ConcurrentHashMap<>())
                .put(module.getName(), module.getVersion());
        log.debug("[ClusterSimulator] 节点部署完成: {} {}", nodeId, module);
        return NodeDeploymentResult.ok(nodeId);
    }

    @Override
    public NodeDeploymentResult undeploy(EnvironmentType environment, String nodeId, String moduleName) {
        Map<String, String> modules = active.get(key(environment, nodeId));
        if (modules != null) {
            modules.remove(moduleName);
        }
        return NodeDeploymentResult.ok(nodeId);
    }

    @Override
    public NodeDeploymentResult deployStandby(EnvironmentType environment, String nodeId, ModuleDescriptor module) {
        if (failingNodes.contains(key(environment, nodeId))) {
            return NodeDeploymentResult.failed(nodeId, "备用槽位部署失败: " + nodeId);
        }
        standby.computeIfAbsent(key(environment, nodeId), k -> new ConcurrentHashMap<>())
                .put(module.getName(), module.getVersion());
        return NodeDeploymentResult.ok(nodeId);
    }

    @Override
    public ClusterHealthSnapshot verifyStandby(EnvironmentType environment, String moduleName) {
        int total = 0;
        int healthy = 0;
        for (String nodeId : nodes.get(environment)) {
            Map<String, String> slot = standby.get(key(environment, nodeId));
            String version = slot != null ? slot.get(moduleName) : null;
            if (version == null) {
                continue;
            }
            total++;
            if (!unhealthyVersions.contains(version)) {
                healthy++;
            }
        }
        return ClusterHealthSnapshot.of(total, healthy);
    }

    @Override
    public void switchTraffic(EnvironmentType environment, String moduleName) {
        for (String nodeId : nodes.get(environment)) {
            Map<String, String> slot = standby.get(key(environment, nodeId));
            String version = slot != null ? slot.remove(moduleName) : null;
            if (version != null) {
                active.computeIfAbsent(key(environment, nodeId), k -> new ConcurrentHashMap<>())
                        .put(moduleName, version);
            }
        }
        log.info("[ClusterSimulator] 流量已切换到绿环境: {} {}", environment, moduleName);
    }

    @Override
    public void discardStandby(EnvironmentType environment, String moduleName) {
        for (String nodeId : nodes.get(environment)) {
            Map<String, String> slot = standby.get(key(environment, nodeId));
            if (slot != null) {
                slot.remove(moduleName);
            }
        }
    }

    // ========== ClusterHealthProbe ==========

    @Override
    public ClusterHealthSnapshot getHealth(EnvironmentType environment) {
        List<NodeHealth> nodeHealth = getNodes(environment);
        int healthy = (int) nodeHealth.stream().filter(NodeHealth::healthy).count();
        return ClusterHealthSnapshot.of(nodeHealth.size(), healthy);
    }

    @Override
    public ClusterMetrics getMetrics(EnvironmentType environment) {
        return injectedMetrics.getOrDefault(environment, NOMINAL);
    }

    @Override
    public List<NodeHealth> getNodes(EnvironmentType environment) {
        List<NodeHealth> result = new ArrayList<>();
        for (String nodeId : nodes.get(environment)) {
            Map<String, String> modules = active.getOrDefault(key(environment, nodeId), Map.of());
            boolean healthy = modules.values().stream().noneMatch(unhealthyVersions::contains);
            String version = modules.values().stream().findFirst().orElse(null);
            result.add(new NodeHealth(nodeId, healthy, version));
        }
        return result;
    }

    // ========== 查询与故障注入 ==========

    /**
     * 节点上某模块的活跃版本
     */
    public Optional<String> versionOn(EnvironmentType environment, String nodeId, String moduleName) {
        return Optional.ofNullable(active.getOrDefault(key(environment, nodeId), Map.of()).get(moduleName));
    }

    /**
     * 运行指定版本的节点数
     */
    public int countNodesRunning(EnvironmentType environment, String moduleName, String version) {
        int count = 0;
        for (String nodeId : nodes.get(environment)) {
            if (version.equals(active.getOrDefault(key(environment, nodeId), Map.of()).get(moduleName))) {
                count++;
            }
        }
        return count;
    }

    public List<String> nodeIds(EnvironmentType environment) {
        return nodes.get(environment);
    }

    public void failDeployOn(EnvironmentType environment, String nodeId) {
        failingNodes.add(key(environment, nodeId));
    }

    public void markVersionUnhealthy(String version) {
        unhealthyVersions.add(version);
    }

    public void injectMetrics(EnvironmentType environment, ClusterMetrics metrics) {
        injectedMetrics.put(environment, metrics);
    }

    public void reset() {
        failingNodes.clear();
        unhealthyVersions.clear();
        injectedMetrics.clear();
    }

    private static String key(EnvironmentType environment, String nodeId) {
        return environment.name() + ":" + nodeId;
    }

    private static String prefix(EnvironmentType environment) {
        return switch (environment) {
            case DEVELOPMENT -> "dev";
            case QA -> "qa";
            case STAGING -> "stg";
            case PRODUCTION -> "prod";
        };
    }
}
