package xyz.firestige.hotswap.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;

import java.util.EnumMap;
import java.util.Map;

/**
 * 集群接入配置
 * <p>
 * 配置了 probe-base-url 时健康探测走 HTTP；否则使用进程内模拟集群，节点数由 nodes 决定。
 */
@ConfigurationProperties(prefix = "hotswap.cluster")
public class HotSwapClusterProperties {

    private String probeBaseUrl;

    private Map<EnvironmentType, Integer> nodes = defaultNodes();

    private static Map<EnvironmentType, Integer> defaultNodes() {
        Map<EnvironmentType, Integer> map = new EnumMap<>(EnvironmentType.class);
        map.put(EnvironmentType.DEVELOPMENT, 1);
        map.put(EnvironmentType.QA, 2);
        map.put(EnvironmentType.STAGING, 2);
        map.put(EnvironmentType.PRODUCTION, 10);
        return map;
    }

    public String getProbeBaseUrl() {
        return probeBaseUrl;
    }

    public void setProbeBaseUrl(String probeBaseUrl) {
        this.probeBaseUrl = probeBaseUrl;
    }

    public Map<EnvironmentType, Integer> getNodes() {
        return nodes;
    }

    public void setNodes(Map<EnvironmentType, Integer> nodes) {
        this.nodes = nodes;
    }
}
