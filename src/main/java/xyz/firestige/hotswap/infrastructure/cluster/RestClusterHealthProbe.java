package xyz.firestige.hotswap.infrastructure.cluster;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.hotswap.domain.health.ClusterHealthProbe;
import xyz.firestige.hotswap.domain.health.ClusterHealthSnapshot;
import xyz.firestige.hotswap.domain.health.ClusterMetrics;
import xyz.firestige.hotswap.domain.health.NodeHealth;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;

import java.util.List;

/**
 * 基于 HTTP 的集群健康探针
 * <p>
 * 约定外部采集器暴露：
 * <pre>
 * GET {baseUrl}/environments/{env}/health  → {"totalNodes":10,"healthyNodes":10}
 * GET {baseUrl}/environments/{env}/metrics → {"avgCpu":..,"avgMemory":..,"avgLatency":..,"avgErrorRate":..,"requestsPerSecond":..}
 * GET {baseUrl}/environments/{env}/nodes   → [{"nodeId":"..","healthy":true,"currentVersion":".."}]
 * </pre>
 */
public class RestClusterHealthProbe implements ClusterHealthProbe {

    private static final Logger log = LoggerFactory.getLogger(RestClusterHealthProbe.class);

    private final String baseUrl;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public RestClusterHealthProbe(String baseUrl, RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public ClusterHealthSnapshot getHealth(EnvironmentType environment) {
        JsonNode body = read(url(environment, "health"), new TypeReference<JsonNode>() {});
        return ClusterHealthSnapshot.of(body.path("totalNodes").asInt(), body.path("healthyNodes").asInt());
    }

    @Override
    public ClusterMetrics getMetrics(EnvironmentType environment) {
        return read(url(environment, "metrics"), new TypeReference<ClusterMetrics>() {});
    }

    @Override
    public List<NodeHealth> getNodes(EnvironmentType environment) {
        return read(url(environment, "nodes"), new TypeReference<List<NodeHealth>>() {});
    }

    private String url(EnvironmentType environment, String resource) {
        return baseUrl + "/environments/" + environment.name().toLowerCase() + "/" + resource;
    }

    private <T> T read(String url, TypeReference<T> type) {
        ResponseEntity<String> response;
        try {
            response = restTemplate.getForEntity(url, String.class);
        } catch (RestClientException e) {
            throw new ClusterProbeException("健康探针请求失败: " + url, e);
        }
        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new ClusterProbeException("健康探针返回异常状态: " + response.getStatusCode() + ", url: " + url);
        }
        try {
            return objectMapper.readValue(response.getBody(), type);
        } catch (JsonProcessingException e) {
            log.error("[RestClusterHealthProbe] 响应解析失败: {}", url, e);
            throw new ClusterProbeException("健康探针响应解析失败: " + url, e);
        }
    }
}
