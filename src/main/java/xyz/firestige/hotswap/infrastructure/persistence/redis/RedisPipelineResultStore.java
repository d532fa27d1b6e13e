package xyz.firestige.hotswap.infrastructure.persistence.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.hotswap.domain.pipeline.PipelineExecutionResult;
import xyz.firestige.hotswap.infrastructure.persistence.PipelineResultStore;
import xyz.firestige.hotswap.infrastructure.persistence.projection.PipelineExecutionView;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 流水线结果 Redis 实现（多实例）
 * <p>
 * Key 设计：
 * - {namespace}:pipeline:{executionId} → 投影 JSON，带 TTL
 * - {namespace}:pipeline:active → 活跃 executionId 集合
 */
public class RedisPipelineResultStore implements PipelineResultStore {

    private static final Logger log = LoggerFactory.getLogger(RedisPipelineResultStore.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final String activeKey;
    private final Duration ttl;

    public RedisPipelineResultStore(StringRedisTemplate redisTemplate,
                                    ObjectMapper objectMapper,
                                    String namespace,
                                    Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = namespace + ":pipeline:";
        this.activeKey = namespace + ":pipeline:active";
        this.ttl = ttl;
    }

    @Override
    public void save(PipelineExecutionResult result) {
        if (result == null) {
            return;
        }
        PipelineExecutionView view = PipelineExecutionView.from(result);
        String id = view.getExecutionId();
        try {
            String json = objectMapper.writeValueAsString(view);
            redisTemplate.opsForValue().set(keyPrefix + id, json, ttl);
            if (view.getStatus().isActive()) {
                redisTemplate.opsForSet().add(activeKey, id);
            } else {
                redisTemplate.opsForSet().remove(activeKey, id);
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("流水线投影序列化失败: " + id, e);
        }
    }

    @Override
    public Optional<PipelineExecutionView> find(String executionId) {
        if (executionId == null) {
            return Optional.empty();
        }
        String json = redisTemplate.opsForValue().get(keyPrefix + executionId);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, PipelineExecutionView.class));
        } catch (JsonProcessingException e) {
            log.error("[RedisPipelineResultStore] 投影反序列化失败: {}", executionId, e);
            throw new IllegalStateException("流水线投影反序列化失败: " + executionId, e);
        }
    }

    @Override
    public List<PipelineExecutionView> findActive() {
        Set<String> ids = redisTemplate.opsForSet().members(activeKey);
        List<PipelineExecutionView> views = new ArrayList<>();
        if (ids == null) {
            return views;
        }
        for (String id : ids) {
            Optional<PipelineExecutionView> view = find(id);
            if (view.isPresent()) {
                views.add(view.get());
            } else {
                // 投影已过期，清理索引
                redisTemplate.opsForSet().remove(activeKey, id);
            }
        }
        return views;
    }
}
