package xyz.firestige.hotswap.infrastructure.persistence.memory;

import xyz.firestige.hotswap.domain.pipeline.PipelineExecutionResult;
import xyz.firestige.hotswap.infrastructure.persistence.PipelineResultStore;
import xyz.firestige.hotswap.infrastructure.persistence.projection.PipelineExecutionView;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 流水线结果内存存储（单实例）
 * <p>
 * 保存的是投影快照而不是活对象，读者不会看到写到一半的状态。
 * 与 Redis 实现一致，终态记录在最后一次更新后保留 ttl，过期记录在下一次保存终态结果时清理。
 */
public class InMemoryPipelineResultStore implements PipelineResultStore {

    private final Map<String, PipelineExecutionView> store = new ConcurrentHashMap<>();
    private final Duration ttl;

    public InMemoryPipelineResultStore() {
        this(Duration.ofDays(7));
    }

    public InMemoryPipelineResultStore(Duration ttl) {
        this.ttl = ttl;
    }

    @Override
    public void save(PipelineExecutionResult result) {
        if (result == null) {
            return;
        }
        PipelineExecutionView view = PipelineExecutionView.from(result);
        store.put(result.getExecutionId().getValue(), view);
        if (view.getStatus() != null && view.getStatus().isTerminal()) {
            purgeExpired(view.getUpdatedAt().minus(ttl));
        }
    }

    private void purgeExpired(LocalDateTime cutoff) {
        store.values().removeIf(v -> v.getStatus() != null && v.getStatus().isTerminal()
                && v.getUpdatedAt() != null && v.getUpdatedAt().isBefore(cutoff));
    }

    @Override
    public Optional<PipelineExecutionView> find(String executionId) {
        if (executionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(store.get(executionId));
    }

    @Override
    public List<PipelineExecutionView> findActive() {
        return store.values().stream()
                .filter(v -> v.getStatus() != null && v.getStatus().isActive())
                .collect(Collectors.toList());
    }

    public int size() {
        return store.size();
    }
}
