package xyz.firestige.hotswap.infrastructure.persistence;

import xyz.firestige.hotswap.domain.pipeline.PipelineExecutionResult;
import xyz.firestige.hotswap.infrastructure.persistence.projection.PipelineExecutionView;

import java.util.List;
import java.util.Optional;

/**
 * 流水线结果存储（executionId → 投影）
 * <p>
 * 单写者（所属流水线任务）每次变更后保存一次投影快照，
 * 状态轮询并发读取，读到的总是某一次保存时的一致快照。
 * <p>
 * 单实例部署使用内存实现，多实例部署使用 Redis 实现。
 */
public interface PipelineResultStore {

    void save(PipelineExecutionResult result);

    Optional<PipelineExecutionView> find(String executionId);

    /**
     * 仍处于活跃状态（CREATED/RUNNING）的流水线
     */
    List<PipelineExecutionView> findActive();
}
