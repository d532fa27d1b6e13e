package xyz.firestige.hotswap.domain.approval;

import xyz.firestige.hotswap.domain.shared.vo.ExecutionId;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 审批请求仓储（按 executionId 唯一）
 */
public interface ApprovalRequestRepository {

    /**
     * 不存在时保存并返回新记录，已存在时返回已有记录
     */
    ApprovalRequest saveIfAbsent(ApprovalRequest request);

    Optional<ApprovalRequest> find(ExecutionId executionId);

    List<ApprovalRequest> findAll();

    /**
     * 删除 respondedAt 早于 cutoff 的终态请求，PENDING 请求不受影响
     *
     * @return 删除数量
     */
    int removeResolvedBefore(LocalDateTime cutoff);
}
