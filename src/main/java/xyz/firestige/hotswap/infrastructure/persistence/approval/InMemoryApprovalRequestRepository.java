package xyz.firestige.hotswap.infrastructure.persistence.approval;

import xyz.firestige.hotswap.domain.approval.ApprovalRequest;
import xyz.firestige.hotswap.domain.approval.ApprovalRequestRepository;
import xyz.firestige.hotswap.domain.approval.ApprovalStatus;
import xyz.firestige.hotswap.domain.shared.vo.ExecutionId;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 审批请求内存仓储
 */
public class InMemoryApprovalRequestRepository implements ApprovalRequestRepository {

    private final Map<ExecutionId, ApprovalRequest> requests = new ConcurrentHashMap<>();

    @Override
    public ApprovalRequest saveIfAbsent(ApprovalRequest request) {
        ApprovalRequest existing = requests.putIfAbsent(request.getDeploymentExecutionId(), request);
        return existing != null ? existing : request;
    }

    @Override
    public Optional<ApprovalRequest> find(ExecutionId executionId) {
        return Optional.ofNullable(requests.get(executionId));
    }

    @Override
    public List<ApprovalRequest> findAll() {
        return new ArrayList<>(requests.values());
    }

    @Override
    public int removeResolvedBefore(LocalDateTime cutoff) {
        int removed = 0;
        Iterator<ApprovalRequest> it = requests.values().iterator();
        while (it.hasNext()) {
            ApprovalRequest r = it.next();
            if (r.getStatus() != ApprovalStatus.PENDING
                    && r.getRespondedAt() != null
                    && r.getRespondedAt().isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }
}
