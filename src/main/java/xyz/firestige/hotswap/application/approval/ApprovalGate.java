package xyz.firestige.hotswap.application.approval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.hotswap.domain.approval.ApprovalRequest;
import xyz.firestige.hotswap.domain.approval.ApprovalRequestRepository;
import xyz.firestige.hotswap.domain.approval.ApprovalStatus;
import xyz.firestige.hotswap.domain.audit.AuditEvent;
import xyz.firestige.hotswap.domain.audit.AuditEventType;
import xyz.firestige.hotswap.domain.audit.AuditRecorder;
import xyz.firestige.hotswap.domain.identity.UserIdentity;
import xyz.firestige.hotswap.domain.shared.CancellationToken;
import xyz.firestige.hotswap.domain.shared.exception.PipelineCancelledException;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.shared.vo.ExecutionId;
import xyz.firestige.hotswap.domain.shared.vo.ModuleDescriptor;
import xyz.firestige.hotswap.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.hotswap.infrastructure.metrics.NoopMetricsRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 审批闸门
 * <p>
 * 状态机：PENDING → {APPROVED, REJECTED, EXPIRED}（终态）。
 * <ul>
 *   <li>{@link #requestApproval} 按 executionId 幂等</li>
 *   <li>{@link #decide} 只允许管理员，且只能作用于 PENDING 请求</li>
 *   <li>{@link #pollUntilResolved} 在按 executionId 划分的条件队列上等待，超时时间为距 timeoutAt 的剩余时长，
 *       决定、过期、取消都会唤醒等待者</li>
 * </ul>
 * 每次状态转换都写入审计（executionId、旧/新状态、操作人）。
 */
public class ApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

    private final ApprovalRequestRepository repository;
    private final AuditRecorder auditRecorder;
    private final MetricsRegistry metrics;
    private final Clock clock;
    private final Map<ExecutionId, Waiter> waiters = new ConcurrentHashMap<>();

    public ApprovalGate(ApprovalRequestRepository repository, AuditRecorder auditRecorder, MetricsRegistry metrics) {
        this(repository, auditRecorder, metrics, Clock.systemDefaultZone());
    }

    public ApprovalGate(ApprovalRequestRepository repository,
                        AuditRecorder auditRecorder,
                        MetricsRegistry metrics,
                        Clock clock) {
        this.repository = repository;
        this.auditRecorder = auditRecorder;
        this.metrics = metrics != null ? metrics : new NoopMetricsRegistry();
        this.clock = clock;
    }

    /**
     * 创建审批请求；同一 executionId 已存在请求时返回已有记录
     */
    public ApprovalRequest requestApproval(ExecutionId executionId,
                                           ModuleDescriptor module,
                                           EnvironmentType environment,
                                           String requesterEmail,
                                           List<String> approverEmails,
                                           Duration timeout) {
        ApprovalRequest candidate = new ApprovalRequest(executionId, module.getName(), module.getVersion(),
                environment, requesterEmail, approverEmails, now(), timeout);
        ApprovalRequest stored = repository.saveIfAbsent(candidate);
        if (stored == candidate) {
            log.info("[ApprovalGate] 创建审批请求: {}, 环境: {}, 超时时间: {}",
                    executionId, environment, stored.getTimeoutAt());
            audit(AuditEventType.APPROVAL_REQUESTED, stored, requesterEmail, null,
                    String.format("请求审批 %s@%s 进入 %s", module.getName(), module.getVersion(), environment));
        } else {
            log.debug("[ApprovalGate] 审批请求已存在，复用: {}, 状态: {}", executionId, stored.getStatus());
        }
        return stored;
    }

    /**
     * 审批决定
     *
     * @throws ApprovalAuthorizationException 非管理员，或不在审批人白名单内
     * @throws ApprovalNotFoundException      没有该 executionId 的审批请求
     * @throws ApprovalStateException         请求已处于终态（含刚刚过期）
     */
    public ApprovalRequest decide(ExecutionId executionId, UserIdentity approver, boolean approved, String reason) {
        if (approver == null || !approver.isAdmin()) {
            throw new ApprovalAuthorizationException(executionId.getValue(),
                    "只有管理员可以审批: " + (approver != null ? approver.email() : "anonymous"));
        }
        ApprovalRequest request = repository.find(executionId)
                .orElseThrow(() -> new ApprovalNotFoundException(executionId.getValue(),
                        "审批请求不存在: " + executionId));

        Waiter waiter = waiterFor(executionId);
        waiter.lock.lock();
        try {
            LocalDateTime now = now();
            if (request.isExpiredAt(now)) {
                expireLocked(request, now, waiter);
            }
            if (request.getStatus() != ApprovalStatus.PENDING) {
                throw new ApprovalStateException(executionId.getValue(), String.format(
                        "审批请求已处于终态，不能再次决定: %s, 当前状态: %s", executionId, request.getStatus()));
            }
            if (!request.isAllowedApprover(approver.email())) {
                throw new ApprovalAuthorizationException(executionId.getValue(),
                        "审批人不在该请求的审批人列表中: " + approver.email());
            }
            if (approved) {
                request.approve(approver.email(), reason, now);
                audit(AuditEventType.APPROVAL_APPROVED, request, approver.email(), ApprovalStatus.PENDING,
                        request.describeDecision());
            } else {
                request.reject(approver.email(), reason, now);
                audit(AuditEventType.APPROVAL_REJECTED, request, approver.email(), ApprovalStatus.PENDING,
                        request.describeDecision());
            }
            log.info("[ApprovalGate] 审批已决定: {}, {}", executionId, request.describeDecision());
            waiter.resolved.signalAll();
            return request;
        } finally {
            waiter.lock.unlock();
            releaseWaiterIfResolved(request, waiter);
        }
    }

    /**
     * 阻塞直到请求离开 PENDING，或到达 timeoutAt（此时由闸门自己转为 EXPIRED）
     *
     * @throws PipelineCancelledException 等待期间被取消
     */
    public ApprovalRequest pollUntilResolved(ExecutionId executionId, CancellationToken token) {
        ApprovalRequest request = repository.find(executionId)
                .orElseThrow(() -> new ApprovalNotFoundException(executionId.getValue(),
                        "审批请求不存在: " + executionId));
        CancellationToken cancellation = token != null ? token : CancellationToken.none();
        Waiter waiter = waiterFor(executionId);
        Runnable wakeUp = () -> {
            waiter.lock.lock();
            try {
                waiter.resolved.signalAll();
            } finally {
                waiter.lock.unlock();
            }
        };
        cancellation.onCancel(wakeUp);
        waiter.lock.lock();
        try {
            while (request.getStatus() == ApprovalStatus.PENDING) {
                cancellation.throwIfCancelled();
                LocalDateTime now = now();
                Duration remaining = Duration.between(now, request.getTimeoutAt());
                if (remaining.isZero() || remaining.isNegative()) {
                    expireLocked(request, now, waiter);
                    break;
                }
                try {
                    waiter.resolved.await(remaining.toNanos(), TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PipelineCancelledException(executionId.getValue(), "等待审批时线程被中断");
                }
            }
            return request;
        } finally {
            waiter.lock.unlock();
            cancellation.removeCallback(wakeUp);
            releaseWaiterIfResolved(request, waiter);
        }
    }

    /**
     * 未过期的 PENDING 请求，按 requestedAt 排序
     */
    public List<ApprovalRequest> listPending() {
        LocalDateTime now = now();
        return repository.findAll().stream()
                .filter(r -> r.isPendingAt(now))
                .sorted(Comparator.comparing(ApprovalRequest::getRequestedAt))
                .collect(Collectors.toList());
    }

    public Optional<ApprovalRequest> find(ExecutionId executionId) {
        return repository.find(executionId);
    }

    /**
     * 把所有已过 timeoutAt 的 PENDING 请求转为 EXPIRED，并唤醒等待者
     *
     * @return 本次过期的请求数
     */
    public int processExpired() {
        int expired = 0;
        LocalDateTime now = now();
        for (ApprovalRequest request : repository.findAll()) {
            if (!request.isExpiredAt(now)) {
                continue;
            }
            Waiter waiter = waiterFor(request.getDeploymentExecutionId());
            waiter.lock.lock();
            try {
                if (request.isExpiredAt(now)) {
                    expireLocked(request, now, waiter);
                    expired++;
                }
            } finally {
                waiter.lock.unlock();
                releaseWaiterIfResolved(request, waiter);
            }
        }
        if (expired > 0) {
            log.info("[ApprovalGate] 清理过期审批请求: {} 个", expired);
        }
        return expired;
    }

    /**
     * 删除决定时间早于 now - retention 的终态请求
     *
     * @return 删除的请求数
     */
    public int purgeResolved(Duration retention) {
        LocalDateTime cutoff = now().minus(retention);
        int purged = repository.removeResolvedBefore(cutoff);
        if (purged > 0) {
            log.info("[ApprovalGate] 清理已决审批请求: {} 个, 决定时间早于 {}", purged, cutoff);
        }
        return purged;
    }

    /**
     * 当前持有的等待队列数量
     */
    int waiterCount() {
        return waiters.size();
    }

    private void expireLocked(ApprovalRequest request, LocalDateTime now, Waiter waiter) {
        long hours = Duration.between(request.getRequestedAt(), request.getTimeoutAt()).toHours();
        request.expire(String.format("超过 %d 小时未审批", hours), now);
        metrics.incrementCounter(MetricsRegistry.APPROVAL_EXPIRED);
        audit(AuditEventType.APPROVAL_EXPIRED, request, "system", ApprovalStatus.PENDING, request.describeDecision());
        log.warn("[ApprovalGate] 审批请求已过期: {}", request.getDeploymentExecutionId());
        waiter.resolved.signalAll();
    }

    private void audit(AuditEventType type, ApprovalRequest request, String actor,
                       ApprovalStatus from, String message) {
        try {
            auditRecorder.record(AuditEvent.builder(type)
                    .executionId(request.getDeploymentExecutionId())
                    .moduleName(request.getModuleName())
                    .environment(request.getTargetEnvironment())
                    .actor(actor)
                    .transition(from, request.getStatus())
                    .message(message)
                    .build());
        } catch (RuntimeException e) {
            log.warn("[ApprovalGate] 审计写入失败: {}", type, e);
        }
    }

    private Waiter waiterFor(ExecutionId executionId) {
        return waiters.computeIfAbsent(executionId, id -> new Waiter());
    }

    /**
     * 终态请求不会再有等待者需要唤醒，移除其条件队列
     */
    private void releaseWaiterIfResolved(ApprovalRequest request, Waiter waiter) {
        if (request.getStatus() != ApprovalStatus.PENDING) {
            waiters.remove(request.getDeploymentExecutionId(), waiter);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static final class Waiter {
        private final ReentrantLock lock = new ReentrantLock();
        private final Condition resolved = lock.newCondition();
    }
}
