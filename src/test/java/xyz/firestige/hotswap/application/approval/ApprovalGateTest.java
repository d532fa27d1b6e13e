package xyz.firestige.hotswap.application.approval;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import xyz.firestige.hotswap.domain.approval.ApprovalRequest;
import xyz.firestige.hotswap.domain.approval.ApprovalStatus;
import xyz.firestige.hotswap.domain.audit.AuditEvent;
import xyz.firestige.hotswap.domain.audit.AuditEventType;
import xyz.firestige.hotswap.domain.identity.UserIdentity;
import xyz.firestige.hotswap.domain.identity.UserRole;
import xyz.firestige.hotswap.domain.shared.CancellationToken;
import xyz.firestige.hotswap.domain.shared.exception.PipelineCancelledException;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.shared.vo.ExecutionId;
import xyz.firestige.hotswap.domain.shared.vo.ModuleDescriptor;
import xyz.firestige.hotswap.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.hotswap.infrastructure.persistence.approval.InMemoryApprovalRequestRepository;
import xyz.firestige.hotswap.util.RecordingAuditRecorder;
import xyz.firestige.hotswap.util.TestDataFactory;
import xyz.firestige.hotswap.util.TimingExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * 审批闸门测试
 */
@Tag("unit")
@ExtendWith(TimingExtension.class)
@DisplayName("ApprovalGate 单元测试")
class ApprovalGateTest {

    private static final ModuleDescriptor MODULE = ModuleDescriptor.of("billing-service", "2.1.0");
    private static final UserIdentity ADMIN = UserIdentity.admin(TestDataFactory.ADMIN);

    private MutableClock clock;
    private RecordingAuditRecorder audit;
    private ApprovalGate gate;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"));
        audit = new RecordingAuditRecorder();
        gate = new ApprovalGate(new InMemoryApprovalRequestRepository(), audit, new NoopMetricsRegistry(), clock);
    }

    private ApprovalRequest request(ExecutionId id, List<String> approvers) {
        return gate.requestApproval(id, MODULE, EnvironmentType.PRODUCTION, TestDataFactory.REQUESTER,
                approvers, Duration.ofHours(4));
    }

    @Test
    @DisplayName("场景: 同一 executionId 重复请求返回同一条记录")
    void requestApproval_isIdempotent() {
        ExecutionId id = ExecutionId.generate();

        ApprovalRequest first = request(id, List.of());
        ApprovalRequest second = request(id, List.of());

        assertThat(second).isSameAs(first);
        assertThat(first.getStatus()).isEqualTo(ApprovalStatus.PENDING);
        assertThat(first.getTimeoutAt()).isEqualTo(first.getRequestedAt().plusHours(4));
        assertThat(audit.ofType(AuditEventType.APPROVAL_REQUESTED)).hasSize(1);
    }

    @Test
    @DisplayName("场景: 管理员批准后记录审批人和原因")
    void decide_approveRecordsDecision() {
        ExecutionId id = ExecutionId.generate();
        request(id, List.of());

        ApprovalRequest decided = gate.decide(id, ADMIN, true, "change window ok");

        assertThat(decided.getStatus()).isEqualTo(ApprovalStatus.APPROVED);
        assertThat(decided.getRespondedBy()).isEqualTo(TestDataFactory.ADMIN);
        assertThat(decided.describeDecision()).isEqualTo("Approved by ops-admin@example.com. change window ok");
        AuditEvent event = audit.ofType(AuditEventType.APPROVAL_APPROVED).get(0);
        assertThat(event.getActor()).isEqualTo(TestDataFactory.ADMIN);
        assertThat(event.getExecutionId()).isEqualTo(id.getValue());
    }

    @Test
    @DisplayName("场景: 非管理员不能审批")
    void decide_requiresAdmin() {
        ExecutionId id = ExecutionId.generate();
        request(id, List.of());

        assertThatThrownBy(() -> gate.decide(id, UserIdentity.of("dev@example.com", UserRole.DEPLOYER), true, "self"))
                .isInstanceOf(ApprovalAuthorizationException.class);
        assertThat(gate.find(id).orElseThrow().getStatus()).isEqualTo(ApprovalStatus.PENDING);
    }

    @Test
    @DisplayName("场景: 不在审批人白名单中的管理员不能审批")
    void decide_respectsApproverList() {
        ExecutionId id = ExecutionId.generate();
        request(id, List.of("release-manager@example.com"));

        assertThatThrownBy(() -> gate.decide(id, ADMIN, true, "ok"))
                .isInstanceOf(ApprovalAuthorizationException.class);
        assertThat(gate.decide(id, UserIdentity.admin("Release-Manager@example.com"), true, "ok").getStatus())
                .isEqualTo(ApprovalStatus.APPROVED);
    }

    @Test
    @DisplayName("场景: 终态请求不能再次决定")
    void decide_terminalRequestRejected() {
        ExecutionId id = ExecutionId.generate();
        request(id, List.of());
        gate.decide(id, ADMIN, false, "perf regression");

        assertThatThrownBy(() -> gate.decide(id, ADMIN, true, "changed my mind"))
                .isInstanceOf(ApprovalStateException.class);
        assertThat(gate.find(id).orElseThrow().getStatus()).isEqualTo(ApprovalStatus.REJECTED);
    }

    @Test
    @DisplayName("场景: 未知 executionId 抛出 ApprovalNotFoundException")
    void decide_unknownRequest() {
        assertThatThrownBy(() -> gate.decide(ExecutionId.generate(), ADMIN, true, "ok"))
                .isInstanceOf(ApprovalNotFoundException.class);
    }

    @Test
    @DisplayName("场景: 超过 timeoutAt 后决定失败，请求转为 EXPIRED")
    void decide_afterTimeoutExpires() {
        ExecutionId id = ExecutionId.generate();
        request(id, List.of());
        clock.advance(Duration.ofHours(4));

        assertThatThrownBy(() -> gate.decide(id, ADMIN, true, "late"))
                .isInstanceOf(ApprovalStateException.class);
        ApprovalRequest expired = gate.find(id).orElseThrow();
        assertThat(expired.getStatus()).isEqualTo(ApprovalStatus.EXPIRED);
        assertThat(expired.describeDecision()).isEqualTo("Approval request expired after 4 hours");
    }

    @Test
    @DisplayName("场景: listPending 只返回未过期请求并按请求时间排序")
    void listPending_excludesExpiredAndSorts() {
        ExecutionId early = ExecutionId.generate();
        ExecutionId late = ExecutionId.generate();
        ExecutionId decided = ExecutionId.generate();
        request(early, List.of());
        clock.advance(Duration.ofMinutes(10));
        request(late, List.of());
        request(decided, List.of());
        gate.decide(decided, ADMIN, true, "ok");

        assertThat(gate.listPending()).extracting(ApprovalRequest::getDeploymentExecutionId)
                .containsExactly(early, late);

        clock.advance(Duration.ofHours(3).plusMinutes(55));
        assertThat(gate.listPending()).extracting(ApprovalRequest::getDeploymentExecutionId)
                .containsExactly(late);
    }

    @Test
    @DisplayName("场景: processExpired 清理所有过期请求")
    void processExpired_expiresOverdueRequests() {
        request(ExecutionId.generate(), List.of());
        request(ExecutionId.generate(), List.of());
        clock.advance(Duration.ofHours(5));

        assertThat(gate.processExpired()).isEqualTo(2);
        assertThat(gate.processExpired()).isZero();
        assertThat(audit.ofType(AuditEventType.APPROVAL_EXPIRED)).hasSize(2);
    }

    @Test
    @DisplayName("场景: 决定会唤醒等待者")
    void pollUntilResolved_wakesOnDecision() throws Exception {
        ApprovalGate realTime = new ApprovalGate(new InMemoryApprovalRequestRepository(), audit, new NoopMetricsRegistry());
        ExecutionId id = ExecutionId.generate();
        realTime.requestApproval(id, MODULE, EnvironmentType.PRODUCTION, TestDataFactory.REQUESTER,
                List.of(), Duration.ofMinutes(5));

        CompletableFuture<ApprovalRequest> waiter = CompletableFuture.supplyAsync(
                () -> realTime.pollUntilResolved(id, CancellationToken.none()));
        await().during(Duration.ofMillis(50)).atMost(Duration.ofSeconds(1)).until(() -> !waiter.isDone());
        realTime.decide(id, ADMIN, true, "ship it");

        assertThat(waiter.get(2, TimeUnit.SECONDS).getStatus()).isEqualTo(ApprovalStatus.APPROVED);
    }

    @Test
    @DisplayName("场景: 等待到 timeoutAt 后由闸门自行过期")
    void pollUntilResolved_expiresAtTimeout() {
        ApprovalGate realTime = new ApprovalGate(new InMemoryApprovalRequestRepository(), audit, new NoopMetricsRegistry());
        ExecutionId id = ExecutionId.generate();
        realTime.requestApproval(id, MODULE, EnvironmentType.PRODUCTION, TestDataFactory.REQUESTER,
                List.of(), Duration.ofMillis(100));

        ApprovalRequest resolved = realTime.pollUntilResolved(id, CancellationToken.none());

        assertThat(resolved.getStatus()).isEqualTo(ApprovalStatus.EXPIRED);
    }

    @Test
    @DisplayName("场景: 取消会唤醒等待者并抛出取消异常")
    void pollUntilResolved_cancelled() {
        ApprovalGate realTime = new ApprovalGate(new InMemoryApprovalRequestRepository(), audit, new NoopMetricsRegistry());
        ExecutionId id = ExecutionId.generate();
        realTime.requestApproval(id, MODULE, EnvironmentType.PRODUCTION, TestDataFactory.REQUESTER,
                List.of(), Duration.ofMinutes(5));
        CancellationToken token = new CancellationToken(id.getValue());

        CompletableFuture<ApprovalRequest> waiter = CompletableFuture.supplyAsync(
                () -> realTime.pollUntilResolved(id, token));
        await().during(Duration.ofMillis(50)).atMost(Duration.ofSeconds(1)).until(() -> !waiter.isDone());
        token.cancel("operator abort");

        assertThatThrownBy(() -> waiter.get(2, TimeUnit.SECONDS))
                .hasCauseInstanceOf(PipelineCancelledException.class);
        assertThat(realTime.find(id).orElseThrow().getStatus()).isEqualTo(ApprovalStatus.PENDING);
    }

    @Test
    @DisplayName("场景: 请求定型后等待队列被移除")
    void resolvedRequest_releasesWaiter() throws Exception {
        // Given
        ApprovalGate realTime = new ApprovalGate(new InMemoryApprovalRequestRepository(), audit, new NoopMetricsRegistry());
        ExecutionId approved = ExecutionId.generate();
        ExecutionId expired = ExecutionId.generate();
        realTime.requestApproval(approved, MODULE, EnvironmentType.PRODUCTION, TestDataFactory.REQUESTER,
                List.of(), Duration.ofMinutes(5));
        realTime.requestApproval(expired, MODULE, EnvironmentType.STAGING, TestDataFactory.REQUESTER,
                List.of(), Duration.ofMillis(50));
        CompletableFuture<ApprovalRequest> waiter = CompletableFuture.supplyAsync(
                () -> realTime.pollUntilResolved(approved, CancellationToken.none()));
        await().atMost(Duration.ofSeconds(1)).until(() -> realTime.waiterCount() >= 1);

        // When
        realTime.decide(approved, ADMIN, true, "ship it");
        waiter.get(2, TimeUnit.SECONDS);
        realTime.pollUntilResolved(expired, CancellationToken.none());

        // Then
        assertThat(realTime.waiterCount()).isZero();
    }

    @Test
    @DisplayName("场景: 超过保留期的终态请求被清理，PENDING 请求保留")
    void purgeResolved_removesOldTerminalRequests() {
        // Given
        ExecutionId decided = ExecutionId.generate();
        ExecutionId recent = ExecutionId.generate();
        ExecutionId pending = ExecutionId.generate();
        request(decided, List.of());
        gate.decide(decided, ADMIN, false, "not this week");
        clock.advance(Duration.ofDays(8));
        request(recent, List.of());
        gate.decide(recent, ADMIN, true, "ok");
        gate.requestApproval(pending, MODULE, EnvironmentType.PRODUCTION, TestDataFactory.REQUESTER,
                List.of(), Duration.ofDays(30));

        // When
        int purged = gate.purgeResolved(Duration.ofDays(7));

        // Then
        assertThat(purged).isEqualTo(1);
        assertThat(gate.find(decided)).isEmpty();
        assertThat(gate.find(recent)).isPresent();
        assertThat(gate.find(pending)).isPresent();
        assertThat(gate.listPending()).extracting(ApprovalRequest::getDeploymentExecutionId).containsExactly(pending);
    }

    /**
     * 可手动推进的时钟
     */
    private static final class MutableClock extends Clock {

        private volatile Instant now;

        private MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
