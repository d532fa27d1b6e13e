package xyz.firestige.hotswap.domain.approval;

import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.shared.vo.ExecutionId;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * 审批请求
 * <p>
 * 阶段需要审批时创建，每个 executionId 最多一条。
 * 只有管理员可以把 PENDING 转为 APPROVED/REJECTED；
 * 系统在超过 timeoutAt 后将其转为 EXPIRED。
 */
public class ApprovalRequest {

    private final String approvalId;
    private final ExecutionId deploymentExecutionId;
    private final String moduleName;
    private final String version;
    private final EnvironmentType targetEnvironment;
    private final String requesterEmail;
    private final List<String> approverEmails;
    private final LocalDateTime requestedAt;
    private final LocalDateTime timeoutAt;

    private volatile ApprovalStatus status;
    private volatile LocalDateTime respondedAt;
    private volatile String respondedBy;
    private volatile String responseReason;

    public ApprovalRequest(ExecutionId deploymentExecutionId,
                           String moduleName,
                           String version,
                           EnvironmentType targetEnvironment,
                           String requesterEmail,
                           List<String> approverEmails,
                           LocalDateTime requestedAt,
                           Duration timeout) {
        this.approvalId = UUID.randomUUID().toString();
        this.deploymentExecutionId = deploymentExecutionId;
        this.moduleName = moduleName;
        this.version = version;
        this.targetEnvironment = targetEnvironment;
        this.requesterEmail = requesterEmail;
        this.approverEmails = approverEmails != null ? List.copyOf(approverEmails) : List.of();
        this.requestedAt = requestedAt;
        this.timeoutAt = requestedAt.plus(timeout);
        this.status = ApprovalStatus.PENDING;
    }

    // ========== 状态转换 ==========

    public void approve(String approver, String reason, LocalDateTime now) {
        transition(ApprovalStatus.APPROVED, approver, reason, now);
    }

    public void reject(String approver, String reason, LocalDateTime now) {
        transition(ApprovalStatus.REJECTED, approver, reason, now);
    }

    public void expire(String reason, LocalDateTime now) {
        transition(ApprovalStatus.EXPIRED, "system", reason, now);
    }

    private void transition(ApprovalStatus target, String actor, String reason, LocalDateTime now) {
        if (status != ApprovalStatus.PENDING) {
            throw new IllegalStateException(String.format(
                    "只有 PENDING 状态的审批可以转为 %s, 当前状态: %s, executionId: %s",
                    target, status, deploymentExecutionId));
        }
        this.status = target;
        this.respondedBy = actor;
        this.responseReason = reason;
        this.respondedAt = now;
    }

    // ========== 查询 ==========

    public boolean isExpiredAt(LocalDateTime now) {
        return status == ApprovalStatus.PENDING && !now.isBefore(timeoutAt);
    }

    public boolean isPendingAt(LocalDateTime now) {
        return status == ApprovalStatus.PENDING && now.isBefore(timeoutAt);
    }

    /**
     * 审批人白名单为空时不限制
     */
    public boolean isAllowedApprover(String email) {
        return approverEmails.isEmpty()
                || approverEmails.stream().anyMatch(a -> a.equalsIgnoreCase(email));
    }

    /**
     * 阶段消息：Approved by x. reason / Rejected by x. reason / expired after n hours
     */
    public String describeDecision() {
        switch (status) {
            case APPROVED:
                return String.format("Approved by %s. %s", respondedBy, nullToEmpty(responseReason)).trim();
            case REJECTED:
                return String.format("Rejected by %s. %s", respondedBy, nullToEmpty(responseReason)).trim();
            case EXPIRED:
                long hours = Duration.between(requestedAt, timeoutAt).toHours();
                return String.format("Approval request expired after %d hours", hours);
            default:
                return "Approval pending";
        }
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }

    public String getApprovalId() { return approvalId; }
    public ExecutionId getDeploymentExecutionId() { return deploymentExecutionId; }
    public String getModuleName() { return moduleName; }
    public String getVersion() { return version; }
    public EnvironmentType getTargetEnvironment() { return targetEnvironment; }
    public String getRequesterEmail() { return requesterEmail; }
    public List<String> getApproverEmails() { return approverEmails; }
    public ApprovalStatus getStatus() { return status; }
    public LocalDateTime getRequestedAt() { return requestedAt; }
    public LocalDateTime getTimeoutAt() { return timeoutAt; }
    public LocalDateTime getRespondedAt() { return respondedAt; }
    public String getRespondedBy() { return respondedBy; }
    public String getResponseReason() { return responseReason; }

    @Override
    public String toString() {
        return "ApprovalRequest{" +
                "approvalId='" + approvalId + '\'' +
                ", executionId=" + deploymentExecutionId +
                ", module='" + moduleName + '@' + version + '\'' +
                ", targetEnvironment=" + targetEnvironment +
                ", status=" + status +
                ", timeoutAt=" + timeoutAt +
                '}';
    }
}
