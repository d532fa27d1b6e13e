package xyz.firestige.hotswap.facade;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.hotswap.application.approval.ApprovalGate;
import xyz.firestige.hotswap.application.orchestration.DeploymentNotFoundException;
import xyz.firestige.hotswap.application.orchestration.PipelineOrchestrator;
import xyz.firestige.hotswap.domain.approval.ApprovalRequest;
import xyz.firestige.hotswap.domain.identity.UserIdentity;
import xyz.firestige.hotswap.domain.pipeline.DeploymentRequest;
import xyz.firestige.hotswap.domain.pipeline.PipelineStatus;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.shared.vo.ExecutionId;
import xyz.firestige.hotswap.domain.shared.vo.ModuleDescriptor;
import xyz.firestige.hotswap.facade.exception.DeploymentValidationException;
import xyz.firestige.hotswap.infrastructure.persistence.projection.PipelineExecutionView;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * 部署 Facade
 * <p>
 * 职责：
 * 1. 参数校验（快速失败，一次性报告所有违规项）
 * 2. 外部命令 → 内部 {@link DeploymentRequest}
 * 3. 调用编排器和审批闸门
 * <p>
 * 每个方法对应一个 HTTP 端点，由外层控制器直接委托；错误通过异常表达：
 * {@link DeploymentValidationException} → 400，{@link DeploymentNotFoundException} → 404。
 */
public class DeploymentFacade {

    private static final Logger logger = LoggerFactory.getLogger(DeploymentFacade.class);

    private final PipelineOrchestrator orchestrator;
    private final ApprovalGate approvalGate;
    private final Validator validator;

    public DeploymentFacade(PipelineOrchestrator orchestrator, ApprovalGate approvalGate, Validator validator) {
        this.orchestrator = orchestrator;
        this.approvalGate = approvalGate;
        this.validator = validator;
    }

    /**
     * POST /deployments
     */
    public DeploymentAccepted submitDeployment(CreateDeploymentCommand command) {
        if (command == null) {
            throw new DeploymentValidationException(List.of("请求体不能为空"));
        }
        logger.info("[Facade] 提交部署: {}@{} -> {}",
                command.getModuleName(), command.getVersion(), command.getTargetEnvironment());

        Set<ConstraintViolation<CreateDeploymentCommand>> violations = validator.validate(command);
        if (!violations.isEmpty()) {
            List<String> details = violations.stream()
                    .map(v -> String.format("[%s] %s", v.getPropertyPath(), v.getMessage()))
                    .sorted()
                    .collect(Collectors.toList());
            logger.warn("[Facade] 部署请求校验失败: {}", String.join("; ", details));
            throw new DeploymentValidationException(details);
        }

        DeploymentRequest request = toRequest(command);
        ExecutionId executionId = orchestrator.submit(request);
        logger.info("[Facade] 部署已受理: {}", executionId);
        return DeploymentAccepted.of(executionId.getValue(), PipelineStatus.RUNNING.name());
    }

    private DeploymentRequest toRequest(CreateDeploymentCommand command) {
        try {
            return DeploymentRequest.builder()
                    .executionId(ExecutionId.generate())
                    .module(ModuleDescriptor.of(command.getModuleName(), command.getVersion(),
                            command.getDescription(), command.getRequesterEmail()))
                    .targetEnvironment(parseEnvironment(command.getTargetEnvironment()))
                    .environmentChain(command.getEnvironmentChain() == null ? List.of()
                            : command.getEnvironmentChain().stream()
                                    .map(this::parseEnvironment)
                                    .collect(Collectors.toList()))
                    .requesterEmail(command.getRequesterEmail())
                    .requireApproval(command.isRequireApproval())
                    .metadata(command.getMetadata() != null ? command.getMetadata() : Map.of())
                    .build();
        } catch (IllegalArgumentException e) {
            logger.warn("[Facade] 部署请求不合法: {}", e.getMessage());
            throw new DeploymentValidationException(List.of(e.getMessage()));
        }
    }

    private EnvironmentType parseEnvironment(String name) {
        return EnvironmentType.parse(name)
                .orElseThrow(() -> new IllegalArgumentException("未知环境: " + name));
    }

    /**
     * GET /deployments/{executionId}
     */
    public PipelineExecutionView getDeployment(String executionId) {
        return orchestrator.getResult(ExecutionId.of(executionId))
                .orElseThrow(() -> new DeploymentNotFoundException(executionId));
    }

    /**
     * POST /deployments/{executionId}/rollback
     */
    public CompletableFuture<PipelineStatus> requestRollback(String executionId, String actor, String reason) {
        logger.info("[Facade] 请求回滚: {}, 操作人: {}", executionId, actor);
        return orchestrator.rollbackDeployment(ExecutionId.of(executionId), actor, reason);
    }

    public boolean cancelDeployment(String executionId, String reason) {
        logger.info("[Facade] 取消部署: {}, 原因: {}", executionId, reason);
        return orchestrator.cancel(ExecutionId.of(executionId), reason);
    }

    /**
     * GET /approvals/pending
     */
    public List<ApprovalRequest> listPendingApprovals() {
        return approvalGate.listPending();
    }

    /**
     * POST /approvals/deployments/{executionId}/approve
     */
    public ApprovalRequest approve(String executionId, UserIdentity approver, String reason) {
        logger.info("[Facade] 审批通过: {}, 审批人: {}", executionId, approver != null ? approver.email() : null);
        return approvalGate.decide(ExecutionId.of(executionId), approver, true, reason);
    }

    /**
     * POST /approvals/deployments/{executionId}/reject
     */
    public ApprovalRequest reject(String executionId, UserIdentity approver, String reason) {
        logger.info("[Facade] 审批拒绝: {}, 审批人: {}", executionId, approver != null ? approver.email() : null);
        return approvalGate.decide(ExecutionId.of(executionId), approver, false, reason);
    }
}
