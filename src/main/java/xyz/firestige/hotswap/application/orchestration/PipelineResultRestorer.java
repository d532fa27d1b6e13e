package xyz.firestige.hotswap.application.orchestration;

import xyz.firestige.hotswap.domain.pipeline.DeploymentRequest;
import xyz.firestige.hotswap.domain.pipeline.PipelineExecutionResult;
import xyz.firestige.hotswap.domain.pipeline.RolloutStrategyType;
import xyz.firestige.hotswap.domain.pipeline.StageResult;
import xyz.firestige.hotswap.domain.pipeline.StageStatus;
import xyz.firestige.hotswap.domain.shared.exception.ErrorType;
import xyz.firestige.hotswap.domain.shared.exception.FailureInfo;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.shared.vo.ExecutionId;
import xyz.firestige.hotswap.domain.shared.vo.ModuleDescriptor;
import xyz.firestige.hotswap.infrastructure.persistence.projection.PipelineExecutionView;
import xyz.firestige.hotswap.infrastructure.persistence.projection.StageView;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 把结果存储中的投影还原为领域对象
 * <p>
 * 只用于已回收句柄的终态流水线：回滚需要阶段记录（策略、上一个版本、发布节点数）。
 * 原请求的显式环境链不在投影里，恢复后按目标环境推导。
 */
final class PipelineResultRestorer {

    private PipelineResultRestorer() {
    }

    static PipelineExecutionResult restore(PipelineExecutionView view) {
        DeploymentRequest request = DeploymentRequest.builder()
                .executionId(ExecutionId.ofTrusted(view.getExecutionId()))
                .module(ModuleDescriptor.ofTrusted(view.getModuleName(), view.getVersion()))
                .targetEnvironment(EnvironmentType.valueOf(view.getTargetEnvironment()))
                .requesterEmail(view.getRequesterEmail())
                .build();
        List<StageResult> stages = view.getStages() == null ? List.of()
                : view.getStages().stream().map(PipelineResultRestorer::restoreStage).collect(Collectors.toList());
        return PipelineExecutionResult.restore(request, view.getTraceId(), view.getStatus(), view.getMessage(),
                view.isDegraded(), view.getStartTime(), view.getEndTime(), stages);
    }

    private static StageResult restoreStage(StageView v) {
        EnvironmentType environment = EnvironmentType.valueOf(v.getStageName());
        LocalDateTime start = v.getStartTime();
        LocalDateTime end = start != null ? start.plusNanos(v.getDurationMillis() * 1_000_000L) : null;
        FailureInfo failure = v.getErrorType() != null
                ? FailureInfo.of(ErrorType.valueOf(v.getErrorType()), v.getMessage(), v.getStageName())
                : null;
        return StageResult.restore(environment,
                v.getStrategy() != null ? RolloutStrategyType.valueOf(v.getStrategy()) : null,
                v.getAttemptedVersion(), v.isRollbackStage(), StageStatus.valueOf(v.getStatus()),
                v.getPreviousVersion(), v.getNodesDeployed(), v.getNodesFailed(), v.getMessage(),
                failure, start, end);
    }
}
