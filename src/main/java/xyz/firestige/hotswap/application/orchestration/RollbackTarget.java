package xyz.firestige.hotswap.application.orchestration;

import xyz.firestige.hotswap.domain.pipeline.RolloutStrategyType;
import xyz.firestige.hotswap.domain.pipeline.StageResult;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.shared.vo.ExecutionId;
import xyz.firestige.hotswap.domain.shared.vo.ModuleDescriptor;

/**
 * 一次回滚的目标
 *
 * @param executionId    所属流水线
 * @param failedModule   需要撤下的模块版本
 * @param environment    目标环境
 * @param strategy       沿用该阶段的发布策略
 * @param restoreVersion 上一个已知良好版本；为 null 表示该环境之前没有此模块，回滚即移除
 * @param record         记录回滚步骤的阶段结果
 * @param actor          发起人
 */
public record RollbackTarget(ExecutionId executionId,
                             ModuleDescriptor failedModule,
                             EnvironmentType environment,
                             RolloutStrategyType strategy,
                             String restoreVersion,
                             StageResult record,
                             String actor) {
}
