package xyz.firestige.hotswap.infrastructure.execution.rollout;

import xyz.firestige.hotswap.domain.pipeline.RolloutStrategyType;

/**
 * 发布策略：把模块按步骤推向目标环境，步骤之间重新评估健康状况
 * <p>
 * 策略集合是封闭的（见 {@link RolloutStrategyType}），由 {@link RolloutStrategyFactory} 按配置选择。
 * 所有实现都支持在步骤之间中止：取消或健康越界都以失败的 {@link StageOutcome} 返回，不向外抛出。
 */
public interface RolloutStrategy {

    RolloutStrategyType getType();

    StageOutcome execute(RolloutContext context);
}
