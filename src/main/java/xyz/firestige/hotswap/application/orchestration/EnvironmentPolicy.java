package xyz.firestige.hotswap.application.orchestration;

import xyz.firestige.hotswap.domain.pipeline.RolloutStrategyType;

import java.time.Duration;
import java.util.List;

/**
 * 单个环境的发布策略
 *
 * @param strategy         发布策略
 * @param requireApproval  该环境是否纳入审批；仅当请求要求审批时生效
 * @param batches          渐进式发布的百分比批次（PROGRESSIVE 使用）
 * @param waitDuration     步骤间等待；为 null 时取全局 canary 等待
 * @param smokeTestTimeout 蓝绿冒烟检查超时；为 null 时取全局值
 */
public record EnvironmentPolicy(RolloutStrategyType strategy,
                                boolean requireApproval,
                                List<Integer> batches,
                                Duration waitDuration,
                                Duration smokeTestTimeout) {

    public EnvironmentPolicy {
        if (strategy == null) {
            throw new IllegalArgumentException("发布策略不能为空");
        }
        batches = batches != null ? List.copyOf(batches) : List.of();
    }

    public static EnvironmentPolicy of(RolloutStrategyType strategy, boolean requireApproval) {
        return new EnvironmentPolicy(strategy, requireApproval, List.of(), null, null);
    }

    public EnvironmentPolicy withBatches(List<Integer> newBatches) {
        return new EnvironmentPolicy(strategy, requireApproval, newBatches, waitDuration, smokeTestTimeout);
    }

    public EnvironmentPolicy withWaitDuration(Duration newWait) {
        return new EnvironmentPolicy(strategy, requireApproval, batches, newWait, smokeTestTimeout);
    }

    public EnvironmentPolicy withRequireApproval(boolean approval) {
        return new EnvironmentPolicy(strategy, approval, batches, waitDuration, smokeTestTimeout);
    }
}
