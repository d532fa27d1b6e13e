package xyz.firestige.hotswap.infrastructure.execution.rollout;

import xyz.firestige.hotswap.domain.cluster.ModuleDeployer;
import xyz.firestige.hotswap.domain.health.ClusterHealthProbe;
import xyz.firestige.hotswap.domain.health.HealthEvaluator;
import xyz.firestige.hotswap.domain.pipeline.RolloutStrategyType;

import java.util.EnumMap;
import java.util.Map;

/**
 * 发布策略工厂：按配置的策略类型选择实现
 */
public class RolloutStrategyFactory {

    private final Map<RolloutStrategyType, RolloutStrategy> strategies = new EnumMap<>(RolloutStrategyType.class);

    public RolloutStrategyFactory(ModuleDeployer deployer, ClusterHealthProbe probe, HealthEvaluator evaluator) {
        for (RolloutStrategyType type : RolloutStrategyType.values()) {
            strategies.put(type, switch (type) {
                case DIRECT -> new DirectRolloutStrategy(deployer, probe, evaluator);
                case CANARY, PROGRESSIVE -> new CanaryRolloutStrategy(type, deployer, probe, evaluator);
                case ROLLING -> new RollingRolloutStrategy(deployer, probe, evaluator);
                case BLUE_GREEN -> new BlueGreenRolloutStrategy(deployer, probe, evaluator);
            });
        }
    }

    public RolloutStrategy create(RolloutStrategyType type) {
        RolloutStrategy strategy = strategies.get(type);
        if (strategy == null) {
            throw new IllegalArgumentException("未知的发布策略: " + type);
        }
        return strategy;
    }
}
