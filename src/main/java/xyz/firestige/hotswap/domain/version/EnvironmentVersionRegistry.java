package xyz.firestige.hotswap.domain.version;

import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;

import java.util.Optional;

/**
 * 环境版本登记簿
 * <p>
 * 记录每个 (模块, 环境) 的当前版本与上一个已知良好版本。
 * 回滚目标取自这里，回滚成功后把它恢复为当前版本。
 */
public interface EnvironmentVersionRegistry {

    Optional<String> currentVersion(String moduleName, EnvironmentType environment);

    Optional<String> previousVersion(String moduleName, EnvironmentType environment);

    /**
     * 部署成功：原当前版本成为上一个已知良好版本
     */
    void recordDeployed(String moduleName, EnvironmentType environment, String version);

    /**
     * 回滚成功：恢复为指定版本，version 为 null 表示模块已移除
     */
    void recordRestored(String moduleName, EnvironmentType environment, String version);

    /**
     * 回滚失败后标记为降级（未知状态）
     */
    void markDegraded(String moduleName, EnvironmentType environment, boolean degraded);

    boolean isDegraded(String moduleName, EnvironmentType environment);

    /**
     * 是否存在任何降级环境
     */
    boolean hasDegradedEnvironment();
}
