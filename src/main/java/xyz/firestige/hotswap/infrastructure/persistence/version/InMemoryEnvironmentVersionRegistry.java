package xyz.firestige.hotswap.infrastructure.persistence.version;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.hotswap.domain.shared.vo.EnvironmentType;
import xyz.firestige.hotswap.domain.version.EnvironmentVersionRegistry;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 环境版本登记簿内存实现
 */
public class InMemoryEnvironmentVersionRegistry implements EnvironmentVersionRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEnvironmentVersionRegistry.class);

    private final Map<String, VersionSlot> slots = new ConcurrentHashMap<>();

    @Override
    public Optional<String> currentVersion(String moduleName, EnvironmentType environment) {
        VersionSlot slot = slots.get(key(moduleName, environment));
        return slot != null ? Optional.ofNullable(slot.current) : Optional.empty();
    }

    @Override
    public Optional<String> previousVersion(String moduleName, EnvironmentType environment) {
        VersionSlot slot = slots.get(key(moduleName, environment));
        return slot != null ? Optional.ofNullable(slot.previous) : Optional.empty();
    }

    @Override
    public void recordDeployed(String moduleName, EnvironmentType environment, String version) {
        slots.compute(key(moduleName, environment), (k, old) -> {
            String previous = old != null ? old.current : null;
            return new VersionSlot(version, previous, false);
        });
        log.info("[VersionRegistry] 记录部署版本: {} {} -> {}", moduleName, environment, version);
    }

    @Override
    public void recordRestored(String moduleName, EnvironmentType environment, String version) {
        slots.compute(key(moduleName, environment), (k, old) -> {
            // 恢复后上一个版本已无意义，保留被回滚掉之前的上一版
            String previous = old != null && version != null && !version.equals(old.previous) ? old.previous : null;
            return new VersionSlot(version, previous, false);
        });
        log.info("[VersionRegistry] 回滚恢复版本: {} {} -> {}", moduleName, environment, version);
    }

    @Override
    public void markDegraded(String moduleName, EnvironmentType environment, boolean degraded) {
        slots.compute(key(moduleName, environment), (k, old) -> old != null
                ? new VersionSlot(old.current, old.previous, degraded)
                : new VersionSlot(null, null, degraded));
        if (degraded) {
            log.error("[VersionRegistry] 环境被标记为降级: {} {}", moduleName, environment);
        }
    }

    @Override
    public boolean isDegraded(String moduleName, EnvironmentType environment) {
        VersionSlot slot = slots.get(key(moduleName, environment));
        return slot != null && slot.degraded;
    }

    @Override
    public boolean hasDegradedEnvironment() {
        return slots.values().stream().anyMatch(s -> s.degraded);
    }

    private static String key(String moduleName, EnvironmentType environment) {
        return moduleName + ":" + environment.name();
    }

    private static final class VersionSlot {
        private final String current;
        private final String previous;
        private final boolean degraded;

        private VersionSlot(String current, String previous, boolean degraded) {
            this.current = current;
            this.previous = previous;
            this.degraded = degraded;
        }
    }
}
