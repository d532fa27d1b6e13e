package xyz.firestige.hotswap.domain.shared.vo;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 部署环境枚举
 * <p>
 * 声明顺序即流水线推进顺序：DEVELOPMENT → QA → STAGING → PRODUCTION
 */
public enum EnvironmentType {

    DEVELOPMENT("开发环境"),

    QA("测试环境"),

    STAGING("预发环境"),

    PRODUCTION("生产环境");

    private final String description;

    EnvironmentType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 从开发环境推进到当前环境的有序环境链
     * <p>
     * 例如 STAGING → [DEVELOPMENT, QA, STAGING]
     */
    public List<EnvironmentType> chainTo() {
        return List.copyOf(Arrays.asList(values()).subList(0, ordinal() + 1));
    }

    /**
     * 是否影响生产流量（默认需要审批的环境）
     */
    public boolean isProductionImpacting() {
        return this == STAGING || this == PRODUCTION;
    }

    /**
     * 大小写不敏感解析
     */
    public static Optional<EnvironmentType> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(e -> e.name().equals(normalized))
                .findFirst();
    }
}
