package xyz.firestige.hotswap.domain.shared.vo;

import java.util.Objects;
import java.util.UUID;

/**
 * ExecutionId 值对象
 * <p>
 * 一次部署请求的唯一标识，贯穿整条流水线的全部历史。
 * 重新部署同一模块/环境总是生成新的 ExecutionId。
 */
public final class ExecutionId {

    private final String value;

    private ExecutionId(String value) {
        this.value = value;
    }

    /**
     * 生成新的 ExecutionId
     */
    public static ExecutionId generate() {
        return new ExecutionId(UUID.randomUUID().toString());
    }

    /**
     * 创建 ExecutionId（带验证）
     *
     * @throws IllegalArgumentException 如果值为空
     */
    public static ExecutionId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ExecutionId 不能为空");
        }
        return new ExecutionId(value.trim());
    }

    /**
     * 创建 ExecutionId（不验证，用于已知合法的场景，例如从存储中恢复）
     */
    public static ExecutionId ofTrusted(String value) {
        return new ExecutionId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionId that = (ExecutionId) o;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
