package xyz.firestige.hotswap.domain.pipeline;

/**
 * 滚动发布中途停止时如何处理已更新的节点
 */
public enum RollingPartialFailurePolicy {

    /**
     * 保留已更新节点，报告部分成功，交由运维决定
     */
    HALT("停止并保留"),

    /**
     * 自动回滚已更新节点
     */
    AUTO_ROLLBACK("自动回滚");

    private final String description;

    RollingPartialFailurePolicy(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
