package xyz.firestige.hotswap.domain.pipeline;

/**
 * 发布策略（封闭变体集合）
 * <p>
 * 策略选择完全由配置驱动，每个变体只有一个 execute 实现。
 */
public enum RolloutStrategyType {

    /**
     * 一次性切换 100%，无中间健康检查
     */
    DIRECT("直接发布"),

    /**
     * 初始比例 + 固定增量，逐批扩大
     */
    CANARY("金丝雀发布"),

    /**
     * 调用方给出显式批次列表，例如 [10,30,50,100]
     */
    PROGRESSIVE("渐进式发布"),

    /**
     * 按节点顺序逐个替换，每个元素健康检查后才继续
     */
    ROLLING("滚动发布"),

    /**
     * 部署到备用（绿）环境，整体检查后一次性切流
     */
    BLUE_GREEN("蓝绿发布");

    private final String description;

    RolloutStrategyType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
