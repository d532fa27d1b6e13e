package xyz.firestige.hotswap.domain.pipeline;

/**
 * 阶段状态枚举（一个环境一次遍历）
 */
public enum StageStatus {

    PENDING("待执行"),

    RUNNING("执行中"),

    SUCCEEDED("已成功"),

    /**
     * 滚动发布中途停止，已更新的元素保留
     */
    PARTIALLY_SUCCEEDED("部分成功"),

    FAILED("已失败"),

    ROLLED_BACK("已回滚"),

    /**
     * 回滚失败，环境状态未知
     */
    ROLLBACK_FAILED("回滚失败");

    private final String description;

    StageStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    public boolean isSuccess() {
        return this == SUCCEEDED;
    }
}
