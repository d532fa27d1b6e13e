package xyz.firestige.hotswap.domain.pipeline;

/**
 * 流水线状态枚举
 * <p>
 * 状态转换说明：
 * - CREATED → RUNNING: 工作线程开始执行
 * - RUNNING → SUCCEEDED: 所有阶段成功
 * - RUNNING → PARTIALLY_SUCCEEDED: 滚动发布中途停止，已更新的节点保留
 * - RUNNING → FAILED: 锁竞争、审批拒绝/超时、取消或无需回滚的失败
 * - RUNNING → ROLLED_BACK: 阶段失败后自动回滚成功
 * - RUNNING → ROLLBACK_FAILED: 回滚重试耗尽，环境处于未知/降级状态
 * - SUCCEEDED / PARTIALLY_SUCCEEDED / FAILED → ROLLED_BACK | ROLLBACK_FAILED: 手动或健康监控触发回滚
 * <p>
 * 同一 executionId 不会从终态回到 RUNNING，重新部署总是新的 executionId。
 */
public enum PipelineStatus {

    CREATED("已创建"),

    RUNNING("执行中"),

    SUCCEEDED("已成功"),

    PARTIALLY_SUCCEEDED("部分成功"),

    FAILED("已失败"),

    ROLLED_BACK("已回滚"),

    ROLLBACK_FAILED("回滚失败");

    private final String description;

    PipelineStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this != CREATED && this != RUNNING;
    }

    public boolean isActive() {
        return !isTerminal();
    }

    /**
     * 是否允许发起整条流水线回滚
     */
    public boolean canRollback() {
        return this == SUCCEEDED || this == PARTIALLY_SUCCEEDED || this == FAILED;
    }
}
