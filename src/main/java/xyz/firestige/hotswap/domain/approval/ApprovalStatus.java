package xyz.firestige.hotswap.domain.approval;

/**
 * 审批状态
 * <p>
 * PENDING → {APPROVED, REJECTED, EXPIRED}，后三者为终态。
 */
public enum ApprovalStatus {

    PENDING("待审批"),

    APPROVED("已批准"),

    REJECTED("已拒绝"),

    EXPIRED("已过期");

    private final String description;

    ApprovalStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }
}
