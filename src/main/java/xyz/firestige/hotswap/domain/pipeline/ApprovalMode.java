package xyz.firestige.hotswap.domain.pipeline;

/**
 * 审批闸门放置方式
 */
public enum ApprovalMode {

    /**
     * 链上任一阶段需要审批时，在第一个阶段之前统一审批（未获批前零节点发布）
     */
    UPFRONT("前置统一审批"),

    /**
     * 在每个需要审批的阶段之前审批；审批按 executionId 记录，已获批的决定对后续阶段有效
     */
    PER_STAGE("逐阶段审批");

    private final String description;

    ApprovalMode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
