package xyz.firestige.hotswap.facade;

import java.util.Map;

/**
 * 部署已受理（202 Accepted 的响应体）
 *
 * @param executionId 后续查询、回滚、审批使用的句柄
 * @param status      受理时的流水线状态
 * @param links       相关资源路径
 */
public record DeploymentAccepted(String executionId, String status, Map<String, String> links) {

    public static DeploymentAccepted of(String executionId, String status) {
        return new DeploymentAccepted(executionId, status, Map.of(
                "self", "/deployments/" + executionId,
                "rollback", "/deployments/" + executionId + "/rollback",
                "approve", "/approvals/deployments/" + executionId + "/approve",
                "reject", "/approvals/deployments/" + executionId + "/reject"));
    }
}
