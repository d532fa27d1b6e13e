package xyz.firestige.hotswap.domain.cluster;

/**
 * 单节点部署结果
 */
public record NodeDeploymentResult(String nodeId, boolean success, String message) {

    public static NodeDeploymentResult ok(String nodeId) {
        return new NodeDeploymentResult(nodeId, true, "");
    }

    public static NodeDeploymentResult failed(String nodeId, String message) {
        return new NodeDeploymentResult(nodeId, false, message);
    }
}
