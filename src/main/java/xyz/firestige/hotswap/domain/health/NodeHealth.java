package xyz.firestige.hotswap.domain.health;

/**
 * 单节点健康状态
 */
public record NodeHealth(String nodeId, boolean healthy, String currentVersion) {
}
