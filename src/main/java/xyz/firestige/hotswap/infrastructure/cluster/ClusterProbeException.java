package xyz.firestige.hotswap.infrastructure.cluster;

/**
 * 远程健康探针调用失败
 */
public class ClusterProbeException extends RuntimeException {

    public ClusterProbeException(String message) {
        super(message);
    }

    public ClusterProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
