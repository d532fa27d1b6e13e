package xyz.firestige.hotswap.infrastructure.lock;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 锁句柄：所有权归获取者独占
 * <p>
 * 必须在所有退出路径（成功、失败、取消、异常）上释放，推荐 try-with-resources 或 finally。
 */
public interface LockHandle extends AutoCloseable {

    String getResource();

    LocalDateTime getAcquiredAt();

    boolean isHeld();

    /**
     * 幂等释放：对已释放句柄再次调用不报错，也不会影响他人后续获取的锁
     */
    void release();

    /**
     * 续期（仅持有者有效）
     *
     * @return 是否续期成功；不支持 TTL 的实现返回 true
     */
    default boolean renew(Duration ttl) {
        return isHeld();
    }

    @Override
    default void close() {
        release();
    }
}
