package xyz.firestige.hotswap.infrastructure.lock;

import xyz.firestige.hotswap.domain.shared.CancellationToken;

import java.time.Duration;

/**
 * 分布式锁（按资源名互斥）
 * <p>
 * 职责：
 * - 串行化同一 (模块, 环境) 的部署，保证同一时刻至多一条活跃流水线
 * - 在超时时间内获取不到锁返回 null（忙碌，不是错误），调用方自行决定重试或快速失败
 * - 进程内实现与集群级实现（Redis SET NX + TTL）可以互换，测试无需外部基础设施
 * <p>
 * 释放通过 {@link LockHandle#release()} 完成，释放是幂等的，
 * 且不会释放之后被其他持有者重新获取的锁。
 *
 * @see xyz.firestige.hotswap.infrastructure.lock.memory.InMemoryDistributedLock
 * @see xyz.firestige.hotswap.infrastructure.lock.redis.RedisDistributedLock
 */
public interface DistributedLock {

    /**
     * 在超时时间内尝试获取锁
     *
     * @param resource 资源名，例如 deploy:billing-service:PRODUCTION
     * @param timeout  最长等待时间
     * @return 锁句柄；超时未获取到返回 null
     */
    default LockHandle acquire(String resource, Duration timeout) {
        return acquire(resource, timeout, CancellationToken.none());
    }

    /**
     * 可取消的获取：等待期间观察取消信号
     *
     * @throws xyz.firestige.hotswap.domain.shared.exception.PipelineCancelledException 等待期间被取消
     */
    LockHandle acquire(String resource, Duration timeout, CancellationToken token);

    /**
     * 资源当前是否被任何人持有
     */
    boolean isLocked(String resource);
}
