package xyz.firestige.hotswap.infrastructure.lock.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.hotswap.domain.shared.CancellationToken;
import xyz.firestige.hotswap.domain.shared.exception.PipelineCancelledException;
import xyz.firestige.hotswap.infrastructure.lock.DistributedLock;
import xyz.firestige.hotswap.infrastructure.lock.LockHandle;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 进程内分布式锁实现（用于测试和单实例场景）
 * <p>
 * 每个资源一个公平信号量，获取方按到达顺序排队。
 * 信号量不绑定线程，句柄可以在任意线程释放。
 */
public class InMemoryDistributedLock implements DistributedLock {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDistributedLock.class);

    private final ConcurrentHashMap<String, Semaphore> locks = new ConcurrentHashMap<>();

    /**
     * 单次定时等待进入公平队列；取消通过中断等待线程送达，不会让出队列位置
     */
    @Override
    public LockHandle acquire(String resource, Duration timeout, CancellationToken token) {
        token.throwIfCancelled();
        Semaphore semaphore = locks.computeIfAbsent(resource, k -> new Semaphore(1, true));
        Thread waiter = Thread.currentThread();
        AtomicBoolean waiting = new AtomicBoolean(true);
        Runnable interrupter = () -> {
            if (waiting.get()) {
                waiter.interrupt();
            }
        };
        token.onCancel(interrupter);
        boolean acquired;
        try {
            acquired = semaphore.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            waiting.set(false);
            if (token.isCancelled()) {
                // 清除取消回调留下的中断标记
                Thread.interrupted();
                throw new PipelineCancelledException(token.getOwner(),
                        "等待锁时被取消: " + resource + ", 原因: " + token.getReason());
            }
            Thread.currentThread().interrupt();
            throw new PipelineCancelledException(token.getOwner(), "等待锁时线程被中断: " + resource);
        } finally {
            waiting.set(false);
            token.removeCallback(interrupter);
        }
        if (token.isCancelled()) {
            // 取消与获取/超时同时发生：清除中断标记，归还许可
            Thread.interrupted();
            if (acquired) {
                semaphore.release();
            }
            throw new PipelineCancelledException(token.getOwner(), "等待锁时被取消: " + resource);
        }
        if (!acquired) {
            log.warn("[InMemoryLock] 获取锁超时: {}, timeout: {}", resource, timeout);
            return null;
        }
        log.debug("[InMemoryLock] 获取锁成功: {}", resource);
        return new InMemoryLockHandle(resource, semaphore);
    }

    @Override
    public boolean isLocked(String resource) {
        Semaphore semaphore = locks.get(resource);
        return semaphore != null && semaphore.availablePermits() == 0;
    }

    /**
     * 排队等待该资源的获取方数量（估计值）
     */
    public int getQueueLength(String resource) {
        Semaphore semaphore = locks.get(resource);
        return semaphore != null ? semaphore.getQueueLength() : 0;
    }

    private static final class InMemoryLockHandle implements LockHandle {

        private final String resource;
        private final Semaphore semaphore;
        private final LocalDateTime acquiredAt = LocalDateTime.now();
        private final AtomicBoolean held = new AtomicBoolean(true);

        private InMemoryLockHandle(String resource, Semaphore semaphore) {
            this.resource = resource;
            this.semaphore = semaphore;
        }

        @Override
        public String getResource() {
            return resource;
        }

        @Override
        public LocalDateTime getAcquiredAt() {
            return acquiredAt;
        }

        @Override
        public boolean isHeld() {
            return held.get();
        }

        @Override
        public void release() {
            // 只有第一次调用归还许可
            if (held.compareAndSet(true, false)) {
                semaphore.release();
                log.debug("[InMemoryLock] 释放锁: {}", resource);
            }
        }
    }
}
