package xyz.firestige.hotswap.domain.shared;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.hotswap.domain.shared.exception.PipelineCancelledException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 协作式取消令牌
 * <p>
 * 与 executionId 一一对应。取消不会中断线程，而是在每个挂起点被观察：
 * <ul>
 *   <li>{@link #await(Duration)} 在步骤间等待时可被取消信号提前唤醒</li>
 *   <li>{@link #onCancel(Runnable)} 让审批等待等条件队列在取消时被唤醒</li>
 *   <li>{@link #throwIfCancelled()} 在阶段边界检查</li>
 * </ul>
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final String owner;
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile String reason;

    public CancellationToken(String owner) {
        this.owner = owner;
    }

    /**
     * 永不取消的令牌（用于回滚等必须跑完的流程）
     */
    public static CancellationToken none() {
        return new CancellationToken("none");
    }

    public void cancel(String cancelReason) {
        if (isCancelled()) {
            return;
        }
        this.reason = cancelReason;
        cancelled.countDown();
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("[CancellationToken] 取消回调执行失败: {}", owner, e);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public String getReason() {
        return reason;
    }

    public String getOwner() {
        return owner;
    }

    /**
     * 注册取消回调；若已取消则立即执行
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled()) {
            callback.run();
        }
    }

    public void removeCallback(Runnable callback) {
        callbacks.remove(callback);
    }

    /**
     * 可取消的等待
     *
     * @return true 表示等待期满，false 表示被取消唤醒
     */
    public boolean await(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return !isCancelled();
        }
        try {
            return !cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel("线程被中断");
            return false;
        }
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new PipelineCancelledException(owner, "流水线已取消: " + (reason != null ? reason : "未知原因"));
        }
    }
}
