package xyz.firestige.hotswap.infrastructure.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 锁续期调度器
 * <p>
 * 长时间运行的阶段（金丝雀等待、审批等待）在持锁期间每 TTL/3 续期一次，
 * 续期由持有者校验，锁被他人接管后续期失败并停止。
 */
public class LockRenewalScheduler {

    private static final Logger log = LoggerFactory.getLogger(LockRenewalScheduler.class);

    private static final Duration MIN_INTERVAL = Duration.ofMillis(100);

    private ScheduledExecutorService scheduler;

    public LockRenewalScheduler() {
        this.scheduler = newScheduler();
    }

    /**
     * 开始续期
     *
     * @return 续期任务句柄，阶段结束时调用 {@link Renewal#stop()}
     */
    public synchronized Renewal start(LockHandle handle, Duration ttl) {
        if (scheduler.isShutdown()) {
            scheduler = newScheduler();
        }
        Duration interval = ttl.dividedBy(3);
        if (interval.compareTo(MIN_INTERVAL) < 0) {
            interval = MIN_INTERVAL;
        }
        Renewal renewal = new Renewal(handle);
        renewal.future = scheduler.scheduleAtFixedRate(() -> renewal.renew(ttl),
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        return renewal;
    }

    public synchronized void shutdown() {
        scheduler.shutdownNow();
    }

    private static ScheduledExecutorService newScheduler() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "hotswap-lock-renewal-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public static final class Renewal {
        private final LockHandle handle;
        private volatile ScheduledFuture<?> future;
        private volatile boolean stopped;

        private Renewal(LockHandle handle) {
            this.handle = handle;
        }

        private void renew(Duration ttl) {
            if (stopped) {
                return;
            }
            try {
                if (!handle.renew(ttl)) {
                    log.warn("[LockRenewal] 锁续期失败，锁已不再由当前持有者持有: {}", handle.getResource());
                    stop();
                }
            } catch (RuntimeException e) {
                log.warn("[LockRenewal] 锁续期异常: {}", handle.getResource(), e);
            }
        }

        public void stop() {
            stopped = true;
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }

        public boolean isStopped() {
            return stopped;
        }
    }
}
