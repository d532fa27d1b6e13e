package xyz.firestige.hotswap.application.approval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 审批超时清理：定期把过期的 PENDING 请求转为 EXPIRED，并删除超过保留期的终态请求
 * <p>
 * 没有流水线在等待的请求（例如进程重启后遗留的）也会被清理。
 */
public class ApprovalTimeoutSweeper {

    private static final Logger log = LoggerFactory.getLogger(ApprovalTimeoutSweeper.class);

    private final ApprovalGate approvalGate;
    private final Duration interval;
    private final Duration retention;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> future;
    private volatile boolean started;

    public ApprovalTimeoutSweeper(ApprovalGate approvalGate, Duration interval, Duration retention) {
        this.approvalGate = approvalGate;
        this.interval = interval;
        this.retention = retention;
    }

    public synchronized void start() {
        if (started) return;
        if (scheduler == null || scheduler.isShutdown()) {
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "hotswap-approval-sweeper");
                t.setDaemon(true);
                return t;
            });
        }
        started = true;
        future = scheduler.scheduleAtFixedRate(this::sweep,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[ApprovalSweeper] 启动审批超时清理, 间隔: {}, 终态保留: {}", interval, retention);
    }

    public synchronized void stop() {
        started = false;
        if (future != null) future.cancel(false);
        if (scheduler != null) scheduler.shutdownNow();
    }

    public boolean isRunning() { return started; }

    void sweep() {
        try {
            approvalGate.processExpired();
            approvalGate.purgeResolved(retention);
        } catch (RuntimeException e) {
            log.warn("[ApprovalSweeper] 审批超时清理失败", e);
        }
    }
}
