package xyz.firestige.hotswap.infrastructure.lock.memory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.hotswap.domain.shared.CancellationToken;
import xyz.firestige.hotswap.domain.shared.exception.PipelineCancelledException;
import xyz.firestige.hotswap.infrastructure.lock.LockHandle;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@Tag("unit")
@Tag("fast")
@DisplayName("InMemoryDistributedLock 单元测试")
class InMemoryDistributedLockTest {

    private static final String RESOURCE = "deploy:billing-service:PRODUCTION";

    private final InMemoryDistributedLock lock = new InMemoryDistributedLock();

    @Test
    @DisplayName("场景: 持有期间其他获取方超时返回 null")
    void secondAcquire_timesOutWhileHeld() {
        LockHandle first = lock.acquire(RESOURCE, Duration.ofMillis(100));

        LockHandle second = lock.acquire(RESOURCE, Duration.ofMillis(50));

        assertThat(first).isNotNull();
        assertThat(first.isHeld()).isTrue();
        assertThat(second).isNull();
        assertThat(lock.isLocked(RESOURCE)).isTrue();
        first.release();
        assertThat(lock.isLocked(RESOURCE)).isFalse();
    }

    @Test
    @DisplayName("场景: 重复释放只归还一次许可")
    void release_isIdempotent() {
        LockHandle handle = lock.acquire(RESOURCE, Duration.ofMillis(100));
        handle.release();
        handle.release();

        LockHandle a = lock.acquire(RESOURCE, Duration.ofMillis(50));
        LockHandle b = lock.acquire(RESOURCE, Duration.ofMillis(50));

        assertThat(a).isNotNull();
        assertThat(b).isNull();
        assertThat(handle.isHeld()).isFalse();
    }

    @Test
    @DisplayName("场景: 释放后等待者获得锁，且可在其他线程释放")
    void waiter_acquiresAfterRelease() throws Exception {
        LockHandle holder = lock.acquire(RESOURCE, Duration.ofMillis(100));
        CompletableFuture<LockHandle> waiter = CompletableFuture.supplyAsync(
                () -> lock.acquire(RESOURCE, Duration.ofSeconds(2)));

        CompletableFuture.runAsync(holder::release).get(1, TimeUnit.SECONDS);

        LockHandle acquired = waiter.get(3, TimeUnit.SECONDS);
        assertThat(acquired).isNotNull();
        acquired.release();
    }

    @Test
    @DisplayName("场景: 不同资源互不影响")
    void differentResources_areIndependent() {
        LockHandle prod = lock.acquire(RESOURCE, Duration.ofMillis(50));
        LockHandle staging = lock.acquire("deploy:billing-service:STAGING", Duration.ofMillis(50));

        assertThat(prod).isNotNull();
        assertThat(staging).isNotNull();
    }

    @Test
    @DisplayName("场景: 等待锁时被取消")
    void cancelledWhileWaiting_throws() {
        lock.acquire(RESOURCE, Duration.ofMillis(50));
        CancellationToken token = new CancellationToken("exec-1");
        token.cancel("operator abort");

        assertThatThrownBy(() -> lock.acquire(RESOURCE, Duration.ofSeconds(5), token))
                .isInstanceOf(PipelineCancelledException.class);
    }

    @Test
    @DisplayName("场景: 等待者按到达顺序获得锁")
    void waiters_acquireInArrivalOrder() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int trial = 0; trial < 5; trial++) {
                assertArrivalOrder(pool);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private void assertArrivalOrder(ExecutorService pool) throws Exception {
        // Given: 锁被持有，A 先排队，B 后排队
        LockHandle holder = lock.acquire(RESOURCE, Duration.ofMillis(100));
        List<String> order = new CopyOnWriteArrayList<>();
        CompletableFuture<Void> first = CompletableFuture.runAsync(() -> acquireAndRecord("A", order), pool);
        await().atMost(Duration.ofSeconds(2)).until(() -> lock.getQueueLength(RESOURCE) == 1);
        CompletableFuture<Void> second = CompletableFuture.runAsync(() -> acquireAndRecord("B", order), pool);
        await().atMost(Duration.ofSeconds(2)).until(() -> lock.getQueueLength(RESOURCE) == 2);

        // When
        holder.release();

        // Then
        CompletableFuture.allOf(first, second).get(5, TimeUnit.SECONDS);
        assertThat(order).containsExactly("A", "B");
    }

    @Test
    @DisplayName("场景: 长时间等待中途取消立即返回，不等到超时")
    void cancelDuringLongWait_wakesWaiter() throws Exception {
        // Given
        LockHandle holder = lock.acquire(RESOURCE, Duration.ofMillis(100));
        CancellationToken token = new CancellationToken("exec-2");
        CompletableFuture<LockHandle> waiter = CompletableFuture.supplyAsync(
                () -> lock.acquire(RESOURCE, Duration.ofSeconds(30), token));
        await().atMost(Duration.ofSeconds(2)).until(() -> lock.getQueueLength(RESOURCE) == 1);

        // When
        token.cancel("operator abort");

        // Then
        assertThatThrownBy(() -> waiter.get(2, TimeUnit.SECONDS))
                .hasCauseInstanceOf(PipelineCancelledException.class);
        assertThat(lock.getQueueLength(RESOURCE)).isZero();
        holder.release();
        assertThat(lock.isLocked(RESOURCE)).isFalse();
    }

    private void acquireAndRecord(String name, List<String> order) {
        LockHandle handle = lock.acquire(RESOURCE, Duration.ofSeconds(5));
        order.add(name);
        handle.release();
    }
}
