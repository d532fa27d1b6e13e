package xyz.firestige.hotswap.infrastructure.lock;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import xyz.firestige.hotswap.util.TimingExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockingDetails;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 锁续期调度测试
 */
@Tag("unit")
@ExtendWith(TimingExtension.class)
@DisplayName("LockRenewalScheduler 单元测试")
class LockRenewalSchedulerTest {

    private static final Duration TTL = Duration.ofMillis(300);

    private LockRenewalScheduler scheduler;
    private LockHandle handle;

    @BeforeEach
    void setUp() {
        scheduler = new LockRenewalScheduler();
        handle = mock(LockHandle.class);
        when(handle.getResource()).thenReturn("deploy:order-service:PRODUCTION");
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    @DisplayName("场景: 持锁期间按 TTL/3 周期续期")
    void renewsPeriodically() {
        // Given
        when(handle.renew(TTL)).thenReturn(true);

        // When
        LockRenewalScheduler.Renewal renewal = scheduler.start(handle, TTL);

        // Then
        await().atMost(Duration.ofSeconds(3)).untilAsserted(() -> verify(handle, atLeast(3)).renew(TTL));
        assertThat(renewal.isStopped()).isFalse();
        renewal.stop();
    }

    @Test
    @DisplayName("场景: 续期失败（锁已被接管）后停止续期")
    void renewalRejected_stopsRenewing() throws InterruptedException {
        // Given
        when(handle.renew(TTL)).thenReturn(false);

        // When
        LockRenewalScheduler.Renewal renewal = scheduler.start(handle, TTL);

        // Then
        await().atMost(Duration.ofSeconds(3)).until(renewal::isStopped);
        Thread.sleep(350);
        verify(handle, times(1)).renew(TTL);
    }

    @Test
    @DisplayName("场景: 续期异常只记录日志，后续周期继续续期")
    void renewalError_keepsRenewing() {
        // Given
        when(handle.renew(TTL)).thenThrow(new IllegalStateException("redis timeout")).thenReturn(true);

        // When
        LockRenewalScheduler.Renewal renewal = scheduler.start(handle, TTL);

        // Then
        await().atMost(Duration.ofSeconds(3)).untilAsserted(() -> verify(handle, atLeast(2)).renew(TTL));
        assertThat(renewal.isStopped()).isFalse();
        renewal.stop();
    }

    @Test
    @DisplayName("场景: 阶段结束主动停止后不再续期")
    void stop_haltsFurtherRenewals() throws InterruptedException {
        // Given
        when(handle.renew(TTL)).thenReturn(true);
        LockRenewalScheduler.Renewal renewal = scheduler.start(handle, TTL);
        await().atMost(Duration.ofSeconds(3)).untilAsserted(() -> verify(handle, atLeast(1)).renew(TTL));

        // When
        renewal.stop();
        Thread.sleep(50);
        int callsAtStop = renewCalls();
        Thread.sleep(350);

        // Then
        assertThat(renewal.isStopped()).isTrue();
        assertThat(renewCalls()).isEqualTo(callsAtStop);
    }

    @Test
    @DisplayName("场景: 调度器关闭后再次启动续期会重建线程")
    void startAfterShutdown_recreatesScheduler() {
        // Given
        when(handle.renew(any(Duration.class))).thenReturn(true);
        scheduler.shutdown();

        // When
        LockRenewalScheduler.Renewal renewal = scheduler.start(handle, TTL);

        // Then
        await().atMost(Duration.ofSeconds(3)).untilAsserted(() -> verify(handle, atLeast(1)).renew(TTL));
        renewal.stop();
    }

    private int renewCalls() {
        return (int) mockingDetails(handle).getInvocations().stream()
                .filter(i -> i.getMethod().getName().equals("renew"))
                .count();
    }
}
