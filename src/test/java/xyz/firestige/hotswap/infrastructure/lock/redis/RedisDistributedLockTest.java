package xyz.firestige.hotswap.infrastructure.lock.redis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;
import xyz.firestige.hotswap.infrastructure.lock.LockHandle;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Redis 分布式锁测试（Mock StringRedisTemplate）
 */
@Tag("unit")
@DisplayName("RedisDistributedLock 单元测试")
class RedisDistributedLockTest {

    private static final Duration TTL = Duration.ofMinutes(5);

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;
    private RedisDistributedLock lock;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        lock = new RedisDistributedLock(redisTemplate, "hotswap", TTL);
    }

    @Test
    @DisplayName("场景: SET NX 成功即获得锁")
    void acquire_setsKeyWithTtl() {
        when(valueOps.setIfAbsent(eq("hotswap:lock:deploy:orders:QA"), anyString(), eq(TTL))).thenReturn(true);

        LockHandle handle = lock.acquire("deploy:orders:QA", Duration.ofSeconds(1));

        assertThat(handle).isNotNull();
        assertThat(handle.getResource()).isEqualTo("deploy:orders:QA");
        assertThat(handle.isHeld()).isTrue();
    }

    @Test
    @DisplayName("场景: 锁被占用直到超时返回 null")
    void acquire_returnsNullOnTimeout() {
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);

        LockHandle handle = lock.acquire("deploy:orders:QA", Duration.ofMillis(150));

        assertThat(handle).isNull();
        verify(valueOps, atLeast(2)).setIfAbsent(anyString(), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("场景: 释放通过比较令牌的脚本执行，且只执行一次")
    @SuppressWarnings("unchecked")
    void release_runsCompareAndDeleteOnce() {
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any())).thenReturn(1L);
        LockHandle handle = lock.acquire("deploy:orders:QA", Duration.ofSeconds(1));

        handle.release();
        handle.release();

        verify(redisTemplate, times(1)).execute(any(RedisScript.class), eq(List.of("hotswap:lock:deploy:orders:QA")), any());
        assertThat(handle.isHeld()).isFalse();
    }

    @Test
    @DisplayName("场景: 续期失败说明锁已被他人接管")
    @SuppressWarnings("unchecked")
    void renew_reportsLostOwnership() {
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any())).thenReturn(0L);
        LockHandle handle = lock.acquire("deploy:orders:QA", Duration.ofSeconds(1));

        assertThat(handle.renew(TTL)).isFalse();
    }

    @Test
    @DisplayName("场景: isLocked 检查键是否存在")
    void isLocked_checksKey() {
        when(redisTemplate.hasKey("hotswap:lock:deploy:orders:QA")).thenReturn(true);

        assertThat(lock.isLocked("deploy:orders:QA")).isTrue();
        assertThat(lock.isLocked("deploy:orders:PRODUCTION")).isFalse();
    }
}
