package xyz.firestige.hotswap.infrastructure.lock.redis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import xyz.firestige.hotswap.domain.shared.CancellationToken;
import xyz.firestige.hotswap.infrastructure.lock.DistributedLock;
import xyz.firestige.hotswap.infrastructure.lock.LockHandle;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 分布式锁 Redis 实现
 * <p>
 * 使用 Redis SET NX PX 原子获取锁，TTL 自动过期防止进程崩溃后泄漏。
 * 锁值为持有者令牌，释放与续期都通过 Lua 脚本先比较令牌再操作，
 * 过期后被他人重新获取的锁不会被误删。
 */
public class RedisDistributedLock implements DistributedLock {

    private static final Logger log = LoggerFactory.getLogger(RedisDistributedLock.class);

    private static final long RETRY_INTERVAL_MILLIS = 100;

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) "
                    + "else return 0 end",
            Long.class);

    private static final RedisScript<Long> RENEW_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('pexpire', KEYS[1], ARGV[2]) "
                    + "else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final Duration lockTtl;

    public RedisDistributedLock(StringRedisTemplate redisTemplate, String namespace, Duration lockTtl) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = namespace + ":lock:";
        this.lockTtl = lockTtl;
    }

    @Override
    public LockHandle acquire(String resource, Duration timeout, CancellationToken token) {
        String key = keyPrefix + resource;
        String owner = UUID.randomUUID().toString();
        long deadline = System.nanoTime() + timeout.toNanos();

        while (true) {
            token.throwIfCancelled();
            Boolean success = redisTemplate.opsForValue().setIfAbsent(key, owner, lockTtl);
            if (Boolean.TRUE.equals(success)) {
                log.debug("[RedisLock] 获取锁成功: {}, ttl: {}", key, lockTtl);
                return new RedisLockHandle(resource, key, owner);
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("[RedisLock] 获取锁超时: {}, timeout: {}", key, timeout);
                return null;
            }
            // 重试间隔内可被取消唤醒
            token.await(Duration.ofNanos(Math.min(remaining, Duration.ofMillis(RETRY_INTERVAL_MILLIS).toNanos())));
        }
    }

    @Override
    public boolean isLocked(String resource) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(keyPrefix + resource));
    }

    private final class RedisLockHandle implements LockHandle {

        private final String resource;
        private final String key;
        private final String owner;
        private final LocalDateTime acquiredAt = LocalDateTime.now();
        private final AtomicBoolean held = new AtomicBoolean(true);

        private RedisLockHandle(String resource, String key, String owner) {
            this.resource = resource;
            this.key = key;
            this.owner = owner;
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
            if (!held.compareAndSet(true, false)) {
                return;
            }
            Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(key), owner);
            if (deleted != null && deleted == 1L) {
                log.debug("[RedisLock] 释放锁: {}", key);
            } else {
                log.warn("[RedisLock] 锁已过期或已被他人持有，跳过释放: {}", key);
            }
        }

        @Override
        public boolean renew(Duration ttl) {
            if (!held.get()) {
                return false;
            }
            Long renewed = redisTemplate.execute(RENEW_SCRIPT, List.of(key), owner, String.valueOf(ttl.toMillis()));
            boolean ok = renewed != null && renewed == 1L;
            if (!ok) {
                log.warn("[RedisLock] 续期失败，锁可能已过期: {}", key);
            }
            return ok;
        }
    }
}
