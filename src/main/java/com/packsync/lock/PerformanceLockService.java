package com.packsync.lock;

import com.packsync.config.LockConfig;
import com.packsync.config.RedisConfig;
import com.packsync.exception.PerformanceLockException;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

/**
 * Mutual exclusion of reconcile-and-sync passes per performance, across all workers.
 *
 * <p>Acquired with Redis {@code SET NX} plus a TTL and a random owner token, so a crashed
 * worker's lock expires on its own. Release deletes the key only if it still holds the
 * caller's token, so a worker whose lock already expired cannot release a successor's.
 *
 * <p>While work runs under {@link #executeWithLock} or {@link #executeIfFree}, a watchdog
 * extends the TTL with the same token check, so a slow pass keeps its lock. A crashed
 * worker stops renewing and its lock still expires.
 */
@Service
public class PerformanceLockService {

    private static final Logger log = LoggerFactory.getLogger(PerformanceLockService.class);

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private static final DefaultRedisScript<Long> RENEW_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('pexpire', KEYS[1], ARGV[2]) else return 0 end",
            Long.class);

    /** One thread renews every held lock of this worker. */
    private final ScheduledExecutorService renewalScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "performance-lock-renewal");
        thread.setDaemon(true);
        return thread;
    });

    private final StringRedisTemplate stringRedisTemplate;
    private final LockConfig lockConfig;

    public PerformanceLockService(StringRedisTemplate stringRedisTemplate, LockConfig lockConfig) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.lockConfig = lockConfig;
    }

    /**
     * Polls for the lock until {@code wait} elapses.
     *
     * @return the owner token, or empty when another worker kept the lock
     */
    public Optional<String> tryLock(String performanceId, Duration wait) {
        String key = lockKey(performanceId);
        String token = UUID.randomUUID().toString();
        Duration ttl = Duration.ofSeconds(lockConfig.getTtlSeconds());
        long deadline = System.currentTimeMillis() + wait.toMillis();

        while (true) {
            Boolean acquired = stringRedisTemplate.opsForValue().setIfAbsent(key, token, ttl);
            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Acquired lock for performance {}", performanceId);
                return Optional.of(token);
            }
            if (System.currentTimeMillis() >= deadline) {
                log.warn("Lock for performance {} still held after {}ms", performanceId, wait.toMillis());
                return Optional.empty();
            }
            try {
                Thread.sleep(lockConfig.getPollIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted waiting for lock on performance {}", performanceId);
                return Optional.empty();
            }
        }
    }

    /** @return false when the lock had expired or belonged to someone else */
    public boolean unlock(String performanceId, String token) {
        Long deleted = stringRedisTemplate.execute(RELEASE_SCRIPT, List.of(lockKey(performanceId)), token);
        boolean released = deleted != null && deleted > 0;
        if (!released) {
            log.warn("Lock for performance {} was no longer held by this worker", performanceId);
        }
        return released;
    }

    /** Resets the TTL if the lock still holds {@code token}. */
    public boolean renew(String performanceId, String token) {
        Long renewed = stringRedisTemplate.execute(
                RENEW_SCRIPT, List.of(lockKey(performanceId)), token, String.valueOf(ttlMillis()));
        return renewed != null && renewed > 0;
    }

    /**
     * Runs {@code work} while holding the performance lock, waiting up to the configured time.
     *
     * @throws PerformanceLockException when the lock could not be acquired
     */
    public <T> T executeWithLock(String performanceId, Supplier<T> work) {
        Duration wait = Duration.ofSeconds(lockConfig.getWaitSeconds());
        String token = tryLock(performanceId, wait)
                .orElseThrow(() -> new PerformanceLockException(performanceId, wait.toMillis()));
        return runHeld(performanceId, token, work);
    }

    /** Runs {@code work} only if the lock is free right now; empty when another worker holds it. */
    public <T> Optional<T> executeIfFree(String performanceId, Supplier<T> work) {
        Optional<String> token = tryLock(performanceId, Duration.ZERO);
        if (token.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(runHeld(performanceId, token.get(), work));
    }

    private <T> T runHeld(String performanceId, String token, Supplier<T> work) {
        Renewal renewal = new Renewal(performanceId, token);
        long period = renewIntervalMillis();
        renewal.future = renewalScheduler.scheduleAtFixedRate(renewal, period, period, TimeUnit.MILLISECONDS);
        try {
            return work.get();
        } finally {
            renewal.future.cancel(false);
            if (renewal.lost.get()) {
                log.error("Work on performance {} finished after its lock was lost", performanceId);
            }
            unlock(performanceId, token);
        }
    }

    @PreDestroy
    void shutdown() {
        renewalScheduler.shutdownNow();
    }

    private long ttlMillis() {
        return TimeUnit.SECONDS.toMillis(lockConfig.getTtlSeconds());
    }

    private long renewIntervalMillis() {
        if (lockConfig.getRenewIntervalMs() > 0) {
            return lockConfig.getRenewIntervalMs();
        }
        return Math.max(ttlMillis() / 3, 1);
    }

    static String lockKey(String performanceId) {
        return RedisConfig.KEY_PREFIX_PERFORMANCE_LOCK + performanceId;
    }

    /** Watchdog for one held lock. Stops for good once the token is gone from Redis. */
    private final class Renewal implements Runnable {

        private final String performanceId;
        private final String token;
        private final AtomicBoolean lost = new AtomicBoolean();
        private volatile ScheduledFuture<?> future;

        private Renewal(String performanceId, String token) {
            this.performanceId = performanceId;
            this.token = token;
        }

        @Override
        public void run() {
            if (lost.get()) {
                return;
            }
            try {
                if (renew(performanceId, token)) {
                    log.debug("Renewed lock for performance {}", performanceId);
                    return;
                }
                lost.set(true);
                log.error("Lock for performance {} expired or was taken over while work was running", performanceId);
                ScheduledFuture<?> scheduled = future;
                if (scheduled != null) {
                    scheduled.cancel(false);
                }
            } catch (RuntimeException e) {
                log.warn("Renewing lock for performance {} failed, retrying: {}", performanceId, e.getMessage());
            }
        }
    }
}
