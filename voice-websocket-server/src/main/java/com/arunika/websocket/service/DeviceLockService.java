package com.arunika.websocket.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Per-device mutual exclusion across nodes using Redis {@code SET NX} with an
 * expiry. Guards session creation so a device never ends up with two active
 * sessions when two nodes see it at once.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeviceLockService {

    static final String LOCK_PREFIX = "lock:device:";
    private static final Duration RETRY_INTERVAL = Duration.ofMillis(50);

    private final RedisTemplate<String, String> redisTemplate;

    /**
     * @return the lock token, or null if the lock is held elsewhere
     */
    public String tryLock(String deviceId, Duration ttl) {
        String lockKey = LOCK_PREFIX + deviceId;
        String token = UUID.randomUUID().toString();

        Boolean acquired = redisTemplate.opsForValue().setIfAbsent(lockKey, token, ttl);
        if (Boolean.TRUE.equals(acquired)) {
            log.debug("Device lock acquired: deviceId={}", deviceId);
            return token;
        }
        return null;
    }

    /**
     * Releases the lock if {@code token} still owns it.
     */
    public boolean unlock(String deviceId, String token) {
        String lockKey = LOCK_PREFIX + deviceId;
        try {
            String current = redisTemplate.opsForValue().get(lockKey);
            if (token.equals(current)) {
                redisTemplate.delete(lockKey);
                log.debug("Device lock released: deviceId={}", deviceId);
                return true;
            }
            log.warn("Device lock expired before release: deviceId={}", deviceId);
            return false;
        } catch (Exception e) {
            log.error("Error releasing device lock: deviceId={}", deviceId, e);
            return false;
        }
    }

    /**
     * Runs {@code operation} while holding the device lock, retrying
     * acquisition until {@code wait} elapses.
     *
     * @return the operation's result, or empty if the lock was not acquired
     */
    public <T> Optional<T> executeWithLock(String deviceId, Duration wait, Supplier<T> operation) {
        long deadline = System.nanoTime() + wait.toNanos();
        String token = tryLock(deviceId, wait);
        while (token == null && System.nanoTime() < deadline) {
            try {
                Thread.sleep(RETRY_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
            token = tryLock(deviceId, wait);
        }
        if (token == null) {
            log.warn("Device lock not acquired: deviceId={}, waited={}", deviceId, wait);
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(operation.get());
        } finally {
            unlock(deviceId, token);
        }
    }
}
