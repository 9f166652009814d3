package com.evently.booking.service;

import com.evently.common.util.TokenGenerator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;

@Service
@Slf4j
public class RedisDistributedLockService implements DistributedLockService {

    private final StringRedisTemplate redisTemplate;

    // Lua script for atomic owner-checked release
    private static final String RELEASE_LOCK_SCRIPT =
        "if redis.call('GET', KEYS[1]) == ARGV[1] then " +
        "  return redis.call('DEL', KEYS[1]) " +
        "else " +
        "  return 0 " +
        "end";

    private final DefaultRedisScript<Long> releaseLockScript;

    private final String instanceId = TokenGenerator.generateInstanceId();

    @Autowired
    public RedisDistributedLockService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.releaseLockScript = new DefaultRedisScript<>(RELEASE_LOCK_SCRIPT, Long.class);
    }

    /**
     * SET NX with expiry. Store failures propagate to the caller.
     */
    @Override
    public boolean tryAcquire(String lockKey, String owner, Duration ttl) {
        Boolean acquired = redisTemplate.opsForValue().setIfAbsent(lockKey, owner, ttl);

        if (Boolean.TRUE.equals(acquired)) {
            log.debug("Acquired lock: {} for owner: {}", lockKey, owner);
            return true;
        }
        log.debug("Lock already held: {}", lockKey);
        return false;
    }

    @Override
    public boolean release(String lockKey, String owner) {
        try {
            Long result = redisTemplate.execute(
                releaseLockScript,
                Collections.singletonList(lockKey),
                owner
            );

            boolean released = result != null && result == 1;
            if (released) {
                log.debug("Released lock: {} for owner: {}", lockKey, owner);
            } else {
                log.debug("Lock not released (expired or held by another owner): {}", lockKey);
            }

            return released;
        } catch (Exception e) {
            log.error("Error releasing lock: {} for owner: {}", lockKey, owner, e);
            return false;
        }
    }

    @Override
    public long releaseAll(Collection<String> lockKeys) {
        if (lockKeys.isEmpty()) {
            return 0;
        }
        try {
            Long deleted = redisTemplate.delete(lockKeys);
            log.debug("Deleted {} of {} lock entries", deleted, lockKeys.size());
            return deleted != null ? deleted : 0;
        } catch (Exception e) {
            log.error("Error deleting lock entries {}, leaving them to expire", lockKeys, e);
            return 0;
        }
    }

    @Override
    public <T> T executeWithLock(String lockKey, Duration timeout, DistributedTask<T> task) {
        boolean acquired;
        try {
            acquired = tryAcquire(lockKey, instanceId, timeout);
        } catch (Exception e) {
            log.error("Error acquiring lock: {}", lockKey, e);
            acquired = false;
        }

        if (!acquired) {
            throw new LockAcquisitionException(lockKey);
        }

        try {
            return task.execute();
        } finally {
            release(lockKey, instanceId);
        }
    }
}
