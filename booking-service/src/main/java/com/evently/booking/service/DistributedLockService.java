package com.evently.booking.service;

import java.time.Duration;
import java.util.Collection;

public interface DistributedLockService {

    /**
     * Atomically create a lock entry if none exists
     *
     * @param lockKey Full key of the lock entry
     * @param owner Value identifying the holder
     * @param ttl Lock expiry
     * @return true if this call created the entry
     */
    boolean tryAcquire(String lockKey, String owner, Duration ttl);

    /**
     * Delete a lock entry only if it is still held by the given owner
     *
     * @return true if the entry was deleted
     */
    boolean release(String lockKey, String owner);

    /**
     * Delete lock entries regardless of owner. Failures are logged and reported as zero deletions.
     *
     * @return number of entries deleted
     */
    long releaseAll(Collection<String> lockKeys);

    /**
     * Execute a task while holding a lock owned by this instance
     *
     * @throws LockAcquisitionException if the lock is held elsewhere or the store is unreachable
     */
    <T> T executeWithLock(String lockKey, Duration timeout, DistributedTask<T> task);

    @FunctionalInterface
    interface DistributedTask<T> {
        T execute();
    }

    /**
     * Lock key of a seat for a show
     */
    static String seatLock(Long showId, Long seatId) {
        return String.format("seat_lock:%d:%d", showId, seatId);
    }

    /**
     * Lock key that keeps a background job single-flight across instances
     */
    static String schedulerLock(String jobName) {
        return "lock:scheduler:" + jobName;
    }
}
