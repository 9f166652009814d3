package com.evently.booking.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Background sweep that cancels pending bookings past the hold window.
 *
 * Fixed-delay scheduling keeps one sweep in flight per instance; the scheduler lock in Redis
 * keeps one in flight across instances. The lock is not renewed, so a sweep stops taking new bookings
 * once most of the lock TTL has passed and leaves the rest to the next cycle. A failure on one booking
 * is logged and the sweep moves on.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(value = "booking.sweeper.enabled", havingValue = "true", matchIfMissing = true)
public class ExpiredBookingSweeper {

    // Share of the scheduler lock TTL a sweep may spend before it stops
    private static final long LOCK_BUDGET_PERCENT = 90;

    static final String SWEEP_LOCK = DistributedLockService.schedulerLock("expired-booking-sweep");

    private final BookingExpiryService expiryService;
    private final DistributedLockService lockService;

    @Value("${booking.sweeper.lock-ttl-seconds:110}")
    private long lockTtlSeconds = 110;

    @Scheduled(fixedDelayString = "${booking.sweeper.interval.ms:120000}",
               initialDelayString = "${booking.sweeper.initial-delay.ms:10000}")
    public void sweepExpiredBookings() {
        try {
            lockService.executeWithLock(SWEEP_LOCK, Duration.ofSeconds(lockTtlSeconds), this::sweep);
        } catch (LockAcquisitionException e) {
            log.debug("Skipping expiry sweep, lock {} is held by another instance", SWEEP_LOCK);
        }
    }

    int sweep() {
        long deadline = System.currentTimeMillis() + lockTtlSeconds * 1000 * LOCK_BUDGET_PERCENT / 100;
        List<Long> expiredBookingIds = expiryService.findExpiredBookingIds(LocalDateTime.now());

        if (expiredBookingIds.isEmpty()) {
            return 0;
        }

        log.info("Expiry sweep: found {} expired bookings", expiredBookingIds.size());

        int reclaimed = 0;
        for (int i = 0; i < expiredBookingIds.size(); i++) {
            if (System.currentTimeMillis() >= deadline) {
                log.warn("Expiry sweep: lock budget of {}s used up, leaving {} bookings for the next cycle",
                        lockTtlSeconds, expiredBookingIds.size() - i);
                break;
            }
            Long bookingId = expiredBookingIds.get(i);
            try {
                if (expiryService.expireBooking(bookingId)) {
                    reclaimed++;
                }
            } catch (Exception e) {
                log.error("Failed to expire booking: {}", bookingId, e);
            }
        }

        if (reclaimed > 0) {
            log.info("Expiry sweep: reclaimed {} bookings", reclaimed);
        }
        return reclaimed;
    }
}
