package com.evently.booking.admission;

import com.evently.booking.queue.DeferredAdmissionJob;
import com.evently.booking.queue.DeferredAdmissionQueue;
import com.evently.common.util.TokenGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Demand-based waiting room in front of the reservation routes.
 *
 * <p>Order of checks for a request:
 * <ol>
 *   <li>a client whose queue marker has been promoted to an admitted token consumes it and passes;</li>
 *   <li>a client still holding a queue marker is deferred again without being re-queued;</li>
 *   <li>if the relevant demand counter (per show when a show id is known, system-wide otherwise)
 *       is above its threshold the client is queued and deferred, without incrementing;</li>
 *   <li>otherwise the counter is incremented, its TTL set on the first increment, and the request passes.</li>
 * </ol>
 * All state lives in Redis so every instance sees the same counters. Redis failures fail open.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AdmissionService {

    static final String SYSTEM_LOAD_KEY = "system_load";

    private final StringRedisTemplate redisTemplate;
    private final DeferredAdmissionQueue admissionQueue;
    private final AdmissionProperties properties;

    public static String waitingRoomKey(String clientId) {
        return "waiting_room:" + clientId;
    }

    public static String admittedKey(String queueToken) {
        return "can_proceed:" + queueToken;
    }

    static String showDemandKey(Long showId) {
        return "show_demand:" + showId;
    }

    public AdmissionDecision evaluate(String clientId, Long showId) {
        try {
            ValueOperations<String, String> ops = redisTemplate.opsForValue();

            String markerKey = waitingRoomKey(clientId);
            String queueToken = ops.get(markerKey);
            if (queueToken != null) {
                return admitOrKeepWaiting(clientId, markerKey, queueToken);
            }

            String counterKey;
            int threshold;
            Duration window;
            if (showId != null) {
                counterKey = showDemandKey(showId);
                threshold = properties.getShowThreshold();
                window = Duration.ofSeconds(properties.getShowWindowSeconds());
            } else {
                counterKey = SYSTEM_LOAD_KEY;
                threshold = properties.getSystemThreshold();
                window = Duration.ofSeconds(properties.getSystemWindowSeconds());
            }

            long current = parseCount(ops.get(counterKey));
            if (current > threshold) {
                return enqueue(clientId, showId, counterKey, current);
            }

            Long count = ops.increment(counterKey);
            if (count != null && count == 1L) {
                redisTemplate.expire(counterKey, window);
            }
            return AdmissionDecision.admitted();

        } catch (Exception e) {
            log.error("Admission check failed for client {}, letting request through", clientId, e);
            return AdmissionDecision.admitted();
        }
    }

    private AdmissionDecision admitOrKeepWaiting(String clientId, String markerKey, String queueToken) {
        String admittedKey = admittedKey(queueToken);
        if (redisTemplate.opsForValue().get(admittedKey) != null) {
            redisTemplate.delete(admittedKey);
            redisTemplate.delete(markerKey);
            log.info("Client {} admitted from waiting room with token {}", clientId, queueToken);
            return AdmissionDecision.admitted();
        }

        log.debug("Client {} still waiting with token {}", clientId, queueToken);
        return AdmissionDecision.deferred(queueToken, estimateWaitSeconds(0),
            "Please wait, you are in the virtual waiting room");
    }

    private AdmissionDecision enqueue(String clientId, Long showId, String counterKey, long current) {
        String queueToken = TokenGenerator.generateQueueToken();
        long delayMs = randomBetween(properties.getMinEnqueueDelayMs(), properties.getMaxEnqueueDelayMs());
        int priority = ThreadLocalRandom.current().nextInt(Math.max(1, properties.getPriorityLevels()));

        DeferredAdmissionJob job = DeferredAdmissionJob.builder()
            .token(queueToken)
            .clientId(clientId)
            .showId(showId)
            .priority(priority)
            .attempt(1)
            .enqueuedAt(System.currentTimeMillis())
            .build();

        admissionQueue.enqueue(job, Duration.ofMillis(delayMs));
        redisTemplate.opsForValue().set(waitingRoomKey(clientId), queueToken,
            Duration.ofSeconds(properties.getMarkerTtlSeconds()));

        log.info("High demand on {} ({} requests), client {} placed in waiting room with token {}",
                counterKey, current, clientId, queueToken);

        return AdmissionDecision.deferred(queueToken, estimateWaitSeconds(delayMs),
            "High traffic detected. You have been placed in the virtual waiting room.");
    }

    /**
     * Enqueue delay plus the time the worker needs to drain the jobs ahead of this one.
     */
    long estimateWaitSeconds(long delayMs) {
        AdmissionProperties.Worker worker = properties.getWorker();
        long depth;
        try {
            depth = admissionQueue.size();
        } catch (Exception e) {
            log.warn("Unable to read waiting room queue depth: {}", e.getMessage());
            depth = 0;
        }
        long meanProcessingMs = (worker.getMinProcessingDelayMs() + worker.getMaxProcessingDelayMs()) / 2;
        long batches = (depth + worker.getConcurrency() - 1) / Math.max(1, worker.getConcurrency());
        long totalMs = delayMs + batches * meanProcessingMs + meanProcessingMs;
        return Math.max(1, (totalMs + 999) / 1000);
    }

    private static long parseCount(String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed demand counter value: {}", value);
            return 0;
        }
    }

    private static long randomBetween(long min, long max) {
        if (max <= min) {
            return min;
        }
        return ThreadLocalRandom.current().nextLong(min, max + 1);
    }
}
