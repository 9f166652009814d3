package com.evently.booking.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Durable delayed queue in a Redis sorted set scored by the time a job becomes ready (epoch millis).
 * A job is claimed by removing it from the set; only one claimer's ZREM succeeds.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DeferredAdmissionQueue {

    static final String QUEUE_KEY = "waiting_room:queue";

    // Ready jobs inspected per requested slot, so priority can reorder within the ready set
    private static final int SCAN_FACTOR = 4;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public void enqueue(DeferredAdmissionJob job, Duration delay) {
        long readyAt = System.currentTimeMillis() + delay.toMillis();
        redisTemplate.opsForZSet().add(QUEUE_KEY, serialize(job), readyAt);
        log.debug("Queued client {} token {} attempt {} ready in {} ms",
                job.getClientId(), job.getToken(), job.getAttempt(), delay.toMillis());
    }

    /**
     * Claim up to {@code max} jobs whose delay has elapsed, highest priority first
     */
    public List<DeferredAdmissionJob> claimReady(int max) {
        if (max <= 0) {
            return List.of();
        }

        ZSetOperations<String, String> zSet = redisTemplate.opsForZSet();
        Set<String> ready = zSet.rangeByScore(QUEUE_KEY, 0, System.currentTimeMillis(), 0, (long) max * SCAN_FACTOR);
        if (ready == null || ready.isEmpty()) {
            return List.of();
        }

        List<Candidate> candidates = new ArrayList<>(ready.size());
        for (String payload : ready) {
            DeferredAdmissionJob job = deserialize(payload);
            if (job == null) {
                zSet.remove(QUEUE_KEY, payload);
                continue;
            }
            candidates.add(new Candidate(payload, job));
        }
        candidates.sort(Comparator.comparingInt((Candidate c) -> c.getJob().getPriority())
            .thenComparingLong(c -> c.getJob().getEnqueuedAt()));

        List<DeferredAdmissionJob> claimed = new ArrayList<>(max);
        for (Candidate candidate : candidates) {
            if (claimed.size() >= max) {
                break;
            }
            Long removed = zSet.remove(QUEUE_KEY, candidate.getPayload());
            if (removed != null && removed > 0) {
                claimed.add(candidate.getJob());
            }
        }
        return claimed;
    }

    public long size() {
        Long size = redisTemplate.opsForZSet().zCard(QUEUE_KEY);
        return size != null ? size : 0;
    }

    private String serialize(DeferredAdmissionJob job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize waiting room job for client " + job.getClientId(), e);
        }
    }

    private DeferredAdmissionJob deserialize(String payload) {
        try {
            return objectMapper.readValue(payload, DeferredAdmissionJob.class);
        } catch (JsonProcessingException e) {
            log.error("Dropping unreadable waiting room job: {}", payload, e);
            return null;
        }
    }

    @Getter
    @AllArgsConstructor
    private static class Candidate {
        private final String payload;
        private final DeferredAdmissionJob job;
    }
}
