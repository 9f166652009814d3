package com.evently.booking.queue;

import com.evently.booking.admission.AdmissionProperties;
import com.evently.booking.admission.AdmissionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Drains the waiting room queue. At most {@code admission.worker.concurrency} jobs run at once.
 *
 * <p>A job waits a simulated processing delay, then promotes the client to admitted if its queue
 * marker still holds the job's token. Failed jobs are re-queued with exponential backoff until
 * {@code admission.worker.max-attempts} is reached; after that the marker simply expires and the
 * client is queued again on a later request.
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "admission.worker.enabled", havingValue = "true", matchIfMissing = true)
public class DeferredAdmissionWorker {

    private final DeferredAdmissionQueue queue;
    private final StringRedisTemplate redisTemplate;
    private final AdmissionProperties.Worker settings;
    private final Duration admittedTtl;
    private final TaskExecutor executor;
    private final Semaphore slots;

    public DeferredAdmissionWorker(DeferredAdmissionQueue queue,
                                   StringRedisTemplate redisTemplate,
                                   AdmissionProperties properties,
                                   @Qualifier("admissionWorkerExecutor") TaskExecutor executor) {
        this.queue = queue;
        this.redisTemplate = redisTemplate;
        this.settings = properties.getWorker();
        this.admittedTtl = Duration.ofSeconds(properties.getAdmittedTtlSeconds());
        this.executor = executor;
        this.slots = new Semaphore(Math.max(1, settings.getConcurrency()));
    }

    @Scheduled(fixedDelayString = "${admission.worker.poll-interval-ms:500}")
    public void poll() {
        int free = slots.availablePermits();
        if (free == 0) {
            return;
        }

        List<DeferredAdmissionJob> jobs;
        try {
            jobs = queue.claimReady(free);
        } catch (Exception e) {
            log.error("Failed to poll waiting room queue", e);
            return;
        }

        for (DeferredAdmissionJob job : jobs) {
            dispatch(job);
        }
    }

    int availableSlots() {
        return slots.availablePermits();
    }

    private void dispatch(DeferredAdmissionJob job) {
        slots.acquireUninterruptibly();
        try {
            executor.execute(() -> {
                try {
                    runJob(job);
                } finally {
                    slots.release();
                }
            });
        } catch (TaskRejectedException e) {
            slots.release();
            handleFailure(job, e);
        }
    }

    void runJob(DeferredAdmissionJob job) {
        try {
            process(job);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handleFailure(job, e);
        } catch (Exception e) {
            handleFailure(job, e);
        }
    }

    private void process(DeferredAdmissionJob job) throws InterruptedException {
        long delayMs = processingDelayMs();
        if (delayMs > 0) {
            Thread.sleep(delayMs);
        }

        String marker = redisTemplate.opsForValue().get(AdmissionService.waitingRoomKey(job.getClientId()));
        if (!job.getToken().equals(marker)) {
            log.debug("Client {} no longer waiting on token {}, nothing to admit", job.getClientId(), job.getToken());
            return;
        }

        redisTemplate.opsForValue().set(AdmissionService.admittedKey(job.getToken()), "true", admittedTtl);
        log.info("Client {} can now proceed with token {}", job.getClientId(), job.getToken());
    }

    private void handleFailure(DeferredAdmissionJob job, Exception cause) {
        if (job.getAttempt() >= settings.getMaxAttempts()) {
            log.error("Waiting room job for client {} token {} failed after {} attempts",
                    job.getClientId(), job.getToken(), job.getAttempt(), cause);
            return;
        }

        long backoffMs = settings.getBackoffMs() * (1L << Math.max(0, job.getAttempt() - 1));
        log.warn("Waiting room job for client {} failed on attempt {}, retrying in {} ms: {}",
                job.getClientId(), job.getAttempt(), backoffMs, cause.getMessage());
        try {
            queue.enqueue(job.nextAttempt(), Duration.ofMillis(backoffMs));
        } catch (Exception e) {
            log.error("Unable to re-queue waiting room job for client {}", job.getClientId(), e);
        }
    }

    private long processingDelayMs() {
        long min = settings.getMinProcessingDelayMs();
        long max = settings.getMaxProcessingDelayMs();
        if (max <= min) {
            return Math.max(0, min);
        }
        return ThreadLocalRandom.current().nextLong(min, max + 1);
    }
}
