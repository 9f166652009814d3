package com.evently.booking.admission;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Waiting room, rate limiter and deferred-admission worker settings.
 */
@Data
@ConfigurationProperties(prefix = "admission")
public class AdmissionProperties {

    private boolean enabled = true;

    private int showThreshold = 50;
    private long showWindowSeconds = 300;

    private int systemThreshold = 200;
    private long systemWindowSeconds = 120;

    // TTL of the waiting_room marker and of the can_proceed token
    private long markerTtlSeconds = 300;
    private long admittedTtlSeconds = 300;

    private long minEnqueueDelayMs = 5000;
    private long maxEnqueueDelayMs = 20000;
    private int priorityLevels = 10;

    private Worker worker = new Worker();
    private RateLimit rateLimit = new RateLimit();

    @Data
    public static class Worker {
        private boolean enabled = true;
        private int concurrency = 10;
        private long pollIntervalMs = 500;
        private int maxAttempts = 3;
        private long backoffMs = 2000;
        private long minProcessingDelayMs = 1000;
        private long maxProcessingDelayMs = 6000;
    }

    @Data
    public static class RateLimit {
        private boolean enabled = true;
        private int requestsPerMinute = 60;
        private int bookingRequestsPerMinute = 30;
    }
}
