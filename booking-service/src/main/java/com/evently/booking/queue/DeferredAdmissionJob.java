package com.evently.booking.queue;

import lombok.*;

/**
 * A waiting client. Serialized as JSON into the queue's sorted set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class DeferredAdmissionJob {

    private String token;
    private String clientId;
    private Long showId;

    // Lower runs first among ready jobs
    private int priority;

    // 1-based
    private int attempt;

    private long enqueuedAt;

    public DeferredAdmissionJob nextAttempt() {
        return toBuilder().attempt(attempt + 1).build();
    }
}
