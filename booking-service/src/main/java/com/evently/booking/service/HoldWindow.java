package com.evently.booking.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * The reservation hold window. Confirm and the expiry sweep both judge lapse through this class.
 */
@Component
public class HoldWindow {

    private final Duration duration;

    public HoldWindow(@Value("${booking.hold.duration.minutes:10}") int holdDurationMinutes) {
        this.duration = Duration.ofMinutes(holdDurationMinutes);
    }

    public Duration getDuration() {
        return duration;
    }

    public LocalDateTime cutoff(LocalDateTime now) {
        return now.minus(duration);
    }

    public LocalDateTime expiresAt(LocalDateTime heldSince) {
        return heldSince.plus(duration);
    }

    /**
     * True when a hold that started at {@code heldSince} is older than the window at {@code now}.
     */
    public boolean isElapsed(LocalDateTime heldSince, LocalDateTime now) {
        return heldSince != null && heldSince.isBefore(cutoff(now));
    }
}
