package com.evently.booking.admission;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AdmissionDecision {

    private static final AdmissionDecision ADMITTED = new AdmissionDecision(true, null, 0, null);

    private final boolean admitted;
    private final String queueToken;
    private final long estimatedWaitSeconds;
    private final String message;

    public static AdmissionDecision admitted() {
        return ADMITTED;
    }

    public static AdmissionDecision deferred(String queueToken, long estimatedWaitSeconds, String message) {
        return new AdmissionDecision(false, queueToken, estimatedWaitSeconds, message);
    }
}
