package com.evently.booking.admission;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeferredAdmissionResponse {

    private String message;
    private String status;
    private String position;
    private String queueToken;
    private long estimatedWaitSeconds;

    public static DeferredAdmissionResponse from(AdmissionDecision decision) {
        return DeferredAdmissionResponse.builder()
            .message(decision.getMessage())
            .status("DEFERRED")
            .position("in_queue")
            .queueToken(decision.getQueueToken())
            .estimatedWaitSeconds(decision.getEstimatedWaitSeconds())
            .build();
    }
}
