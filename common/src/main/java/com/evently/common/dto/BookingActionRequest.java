package com.evently.common.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

/**
 * Body of confirm and cancel calls; identifies the requester.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookingActionRequest {

    @NotNull(message = "User ID is required")
    private Long userId;
}
