package com.evently.common.dto;

import jakarta.validation.constraints.*;
import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LockSeatsRequest {

    @NotNull(message = "User ID is required")
    private Long userId;

    @NotEmpty(message = "Seat IDs are required")
    @Size(max = 10, message = "Can lock at most 10 seats at a time")
    private List<@NotNull Long> seatIds;
}
