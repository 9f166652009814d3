package com.evently.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LockSeatsResponse {

    private Long bookingId;
    private Long showId;
    private String status;
    private List<SeatDto> lockedSeats;

    private long expiresInSeconds;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime expiresAt;

    private String message;
}
