package com.evently.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.io.Serializable;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SeatDto implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long seatId;
    private String seatRow;
    private Integer seatNumber;

    // Populated on seat map reads only
    private String status; // AVAILABLE, LOCKED, BOOKED
    private Long bookingId;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime lockedAt;
}
