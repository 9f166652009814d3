package com.evently.common.dto;

import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookingSeatsResponse {

    private Long bookingId;
    private String status;
    private List<SeatDto> seats;
    private String message;

    public int getSeatCount() {
        return seats != null ? seats.size() : 0;
    }
}
