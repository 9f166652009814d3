package com.evently.booking.service;

import java.util.List;

/**
 * Lock conflict. Carries the seat ids that could not be secured so the caller can retry with another set.
 */
public class SeatsUnavailableException extends BookingException {

    private final List<Long> seatIds;

    public SeatsUnavailableException(List<Long> seatIds) {
        super("Some seats are not available: " + seatIds);
        this.seatIds = List.copyOf(seatIds);
    }

    public List<Long> getSeatIds() {
        return seatIds;
    }
}
