package com.evently.booking.service;

import java.util.List;

/**
 * Requested seat ids that are not seats of the show's venue.
 */
public class InvalidSeatsException extends BookingValidationException {

    private final List<Long> seatIds;

    public InvalidSeatsException(List<Long> seatIds) {
        super("Invalid seat IDs for this show: " + seatIds);
        this.seatIds = List.copyOf(seatIds);
    }

    public List<Long> getSeatIds() {
        return seatIds;
    }
}
