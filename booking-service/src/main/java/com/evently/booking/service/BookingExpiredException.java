package com.evently.booking.service;

import java.util.List;

/**
 * The hold window of a booking lapsed before confirmation. The booking has been cancelled
 * and a new lock is required.
 */
public class BookingExpiredException extends BookingException {

    private final Long bookingId;
    private final List<Long> seatIds;

    public BookingExpiredException(Long bookingId, List<Long> seatIds) {
        super("Seat lock has expired for booking " + bookingId + ". Please select seats again.");
        this.bookingId = bookingId;
        this.seatIds = List.copyOf(seatIds);
    }

    public Long getBookingId() {
        return bookingId;
    }

    public List<Long> getSeatIds() {
        return seatIds;
    }
}
