package com.evently.booking.service;

public class BookingNotFoundException extends BookingException {

    public BookingNotFoundException(String message) {
        super(message);
    }

    public BookingNotFoundException(Long bookingId) {
        super("Booking not found: " + bookingId);
    }
}
