package com.evently.booking.service;

public class BookingStateException extends BookingException {

    public BookingStateException(String message) {
        super(message);
    }
}
