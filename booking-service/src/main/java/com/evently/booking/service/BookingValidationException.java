package com.evently.booking.service;

public class BookingValidationException extends BookingException {

    public BookingValidationException(String message) {
        super(message);
    }
}
