package com.evently.booking.service;

public class PaymentFailedException extends BookingException {

    public PaymentFailedException(String message) {
        super(message);
    }
}
