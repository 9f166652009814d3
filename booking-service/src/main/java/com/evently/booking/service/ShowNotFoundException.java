package com.evently.booking.service;

public class ShowNotFoundException extends BookingException {

    public ShowNotFoundException(Long showId) {
        super("Show not found: " + showId);
    }
}
