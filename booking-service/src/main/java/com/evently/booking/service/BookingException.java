package com.evently.booking.service;

/**
 * Base class of every reservation failure reported to callers.
 */
public class BookingException extends RuntimeException {

    public BookingException(String message) {
        super(message);
    }

    public BookingException(String message, Throwable cause) {
        super(message, cause);
    }
}
