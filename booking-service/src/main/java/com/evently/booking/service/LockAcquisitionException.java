package com.evently.booking.service;

public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(String lockKey) {
        super("Unable to acquire lock: " + lockKey);
    }
}
