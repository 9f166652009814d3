package com.evently.booking.service;

import com.evently.common.dto.BookingDto;

/**
 * Publishes booking lifecycle events. Called after the owning transaction commits;
 * implementations must not throw.
 */
public interface EventMessagingService {

    void publishSeatsLocked(BookingDto booking);

    void publishBookingConfirmed(BookingDto booking);

    void publishBookingCancelled(BookingDto booking);

    void publishBookingExpired(BookingDto booking);
}
