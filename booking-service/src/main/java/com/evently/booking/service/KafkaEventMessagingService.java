package com.evently.booking.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.evently.common.dto.BookingDto;
import com.evently.common.dto.SeatDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Service
@Slf4j
@RequiredArgsConstructor
public class KafkaEventMessagingService implements EventMessagingService {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    @Value("${kafka.topics.booking-locked:booking-locked}")
    private String bookingLockedTopic;

    @Value("${kafka.topics.booking-confirmed:booking-confirmed}")
    private String bookingConfirmedTopic;

    @Value("${kafka.topics.booking-cancelled:booking-cancelled}")
    private String bookingCancelledTopic;

    @Value("${kafka.topics.booking-expired:booking-expired}")
    private String bookingExpiredTopic;

    @Override
    public void publishSeatsLocked(BookingDto booking) {
        Map<String, Object> event = createBookingEvent(booking, "SEATS_LOCKED");
        event.put("heldSince", booking.getHeldSince());
        send(bookingLockedTopic, booking, event);
    }

    @Override
    public void publishBookingConfirmed(BookingDto booking) {
        Map<String, Object> event = createBookingEvent(booking, "BOOKING_CONFIRMED");
        event.put("confirmedAt", booking.getConfirmedAt());
        send(bookingConfirmedTopic, booking, event);
    }

    @Override
    public void publishBookingCancelled(BookingDto booking) {
        Map<String, Object> event = createBookingEvent(booking, "BOOKING_CANCELLED");
        event.put("cancelledAt", booking.getCancelledAt());
        send(bookingCancelledTopic, booking, event);
    }

    /**
     * Publish booking expired event (hold window lapsed, found by confirm or the sweeper)
     */
    @Override
    public void publishBookingExpired(BookingDto booking) {
        Map<String, Object> event = createBookingEvent(booking, "BOOKING_EXPIRED");
        event.put("heldSince", booking.getHeldSince());
        event.put("cancelledAt", booking.getCancelledAt());
        send(bookingExpiredTopic, booking, event);
    }

    private void send(String topic, BookingDto booking, Map<String, Object> event) {
        String key = String.valueOf(booking.getBookingId());
        try {
            String eventJson = objectMapper.writeValueAsString(event);

            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, key, eventJson);

            future.whenComplete((result, throwable) -> {
                if (throwable != null) {
                    log.error("Failed to publish {} event for booking: {}", event.get("eventType"), key, throwable);
                } else {
                    log.debug("Published {} event for booking: {} to partition: {}",
                             event.get("eventType"), key, result.getRecordMetadata().partition());
                }
            });

        } catch (Exception e) {
            log.error("Error creating {} event for booking: {}", event.get("eventType"), key, e);
        }
    }

    private Map<String, Object> createBookingEvent(BookingDto booking, String eventType) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", eventType);
        event.put("bookingId", booking.getBookingId());
        event.put("userId", booking.getUserId());
        event.put("showId", booking.getShowId());
        event.put("status", booking.getStatus());
        event.put("seatIds", seatIds(booking.getSeats()));
        event.put("timestamp", System.currentTimeMillis());
        event.put("source", "booking-service");
        return event;
    }

    private List<Long> seatIds(List<SeatDto> seats) {
        if (seats == null) {
            return Collections.emptyList();
        }
        return seats.stream().map(SeatDto::getSeatId).toList();
    }
}
