package com.evently.booking.controller;

import com.evently.booking.service.BookingException;
import com.evently.booking.service.BookingHistoryService;
import com.evently.booking.service.PaymentSimulationService;
import com.evently.booking.service.ReservationService;
import com.evently.common.dto.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Booking Controller", description = "Seat locking, confirmation and cancellation")
public class BookingController {

    private final ReservationService reservationService;
    private final BookingHistoryService bookingHistoryService;
    private final PaymentSimulationService paymentSimulationService;

    @PostMapping("/shows/{showId}/lock")
    @Operation(
        summary = "Lock seats for a show",
        description = "Atomically locks every requested seat for the user and opens a pending booking. " +
                     "Either all seats are locked or none are. The hold lasts booking.hold.duration.minutes."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Seats locked, booking pending"),
        @ApiResponse(responseCode = "400", description = "Invalid request or seats not in the show's venue"),
        @ApiResponse(responseCode = "404", description = "Show not found"),
        @ApiResponse(responseCode = "409", description = "One or more seats are not available"),
        @ApiResponse(responseCode = "429", description = "Deferred to the waiting room or rate limited")
    })
    public ResponseEntity<LockSeatsResponse> lockSeats(
            @Parameter(description = "Show to lock seats for") @PathVariable Long showId,
            @Valid @RequestBody LockSeatsRequest request) {

        log.info("Seat lock request received for user: {} show: {} seats: {}",
                request.getUserId(), showId, request.getSeatIds());

        try {
            LockSeatsResponse response = reservationService.lockSeats(showId, request);

            log.info("Seat lock successful: booking {} for user: {}", response.getBookingId(), request.getUserId());

            return ResponseEntity.status(HttpStatus.CREATED).body(response);

        } catch (BookingException e) {
            log.warn("Seat lock failed for user: {} show: {} - {}", request.getUserId(), showId, e.getMessage());
            throw e;
        }
    }

    @PostMapping("/bookings/{bookingId}/confirm")
    @Operation(
        summary = "Confirm a pending booking",
        description = "Books the locked seats if the hold has not lapsed. A lapsed hold is released and " +
                     "the booking cancelled."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Booking confirmed"),
        @ApiResponse(responseCode = "400", description = "Booking is not pending"),
        @ApiResponse(responseCode = "404", description = "Booking not found for this user"),
        @ApiResponse(responseCode = "410", description = "Hold expired, seats released")
    })
    public ResponseEntity<BookingSeatsResponse> confirmBooking(
            @Parameter(description = "Booking to confirm") @PathVariable Long bookingId,
            @Valid @RequestBody BookingActionRequest request) {

        log.info("Booking confirmation request for booking: {} user: {}", bookingId, request.getUserId());

        try {
            BookingSeatsResponse response = reservationService.confirmBooking(bookingId, request.getUserId());

            log.info("Booking {} confirmed with {} seats", bookingId, response.getSeatCount());

            return ResponseEntity.ok(response);

        } catch (BookingException e) {
            log.warn("Booking confirmation failed for booking: {} - {}", bookingId, e.getMessage());
            throw e;
        }
    }

    @PostMapping("/bookings/{bookingId}/cancel")
    @Operation(
        summary = "Cancel a booking",
        description = "Releases every seat the booking still holds and marks it cancelled."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Booking cancelled"),
        @ApiResponse(responseCode = "400", description = "Booking is already cancelled"),
        @ApiResponse(responseCode = "404", description = "Booking not found for this user")
    })
    public ResponseEntity<BookingSeatsResponse> cancelBooking(
            @Parameter(description = "Booking to cancel") @PathVariable Long bookingId,
            @Valid @RequestBody BookingActionRequest request) {

        log.info("Booking cancellation request for booking: {} user: {}", bookingId, request.getUserId());

        try {
            BookingSeatsResponse response = reservationService.cancelBooking(bookingId, request.getUserId());

            log.info("Booking {} cancelled, {} seats released", bookingId, response.getSeatCount());

            return ResponseEntity.ok(response);

        } catch (BookingException e) {
            log.warn("Booking cancellation failed for booking: {} - {}", bookingId, e.getMessage());
            throw e;
        }
    }

    @PostMapping("/bookings/payments/simulate")
    @Operation(
        summary = "Simulate a payment",
        description = "Stands in for a payment gateway. Succeeds most of the time after a short delay."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Payment accepted"),
        @ApiResponse(responseCode = "402", description = "Payment declined"),
        @ApiResponse(responseCode = "404", description = "Booking not found for this user")
    })
    public ResponseEntity<PaymentResultDto> simulatePayment(@Valid @RequestBody PaymentRequest request) {
        log.info("Payment simulation for booking: {} user: {}", request.getBookingId(), request.getUserId());
        return ResponseEntity.ok(paymentSimulationService.simulatePayment(request));
    }

    @GetMapping("/users/{userId}/bookings")
    @Operation(summary = "List a user's bookings", description = "Newest first, with show details and held seats.")
    public ResponseEntity<List<BookingDto>> getUserBookings(
            @Parameter(description = "User id") @PathVariable Long userId) {

        log.debug("Booking history request for user: {}", userId);
        return ResponseEntity.ok(bookingHistoryService.getUserBookings(userId));
    }

    @GetMapping("/bookings/health")
    @Operation(
        summary = "Health check endpoint",
        description = "Simple health check for load balancer and monitoring."
    )
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Booking Service is healthy");
    }
}
