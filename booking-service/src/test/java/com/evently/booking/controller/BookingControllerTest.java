package com.evently.booking.controller;

import com.evently.booking.service.BookingExpiredException;
import com.evently.booking.service.BookingHistoryService;
import com.evently.booking.service.BookingNotFoundException;
import com.evently.booking.service.PaymentFailedException;
import com.evently.booking.service.PaymentSimulationService;
import com.evently.booking.service.ReservationService;
import com.evently.booking.service.SeatsUnavailableException;
import com.evently.common.dto.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookingControllerTest {

    @Mock
    private ReservationService reservationService;

    @Mock
    private BookingHistoryService bookingHistoryService;

    @Mock
    private PaymentSimulationService paymentSimulationService;

    @InjectMocks
    private BookingController bookingController;

    private final BookingActionRequest action = BookingActionRequest.builder().userId(7L).build();

    // ─── lockSeats ───────────────────────────────────────────────────────

    @Test
    void lockSeats_Success_Returns201() {
        LockSeatsRequest request = LockSeatsRequest.builder().userId(7L).seatIds(List.of(1L, 2L)).build();
        LockSeatsResponse response = LockSeatsResponse.builder().bookingId(99L).showId(1L).status("PENDING").build();
        when(reservationService.lockSeats(1L, request)).thenReturn(response);

        ResponseEntity<LockSeatsResponse> result = bookingController.lockSeats(1L, request);

        assertEquals(HttpStatus.CREATED, result.getStatusCode());
        assertEquals(99L, result.getBody().getBookingId());
    }

    @Test
    void lockSeats_Conflict_Rethrown() {
        LockSeatsRequest request = LockSeatsRequest.builder().userId(7L).seatIds(List.of(1L)).build();
        when(reservationService.lockSeats(1L, request)).thenThrow(new SeatsUnavailableException(List.of(1L)));

        assertThrows(SeatsUnavailableException.class, () -> bookingController.lockSeats(1L, request));
    }

    // ─── confirm / cancel ────────────────────────────────────────────────

    @Test
    void confirmBooking_Success_Returns200() {
        BookingSeatsResponse response = BookingSeatsResponse.builder()
            .bookingId(99L).status("CONFIRMED").seats(List.of(SeatDto.builder().seatId(1L).build())).build();
        when(reservationService.confirmBooking(99L, 7L)).thenReturn(response);

        ResponseEntity<BookingSeatsResponse> result = bookingController.confirmBooking(99L, action);

        assertEquals(HttpStatus.OK, result.getStatusCode());
        assertEquals("CONFIRMED", result.getBody().getStatus());
    }

    @Test
    void confirmBooking_Expired_Rethrown() {
        when(reservationService.confirmBooking(99L, 7L)).thenThrow(new BookingExpiredException(99L, List.of(1L)));

        assertThrows(BookingExpiredException.class, () -> bookingController.confirmBooking(99L, action));
    }

    @Test
    void cancelBooking_Success_Returns200() {
        when(reservationService.cancelBooking(99L, 7L)).thenReturn(BookingSeatsResponse.builder()
            .bookingId(99L).status("CANCELLED").seats(List.of()).build());

        ResponseEntity<BookingSeatsResponse> result = bookingController.cancelBooking(99L, action);

        assertEquals(HttpStatus.OK, result.getStatusCode());
        assertEquals("CANCELLED", result.getBody().getStatus());
    }

    @Test
    void cancelBooking_NotFound_Rethrown() {
        when(reservationService.cancelBooking(99L, 7L)).thenThrow(new BookingNotFoundException(99L));

        assertThrows(BookingNotFoundException.class, () -> bookingController.cancelBooking(99L, action));
    }

    // ─── payments / history / health ─────────────────────────────────────

    @Test
    void simulatePayment_Success() {
        PaymentRequest request = PaymentRequest.builder().bookingId(99L).userId(7L).amount(BigDecimal.TEN).build();
        when(paymentSimulationService.simulatePayment(request)).thenReturn(PaymentResultDto.builder()
            .success(true).transactionId("txn_1").amount(BigDecimal.TEN).build());

        ResponseEntity<PaymentResultDto> result = bookingController.simulatePayment(request);

        assertEquals(HttpStatus.OK, result.getStatusCode());
        assertTrue(result.getBody().isSuccess());
    }

    @Test
    void simulatePayment_Declined_Propagates() {
        PaymentRequest request = PaymentRequest.builder().bookingId(99L).userId(7L).amount(BigDecimal.TEN).build();
        when(paymentSimulationService.simulatePayment(request))
            .thenThrow(new PaymentFailedException("Payment failed: insufficient funds"));

        assertThrows(PaymentFailedException.class, () -> bookingController.simulatePayment(request));
    }

    @Test
    void getUserBookings_ReturnsHistory() {
        when(bookingHistoryService.getUserBookings(7L)).thenReturn(List.of(
            BookingDto.builder().bookingId(99L).userId(7L).status("CONFIRMED").build()));

        ResponseEntity<List<BookingDto>> result = bookingController.getUserBookings(7L);

        assertEquals(1, result.getBody().size());
    }

    @Test
    void health_ReturnsOk() {
        ResponseEntity<String> result = bookingController.health();

        assertEquals(HttpStatus.OK, result.getStatusCode());
        assertEquals("Booking Service is healthy", result.getBody());
    }
}
