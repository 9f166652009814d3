package com.evently.booking.exception;

import com.evently.booking.service.BookingException;
import com.evently.booking.service.BookingExpiredException;
import com.evently.booking.service.BookingNotFoundException;
import com.evently.booking.service.BookingStateException;
import com.evently.booking.service.BookingValidationException;
import com.evently.booking.service.InvalidSeatsException;
import com.evently.booking.service.PaymentFailedException;
import com.evently.booking.service.SeatsUnavailableException;
import com.evently.booking.service.ShowNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    private MockHttpServletRequest request;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
        request = new MockHttpServletRequest("POST", "/api/v1/shows/1/lock");
    }

    @Test
    void handleNotFound_Booking() {
        ResponseEntity<ErrorResponse> response = handler.handleNotFound(new BookingNotFoundException(5L), request);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals(404, response.getBody().getStatus());
        assertEquals("/api/v1/shows/1/lock", response.getBody().getPath());
        assertTrue(response.getBody().getMessage().contains("5"));
    }

    @Test
    void handleNotFound_Show() {
        ResponseEntity<ErrorResponse> response = handler.handleNotFound(new ShowNotFoundException(1L), request);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }

    @Test
    void handleSeatsUnavailable_ConflictWithSeatIds() {
        ResponseEntity<ErrorResponse> response =
            handler.handleSeatsUnavailable(new SeatsUnavailableException(List.of(3L, 4L)), request);

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals(List.of(3L, 4L), response.getBody().getSeatIds());
    }

    @Test
    void handleInvalidSeats_BadRequestWithSeatIds() {
        ResponseEntity<ErrorResponse> response =
            handler.handleInvalidSeats(new InvalidSeatsException(List.of(99L)), request);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(List.of(99L), response.getBody().getSeatIds());
    }

    @Test
    void handleExpired_Gone() {
        ResponseEntity<ErrorResponse> response =
            handler.handleExpired(new BookingExpiredException(5L, List.of(1L, 2L)), request);

        assertEquals(HttpStatus.GONE, response.getStatusCode());
        assertEquals(410, response.getBody().getStatus());
        assertEquals(List.of(1L, 2L), response.getBody().getSeatIds());
    }

    @Test
    void handleBadRequest_StateAndValidation() {
        assertEquals(HttpStatus.BAD_REQUEST,
            handler.handleBadRequest(new BookingStateException("Booking is already cancelled"), request).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST,
            handler.handleBadRequest(new BookingValidationException("Seat IDs cannot be empty"), request).getStatusCode());
    }

    @Test
    void handlePaymentFailed_PaymentRequired() {
        ResponseEntity<ErrorResponse> response =
            handler.handlePaymentFailed(new PaymentFailedException("Payment failed: insufficient funds"), request);

        assertEquals(HttpStatus.PAYMENT_REQUIRED, response.getStatusCode());
        assertEquals("Payment failed: insufficient funds", response.getBody().getMessage());
    }

    @Test
    void handleBookingException_Fallback() {
        ResponseEntity<ErrorResponse> response = handler.handleBookingException(new BookingException("Oops"), request);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertNull(response.getBody().getSeatIds());
    }

    @Test
    void handleValidationException_CollectsFieldErrors() {
        MethodArgumentNotValidException ex = mock(MethodArgumentNotValidException.class);
        BindingResult bindingResult = mock(BindingResult.class);
        when(ex.getBindingResult()).thenReturn(bindingResult);
        when(bindingResult.getFieldErrors()).thenReturn(List.of(
            new FieldError("lockSeatsRequest", "seatIds", "Seat IDs cannot be empty")));

        ResponseEntity<ErrorResponse> response = handler.handleValidationException(ex, request);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Validation Failed", response.getBody().getError());
        assertEquals("Seat IDs cannot be empty", response.getBody().getValidationErrors().get("seatIds"));
    }

    @Test
    void handleDataAccessException_ServiceUnavailable() {
        ResponseEntity<ErrorResponse> response =
            handler.handleDataAccessException(new RedisConnectionFailureException("Redis down"), request);

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals(503, response.getBody().getStatus());
    }

    @Test
    void handleGenericException_InternalError() {
        ResponseEntity<ErrorResponse> response = handler.handleGenericException(new RuntimeException("boom"), request);

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertFalse(response.getBody().getMessage().contains("boom"));
    }
}
