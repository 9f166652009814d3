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
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({BookingNotFoundException.class, ShowNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(BookingException e, HttpServletRequest request) {
        log.warn("Not found: {}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, e.getMessage(), request, null);
    }

    @ExceptionHandler(SeatsUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleSeatsUnavailable(SeatsUnavailableException e, HttpServletRequest request) {
        log.warn("Seat conflict: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, e.getMessage(), request, e.getSeatIds());
    }

    @ExceptionHandler(InvalidSeatsException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSeats(InvalidSeatsException e, HttpServletRequest request) {
        log.warn("Invalid seats: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e.getMessage(), request, e.getSeatIds());
    }

    @ExceptionHandler(BookingExpiredException.class)
    public ResponseEntity<ErrorResponse> handleExpired(BookingExpiredException e, HttpServletRequest request) {
        log.warn("Booking expired: {}", e.getMessage());
        return build(HttpStatus.GONE, e.getMessage(), request, e.getSeatIds());
    }

    @ExceptionHandler({BookingStateException.class, BookingValidationException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(BookingException e, HttpServletRequest request) {
        log.warn("Rejected booking request: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e.getMessage(), request, null);
    }

    @ExceptionHandler(PaymentFailedException.class)
    public ResponseEntity<ErrorResponse> handlePaymentFailed(PaymentFailedException e, HttpServletRequest request) {
        log.warn("Payment failed: {}", e.getMessage());
        return build(HttpStatus.PAYMENT_REQUIRED, e.getMessage(), request, null);
    }

    @ExceptionHandler(BookingException.class)
    public ResponseEntity<ErrorResponse> handleBookingException(BookingException e, HttpServletRequest request) {
        log.warn("Booking error: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e.getMessage(), request, null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e,
                                                                   HttpServletRequest request) {
        Map<String, String> fieldErrors = new HashMap<>();

        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            fieldErrors.put(fieldError.getField(), fieldError.getDefaultMessage());
        }

        ErrorResponse errorResponse = ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(HttpStatus.BAD_REQUEST.value())
            .error("Validation Failed")
            .message("Invalid request parameters")
            .path(request.getRequestURI())
            .validationErrors(fieldErrors)
            .build();

        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception e, HttpServletRequest request) {
        log.warn("Malformed request to {}: {}", request.getRequestURI(), e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Malformed request", request, null);
    }

    /**
     * Database or Redis unreachable. Nothing was committed.
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(DataAccessException e, HttpServletRequest request) {
        log.error("Data store failure in booking service", e);
        return build(HttpStatus.SERVICE_UNAVAILABLE,
            "A backing store is temporarily unavailable. Please try again later.", request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e, HttpServletRequest request) {
        log.error("Unexpected error in booking service", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred. Please try again later.", request, null);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, HttpServletRequest request,
                                                List<Long> seatIds) {
        ErrorResponse errorResponse = ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(status.value())
            .error(status.getReasonPhrase())
            .message(message)
            .path(request.getRequestURI())
            .seatIds(seatIds)
            .build();

        return ResponseEntity.status(status).body(errorResponse);
    }
}
