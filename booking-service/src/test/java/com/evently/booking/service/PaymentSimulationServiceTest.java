package com.evently.booking.service;

import com.evently.booking.repository.BookingRepository;
import com.evently.common.dto.PaymentRequest;
import com.evently.common.dto.PaymentResultDto;
import com.evently.common.entity.Booking;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentSimulationServiceTest {

    @Mock
    private BookingRepository bookingRepository;

    private PaymentSimulationService paymentService;

    private final PaymentRequest request = PaymentRequest.builder()
        .bookingId(5L).userId(7L).amount(new BigDecimal("49.99")).build();

    @BeforeEach
    void setUp() {
        paymentService = new PaymentSimulationService(bookingRepository);
        ReflectionTestUtils.setField(paymentService, "delayMs", 0L);
    }

    private void bookingExists() {
        when(bookingRepository.findByIdAndUserId(5L, 7L)).thenReturn(Optional.of(Booking.builder()
            .id(5L).userId(7L).showId(1L)
            .status(Booking.BookingStatus.PENDING)
            .heldSince(LocalDateTime.now())
            .build()));
    }

    @Test
    void simulatePayment_Approved_ReturnsTransaction() {
        bookingExists();
        ReflectionTestUtils.setField(paymentService, "successRate", 1.0);

        PaymentResultDto result = paymentService.simulatePayment(request);

        assertTrue(result.isSuccess());
        assertTrue(result.getTransactionId().startsWith("txn_"));
        assertEquals(new BigDecimal("49.99"), result.getAmount());
    }

    @Test
    void simulatePayment_Declined_ThrowsPaymentFailed() {
        bookingExists();
        ReflectionTestUtils.setField(paymentService, "successRate", 0.0);

        PaymentFailedException e = assertThrows(PaymentFailedException.class,
            () -> paymentService.simulatePayment(request));

        assertEquals("Payment failed: insufficient funds", e.getMessage());
    }

    @Test
    void simulatePayment_UnknownBooking_NotFound() {
        when(bookingRepository.findByIdAndUserId(5L, 7L)).thenReturn(Optional.empty());

        assertThrows(BookingNotFoundException.class, () -> paymentService.simulatePayment(request));
    }

    @Test
    void simulatePayment_NeverChangesBookingState() {
        bookingExists();
        ReflectionTestUtils.setField(paymentService, "successRate", 1.0);

        paymentService.simulatePayment(request);

        verify(bookingRepository, never()).save(any());
    }
}
