package com.evently.booking.service;

import com.evently.booking.repository.BookingRepository;
import com.evently.common.dto.PaymentRequest;
import com.evently.common.dto.PaymentResultDto;
import com.evently.common.util.TokenGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Stand-in for a payment gateway: a delayed, randomly failing charge. Never touches booking state.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PaymentSimulationService {

    private final BookingRepository bookingRepository;

    @Value("${payment.simulation.delay-ms:1000}")
    private long delayMs;

    @Value("${payment.simulation.success-rate:0.9}")
    private double successRate;

    public PaymentResultDto simulatePayment(PaymentRequest request) {
        bookingRepository.findByIdAndUserId(request.getBookingId(), request.getUserId())
            .orElseThrow(() -> new BookingNotFoundException(request.getBookingId()));

        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PaymentFailedException("Payment processing interrupted");
            }
        }

        if (ThreadLocalRandom.current().nextDouble() >= successRate) {
            log.warn("Simulated payment declined for booking {} amount {}", request.getBookingId(), request.getAmount());
            throw new PaymentFailedException("Payment failed: insufficient funds");
        }

        String transactionId = TokenGenerator.generateTransactionId();
        log.info("Simulated payment succeeded for booking {} transaction {}", request.getBookingId(), transactionId);

        return PaymentResultDto.builder()
            .success(true)
            .transactionId(transactionId)
            .amount(request.getAmount())
            .message("Payment successful")
            .build();
    }
}
