package com.evently.booking.service;

import com.evently.booking.repository.BookingRepository;
import com.evently.booking.repository.ShowSeatRepository;
import com.evently.common.dto.BookingDto;
import com.evently.common.entity.Booking;
import com.evently.common.entity.ShowSeat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Reclaims pending bookings whose hold window has lapsed, one transaction per booking.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BookingExpiryService {

    private final BookingRepository bookingRepository;
    private final ShowSeatRepository showSeatRepository;
    private final DistributedLockService lockService;
    private final EventMessagingService messagingService;
    private final HoldWindow holdWindow;

    @Transactional(readOnly = true)
    public List<Long> findExpiredBookingIds(LocalDateTime now) {
        return bookingRepository.findIdsByStatusAndHeldSinceBefore(
            Booking.BookingStatus.PENDING, holdWindow.cutoff(now));
    }

    /**
     * Cancel one expired booking and release its seats. Returns false when the booking was
     * confirmed, cancelled or is no longer past its window by the time its row lock is held.
     */
    @Transactional
    public boolean expireBooking(Long bookingId) {
        Booking booking = bookingRepository.findByIdForUpdate(bookingId).orElse(null);
        LocalDateTime now = LocalDateTime.now();

        if (booking == null || !booking.isPending() || !holdWindow.isElapsed(booking.getHeldSince(), now)) {
            log.debug("Booking {} no longer eligible for expiry, skipping", bookingId);
            return false;
        }

        List<ShowSeat> seats = showSeatRepository.findByBookingIdForUpdate(bookingId);
        List<Long> seatIds = seats.stream().map(ShowSeat::getSeatId).toList();

        seats.forEach(ShowSeat::release);
        showSeatRepository.saveAll(seats);
        booking.cancel();
        bookingRepository.save(booking);

        // Prepare values for afterCompletion
        List<String> lockKeys = ReservationService.seatLockKeys(booking.getShowId(), seatIds);
        BookingDto bookingDto = BookingDtoMapper.toDto(booking, ReservationService.seatIdsOnly(seatIds));

        // Lock entries self-expire, so deletion is best-effort and only after commit
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_COMMITTED) {
                    lockService.releaseAll(lockKeys);
                    messagingService.publishBookingExpired(bookingDto);
                } else {
                    log.warn("Expiry of booking {} rolled back, seats remain locked", bookingId);
                }
            }
        });

        log.info("Expired booking {} ({} seats released)", bookingId, seatIds.size());
        return true;
    }
}
