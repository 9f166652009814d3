package com.evently.booking.service;

import com.evently.booking.repository.BookingRepository;
import com.evently.booking.repository.ShowSeatRepository;
import com.evently.common.dto.BookingDto;
import com.evently.common.entity.Booking;
import com.evently.common.entity.ShowSeat;
import com.evently.common.entity.ShowSeatId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookingExpiryServiceTest {

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private ShowSeatRepository showSeatRepository;

    @Mock
    private DistributedLockService lockService;

    @Mock
    private EventMessagingService messagingService;

    private BookingExpiryService expiryService;

    @BeforeEach
    void setUp() {
        expiryService = new BookingExpiryService(bookingRepository, showSeatRepository, lockService,
            messagingService, new HoldWindow(10));
        TransactionSynchronizationManager.initSynchronization();
    }

    @AfterEach
    void tearDown() {
        TransactionSynchronizationManager.clearSynchronization();
    }

    private Booking pendingBooking(LocalDateTime heldSince) {
        return Booking.builder()
            .id(5L).userId(7L).showId(1L)
            .status(Booking.BookingStatus.PENDING)
            .heldSince(heldSince)
            .build();
    }

    private ShowSeat lockedSeat(Long seatId, LocalDateTime lockedAt) {
        return ShowSeat.builder()
            .id(new ShowSeatId(1L, seatId))
            .status(ShowSeat.SeatStatus.LOCKED)
            .bookingId(5L)
            .lockedAt(lockedAt)
            .build();
    }

    @Test
    void findExpiredBookingIds_QueriesPendingBookingsBeforeCutoff() {
        LocalDateTime now = LocalDateTime.of(2025, 6, 1, 12, 0);
        when(bookingRepository.findIdsByStatusAndHeldSinceBefore(Booking.BookingStatus.PENDING, now.minusMinutes(10)))
            .thenReturn(List.of(5L, 6L));

        assertEquals(List.of(5L, 6L), expiryService.findExpiredBookingIds(now));
    }

    @Test
    void expireBooking_Lapsed_CancelsAndReleasesSeats() {
        LocalDateTime heldSince = LocalDateTime.now().minusMinutes(12);
        Booking booking = pendingBooking(heldSince);
        ShowSeat first = lockedSeat(10L, heldSince);
        ShowSeat second = lockedSeat(11L, heldSince);

        when(bookingRepository.findByIdForUpdate(5L)).thenReturn(Optional.of(booking));
        when(showSeatRepository.findByBookingIdForUpdate(5L)).thenReturn(List.of(first, second));

        assertTrue(expiryService.expireBooking(5L));

        assertEquals(Booking.BookingStatus.CANCELLED, booking.getStatus());
        assertNotNull(booking.getCancelledAt());
        assertTrue(first.isAvailable());
        assertTrue(second.isAvailable());
        assertNull(first.getBookingId());
        verify(bookingRepository).save(booking);

        verifyNoInteractions(lockService, messagingService);
        TransactionSynchronizationManager.getSynchronizations()
            .forEach(s -> s.afterCompletion(TransactionSynchronization.STATUS_COMMITTED));

        verify(lockService).releaseAll(List.of("seat_lock:1:10", "seat_lock:1:11"));
        ArgumentCaptor<BookingDto> captor = ArgumentCaptor.forClass(BookingDto.class);
        verify(messagingService).publishBookingExpired(captor.capture());
        assertEquals("CANCELLED", captor.getValue().getStatus());
        assertEquals(2, captor.getValue().getSeats().size());
    }

    @Test
    void expireBooking_RolledBack_LeavesLockEntries() {
        LocalDateTime heldSince = LocalDateTime.now().minusMinutes(12);
        when(bookingRepository.findByIdForUpdate(5L)).thenReturn(Optional.of(pendingBooking(heldSince)));
        when(showSeatRepository.findByBookingIdForUpdate(5L)).thenReturn(List.of(lockedSeat(10L, heldSince)));

        expiryService.expireBooking(5L);
        TransactionSynchronizationManager.getSynchronizations()
            .forEach(s -> s.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));

        verifyNoInteractions(lockService, messagingService);
    }

    @Test
    void expireBooking_ConfirmedMeanwhile_Skipped() {
        Booking booking = pendingBooking(LocalDateTime.now().minusMinutes(12));
        booking.confirm();
        when(bookingRepository.findByIdForUpdate(5L)).thenReturn(Optional.of(booking));

        assertFalse(expiryService.expireBooking(5L));

        verifyNoInteractions(showSeatRepository);
        verify(bookingRepository, never()).save(any());
    }

    @Test
    void expireBooking_StillWithinWindow_Skipped() {
        when(bookingRepository.findByIdForUpdate(5L))
            .thenReturn(Optional.of(pendingBooking(LocalDateTime.now().minusMinutes(2))));

        assertFalse(expiryService.expireBooking(5L));
        verifyNoInteractions(showSeatRepository);
    }

    @Test
    void expireBooking_Missing_Skipped() {
        when(bookingRepository.findByIdForUpdate(eq(5L))).thenReturn(Optional.empty());

        assertFalse(expiryService.expireBooking(5L));
        assertTrue(TransactionSynchronizationManager.getSynchronizations().isEmpty());
    }
}
