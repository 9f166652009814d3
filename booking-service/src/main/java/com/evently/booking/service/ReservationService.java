package com.evently.booking.service;

import com.evently.booking.repository.BookingRepository;
import com.evently.booking.repository.SeatRepository;
import com.evently.booking.repository.ShowRepository;
import com.evently.booking.repository.ShowSeatRepository;
import com.evently.common.dto.BookingDto;
import com.evently.common.dto.BookingSeatsResponse;
import com.evently.common.dto.LockSeatsRequest;
import com.evently.common.dto.LockSeatsResponse;
import com.evently.common.dto.SeatDto;
import com.evently.common.entity.Booking;
import com.evently.common.entity.Seat;
import com.evently.common.entity.Show;
import com.evently.common.entity.ShowSeat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Seat reservation protocol: lock, confirm and cancel.
 *
 * <p>Every lock request takes row locks on the targeted show seats, then a per-seat Redis entry
 * ({@code seat_lock:{showId}:{seatId}}, value = user id, TTL = hold window). The database stays
 * authoritative. Redis entries are deleted after commit on every path that moves a seat out of LOCKED,
 * and entries taken by a lock attempt are released if that attempt rolls back.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReservationService {

    private final ShowRepository showRepository;
    private final SeatRepository seatRepository;
    private final ShowSeatRepository showSeatRepository;
    private final BookingRepository bookingRepository;
    private final DistributedLockService lockService;
    private final EventMessagingService messagingService;
    private final HoldWindow holdWindow;

    @Value("${booking.max.seats.per.booking:10}")
    private int maxSeatsPerBooking;

    /**
     * Lock seats for a show. All requested seats are granted or none are.
     */
    @Transactional
    public LockSeatsResponse lockSeats(Long showId, LockSeatsRequest request) {
        List<Long> seatIds = validateLockRequest(request);
        Long userId = request.getUserId();

        Show show = showRepository.findById(showId)
            .orElseThrow(() -> new ShowNotFoundException(showId));

        // 1. Row locks on existing show seats
        List<ShowSeat> existing = showSeatRepository.findForUpdate(showId, seatIds);

        List<Long> unavailable = existing.stream()
            .filter(showSeat -> !showSeat.isAvailable())
            .map(ShowSeat::getSeatId)
            .toList();
        if (!unavailable.isEmpty()) {
            throw new SeatsUnavailableException(unavailable);
        }

        // 2. Every requested seat must belong to the show's venue
        List<Seat> seats = seatRepository.findByVenueIdAndIdIn(show.getVenueId(), seatIds);
        Set<Long> venueSeatIds = seats.stream().map(Seat::getId).collect(Collectors.toSet());
        List<Long> invalid = seatIds.stream().filter(id -> !venueSeatIds.contains(id)).toList();
        if (!invalid.isEmpty()) {
            throw new InvalidSeatsException(invalid);
        }

        // 3. Cross-process arbitration, all-or-nothing
        String owner = String.valueOf(userId);
        List<String> acquiredKeys = acquireSeatLocks(showId, seatIds, owner);

        try {
            LocalDateTime now = LocalDateTime.now();

            Booking booking = bookingRepository.save(Booking.builder()
                .userId(userId)
                .showId(showId)
                .status(Booking.BookingStatus.PENDING)
                .heldSince(now)
                .build());

            Map<Long, ShowSeat> existingBySeatId = existing.stream()
                .collect(Collectors.toMap(ShowSeat::getSeatId, Function.identity()));

            List<ShowSeat> toLock = new ArrayList<>(seatIds.size());
            List<Long> createdSeatIds = new ArrayList<>();
            for (Long seatId : seatIds) {
                ShowSeat showSeat = existingBySeatId.get(seatId);
                if (showSeat == null) {
                    showSeat = ShowSeat.available(showId, seatId);
                    createdSeatIds.add(seatId);
                }
                showSeat.lock(booking.getId(), now);
                toLock.add(showSeat);
            }
            try {
                showSeatRepository.saveAllAndFlush(toLock);
            } catch (DataIntegrityViolationException e) {
                // Another attempt created one of these rows after our row-lock read
                log.warn("Show seat rows for show={} seats={} were created concurrently", showId, createdSeatIds);
                throw new SeatsUnavailableException(createdSeatIds);
            }

            // Prepare DTOs before afterCompletion to avoid lazy-load issues
            List<SeatDto> lockedSeats = BookingDtoMapper.toSeatDtos(seatIds, seats);
            BookingDto bookingDto = BookingDtoMapper.toDto(booking, lockedSeats);

            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    if (status == STATUS_COMMITTED) {
                        messagingService.publishSeatsLocked(bookingDto);
                    } else {
                        releaseOwnedLocks(acquiredKeys, owner);
                        log.warn("Seat lock rolled back for show={} user={}, released {} lock entries",
                                showId, userId, acquiredKeys.size());
                    }
                }
            });

            log.info("Seats locked: booking={} show={} user={} seats={}",
                    booking.getId(), showId, userId, seatIds);

            return LockSeatsResponse.builder()
                .bookingId(booking.getId())
                .showId(showId)
                .status(booking.getStatus().name())
                .lockedSeats(lockedSeats)
                .expiresInSeconds(holdWindow.getDuration().toSeconds())
                .expiresAt(holdWindow.expiresAt(now))
                .message("Seats locked successfully. Complete payment within "
                        + holdWindow.getDuration().toMinutes() + " minutes.")
                .build();

        } catch (RuntimeException e) {
            releaseOwnedLocks(acquiredKeys, owner);
            throw e;
        }
    }

    /**
     * Confirm a pending booking. A lapsed hold cancels the booking, commits that, and reports expiry.
     */
    @Transactional(noRollbackFor = BookingExpiredException.class)
    public BookingSeatsResponse confirmBooking(Long bookingId, Long userId) {
        Booking booking = bookingRepository.findByIdAndUserIdForUpdate(bookingId, userId)
            .orElseThrow(() -> new BookingNotFoundException(bookingId));

        if (!booking.isPending()) {
            throw new BookingStateException("Booking is not in pending status: " + booking.getStatus());
        }

        List<ShowSeat> lockedSeats = showSeatRepository.findByBookingIdForUpdate(bookingId).stream()
            .filter(ShowSeat::isLocked)
            .toList();
        if (lockedSeats.isEmpty()) {
            throw new BookingStateException("No locked seats found for booking " + bookingId);
        }

        Long showId = booking.getShowId();
        List<Long> seatIds = lockedSeats.stream().map(ShowSeat::getSeatId).toList();
        List<String> lockKeys = seatLockKeys(showId, seatIds);

        LocalDateTime now = LocalDateTime.now();
        boolean expired = holdWindow.isElapsed(booking.getHeldSince(), now)
            || lockedSeats.stream().anyMatch(showSeat -> holdWindow.isElapsed(showSeat.getLockedAt(), now));

        if (expired) {
            lockedSeats.forEach(ShowSeat::release);
            showSeatRepository.saveAll(lockedSeats);
            booking.cancel();
            bookingRepository.save(booking);

            BookingDto bookingDto = BookingDtoMapper.toDto(booking, seatIdsOnly(seatIds));
            releaseLocksAfterCommit(lockKeys, () -> messagingService.publishBookingExpired(bookingDto));

            log.warn("Booking {} expired at confirmation, {} seats released", bookingId, seatIds.size());
            throw new BookingExpiredException(bookingId, seatIds);
        }

        lockedSeats.forEach(ShowSeat::book);
        showSeatRepository.saveAll(lockedSeats);
        booking.confirm();
        bookingRepository.save(booking);

        List<SeatDto> confirmedSeats = BookingDtoMapper.toSeatDtos(seatIds, seatRepository.findByIdIn(seatIds));
        BookingDto bookingDto = BookingDtoMapper.toDto(booking, confirmedSeats);
        releaseLocksAfterCommit(lockKeys, () -> messagingService.publishBookingConfirmed(bookingDto));

        log.info("Booking confirmed: booking={} user={} seats={}", bookingId, userId, seatIds);

        return BookingSeatsResponse.builder()
            .bookingId(bookingId)
            .status(booking.getStatus().name())
            .seats(confirmedSeats)
            .message("Booking confirmed successfully")
            .build();
    }

    /**
     * Cancel a booking that is pending or confirmed, releasing all of its seats.
     */
    @Transactional
    public BookingSeatsResponse cancelBooking(Long bookingId, Long userId) {
        Booking booking = bookingRepository.findByIdAndUserIdForUpdate(bookingId, userId)
            .orElseThrow(() -> new BookingNotFoundException(bookingId));

        if (booking.isCancelled()) {
            throw new BookingStateException("Booking is already cancelled");
        }

        List<ShowSeat> ownedSeats = showSeatRepository.findByBookingIdForUpdate(bookingId);
        List<Long> seatIds = ownedSeats.stream().map(ShowSeat::getSeatId).toList();

        ownedSeats.forEach(ShowSeat::release);
        showSeatRepository.saveAll(ownedSeats);
        booking.cancel();
        bookingRepository.save(booking);

        List<SeatDto> cancelledSeats = BookingDtoMapper.toSeatDtos(seatIds, seatRepository.findByIdIn(seatIds));
        BookingDto bookingDto = BookingDtoMapper.toDto(booking, cancelledSeats);
        releaseLocksAfterCommit(seatLockKeys(booking.getShowId(), seatIds),
            () -> messagingService.publishBookingCancelled(bookingDto));

        log.info("Booking cancelled: booking={} user={} seats={}", bookingId, userId, seatIds);

        return BookingSeatsResponse.builder()
            .bookingId(bookingId)
            .status(booking.getStatus().name())
            .seats(cancelledSeats)
            .message("Booking cancelled successfully")
            .build();
    }

    /**
     * Take every seat's Redis entry or none. On a lost race the entries taken so far are released
     * and the seats not secured (the contested one and those after it) are reported.
     */
    private List<String> acquireSeatLocks(Long showId, List<Long> seatIds, String owner) {
        List<String> acquiredKeys = new ArrayList<>(seatIds.size());

        for (int i = 0; i < seatIds.size(); i++) {
            String key = DistributedLockService.seatLock(showId, seatIds.get(i));
            boolean acquired;
            try {
                acquired = lockService.tryAcquire(key, owner, holdWindow.getDuration());
            } catch (RuntimeException e) {
                releaseOwnedLocks(acquiredKeys, owner);
                throw e;
            }

            if (!acquired) {
                releaseOwnedLocks(acquiredKeys, owner);
                List<Long> notSecured = seatIds.subList(i, seatIds.size());
                log.info("Seat lock race lost for show={} owner={} seats={}", showId, owner, notSecured);
                throw new SeatsUnavailableException(notSecured);
            }
            acquiredKeys.add(key);
        }
        return acquiredKeys;
    }

    private void releaseOwnedLocks(List<String> keys, String owner) {
        for (String key : keys) {
            lockService.release(key, owner);
        }
    }

    private void releaseLocksAfterCommit(List<String> lockKeys, Runnable onCommit) {
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_COMMITTED) {
                    lockService.releaseAll(lockKeys);
                    onCommit.run();
                }
            }
        });
    }

    private List<Long> validateLockRequest(LockSeatsRequest request) {
        if (request.getUserId() == null) {
            throw new BookingValidationException("User ID is required");
        }
        if (request.getSeatIds() == null || request.getSeatIds().isEmpty()) {
            throw new BookingValidationException("Seat IDs cannot be empty");
        }
        if (request.getSeatIds().stream().anyMatch(Objects::isNull)) {
            throw new BookingValidationException("Seat IDs cannot contain null values");
        }

        List<Long> seatIds = List.copyOf(new LinkedHashSet<>(request.getSeatIds()));
        if (seatIds.size() > maxSeatsPerBooking) {
            throw new BookingValidationException("Cannot lock more than " + maxSeatsPerBooking + " seats at once");
        }
        return seatIds;
    }

    static List<String> seatLockKeys(Long showId, List<Long> seatIds) {
        return seatIds.stream()
            .map(seatId -> DistributedLockService.seatLock(showId, seatId))
            .toList();
    }

    static List<SeatDto> seatIdsOnly(List<Long> seatIds) {
        return seatIds.stream().map(id -> SeatDto.builder().seatId(id).build()).toList();
    }
}
