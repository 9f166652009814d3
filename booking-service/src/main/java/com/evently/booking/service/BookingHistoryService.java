package com.evently.booking.service;

import com.evently.booking.repository.BookingRepository;
import com.evently.booking.repository.SeatRepository;
import com.evently.booking.repository.ShowRepository;
import com.evently.booking.repository.ShowSeatRepository;
import com.evently.common.dto.BookingDto;
import com.evently.common.entity.Booking;
import com.evently.common.entity.Seat;
import com.evently.common.entity.Show;
import com.evently.common.entity.ShowSeat;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class BookingHistoryService {

    private final BookingRepository bookingRepository;
    private final ShowRepository showRepository;
    private final ShowSeatRepository showSeatRepository;
    private final SeatRepository seatRepository;

    /**
     * All bookings of a user, newest first, with show details and the seats each booking still owns
     */
    @Transactional(readOnly = true)
    public List<BookingDto> getUserBookings(Long userId) {
        List<Booking> bookings = bookingRepository.findByUserIdOrderByCreatedAtDesc(userId);
        if (bookings.isEmpty()) {
            return Collections.emptyList();
        }

        List<Long> bookingIds = bookings.stream().map(Booking::getId).toList();
        List<Long> showIds = bookings.stream().map(Booking::getShowId).distinct().toList();

        Map<Long, Show> showsById = showRepository.findAllByIdWithDetails(showIds).stream()
            .collect(Collectors.toMap(Show::getId, Function.identity()));

        Map<Long, List<Long>> seatIdsByBooking = showSeatRepository.findByBookingIdIn(bookingIds).stream()
            .collect(Collectors.groupingBy(ShowSeat::getBookingId,
                Collectors.mapping(ShowSeat::getSeatId, Collectors.toList())));

        List<Long> allSeatIds = seatIdsByBooking.values().stream().flatMap(List::stream).toList();
        List<Seat> seats = allSeatIds.isEmpty() ? Collections.emptyList() : seatRepository.findByIdIn(allSeatIds);

        return bookings.stream()
            .map(booking -> BookingDtoMapper.toDto(
                booking,
                showsById.get(booking.getShowId()),
                BookingDtoMapper.toSeatDtos(seatIdsByBooking.getOrDefault(booking.getId(), List.of()), seats)))
            .toList();
    }
}
