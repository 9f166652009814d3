package com.evently.booking.service;

import com.evently.common.dto.BookingDto;
import com.evently.common.dto.SeatDto;
import com.evently.common.entity.Booking;
import com.evently.common.entity.Seat;
import com.evently.common.entity.Show;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

final class BookingDtoMapper {

    private BookingDtoMapper() {
    }

    static BookingDto toDto(Booking booking, List<SeatDto> seats) {
        return BookingDto.builder()
            .bookingId(booking.getId())
            .userId(booking.getUserId())
            .showId(booking.getShowId())
            .status(booking.getStatus().name())
            .seats(seats)
            .heldSince(booking.getHeldSince())
            .createdAt(booking.getCreatedAt())
            .confirmedAt(booking.getConfirmedAt())
            .cancelledAt(booking.getCancelledAt())
            .build();
    }

    static BookingDto toDto(Booking booking, Show show, List<SeatDto> seats) {
        BookingDto dto = toDto(booking, seats);
        if (show != null) {
            dto.setShowStartTime(show.getStartTime());
            dto.setEventTitle(show.getEvent().getTitle());
            dto.setVenueName(show.getVenue().getName());
        }
        return dto;
    }

    static SeatDto toSeatDto(Seat seat) {
        return SeatDto.builder()
            .seatId(seat.getId())
            .seatRow(seat.getSeatRow())
            .seatNumber(seat.getSeatNumber())
            .build();
    }

    /**
     * Seat details in the order of {@code seatIds}; ids without a seat row are reported by id only.
     */
    static List<SeatDto> toSeatDtos(List<Long> seatIds, Collection<Seat> seats) {
        Map<Long, Seat> byId = seats.stream().collect(Collectors.toMap(Seat::getId, Function.identity()));
        return seatIds.stream()
            .map(id -> byId.containsKey(id) ? toSeatDto(byId.get(id)) : SeatDto.builder().seatId(id).build())
            .toList();
    }
}
