package com.evently.booking.service;

import com.evently.booking.repository.BookingRepository;
import com.evently.booking.repository.SeatRepository;
import com.evently.booking.repository.ShowRepository;
import com.evently.booking.repository.ShowSeatRepository;
import com.evently.common.dto.BookingDto;
import com.evently.common.entity.Booking;
import com.evently.common.entity.Event;
import com.evently.common.entity.Seat;
import com.evently.common.entity.Show;
import com.evently.common.entity.ShowSeat;
import com.evently.common.entity.ShowSeatId;
import com.evently.common.entity.Venue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookingHistoryServiceTest {

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private ShowRepository showRepository;

    @Mock
    private ShowSeatRepository showSeatRepository;

    @Mock
    private SeatRepository seatRepository;

    @InjectMocks
    private BookingHistoryService historyService;

    @Test
    void getUserBookings_NoBookings_SkipsLookups() {
        when(bookingRepository.findByUserIdOrderByCreatedAtDesc(7L)).thenReturn(List.of());

        assertTrue(historyService.getUserBookings(7L).isEmpty());
        verifyNoInteractions(showRepository, showSeatRepository, seatRepository);
    }

    @Test
    void getUserBookings_AttachesShowDetailsAndOwnedSeats() {
        LocalDateTime start = LocalDateTime.now().plusDays(3);
        Show show = Show.builder()
            .id(1L)
            .event(Event.builder().id(10L).title("Rock Night").build())
            .venue(Venue.builder().id(3L).name("City Arena").build())
            .startTime(start)
            .build();
        Booking confirmed = Booking.builder().id(20L).userId(7L).showId(1L)
            .status(Booking.BookingStatus.CONFIRMED).heldSince(LocalDateTime.now()).build();
        Booking cancelled = Booking.builder().id(21L).userId(7L).showId(1L)
            .status(Booking.BookingStatus.CANCELLED).heldSince(LocalDateTime.now().minusDays(1)).build();

        when(bookingRepository.findByUserIdOrderByCreatedAtDesc(7L)).thenReturn(List.of(confirmed, cancelled));
        when(showRepository.findAllByIdWithDetails(List.of(1L))).thenReturn(List.of(show));
        when(showSeatRepository.findByBookingIdIn(List.of(20L, 21L))).thenReturn(List.of(
            ShowSeat.builder().id(new ShowSeatId(1L, 5L)).status(ShowSeat.SeatStatus.BOOKED).bookingId(20L).build()));
        when(seatRepository.findByIdIn(List.of(5L))).thenReturn(List.of(
            Seat.builder().id(5L).venueId(3L).seatRow("C").seatNumber(12).build()));

        List<BookingDto> history = historyService.getUserBookings(7L);

        assertEquals(2, history.size());
        BookingDto first = history.get(0);
        assertEquals(20L, first.getBookingId());
        assertEquals("Rock Night", first.getEventTitle());
        assertEquals("City Arena", first.getVenueName());
        assertEquals(start, first.getShowStartTime());
        assertEquals(1, first.getSeats().size());
        assertEquals("C", first.getSeats().get(0).getSeatRow());
        assertTrue(history.get(1).getSeats().isEmpty());
        assertEquals("CANCELLED", history.get(1).getStatus());
    }
}
