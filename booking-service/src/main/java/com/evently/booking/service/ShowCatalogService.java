package com.evently.booking.service;

import com.evently.booking.repository.SeatRepository;
import com.evently.booking.repository.ShowRepository;
import com.evently.booking.repository.ShowSeatRepository;
import com.evently.common.dto.SeatDto;
import com.evently.common.dto.ShowDto;
import com.evently.common.entity.Seat;
import com.evently.common.entity.Show;
import com.evently.common.entity.ShowSeat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read side of the show catalog: upcoming shows with seat counts, and per-show seat maps.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ShowCatalogService {

    private final ShowRepository showRepository;
    private final SeatRepository seatRepository;
    private final ShowSeatRepository showSeatRepository;

    @Transactional(readOnly = true)
    public List<ShowDto> getUpcomingShows() {
        return toDtos(showRepository.findUpcomingWithDetails(LocalDateTime.now()));
    }

    /**
     * Upcoming shows filtered by venue name and event title (case-insensitive substring),
     * start time range, and remaining availability. Null filters are ignored.
     */
    @Transactional(readOnly = true)
    public List<ShowDto> searchShows(String venue, String event, LocalDateTime from, LocalDateTime to,
                                     boolean availableOnly) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new BookingValidationException("Search range start must not be after its end");
        }

        List<Show> matching = showRepository.findUpcomingWithDetails(LocalDateTime.now()).stream()
            .filter(show -> containsIgnoreCase(show.getVenue().getName(), venue))
            .filter(show -> containsIgnoreCase(show.getEvent().getTitle(), event))
            .filter(show -> from == null || !show.getStartTime().isBefore(from))
            .filter(show -> to == null || !show.getStartTime().isAfter(to))
            .toList();

        List<ShowDto> shows = toDtos(matching);
        if (availableOnly) {
            return shows.stream().filter(ShowDto::hasAvailability).toList();
        }
        return shows;
    }

    @Transactional(readOnly = true)
    public ShowDto getShow(Long showId) {
        Show show = showRepository.findByIdWithDetails(showId)
            .orElseThrow(() -> new ShowNotFoundException(showId));
        return toDtos(List.of(show)).get(0);
    }

    /**
     * Status of every venue seat for the show. Seats without a show seat row read as AVAILABLE.
     */
    @Transactional(readOnly = true)
    public List<SeatDto> getSeatMap(Long showId) {
        Show show = showRepository.findById(showId)
            .orElseThrow(() -> new ShowNotFoundException(showId));

        Map<Long, ShowSeat> showSeats = showSeatRepository.findByShowId(showId).stream()
            .collect(Collectors.toMap(ShowSeat::getSeatId, Function.identity()));

        List<Seat> seats = seatRepository.findByVenueIdOrderBySeatRowAscSeatNumberAsc(show.getVenueId());
        log.debug("Seat map for show {}: {} seats, {} with status rows", showId, seats.size(), showSeats.size());

        return seats.stream()
            .map(seat -> toSeatMapEntry(seat, showSeats.get(seat.getId())))
            .toList();
    }

    private SeatDto toSeatMapEntry(Seat seat, ShowSeat showSeat) {
        SeatDto dto = BookingDtoMapper.toSeatDto(seat);
        if (showSeat == null) {
            dto.setStatus(ShowSeat.SeatStatus.AVAILABLE.name());
        } else {
            dto.setStatus(showSeat.getStatus().name());
            dto.setBookingId(showSeat.getBookingId());
            dto.setLockedAt(showSeat.getLockedAt());
        }
        return dto;
    }

    /**
     * Seat counts for the whole list come from one grouped query per table.
     */
    private List<ShowDto> toDtos(List<Show> shows) {
        if (shows.isEmpty()) {
            return List.of();
        }
        Set<Long> venueIds = shows.stream().map(Show::getVenueId).collect(Collectors.toSet());
        Set<Long> showIds = shows.stream().map(Show::getId).collect(Collectors.toSet());

        Map<Long, Long> totalByVenue = toCountMap(seatRepository.countByVenueIds(venueIds));
        Map<Long, Long> takenByShow = toCountMap(
            showSeatRepository.countByShowIdsAndStatusNot(showIds, ShowSeat.SeatStatus.AVAILABLE));

        return shows.stream()
            .map(show -> toDto(show,
                totalByVenue.getOrDefault(show.getVenueId(), 0L),
                takenByShow.getOrDefault(show.getId(), 0L)))
            .toList();
    }

    private static Map<Long, Long> toCountMap(List<Object[]> rows) {
        Map<Long, Long> counts = new HashMap<>();
        for (Object[] row : rows) {
            counts.put(((Number) row[0]).longValue(), ((Number) row[1]).longValue());
        }
        return counts;
    }

    private ShowDto toDto(Show show, long totalSeats, long takenSeats) {
        return ShowDto.builder()
            .showId(show.getId())
            .eventId(show.getEvent().getId())
            .eventTitle(show.getEvent().getTitle())
            .venueId(show.getVenue().getId())
            .venueName(show.getVenue().getName())
            .venueAddress(show.getVenue().getAddress())
            .startTime(show.getStartTime())
            .endTime(show.getEndTime())
            .price(show.getPrice())
            .totalSeats(totalSeats)
            .availableSeats(Math.max(0, totalSeats - takenSeats))
            .build();
    }

    private static boolean containsIgnoreCase(String value, String fragment) {
        if (fragment == null || fragment.isBlank()) {
            return true;
        }
        return value != null && value.toLowerCase(Locale.ROOT).contains(fragment.trim().toLowerCase(Locale.ROOT));
    }
}
