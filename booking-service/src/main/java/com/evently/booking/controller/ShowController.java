package com.evently.booking.controller;

import com.evently.booking.service.ShowCatalogService;
import com.evently.common.dto.SeatDto;
import com.evently.common.dto.ShowDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/v1/shows")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Show Controller", description = "Show discovery and seat maps")
public class ShowController {

    private final ShowCatalogService showCatalogService;

    @GetMapping
    @Operation(summary = "List upcoming shows", description = "Shows that have not started, soonest first.")
    public ResponseEntity<List<ShowDto>> getUpcomingShows() {
        return ResponseEntity.ok(showCatalogService.getUpcomingShows());
    }

    @GetMapping("/search")
    @Operation(
        summary = "Search upcoming shows",
        description = "Filters by venue name, event title, start time range and seat availability. " +
                     "Name filters are case-insensitive substring matches."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Matching shows"),
        @ApiResponse(responseCode = "400", description = "Invalid time range")
    })
    public ResponseEntity<List<ShowDto>> searchShows(
            @RequestParam(required = false) String venue,
            @RequestParam(required = false) String event,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(defaultValue = "false") boolean availableOnly) {

        log.debug("Show search: venue={} event={} from={} to={} availableOnly={}",
                venue, event, from, to, availableOnly);
        return ResponseEntity.ok(showCatalogService.searchShows(venue, event, from, to, availableOnly));
    }

    @GetMapping("/{showId}")
    @Operation(summary = "Get show details")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Show found"),
        @ApiResponse(responseCode = "404", description = "Show not found")
    })
    public ResponseEntity<ShowDto> getShow(@Parameter(description = "Show id") @PathVariable Long showId) {
        return ResponseEntity.ok(showCatalogService.getShow(showId));
    }

    @GetMapping("/{showId}/seats")
    @Operation(summary = "Get the seat map of a show", description = "Every seat of the venue with its status.")
    public ResponseEntity<List<SeatDto>> getSeatMap(@Parameter(description = "Show id") @PathVariable Long showId) {
        return ResponseEntity.ok(showCatalogService.getSeatMap(showId));
    }
}
