package com.evently.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.*;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ShowDto implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long showId;
    private Long eventId;
    private String eventTitle;
    private Long venueId;
    private String venueName;
    private String venueAddress;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime startTime;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime endTime;

    private BigDecimal price;
    private long totalSeats;
    private long availableSeats;

    public boolean hasAvailability() {
        return availableSeats > 0;
    }
}
