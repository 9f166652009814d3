package com.evently.common.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * A physical seat of a venue, identified by (venue, row, number).
 */
@Entity
@Table(name = "seats",
    uniqueConstraints = @UniqueConstraint(name = "uk_seat_venue_row_number",
        columnNames = {"venue_id", "seat_row", "seat_number"}),
    indexes = @Index(name = "idx_seat_venue", columnList = "venue_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Seat {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "venue_id", nullable = false)
    private Long venueId;

    @NotBlank
    @Size(max = 10)
    @Column(name = "seat_row", nullable = false)
    private String seatRow;

    @NotNull
    @Positive
    @Column(name = "seat_number", nullable = false)
    private Integer seatNumber;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
