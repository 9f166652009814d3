package com.evently.common.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * Per-show availability of a seat. {@code lockedAt} is non-null exactly while the status is LOCKED,
 * and a non-AVAILABLE row always names its owning booking.
 *
 * <p>Rows built with {@link #available} are new and are inserted with persist, so two attempts that
 * both create the same row collide on the primary key instead of merging over each other.
 */
@Entity
@Table(name = "show_seats", indexes = {
    @Index(name = "idx_show_seat_booking", columnList = "booking_id"),
    @Index(name = "idx_show_seat_status", columnList = "show_id, status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ShowSeat implements Persistable<ShowSeatId> {

    @EmbeddedId
    private ShowSeatId id;

    @NotNull
    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private SeatStatus status;

    @Column(name = "booking_id")
    private Long bookingId;

    @Column(name = "locked_at")
    private LocalDateTime lockedAt;

    @Transient
    @Builder.Default
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private boolean newRow = false;

    public enum SeatStatus {
        AVAILABLE, LOCKED, BOOKED
    }

    public static ShowSeat available(Long showId, Long seatId) {
        return ShowSeat.builder()
            .id(new ShowSeatId(showId, seatId))
            .status(SeatStatus.AVAILABLE)
            .newRow(true)
            .build();
    }

    @Override
    public boolean isNew() {
        return newRow;
    }

    @PostPersist
    @PostLoad
    void markPersisted() {
        this.newRow = false;
    }

    public Long getShowId() {
        return id.getShowId();
    }

    public Long getSeatId() {
        return id.getSeatId();
    }

    public boolean isAvailable() {
        return status == SeatStatus.AVAILABLE;
    }

    public boolean isLocked() {
        return status == SeatStatus.LOCKED;
    }

    public void lock(Long bookingId, LocalDateTime at) {
        this.status = SeatStatus.LOCKED;
        this.bookingId = bookingId;
        this.lockedAt = at;
    }

    public void book() {
        this.status = SeatStatus.BOOKED;
        this.lockedAt = null;
    }

    public void release() {
        this.status = SeatStatus.AVAILABLE;
        this.bookingId = null;
        this.lockedAt = null;
    }
}
