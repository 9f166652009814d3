package com.evently.booking.repository;

import com.evently.common.entity.Booking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface BookingRepository extends JpaRepository<Booking, Long> {

    /**
     * Find a booking owned by the given user, holding a row lock until the transaction ends
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.id = :bookingId AND b.userId = :userId")
    Optional<Booking> findByIdAndUserIdForUpdate(@Param("bookingId") Long bookingId,
                                                 @Param("userId") Long userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.id = :bookingId")
    Optional<Booking> findByIdForUpdate(@Param("bookingId") Long bookingId);

    Optional<Booking> findByIdAndUserId(Long id, Long userId);

    List<Booking> findByUserIdOrderByCreatedAtDesc(Long userId);

    /**
     * Bookings still pending whose hold started before the cutoff, oldest first
     */
    @Query("SELECT b.id FROM Booking b WHERE b.status = :status " +
           "AND b.heldSince < :cutoff ORDER BY b.heldSince")
    List<Long> findIdsByStatusAndHeldSinceBefore(@Param("status") Booking.BookingStatus status,
                                                 @Param("cutoff") LocalDateTime cutoff);
}
