package com.evently.booking.repository;

import com.evently.common.entity.ShowSeat;
import com.evently.common.entity.ShowSeatId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;

@Repository
public interface ShowSeatRepository extends JpaRepository<ShowSeat, ShowSeatId> {

    /**
     * Row-lock the show seats targeted by a lock request (SELECT ... FOR UPDATE).
     * Ordered by seat id so overlapping requests take row locks in the same order.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT ss FROM ShowSeat ss WHERE ss.id.showId = :showId " +
           "AND ss.id.seatId IN :seatIds ORDER BY ss.id.seatId")
    List<ShowSeat> findForUpdate(@Param("showId") Long showId, @Param("seatIds") Collection<Long> seatIds);

    /**
     * Row-lock every show seat owned by a booking
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT ss FROM ShowSeat ss WHERE ss.bookingId = :bookingId ORDER BY ss.id.seatId")
    List<ShowSeat> findByBookingIdForUpdate(@Param("bookingId") Long bookingId);

    @Query("SELECT ss FROM ShowSeat ss WHERE ss.bookingId IN :bookingIds ORDER BY ss.id.seatId")
    List<ShowSeat> findByBookingIdIn(@Param("bookingIds") Collection<Long> bookingIds);

    @Query("SELECT ss FROM ShowSeat ss WHERE ss.id.showId = :showId")
    List<ShowSeat> findByShowId(@Param("showId") Long showId);

    /**
     * Count of seats not in the given status per show, as [showId, count] rows. Shows without such seats are absent.
     */
    @Query("SELECT ss.id.showId, COUNT(ss) FROM ShowSeat ss " +
           "WHERE ss.id.showId IN :showIds AND ss.status <> :status GROUP BY ss.id.showId")
    List<Object[]> countByShowIdsAndStatusNot(@Param("showIds") Collection<Long> showIds,
                                             @Param("status") ShowSeat.SeatStatus status);
}
