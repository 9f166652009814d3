package com.evently.booking.repository;

import com.evently.common.entity.Seat;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SeatRepository extends JpaRepository<Seat, Long> {

    /**
     * Seats of a venue among the given ids; ids of other venues or unknown ids are left out
     */
    @Query("SELECT s FROM Seat s WHERE s.venueId = :venueId AND s.id IN :seatIds ORDER BY s.id")
    List<Seat> findByVenueIdAndIdIn(@Param("venueId") Long venueId, @Param("seatIds") Collection<Long> seatIds);

    @Query("SELECT s FROM Seat s WHERE s.id IN :seatIds ORDER BY s.id")
    List<Seat> findByIdIn(@Param("seatIds") Collection<Long> seatIds);

    List<Seat> findByVenueIdOrderBySeatRowAscSeatNumberAsc(Long venueId);

    /**
     * Seat count per venue as [venueId, count] rows
     */
    @Query("SELECT s.venueId, COUNT(s) FROM Seat s WHERE s.venueId IN :venueIds GROUP BY s.venueId")
    List<Object[]> countByVenueIds(@Param("venueIds") Collection<Long> venueIds);
}
