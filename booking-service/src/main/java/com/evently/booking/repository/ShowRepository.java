package com.evently.booking.repository;

import com.evently.common.entity.Show;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ShowRepository extends JpaRepository<Show, Long> {

    @Query("SELECT s FROM Show s JOIN FETCH s.event JOIN FETCH s.venue " +
           "WHERE s.startTime > :now ORDER BY s.startTime")
    List<Show> findUpcomingWithDetails(@Param("now") LocalDateTime now);

    @Query("SELECT s FROM Show s JOIN FETCH s.event JOIN FETCH s.venue WHERE s.id = :showId")
    Optional<Show> findByIdWithDetails(@Param("showId") Long showId);

    @Query("SELECT s FROM Show s JOIN FETCH s.event JOIN FETCH s.venue WHERE s.id IN :showIds")
    List<Show> findAllByIdWithDetails(@Param("showIds") Collection<Long> showIds);
}
