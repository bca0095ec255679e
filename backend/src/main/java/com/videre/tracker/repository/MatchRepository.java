package com.videre.tracker.repository;

import com.videre.tracker.model.MatchModel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface MatchRepository extends JpaRepository<MatchModel, Long> {

    @Query("select m from MatchModel m left join fetch m.games where m.id = :id")
    Optional<MatchModel> findWithGamesById(@Param("id") Long id);

    @Query("select m from MatchModel m join fetch m.event where m.id = :id")
    Optional<MatchModel> findWithEventById(@Param("id") Long id);

    List<MatchModel> findByEventIdOrderByIdAsc(Long eventId);

    long countByEventId(Long eventId);
}
