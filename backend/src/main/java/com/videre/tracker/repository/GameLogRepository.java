package com.videre.tracker.repository;

import com.videre.tracker.model.GameLogModel;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface GameLogRepository extends JpaRepository<GameLogModel, Long> {

    // chronological replay order: timestamp, then id as a stable tie-break
    Page<GameLogModel> findByGameIdOrderByTimestampAscIdAsc(Long gameId, Pageable pageable);

    @Query("select l from GameLogModel l where l.gameId = :gameId "
            + "and (l.timestamp > :timestamp or (l.timestamp = :timestamp and l.id > :id)) "
            + "order by l.timestamp asc, l.id asc")
    List<GameLogModel> findPageAfter(@Param("gameId") Long gameId, @Param("timestamp") Instant timestamp,
                                     @Param("id") Long id, Pageable pageable);

    long countByGameId(Long gameId);
}
