package com.videre.tracker.repository;

import com.videre.tracker.model.EventModel;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface EventRepository extends JpaRepository<EventModel, Long> {

    // Conditional update keeps the completion time set-once even under concurrent writers
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update EventModel e set e.endTime = :endTime where e.id = :id and e.endTime is null")
    int setEndTimeIfUnset(@Param("id") Long id, @Param("endTime") Instant endTime);

    @Query("select e from EventModel e left join fetch e.matches where e.id = :id")
    Optional<EventModel> findWithMatchesById(@Param("id") Long id);

    @Query("select e from EventModel e left join fetch e.deck where e.id = :id")
    Optional<EventModel> findWithDeckById(@Param("id") Long id);

    @Query("select distinct e.format from EventModel e where e.format is not null order by e.format")
    List<String> findDistinctFormats();

    @EntityGraph(attributePaths = "deck")
    Page<EventModel> findAllByOrderByStartTimeDescIdDesc(Pageable pageable);

    // Keyset continuation of the newest-first listing, strictly after (startTime, id)
    @EntityGraph(attributePaths = "deck")
    @Query("select e from EventModel e where e.startTime < :startTime or (e.startTime = :startTime and e.id < :id) "
            + "order by e.startTime desc, e.id desc")
    List<EventModel> findPageBefore(@Param("startTime") Instant startTime, @Param("id") Long id, Pageable pageable);
}
