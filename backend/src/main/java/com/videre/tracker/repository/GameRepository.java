package com.videre.tracker.repository;

import com.videre.tracker.model.GameModel;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface GameRepository extends JpaRepository<GameModel, Long> {

    List<GameModel> findByMatchIdOrderByIdAsc(Long matchId);

    long countByMatchId(Long matchId);
}
