package com.videre.tracker.repository;

import com.videre.tracker.model.DeckModel;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DeckRepository extends JpaRepository<DeckModel, String> {
}
