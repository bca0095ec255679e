package com.videre.tracker.dto;

import java.time.Instant;

public record EventSummaryDTO(Long id, String format, String description, String deckHash, String deckName,
                              Instant startTime, Instant endTime, boolean completed) {}
