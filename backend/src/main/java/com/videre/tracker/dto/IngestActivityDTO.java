package com.videre.tracker.dto;

import java.time.Instant;

/** A row the writer just created: kind is EVENT, MATCH or GAME. */
public record IngestActivityDTO(String kind, Long id, Long parentId, Instant at) {}
