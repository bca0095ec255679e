package com.videre.tracker.dto;

import com.videre.tracker.model.CardEntry;
import com.videre.tracker.model.PlayerResult;

import java.util.List;
import java.util.Map;

public record MatchDTO(Long id, Long eventId, List<PlayerResult> playerResults,
                       Map<Long, List<CardEntry>> sideboardChanges, List<GameDTO> games) {}
