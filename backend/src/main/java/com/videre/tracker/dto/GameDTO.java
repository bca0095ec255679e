package com.videre.tracker.dto;

import com.videre.tracker.model.GamePlayerResult;

import java.util.List;

public record GameDTO(Long id, Long matchId, List<GamePlayerResult> gamePlayerResults, long logCount) {}
