package com.videre.tracker.dto;

import java.util.List;

public record EventDetailDTO(EventSummaryDTO event, List<MatchDTO> matches) {}
