package com.videre.tracker.controller;

import com.videre.tracker.dto.MatchDTO;
import com.videre.tracker.service.EventQueryService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/matches")
@CrossOrigin(origins = "*")
public class MatchController {

    private final EventQueryService queryService;

    public MatchController(EventQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/{id}")
    public MatchDTO get(@PathVariable Long id) {
        return queryService.getMatch(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Match not found: " + id));
    }
}
