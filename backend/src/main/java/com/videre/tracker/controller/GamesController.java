package com.videre.tracker.controller;

import com.videre.tracker.dto.GameDTO;
import com.videre.tracker.dto.GameLogDTO;
import com.videre.tracker.service.EventQueryService;
import com.videre.tracker.stream.IngestFeeds;
import com.videre.tracker.stream.NdjsonStreamer;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.util.List;

@RestController
@RequestMapping("/api/games")
@CrossOrigin(origins = "*")
public class GamesController {

    private final EventQueryService queryService;
    private final NdjsonStreamer streamer;
    private final IngestFeeds feeds;

    public GamesController(EventQueryService queryService, NdjsonStreamer streamer, IngestFeeds feeds) {
        this.queryService = queryService;
        this.streamer = streamer;
        this.feeds = feeds;
    }

    @GetMapping("/{id}")
    public GameDTO get(@PathVariable Long id) {
        return queryService.getGame(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Game not found: " + id));
    }

    @GetMapping("/{id}/logs")
    public ResponseEntity<?> logs(@PathVariable Long id,
                                  @RequestParam(name = "stream", defaultValue = "false") boolean stream,
                                  @RequestParam(name = "page", defaultValue = "0") int page,
                                  @RequestParam(name = "size", defaultValue = "500") int size) {
        requireGame(id);
        if (stream) {
            return streamer.drain("game-" + id + "-logs", queryService.streamGameLogs(id));
        }
        List<GameLogDTO> logs = queryService.listGameLogs(id, page, size);
        return ResponseEntity.ok(logs);
    }

    // Log entries of this game as they are stored; the game does not need to exist yet
    @GetMapping("/{id}/logs/watch")
    public ResponseEntity<ResponseBodyEmitter> watchLogs(@PathVariable Long id) {
        return streamer.subscribe("game-" + id + "-watch", feeds.gameLogs(),
                (GameLogDTO entry) -> id.equals(entry.gameId()));
    }

    private void requireGame(Long id) {
        if (!queryService.gameExists(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Game not found: " + id);
        }
    }
}
