package com.videre.tracker.controller;

import com.videre.tracker.dto.EventDetailDTO;
import com.videre.tracker.dto.EventSummaryDTO;
import com.videre.tracker.dto.IngestActivityDTO;
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
@RequestMapping("/api/events")
@CrossOrigin(origins = "*")
public class EventsController {

    private final EventQueryService queryService;
    private final NdjsonStreamer streamer;
    private final IngestFeeds feeds;

    public EventsController(EventQueryService queryService, NdjsonStreamer streamer, IngestFeeds feeds) {
        this.queryService = queryService;
        this.streamer = streamer;
        this.feeds = feeds;
    }

    @GetMapping
    public ResponseEntity<?> list(@RequestParam(name = "stream", defaultValue = "false") boolean stream,
                                  @RequestParam(name = "page", defaultValue = "0") int page,
                                  @RequestParam(name = "size", defaultValue = "50") int size) {
        if (stream) {
            return streamer.drain("events", queryService.streamEvents());
        }
        List<EventSummaryDTO> events = queryService.listEvents(page, size);
        return ResponseEntity.ok(events);
    }

    @GetMapping("/formats")
    public List<String> formats() {
        return queryService.listFormats();
    }

    // Newly created events, matches and games as they commit
    @GetMapping("/watch")
    public ResponseEntity<ResponseBodyEmitter> watch() {
        return streamer.subscribe("events-watch", feeds.activity(), (IngestActivityDTO item) -> true);
    }

    @GetMapping("/{id}")
    public EventDetailDTO get(@PathVariable Long id) {
        return queryService.getEvent(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Event not found: " + id));
    }
}
