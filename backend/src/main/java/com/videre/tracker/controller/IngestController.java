package com.videre.tracker.controller;

import com.videre.tracker.ingest.Notification;
import com.videre.tracker.ingest.NotificationDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Intake for client notifications. Accepted notifications are processed asynchronously; the
 * response never reflects whether the write succeeded.
 */
@RestController
@RequestMapping("/api/ingest")
public class IngestController {
    private static final Logger log = LoggerFactory.getLogger(IngestController.class);

    private final NotificationDispatcher dispatcher;

    public IngestController(NotificationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping("/notifications")
    public ResponseEntity<?> accept(@RequestBody Notification notification) {
        if (notification == null) {
            return ResponseEntity.badRequest().body(Map.of("message", "notification body is required"));
        }
        log.debug("[Ingest][Intake] {} for subject {}", notification.getClass().getSimpleName(), notification.subjectId());
        dispatcher.dispatch(notification);
        return ResponseEntity.accepted().body(Map.of("accepted", true, "kind", notification.getClass().getSimpleName()));
    }
}
