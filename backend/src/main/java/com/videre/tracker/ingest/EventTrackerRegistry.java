package com.videre.tracker.ingest;

import com.videre.tracker.config.IngestSettings;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Holds one {@link EventTracker} per event the client currently reports as live.
 */
@Component
public class EventTrackerRegistry {
    private static final Logger log = LoggerFactory.getLogger(EventTrackerRegistry.class);

    private final EventDatabaseWriter writer;
    private final IngestSettings settings;
    private final Clock clock;
    private final Map<Long, Registration> trackers = new ConcurrentHashMap<>();

    @Autowired
    public EventTrackerRegistry(EventDatabaseWriter writer, IngestSettings settings) {
        this(writer, settings, Clock.systemUTC());
    }

    EventTrackerRegistry(EventDatabaseWriter writer, IngestSettings settings, Clock clock) {
        this.writer = writer;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Starts tracking an event whose row has been written. An event that is already complete is
     * finalized straight away and not kept.
     */
    public EventTracker track(long eventId, boolean completed, Instant endTime) {
        Registration registration = trackers.computeIfAbsent(eventId, id -> {
            LiveEvent state = new LiveEvent(id, clock.instant());
            if (completed) state.markCompleted(endTime);
            return new Registration(state, new EventTracker(state, writer, clock));
        });
        registration.state.touch(clock.instant());
        if (registration.tracker.isFinalized()) {
            release(eventId, registration);
        }
        return registration.tracker;
    }

    /** Records activity for an event so the idle sweep leaves its tracker alone. */
    public void touch(long eventId) {
        Registration registration = trackers.get(eventId);
        if (registration != null) {
            registration.state.touch(clock.instant());
        }
    }

    /**
     * Applies a completion report. With no live tracker the event row is awaited first and the
     * set-once end time is written directly.
     */
    public boolean complete(long eventId, Instant endTime) {
        Registration registration = trackers.remove(eventId);
        if (registration != null) {
            registration.state.markCompleted(endTime);
            boolean updated = registration.tracker.finalizeIfCompleted();
            registration.tracker.close();
            return updated;
        }
        if (!awaitEvent(eventId)) {
            log.warn("[Tracker][Complete] event {} never appeared, end time dropped", eventId);
            return false;
        }
        return writer.updateEventEndTime(eventId, endTime != null ? endTime : clock.instant());
    }

    public boolean isTracking(long eventId) {
        return trackers.containsKey(eventId);
    }

    public int size() {
        return trackers.size();
    }

    @Scheduled(fixedDelayString = "${tracker.ingest.tracker-sweep-ms:600000}",
            initialDelayString = "${tracker.ingest.tracker-sweep-ms:600000}")
    public void sweepIdle() {
        Instant cutoff = clock.instant().minus(settings.getTrackerIdle());
        List<Long> idle = new ArrayList<>();
        trackers.forEach((id, registration) -> {
            if (registration.state.lastTouched().isBefore(cutoff)) idle.add(id);
        });
        for (Long id : idle) {
            Registration registration = trackers.get(id);
            if (registration != null) release(id, registration);
        }
        if (!idle.isEmpty()) {
            log.info("[Tracker][Sweep] released {} idle trackers, {} remain", idle.size(), trackers.size());
        }
    }

    @PreDestroy
    public void closeAll() {
        int count = trackers.size();
        new ArrayList<>(trackers.keySet()).forEach(id -> {
            Registration registration = trackers.get(id);
            if (registration != null) release(id, registration);
        });
        if (count > 0) {
            log.info("[Tracker][Shutdown] closed {} trackers", count);
        }
    }

    private void release(long eventId, Registration registration) {
        if (trackers.remove(eventId, registration)) {
            registration.tracker.close();
        }
    }

    private boolean awaitEvent(long eventId) {
        CompletableFuture<Boolean> wait = writer.waitForEvent(eventId);
        try {
            return Boolean.TRUE.equals(wait.get());
        } catch (InterruptedException ex) {
            wait.cancel(false);
            Thread.currentThread().interrupt();
            return false;
        } catch (CancellationException ex) {
            return false;
        } catch (ExecutionException ex) {
            log.warn("[Tracker][Complete] waiting for event {} failed: {}", eventId, ex.getMessage());
            return false;
        }
    }

    private static final class Registration {
        private final LiveEvent state;
        private final EventTracker tracker;

        private Registration(LiveEvent state, EventTracker tracker) {
            this.state = state;
            this.tracker = tracker;
        }
    }

    private static final class LiveEvent implements TrackedEvent {
        private final long id;
        private volatile boolean completed;
        private volatile Instant endTime;
        private volatile Instant lastTouched;

        private LiveEvent(long id, Instant now) {
            this.id = id;
            this.lastTouched = now;
        }

        @Override public long getId() { return id; }
        @Override public boolean isCompleted() { return completed; }
        @Override public Instant getEndTime() { return endTime; }

        void markCompleted(Instant at) {
            this.endTime = at;
            this.completed = true;
        }

        void touch(Instant now) { this.lastTouched = now; }

        Instant lastTouched() { return lastTouched; }
    }
}
