package com.videre.tracker.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bound to one top-level event for as long as the client reports it. Finalizing writes the end
 * time through {@link EventDatabaseWriter#updateEventEndTime}, which only ever sets it once, so
 * finalizing twice is harmless.
 */
public class EventTracker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventTracker.class);

    private final TrackedEvent event;
    private final EventDatabaseWriter writer;
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean finalized;

    public EventTracker(TrackedEvent event, EventDatabaseWriter writer, Clock clock) {
        this.event = event;
        this.writer = writer;
        this.clock = clock;
        if (event.isCompleted()) {
            finalizeEvent();
        }
    }

    public long getEventId() {
        return event.getId();
    }

    public boolean isFinalized() {
        return finalized;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Writes the end time if the event is reported complete. Returns whether the row changed. */
    public boolean finalizeIfCompleted() {
        return event.isCompleted() && finalizeEvent();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        finalizeIfCompleted();
        log.debug("[Tracker] closed event {} finalized={}", event.getId(), finalized);
    }

    private boolean finalizeEvent() {
        Instant endTime = event.getEndTime() != null ? event.getEndTime() : Instant.now(clock);
        boolean updated = writer.updateEventEndTime(event.getId(), endTime);
        if (updated) {
            log.debug("[Tracker] event {} ended at {}", event.getId(), endTime);
        }
        finalized = true;
        return updated;
    }
}
