package com.videre.tracker.ingest;

import java.time.Instant;

/** Source-side view of a live top-level event, as last reported by the game client. */
public interface TrackedEvent {

    long getId();

    boolean isCompleted();

    /** End time reported by the client, or null when it has none. */
    Instant getEndTime();
}
