package com.videre.tracker.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class IngestSettings {

    private final long parentWaitTimeoutMs;
    private final long pollInitialMs;
    private final long pollMaxMs;
    private final int maxConflictRetries;
    private final int maxUpdateRetries;
    private final long trackerIdleHours;

    public IngestSettings(@Value("${tracker.ingest.parent-wait-timeout-ms:15000}") long parentWaitTimeoutMs,
                          @Value("${tracker.ingest.poll-initial-ms:100}") long pollInitialMs,
                          @Value("${tracker.ingest.poll-max-ms:1000}") long pollMaxMs,
                          @Value("${tracker.ingest.max-conflict-retries:1}") int maxConflictRetries,
                          @Value("${tracker.ingest.max-update-retries:5}") int maxUpdateRetries,
                          @Value("${tracker.ingest.tracker-idle-hours:24}") long trackerIdleHours) {
        this.parentWaitTimeoutMs = parentWaitTimeoutMs;
        this.pollInitialMs = Math.max(1, pollInitialMs);
        this.pollMaxMs = Math.max(this.pollInitialMs, pollMaxMs);
        this.maxConflictRetries = Math.max(0, maxConflictRetries);
        this.maxUpdateRetries = Math.max(0, maxUpdateRetries);
        this.trackerIdleHours = trackerIdleHours;
    }

    public Duration getParentWaitTimeout() { return Duration.ofMillis(parentWaitTimeoutMs); }
    public Duration getPollInitial() { return Duration.ofMillis(pollInitialMs); }
    public Duration getPollMax() { return Duration.ofMillis(pollMaxMs); }
    public int getMaxConflictRetries() { return maxConflictRetries; }
    // Stale-version retries for result and sideboard replacements
    public int getMaxUpdateRetries() { return maxUpdateRetries; }
    public Duration getTrackerIdle() { return Duration.ofHours(trackerIdleHours); }
}
