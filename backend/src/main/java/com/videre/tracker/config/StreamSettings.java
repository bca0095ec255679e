package com.videre.tracker.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class StreamSettings {

    private final long liveTimeoutMs;
    private final int pageSize;
    private final int maxPending;

    public StreamSettings(@Value("${tracker.stream.live-timeout-ms:3600000}") long liveTimeoutMs,
                          @Value("${tracker.stream.page-size:100}") int pageSize,
                          @Value("${tracker.stream.max-pending:1024}") int maxPending) {
        this.liveTimeoutMs = liveTimeoutMs;
        this.pageSize = Math.max(1, Math.min(pageSize, 1000));
        this.maxPending = Math.max(1, maxPending);
    }

    public long getLiveTimeoutMs() { return liveTimeoutMs; }
    public int getPageSize() { return pageSize; }
    // live items queued for one slow client before its stream is dropped
    public int getMaxPending() { return maxPending; }
}
