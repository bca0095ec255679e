package com.videre.tracker.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Waits until a row with a caller-assigned identity is visible in the store.
 *
 * <p>Each identity gets a lazily created single-fire signal that the owning writer completes
 * right after the row commits. Rows committed elsewhere (another process, a previous run) never
 * fire that signal, so every wait also re-probes the store on a backoff schedule until the
 * deadline. Nothing blocks a thread: callers get a future that completes with {@code true} once
 * the row is visible, {@code false} at the deadline, or is cancelled by the caller.
 */
public class RowAwaiter {
    private static final Logger log = LoggerFactory.getLogger(RowAwaiter.class);

    /** Existence check against the store. */
    @FunctionalInterface
    public interface RowProbe {
        boolean exists(RowKind kind, long id);
    }

    private final ScheduledExecutorService scheduler;
    private final RowProbe probe;
    private final PersistedIdCache cache;
    private final Duration initialInterval;
    private final Duration maxInterval;
    private final Map<String, CompletableFuture<Void>> signals = new ConcurrentHashMap<>();

    public RowAwaiter(ScheduledExecutorService scheduler, RowProbe probe, PersistedIdCache cache,
                      Duration initialInterval, Duration maxInterval) {
        this.scheduler = scheduler;
        this.probe = probe;
        this.cache = cache;
        this.initialInterval = initialInterval;
        this.maxInterval = maxInterval;
    }

    public CompletableFuture<Boolean> await(RowKind kind, long id, Duration timeout) {
        if (cache.contains(kind, id)) {
            return CompletableFuture.completedFuture(true);
        }
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        CompletableFuture<Void> signal = signals.computeIfAbsent(key(kind, id), k -> new CompletableFuture<>());
        signal.thenRun(() -> result.complete(true));

        long deadline = System.nanoTime() + timeout.toNanos();
        schedulePoll(result, kind, id, deadline, 0L);
        result.whenComplete((visible, error) -> {
            if (!Boolean.TRUE.equals(visible) && !signal.isDone()) {
                // Other waiters on the same identity keep polling, so dropping the signal is safe
                signals.remove(key(kind, id), signal);
            }
        });
        return result;
    }

    /** Called by the writer once the row for {@code id} is known to be committed. */
    public void markVisible(RowKind kind, long id) {
        cache.record(kind, id);
        CompletableFuture<Void> signal = signals.remove(key(kind, id));
        if (signal != null) {
            signal.complete(null);
        }
    }

    public int pendingSignals() {
        return signals.size();
    }

    public void reset() {
        signals.values().forEach(s -> s.cancel(false));
        signals.clear();
    }

    private void schedulePoll(CompletableFuture<Boolean> result, RowKind kind, long id, long deadline, long delayNanos) {
        if (result.isDone()) return;
        ScheduledFuture<?> task = scheduler.schedule(() -> poll(result, kind, id, deadline, delayNanos),
                delayNanos, TimeUnit.NANOSECONDS);
        result.whenComplete((r, t) -> task.cancel(false));
    }

    private void poll(CompletableFuture<Boolean> result, RowKind kind, long id, long deadline, long lastDelayNanos) {
        if (result.isDone()) return;
        try {
            if (cache.contains(kind, id) || probe.exists(kind, id)) {
                markVisible(kind, id);
                result.complete(true);
                return;
            }
        } catch (RuntimeException ex) {
            log.warn("[RowAwaiter][Probe] kind={} id={} failed: {}", kind, id, ex.getMessage());
        }
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            result.complete(false);
            return;
        }
        long next = lastDelayNanos == 0L ? initialInterval.toNanos() : Math.min(lastDelayNanos * 2, maxInterval.toNanos());
        schedulePoll(result, kind, id, deadline, Math.min(next, remaining));
    }

    private static String key(RowKind kind, long id) {
        return kind.name() + ':' + id;
    }
}
