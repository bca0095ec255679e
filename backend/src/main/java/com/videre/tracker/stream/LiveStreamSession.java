package com.videre.tracker.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * One subscribe-mode NDJSON stream. Items from the feed are serialized on the publishing thread,
 * queued, and written by a single drainer at a time (a one-permit semaphore), so lines from
 * concurrent deliveries never interleave and publishers never wait on the client's socket.
 *
 * <p>The feed subscription is released exactly once, whichever of client disconnect, timeout,
 * write failure, overflow or explicit close happens first.
 */
public class LiveStreamSession<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LiveStreamSession.class);

    /** Where complete lines go; each {@link #send} must write and flush. */
    public interface LineSink {
        void send(byte[] line) throws IOException;

        void complete();
    }

    private final String name;
    private final ObjectMapper mapper;
    private final LineSink sink;
    private final Executor executor;
    private final Predicate<? super T> filter;
    private final int maxPending;

    private final Queue<byte[]> pending = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pendingCount = new AtomicInteger();
    private final Semaphore writePermit = new Semaphore(1);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Subscription subscription;

    public LiveStreamSession(String name, ObjectMapper mapper, LineSink sink, Executor executor,
                             Predicate<? super T> filter, int maxPending) {
        this.name = name;
        this.mapper = mapper;
        this.sink = sink;
        this.executor = executor;
        this.filter = filter;
        this.maxPending = maxPending;
    }

    public void open(LiveFeed<T> feed) {
        Subscription sub = feed.subscribe(this::deliver);
        this.subscription = sub;
        // closed while subscribing: the close path may have missed the subscription
        if (closed.get()) {
            sub.close();
        }
        log.debug("[Stream][{}] opened", name);
    }

    public void deliver(T item) {
        if (closed.get() || !filter.test(item)) return;
        byte[] line;
        try {
            byte[] json = mapper.writeValueAsBytes(item);
            line = new byte[json.length + 1];
            System.arraycopy(json, 0, line, 0, json.length);
            line[json.length] = '\n';
        } catch (JsonProcessingException ex) {
            log.warn("[Stream][{}] skipped item that failed to serialize: {}", name, ex.getOriginalMessage());
            return;
        }
        if (pendingCount.incrementAndGet() > maxPending) {
            log.warn("[Stream][{}] client fell {} items behind, closing", name, maxPending);
            close();
            return;
        }
        pending.add(line);
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException ex) {
            log.warn("[Stream][{}] writer pool saturated, closing", name);
            close();
        }
    }

    /** Closes the stream from the server side and completes the response. */
    @Override
    public void close() {
        if (release()) {
            try {
                sink.complete();
            } catch (RuntimeException ex) {
                log.debug("[Stream][{}] completion after disconnect: {}", name, ex.getMessage());
            }
        }
    }

    /** The transport already ended (disconnect, timeout, error); only the subscription is released. */
    public void detach() {
        release();
    }

    public boolean isClosed() {
        return closed.get();
    }

    int pendingItems() {
        return pendingCount.get();
    }

    private boolean release() {
        if (!closed.compareAndSet(false, true)) return false;
        Subscription sub = subscription;
        if (sub != null) {
            sub.close();
        }
        pending.clear();
        log.debug("[Stream][{}] closed", name);
        return true;
    }

    private void drain() {
        while (!pending.isEmpty() && !closed.get()) {
            if (!writePermit.tryAcquire()) {
                // the permit holder re-checks the queue before giving up
                return;
            }
            try {
                byte[] line;
                while (!closed.get() && (line = pending.poll()) != null) {
                    pendingCount.decrementAndGet();
                    sink.send(line);
                }
            } catch (IOException ex) {
                log.debug("[Stream][{}] client went away: {}", name, ex.getMessage());
                detach();
            } catch (RuntimeException ex) {
                log.debug("[Stream][{}] write rejected: {}", name, ex.getMessage());
                detach();
            } finally {
                writePermit.release();
            }
        }
    }
}
