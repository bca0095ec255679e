package com.videre.tracker.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * In-process push source. Listeners are invoked on the publishing thread, in subscription order;
 * a failing listener is logged and does not affect the others or the publisher.
 */
public class LiveFeed<T> {
    private static final Logger log = LoggerFactory.getLogger(LiveFeed.class);

    private final String name;
    private final List<Listener<T>> listeners = new CopyOnWriteArrayList<>();

    public LiveFeed(String name) {
        this.name = name;
    }

    public Subscription subscribe(Consumer<? super T> callback) {
        Listener<T> listener = new Listener<>(callback);
        listeners.add(listener);
        log.debug("[LiveFeed][{}] subscribed, listeners={}", name, listeners.size());
        return listener.handle(this);
    }

    public void publish(T item) {
        for (Listener<T> listener : listeners) {
            try {
                listener.callback.accept(item);
            } catch (RuntimeException ex) {
                log.warn("[LiveFeed][{}] listener failed: {}", name, ex.toString());
            }
        }
    }

    public int subscriberCount() {
        return listeners.size();
    }

    public String getName() {
        return name;
    }

    private static final class Listener<T> {
        private final Consumer<? super T> callback;

        private Listener(Consumer<? super T> callback) {
            this.callback = callback;
        }

        private Subscription handle(LiveFeed<T> feed) {
            AtomicBoolean active = new AtomicBoolean(true);
            Listener<T> self = this;
            return new Subscription() {
                @Override
                public boolean isActive() {
                    return active.get();
                }

                @Override
                public void close() {
                    if (active.compareAndSet(true, false)) {
                        feed.listeners.remove(self);
                        log.debug("[LiveFeed][{}] unsubscribed, listeners={}", feed.name, feed.listeners.size());
                    }
                }
            };
        }
    }
}
