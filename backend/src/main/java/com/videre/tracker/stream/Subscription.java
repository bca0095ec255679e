package com.videre.tracker.stream;

/**
 * Handle for one listener attached to a {@link LiveFeed}. Closing detaches the listener;
 * only the first close has an effect.
 */
public interface Subscription extends AutoCloseable {

    boolean isActive();

    @Override
    void close();
}
