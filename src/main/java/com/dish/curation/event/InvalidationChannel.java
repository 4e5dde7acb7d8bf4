package com.dish.curation.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Explicit publish/subscribe channel for invalidation signals.
 *
 * <p>A channel is created by the owner of a set of components and handed to each of
 * them by reference; there is no process-wide instance. A listener that throws does
 * not prevent delivery to the others.</p>
 */
public class InvalidationChannel {
    private static final Logger log = LoggerFactory.getLogger(InvalidationChannel.class);

    private final List<InvalidationListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a listener and returns a handle that removes it when closed.
     */
    public Subscription subscribe(InvalidationListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(InvalidationEvent event) {
        log.debug("invalidation.published topic={} scope={} dishes={} restaurants={}",
                event.topic(), event.scope(), event.dishIds(), event.restaurantIds());
        for (InvalidationListener listener : listeners) {
            try {
                listener.onInvalidated(event);
            } catch (RuntimeException e) {
                log.warn("Invalidation listener {} failed for {}: {}",
                        listener.getClass().getSimpleName(), event.topic(), e.getMessage(), e);
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }

    /**
     * Handle returned by {@link #subscribe(InvalidationListener)}.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
