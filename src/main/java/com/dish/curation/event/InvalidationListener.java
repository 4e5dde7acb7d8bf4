package com.dish.curation.event;

/**
 * Listener for invalidation signals. Implementations react to changes made by
 * another component, e.g. by dropping cached reads or re-fetching a view.
 */
@FunctionalInterface
public interface InvalidationListener {

    /**
     * Called after a change has been written through the gateway.
     *
     * @param event what changed
     */
    void onInvalidated(InvalidationEvent event);
}
