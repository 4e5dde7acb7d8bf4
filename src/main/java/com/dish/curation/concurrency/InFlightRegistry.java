package com.dish.curation.concurrency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Tracks mutating operations that have been submitted but not yet settled.
 *
 * <p>A control bound to an operation key should be disabled while
 * {@link #isInFlight(String)} is true. Submitting the same key again before the
 * first call settles fails with {@link OperationInFlightException}. Keys are
 * released when the call returns or throws.</p>
 */
public class InFlightRegistry {
    private static final Logger log = LoggerFactory.getLogger(InFlightRegistry.class);

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public boolean isInFlight(String operationKey) {
        return inFlight.contains(operationKey);
    }

    public int size() {
        return inFlight.size();
    }

    /**
     * Runs the action under the given key.
     *
     * @throws OperationInFlightException if the key is already held
     */
    public <T> T run(String operationKey, Supplier<T> action) {
        if (!inFlight.add(operationKey)) {
            log.debug("Rejected duplicate submission of {}", operationKey);
            throw new OperationInFlightException(operationKey);
        }
        try {
            return action.get();
        } finally {
            inFlight.remove(operationKey);
        }
    }

    public void run(String operationKey, Runnable action) {
        run(operationKey, () -> {
            action.run();
            return null;
        });
    }
}
