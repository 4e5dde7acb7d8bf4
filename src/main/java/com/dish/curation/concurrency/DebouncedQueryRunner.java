package com.dish.curation.concurrency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs text-driven queries after a debounce period and applies only the newest result.
 *
 * <p>Every {@link #onInput(Object)} restarts the debounce timer. When the timer fires
 * the query is started with a fresh request token. A response whose token has been
 * superseded by a later request is dropped instead of being applied.</p>
 *
 * @param <Q> the query input (e.g. the search text)
 * @param <R> the query result
 */
public class DebouncedQueryRunner<Q, R> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DebouncedQueryRunner.class);

    private final Debouncer debouncer;
    private final LatestRequestGuard guard = new LatestRequestGuard();
    private final Function<Q, CompletableFuture<R>> query;
    private final Consumer<R> onResult;
    private final Consumer<Throwable> onError;
    private final Runnable onStale;

    /**
     * @param debouncer the debouncer timing executions
     * @param query     starts the (possibly remote) query for an input
     * @param onResult  receives results that are still current
     * @param onError   receives failures of queries that are still current
     * @param onStale   notified when a superseded response is dropped
     */
    public DebouncedQueryRunner(Debouncer debouncer,
                                Function<Q, CompletableFuture<R>> query,
                                Consumer<R> onResult,
                                Consumer<Throwable> onError,
                                Runnable onStale) {
        this.debouncer = debouncer;
        this.query = query;
        this.onResult = onResult;
        this.onError = onError;
        this.onStale = onStale != null ? onStale : () -> { };
    }

    /**
     * Records new input; the query runs once input has been quiet for the debounce delay.
     */
    public void onInput(Q input) {
        debouncer.submit(() -> execute(input));
    }

    /**
     * Runs the query immediately, bypassing the debounce timer.
     */
    public CompletableFuture<Void> execute(Q input) {
        long token = guard.next();
        CompletableFuture<R> future;
        try {
            future = query.apply(input);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.handle((result, error) -> {
            if (!guard.isCurrent(token)) {
                log.debug("query.stale token={} latest={}", token, guard.current());
                onStale.run();
                return null;
            }
            if (error != null) {
                onError.accept(error);
            } else {
                onResult.accept(result);
            }
            return null;
        });
    }

    @Override
    public void close() {
        debouncer.close();
    }
}
