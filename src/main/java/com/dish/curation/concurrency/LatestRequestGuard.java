package com.dish.curation.concurrency;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Stale-response guard based on a monotonically increasing request token.
 *
 * <p>Each new request takes a token via {@link #next()}. When its response arrives
 * it is applied only if {@link #isCurrent(long)} still holds, i.e. no newer request
 * was issued in the meantime.</p>
 */
public class LatestRequestGuard {

    private final AtomicLong latest = new AtomicLong();

    public long next() {
        return latest.incrementAndGet();
    }

    public boolean isCurrent(long token) {
        return latest.get() == token;
    }

    public long current() {
        return latest.get();
    }
}
