package com.dish.curation.metrics;

import com.dish.curation.core.model.ItemKind;
import com.dish.curation.query.SortKey;
import com.dish.curation.ranking.RankOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link CurationMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code curation.rank.outcome}: Counter (tags: kind, status)</li>
 *   <li>{@code curation.link}: Counter (tag: result = created, removed, failed)</li>
 *   <li>{@code curation.bulk.size}: DistributionSummary of pairs per bulk link</li>
 *   <li>{@code curation.pipeline.duration}: Timer (tag: sort)</li>
 *   <li>{@code curation.query.stale}: Counter of dropped superseded responses</li>
 *   <li>{@code curation.cache.hit} / {@code curation.cache.miss}: Counters</li>
 * </ul>
 */
public class MicrometerCurationMetrics implements CurationMetrics {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<SortKey, Timer> timerCache = new ConcurrentHashMap<>();
    private final Counter linkCreated;
    private final Counter linkRemoved;
    private final Counter linkFailed;
    private final DistributionSummary bulkSize;
    private final Counter staleDropped;
    private final Counter cacheHit;
    private final Counter cacheMiss;

    public MicrometerCurationMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.linkCreated = linkCounter("created");
        this.linkRemoved = linkCounter("removed");
        this.linkFailed = linkCounter("failed");
        this.bulkSize = DistributionSummary.builder("curation.bulk.size")
                .description("Number of dish-restaurant pairs per bulk link")
                .register(registry);
        this.staleDropped = Counter.builder("curation.query.stale")
                .description("Superseded query responses that were dropped")
                .register(registry);
        this.cacheHit = Counter.builder("curation.cache.hit")
                .description("Read cache hits")
                .register(registry);
        this.cacheMiss = Counter.builder("curation.cache.miss")
                .description("Read cache misses")
                .register(registry);
    }

    @Override
    public void recordRankOutcome(ItemKind kind, RankOutcome.Status status) {
        String key = kind.name() + ":" + status.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("curation.rank.outcome")
                        .description("Rank assignment outcomes")
                        .tag("kind", kind.name())
                        .tag("status", status.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementLinkCreated() {
        linkCreated.increment();
    }

    @Override
    public void incrementLinkRemoved() {
        linkRemoved.increment();
    }

    @Override
    public void incrementLinkFailed() {
        linkFailed.increment();
    }

    @Override
    public void recordBulkLinkSize(int pairs) {
        bulkSize.record(pairs);
    }

    @Override
    public void recordPipelineDuration(SortKey sortKey, Duration duration) {
        timerCache.computeIfAbsent(sortKey, k ->
                Timer.builder("curation.pipeline.duration")
                        .description("Duration of search, filter and sort over a list snapshot")
                        .tag("sort", k.wireValue())
                        .register(registry))
                .record(duration);
    }

    @Override
    public void incrementStaleResponseDropped() {
        staleDropped.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHit.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMiss.increment();
    }

    private Counter linkCounter(String result) {
        return Counter.builder("curation.link")
                .description("Dish-restaurant link operations")
                .tag("result", result)
                .register(registry);
    }
}
