package com.dish.curation.api;

import com.dish.curation.cache.CacheConfig;
import com.dish.curation.cache.CacheStats;
import com.dish.curation.cache.CachingDataGateway;
import com.dish.curation.concurrency.DebouncedQueryRunner;
import com.dish.curation.concurrency.Debouncer;
import com.dish.curation.concurrency.InFlightRegistry;
import com.dish.curation.config.CurationOptions;
import com.dish.curation.core.model.CuratedItem;
import com.dish.curation.event.InvalidationChannel;
import com.dish.curation.gateway.HttpDataGateway;
import com.dish.curation.gateway.HttpGatewayConfig;
import com.dish.curation.gateway.ItemQuery;
import com.dish.curation.gateway.RemoteDataGateway;
import com.dish.curation.linking.AssociationManager;
import com.dish.curation.metrics.CurationMetrics;
import com.dish.curation.metrics.NoOpCurationMetrics;
import com.dish.curation.query.ListQuery;
import com.dish.curation.query.ListQueryPipeline;
import com.dish.curation.ranking.ItemSnapshot;
import com.dish.curation.ranking.RankAssignmentEngine;
import com.dish.curation.ranking.RankCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Main entry point for curation. Wires the gateway, invalidation channel, metrics,
 * rank engine, association manager and list pipeline from one configuration.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (CurationClient client = CurationClient.builder()
 *         .gatewayConfig(HttpGatewayConfig.localDefaults())
 *         .build()) {
 *
 *     List&lt;CuratedItem&gt; dishes = client.browse(
 *             ItemQuery.inMunicipality(ItemKind.DISH, 3),
 *             ListQuery.builder().sortKey(SortKey.RATING).build());
 *
 *     RankOutcome outcome = client.rankEngine().setRank(dishes.get(0), 1, dishes);
 *     if (outcome.requiresConfirmation()) {
 *         client.rankEngine().confirm(outcome.change());
 *     }
 *
 *     client.associations().bulkLink(Set.of(1L, 2L), Set.of(10L), LinkMetadata.defaults());
 * }
 * </pre>
 */
public class CurationClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CurationClient.class);

    static final String SEARCH_THREAD_NAME = "curation-search";
    private static final int SEARCH_THREADS = 2;

    private final RemoteDataGateway gateway;
    private final CachingDataGateway cache;
    private final InvalidationChannel.Subscription cacheSubscription;
    private final CurationOptions options;
    private final CurationMetrics metrics;
    private final InvalidationChannel channel;
    private final RankAssignmentEngine rankEngine;
    private final AssociationManager associations;
    private final ListQueryPipeline pipeline;
    private final ExecutorService searchExecutor;

    private CurationClient(Builder builder) {
        this.options = builder.options != null ? builder.options : CurationOptions.defaults();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpCurationMetrics();
        this.channel = builder.channel != null ? builder.channel : new InvalidationChannel();

        RemoteDataGateway base = builder.gateway != null
                ? builder.gateway : new HttpDataGateway(builder.gatewayConfig);

        CacheConfig cacheConfig = options.getCacheConfig();
        if (cacheConfig.enabled()) {
            this.cache = new CachingDataGateway(base, cacheConfig, metrics);
            this.cacheSubscription = channel.subscribe(cache);
            this.gateway = cache;
        } else {
            this.cache = null;
            this.cacheSubscription = null;
            this.gateway = base;
        }

        InFlightRegistry inFlight = new InFlightRegistry();
        this.rankEngine = new RankAssignmentEngine(gateway, channel, inFlight, metrics);
        this.associations = new AssociationManager(gateway, channel, inFlight, metrics, options);
        this.pipeline = new ListQueryPipeline(metrics);
        this.searchExecutor = Executors.newFixedThreadPool(SEARCH_THREADS, r -> {
            Thread t = new Thread(r, SEARCH_THREAD_NAME);
            t.setDaemon(true);
            return t;
        });

        log.info("CurationClient initialized: bulkConcurrency={}, cache={}",
                options.getBulkLinkConcurrency(), cacheConfig.enabled());
    }

    public RemoteDataGateway gateway() {
        return gateway;
    }

    public RankAssignmentEngine rankEngine() {
        return rankEngine;
    }

    public AssociationManager associations() {
        return associations;
    }

    public ListQueryPipeline pipeline() {
        return pipeline;
    }

    public InvalidationChannel channel() {
        return channel;
    }

    public CurationOptions options() {
        return options;
    }

    /**
     * Read cache statistics, empty when caching is disabled.
     */
    public Optional<CacheStats> cacheStats() {
        return cache != null ? Optional.of(cache.getStats()) : Optional.empty();
    }

    /**
     * Fetches a collection and runs it through search, filter and sort.
     */
    public List<CuratedItem> browse(ItemQuery source, ListQuery query) {
        return pipeline.run(gateway.fetchItems(source), query);
    }

    public ItemSnapshot snapshot(ItemQuery source) {
        return new ItemSnapshot(gateway.fetchItems(source));
    }

    public RankCommand rankCommand(ItemSnapshot snapshot, CuratedItem item, Integer desiredRank) {
        return new RankCommand(rankEngine, snapshot, item, desiredRank);
    }

    /**
     * Creates a runner for search-as-you-type over the given source collection.
     * Queries run after the configured debounce delay; superseded responses are
     * dropped and counted. The caller closes the runner.
     */
    public DebouncedQueryRunner<ListQuery, List<CuratedItem>> newSearchRunner(ItemQuery source,
                                                                             Consumer<List<CuratedItem>> onResult,
                                                                             Consumer<Throwable> onError) {
        return new DebouncedQueryRunner<>(
                new Debouncer(options.getDebounceDelay()),
                query -> CompletableFuture.supplyAsync(() -> browse(source, query), searchExecutor),
                onResult,
                onError,
                metrics::incrementStaleResponseDropped);
    }

    @Override
    public void close() {
        associations.close();
        searchExecutor.shutdown();
        try {
            if (!searchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                searchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            searchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (cacheSubscription != null) {
            cacheSubscription.close();
        }
        log.info("CurationClient closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RemoteDataGateway gateway;
        private HttpGatewayConfig gatewayConfig;
        private CurationOptions options;
        private CurationMetrics metrics;
        private InvalidationChannel channel;

        /**
         * Uses the given gateway instead of the HTTP one.
         */
        public Builder gateway(RemoteDataGateway gateway) {
            this.gateway = gateway;
            return this;
        }

        public Builder gatewayConfig(HttpGatewayConfig gatewayConfig) {
            this.gatewayConfig = gatewayConfig;
            return this;
        }

        public Builder options(CurationOptions options) {
            this.options = options;
            return this;
        }

        public Builder metrics(CurationMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder channel(InvalidationChannel channel) {
            this.channel = channel;
            return this;
        }

        public CurationClient build() {
            if (gateway == null && gatewayConfig == null) {
                throw new IllegalStateException("Either a gateway or a gatewayConfig is required");
            }
            return new CurationClient(this);
        }
    }
}
