package com.dish.curation.linking;

import com.dish.curation.concurrency.InFlightRegistry;
import com.dish.curation.config.CurationOptions;
import com.dish.curation.core.ValidationException;
import com.dish.curation.core.model.LinkMetadata;
import com.dish.curation.core.model.LinkPair;
import com.dish.curation.core.model.LinkedItemRef;
import com.dish.curation.event.InvalidationChannel;
import com.dish.curation.event.InvalidationEvent;
import com.dish.curation.gateway.RemoteDataGateway;
import com.dish.curation.gateway.RemoteGatewayException;
import com.dish.curation.logging.LogContext;
import com.dish.curation.metrics.CurationMetrics;
import com.dish.curation.metrics.NoOpCurationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Manages the many-to-many links between dishes and restaurants.
 *
 * <p>{@link #link} and {@link #unlink} are idempotent: an already existing pair
 * (status 409) and a missing pair (status 404) count as success. {@link #bulkLink}
 * attempts every pair of the cross product concurrently and reports each outcome.</p>
 */
public class AssociationManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AssociationManager.class);

    private final RemoteDataGateway gateway;
    private final InvalidationChannel channel;
    private final InFlightRegistry inFlight;
    private final CurationMetrics metrics;
    private final ExecutorService executor;
    private final Duration bulkTimeout;

    public AssociationManager(RemoteDataGateway gateway) {
        this(gateway, new InvalidationChannel(), new InFlightRegistry(),
                new NoOpCurationMetrics(), CurationOptions.defaults());
    }

    public AssociationManager(RemoteDataGateway gateway, InvalidationChannel channel,
                              InFlightRegistry inFlight, CurationMetrics metrics,
                              CurationOptions options) {
        this.gateway = Objects.requireNonNull(gateway, "gateway is required");
        this.channel = Objects.requireNonNull(channel, "channel is required");
        this.inFlight = Objects.requireNonNull(inFlight, "inFlight is required");
        this.metrics = metrics != null ? metrics : new NoOpCurationMetrics();
        this.executor = Executors.newFixedThreadPool(options.getBulkLinkConcurrency(), r -> {
            Thread t = new Thread(r, "bulk-link");
            t.setDaemon(true);
            return t;
        });
        this.bulkTimeout = options.getBulkLinkTimeout();
    }

    /**
     * Links a dish to a restaurant. Linking an already linked pair succeeds.
     *
     * @throws ValidationException    if an id is not positive
     * @throws RemoteGatewayException on any other gateway failure
     */
    public void link(long dishId, long restaurantId, LinkMetadata metadata) {
        validateIds(dishId, restaurantId);
        LinkMetadata meta = metadata != null ? metadata : LinkMetadata.defaults();
        inFlight.run(operationKey(dishId, restaurantId), () -> {
            try (LogContext ignored = LogContext.forLink(dishId, restaurantId)) {
                try {
                    createIgnoringDuplicate(dishId, restaurantId, meta);
                } catch (RemoteGatewayException e) {
                    metrics.incrementLinkFailed();
                    throw e;
                }
                log.info("link.created dishId={} restaurantId={} availability={}",
                        dishId, restaurantId, meta.availability().wireValue());
            }
        });
        metrics.incrementLinkCreated();
        channel.publish(InvalidationEvent.associations(Set.of(dishId), Set.of(restaurantId)));
    }

    /**
     * Removes the link. Unlinking a pair that is not linked succeeds.
     */
    public void unlink(long dishId, long restaurantId) {
        validateIds(dishId, restaurantId);
        inFlight.run(operationKey(dishId, restaurantId), () -> {
            try (LogContext ignored = LogContext.forLink(dishId, restaurantId)) {
                try {
                    gateway.deleteLink(dishId, restaurantId);
                } catch (RemoteGatewayException e) {
                    if (!e.isNotFound()) {
                        metrics.incrementLinkFailed();
                        throw e;
                    }
                    log.debug("link.absent dishId={} restaurantId={}", dishId, restaurantId);
                }
                log.info("link.removed dishId={} restaurantId={}", dishId, restaurantId);
            }
        });
        metrics.incrementLinkRemoved();
        channel.publish(InvalidationEvent.associations(Set.of(dishId), Set.of(restaurantId)));
    }

    /**
     * Links when the pair is not linked, unlinks when it is.
     *
     * @return true when the pair is linked after the call
     */
    public boolean toggle(long dishId, long restaurantId, LinkMetadata metadata) {
        validateIds(dishId, restaurantId);
        if (linkedRestaurantIds(dishId).contains(restaurantId)) {
            unlink(dishId, restaurantId);
            return false;
        }
        link(dishId, restaurantId, metadata);
        return true;
    }

    /**
     * Attempts every (dish, restaurant) pair of the cross product concurrently.
     * Failures of individual pairs are collected, never thrown.
     *
     * @throws ValidationException if either id set is empty or holds a non-positive id
     */
    public BulkLinkResult bulkLink(Collection<Long> dishIds, Collection<Long> restaurantIds, LinkMetadata metadata) {
        if (dishIds == null || dishIds.isEmpty()) {
            throw new ValidationException("At least one dish is required");
        }
        if (restaurantIds == null || restaurantIds.isEmpty()) {
            throw new ValidationException("At least one restaurant is required");
        }
        List<LinkPair> pairs = new ArrayList<>();
        for (Long dishId : new LinkedHashSet<>(dishIds)) {
            for (Long restaurantId : new LinkedHashSet<>(restaurantIds)) {
                validateIds(dishId, restaurantId);
                pairs.add(new LinkPair(dishId, restaurantId));
            }
        }
        return linkAll(pairs, metadata);
    }

    /**
     * Re-attempts only the failed pairs of a previous bulk result.
     */
    public BulkLinkResult retryFailed(BulkLinkResult previous, LinkMetadata metadata) {
        if (!previous.hasFailures()) {
            return new BulkLinkResult(List.of(), List.of());
        }
        log.info("bulk-link.retry pairs={}", previous.failureCount());
        return linkAll(previous.failedPairs(), metadata);
    }

    public List<LinkedItemRef> listAssociatedRestaurants(long dishId) {
        log.debug("link.list dishId={}", dishId);
        return gateway.fetchAssociatedRestaurants(dishId);
    }

    public List<LinkedItemRef> listAssociatedDishes(long restaurantId) {
        log.debug("link.list restaurantId={}", restaurantId);
        return gateway.fetchAssociatedDishes(restaurantId);
    }

    public Set<Long> linkedRestaurantIds(long dishId) {
        return listAssociatedRestaurants(dishId).stream()
                .map(LinkedItemRef::id)
                .collect(Collectors.toUnmodifiableSet());
    }

    public Set<Long> linkedDishIds(long restaurantId) {
        return listAssociatedDishes(restaurantId).stream()
                .map(LinkedItemRef::id)
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isInFlight(long dishId, long restaurantId) {
        return inFlight.isInFlight(operationKey(dishId, restaurantId));
    }

    public static String operationKey(long dishId, long restaurantId) {
        return "link:" + dishId + ":" + restaurantId;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private BulkLinkResult linkAll(List<LinkPair> pairs, LinkMetadata metadata) {
        LinkMetadata meta = metadata != null ? metadata : LinkMetadata.defaults();
        String batchId = LogContext.generateCorrelationId();
        metrics.recordBulkLinkSize(pairs.size());

        try (LogContext ignored = LogContext.forBulkLink(batchId)) {
            log.info("bulk-link.start batchId={} pairs={}", batchId, pairs.size());

            List<CompletableFuture<PairOutcome>> futures = pairs.stream()
                    .map(pair -> submit(pair, meta))
                    .toList();

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            List<LinkPair> succeeded = new ArrayList<>();
            List<BulkLinkResult.LinkFailure> failed = new ArrayList<>();
            for (CompletableFuture<PairOutcome> future : futures) {
                PairOutcome outcome = future.join();
                if (outcome.failure() == null) {
                    succeeded.add(outcome.pair());
                } else {
                    failed.add(outcome.failure());
                }
            }

            if (!succeeded.isEmpty()) {
                channel.publish(InvalidationEvent.associations(
                        succeeded.stream().map(LinkPair::dishId).collect(Collectors.toSet()),
                        succeeded.stream().map(LinkPair::restaurantId).collect(Collectors.toSet())));
            }
            BulkLinkResult result = new BulkLinkResult(succeeded, failed);
            log.info("bulk-link.complete batchId={} succeeded={} failed={}",
                    batchId, result.successCount(), result.failureCount());
            return result;
        }
    }

    /**
     * Queues one pair. The timeout is armed when a worker picks the pair up, so time
     * spent waiting for a free worker does not count against it.
     */
    private CompletableFuture<PairOutcome> submit(LinkPair pair, LinkMetadata meta) {
        CompletableFuture<PairOutcome> outcome = new CompletableFuture<>();
        executor.execute(() -> {
            if (outcome.isDone()) {
                return;
            }
            outcome.completeOnTimeout(PairOutcome.timedOut(pair, bulkTimeout),
                    bulkTimeout.toMillis(), TimeUnit.MILLISECONDS);
            outcome.complete(attempt(pair, meta));
        });
        return outcome;
    }

    private PairOutcome attempt(LinkPair pair, LinkMetadata meta) {
        try {
            createIgnoringDuplicate(pair.dishId(), pair.restaurantId(), meta);
            metrics.incrementLinkCreated();
            return PairOutcome.success(pair);
        } catch (RemoteGatewayException e) {
            metrics.incrementLinkFailed();
            log.warn("bulk-link.pair-failed pair={} status={} message={}", pair, e.getStatus(), e.getRemoteMessage());
            return PairOutcome.failure(pair, e.getStatus(), e.getRemoteMessage());
        } catch (RuntimeException e) {
            metrics.incrementLinkFailed();
            log.warn("bulk-link.pair-failed pair={} error={}", pair, e.toString());
            return PairOutcome.failure(pair, RemoteGatewayException.STATUS_UNREACHABLE, e.getMessage());
        }
    }

    private void createIgnoringDuplicate(long dishId, long restaurantId, LinkMetadata meta) {
        try {
            gateway.createLink(dishId, restaurantId, meta);
        } catch (RemoteGatewayException e) {
            if (!e.isConflict()) {
                throw e;
            }
            log.debug("link.exists dishId={} restaurantId={}", dishId, restaurantId);
        }
    }

    private static void validateIds(Long dishId, Long restaurantId) {
        if (dishId == null || dishId <= 0) {
            throw new ValidationException("Invalid dish id: " + dishId);
        }
        if (restaurantId == null || restaurantId <= 0) {
            throw new ValidationException("Invalid restaurant id: " + restaurantId);
        }
    }

    private record PairOutcome(LinkPair pair, BulkLinkResult.LinkFailure failure) {

        static PairOutcome success(LinkPair pair) {
            return new PairOutcome(pair, null);
        }

        static PairOutcome failure(LinkPair pair, int status, String message) {
            return new PairOutcome(pair, new BulkLinkResult.LinkFailure(pair, status, message));
        }

        static PairOutcome timedOut(LinkPair pair, Duration timeout) {
            return failure(pair, RemoteGatewayException.STATUS_UNREACHABLE,
                    "timed out after " + timeout.toMillis() + " ms");
        }
    }
}
