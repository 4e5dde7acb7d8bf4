package com.dish.curation.cache;

import com.dish.curation.core.model.CuratedItem;
import com.dish.curation.core.model.ItemKind;
import com.dish.curation.core.model.LinkMetadata;
import com.dish.curation.core.model.LinkedItemRef;
import com.dish.curation.core.model.Municipality;
import com.dish.curation.event.InvalidationEvent;
import com.dish.curation.event.InvalidationListener;
import com.dish.curation.gateway.ItemPatch;
import com.dish.curation.gateway.ItemQuery;
import com.dish.curation.gateway.RemoteDataGateway;
import com.dish.curation.metrics.CurationMetrics;
import com.dish.curation.metrics.NoOpCurationMetrics;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Caffeine-backed read cache in front of a {@link RemoteDataGateway}.
 * Implements {@link InvalidationListener} so signals from the engine and the
 * association manager drop stale entries; its own writes invalidate as well.
 *
 * <p>Every invalidation bumps a generation counter. A load that overlaps an
 * invalidation does not keep its result, since it may predate the change.</p>
 */
public class CachingDataGateway implements RemoteDataGateway, InvalidationListener {
    private static final Logger log = LoggerFactory.getLogger(CachingDataGateway.class);

    private static final String MUNICIPALITIES = "municipalities";

    private final RemoteDataGateway delegate;
    private final CurationMetrics metrics;
    private final Cache<ItemQuery, List<CuratedItem>> items;
    private final Cache<AssociationKey, List<LinkedItemRef>> associations;
    private final Cache<String, List<Municipality>> municipalities;
    private final AtomicLong generation = new AtomicLong();

    public CachingDataGateway(RemoteDataGateway delegate, CacheConfig config) {
        this(delegate, config, new NoOpCurationMetrics());
    }

    public CachingDataGateway(RemoteDataGateway delegate, CacheConfig config, CurationMetrics metrics) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.metrics = metrics != null ? metrics : new NoOpCurationMetrics();
        this.items = newCache(config);
        this.associations = newCache(config);
        this.municipalities = newCache(config);
        log.info("CachingDataGateway initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    private static <K, V> Cache<K, V> newCache(CacheConfig config) {
        return Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
    }

    @Override
    public List<CuratedItem> fetchItems(ItemQuery query) {
        return read(items, query, delegate::fetchItems);
    }

    @Override
    public List<LinkedItemRef> fetchAssociatedRestaurants(long dishId) {
        return read(associations, new AssociationKey(ItemKind.DISH, dishId),
                key -> delegate.fetchAssociatedRestaurants(dishId));
    }

    @Override
    public List<LinkedItemRef> fetchAssociatedDishes(long restaurantId) {
        return read(associations, new AssociationKey(ItemKind.RESTAURANT, restaurantId),
                key -> delegate.fetchAssociatedDishes(restaurantId));
    }

    @Override
    public List<Municipality> fetchMunicipalities() {
        return read(municipalities, MUNICIPALITIES, key -> delegate.fetchMunicipalities());
    }

    @Override
    public CuratedItem updateItem(CuratedItem current, ItemPatch patch) {
        try {
            return delegate.updateItem(current, patch);
        } finally {
            invalidateItems(current.getKind());
        }
    }

    @Override
    public void createLink(long dishId, long restaurantId, LinkMetadata metadata) {
        try {
            delegate.createLink(dishId, restaurantId, metadata);
        } finally {
            invalidatePair(dishId, restaurantId);
        }
    }

    @Override
    public void deleteLink(long dishId, long restaurantId) {
        try {
            delegate.deleteLink(dishId, restaurantId);
        } finally {
            invalidatePair(dishId, restaurantId);
        }
    }

    @Override
    public CuratedItem createItem(CuratedItem item) {
        CuratedItem created = delegate.createItem(item);
        invalidateItems(item.getKind());
        return created;
    }

    @Override
    public void deleteItem(ItemKind kind, long id) {
        delegate.deleteItem(kind, id);
        invalidateItems(kind);
        generation.incrementAndGet();
        associations.invalidateAll();
    }

    @Override
    public void onInvalidated(InvalidationEvent event) {
        generation.incrementAndGet();
        switch (event.topic()) {
            case ITEMS -> {
                if (event.scope() != null) {
                    invalidateItems(event.scope().kind());
                } else {
                    items.invalidateAll();
                }
            }
            case ASSOCIATIONS -> {
                event.dishIds().forEach(id -> associations.invalidate(new AssociationKey(ItemKind.DISH, id)));
                event.restaurantIds().forEach(id -> associations.invalidate(new AssociationKey(ItemKind.RESTAURANT, id)));
            }
        }
        log.debug("Cache invalidated for {} dishes={} restaurants={}",
                event.topic(), event.dishIds(), event.restaurantIds());
    }

    public void invalidateAll() {
        generation.incrementAndGet();
        items.invalidateAll();
        associations.invalidateAll();
        municipalities.invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    public CacheStats getStats() {
        long hits = 0;
        long misses = 0;
        long evictions = 0;
        long size = 0;
        for (Cache<?, ?> cache : List.<Cache<?, ?>>of(items, associations, municipalities)) {
            com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
            hits += stats.hitCount();
            misses += stats.missCount();
            evictions += stats.evictionCount();
            size += cache.estimatedSize();
        }
        return new CacheStats(hits, misses, evictions, size);
    }

    private <K, V> V read(Cache<K, V> cache, K key, Function<K, V> loader) {
        V cached = cache.getIfPresent(key);
        if (cached != null) {
            metrics.recordCacheHit();
            return cached;
        }
        metrics.recordCacheMiss();
        long seen = generation.get();
        V loaded = loader.apply(key);
        cache.put(key, loaded);
        if (generation.get() != seen) {
            // invalidated while loading
            cache.invalidate(key);
            log.debug("Dropped cache entry loaded across an invalidation: {}", key);
        }
        return loaded;
    }

    private void invalidateItems(ItemKind kind) {
        generation.incrementAndGet();
        items.asMap().keySet().removeIf(query -> query.kind() == kind);
    }

    private void invalidatePair(long dishId, long restaurantId) {
        generation.incrementAndGet();
        associations.invalidate(new AssociationKey(ItemKind.DISH, dishId));
        associations.invalidate(new AssociationKey(ItemKind.RESTAURANT, restaurantId));
    }

    /**
     * Key of an association read: the owner's kind and id.
     */
    record AssociationKey(ItemKind ownerKind, long ownerId) {}
}
