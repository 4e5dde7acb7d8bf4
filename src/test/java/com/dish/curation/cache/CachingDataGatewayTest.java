package com.dish.curation.cache;

import com.dish.curation.core.model.CuratedItem;
import com.dish.curation.core.model.ItemKind;
import com.dish.curation.core.model.LinkMetadata;
import com.dish.curation.core.model.LinkedItemRef;
import com.dish.curation.core.model.RankScope;
import com.dish.curation.event.InvalidationEvent;
import com.dish.curation.gateway.ItemPatch;
import com.dish.curation.gateway.ItemQuery;
import com.dish.curation.gateway.RemoteDataGateway;
import com.dish.curation.metrics.MicrometerCurationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CachingDataGatewayTest {

    @Mock
    private RemoteDataGateway delegate;

    private SimpleMeterRegistry registry;
    private CachingDataGateway cache;

    private final ItemQuery dishes = ItemQuery.inMunicipality(ItemKind.DISH, 1);
    private final ItemQuery restaurants = ItemQuery.inMunicipality(ItemKind.RESTAURANT, 1);

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        cache = new CachingDataGateway(delegate, CacheConfig.defaults(), new MicrometerCurationMetrics(registry));
    }

    private static CuratedItem dish(long id) {
        return CuratedItem.dish().id(id).name("Dish " + id).municipalityId(1).build();
    }

    @Test
    @DisplayName("Should serve repeated reads from the cache")
    void testCachedRead() {
        when(delegate.fetchItems(dishes)).thenReturn(List.of(dish(1)));

        cache.fetchItems(dishes);
        cache.fetchItems(dishes);

        verify(delegate, times(1)).fetchItems(dishes);
        CacheStats stats = cache.getStats();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(0.5, stats.hitRate());
        assertEquals(1.0, registry.get("curation.cache.hit").counter().count());
    }

    @Test
    @DisplayName("Should drop item reads of the written kind on update")
    void testUpdateInvalidates() {
        when(delegate.fetchItems(dishes)).thenReturn(List.of(dish(1)));
        when(delegate.fetchItems(restaurants)).thenReturn(List.of());
        when(delegate.updateItem(any(CuratedItem.class), any(ItemPatch.class))).thenReturn(dish(1));

        cache.fetchItems(dishes);
        cache.fetchItems(restaurants);
        cache.updateItem(dish(1), ItemPatch.clearRank());
        cache.fetchItems(dishes);
        cache.fetchItems(restaurants);

        verify(delegate, times(2)).fetchItems(dishes);
        verify(delegate, times(1)).fetchItems(restaurants);
    }

    @Test
    @DisplayName("Should drop association reads named by an invalidation signal")
    void testAssociationSignal() {
        when(delegate.fetchAssociatedRestaurants(1)).thenReturn(List.<LinkedItemRef>of());
        when(delegate.fetchAssociatedRestaurants(2)).thenReturn(List.<LinkedItemRef>of());

        cache.fetchAssociatedRestaurants(1);
        cache.fetchAssociatedRestaurants(2);
        cache.onInvalidated(InvalidationEvent.associations(Set.of(1L), Set.of()));
        cache.fetchAssociatedRestaurants(1);
        cache.fetchAssociatedRestaurants(2);

        verify(delegate, times(2)).fetchAssociatedRestaurants(1);
        verify(delegate, times(1)).fetchAssociatedRestaurants(2);
    }

    @Test
    @DisplayName("Should drop item reads of the signalled scope's kind")
    void testItemsSignal() {
        when(delegate.fetchItems(restaurants)).thenReturn(List.of());

        cache.fetchItems(restaurants);
        cache.onInvalidated(InvalidationEvent.items(RankScope.restaurants(1), Set.of(3L)));
        cache.fetchItems(restaurants);

        verify(delegate, times(2)).fetchItems(restaurants);
    }

    @Test
    @DisplayName("Should not keep a read whose load overlapped an invalidation")
    void testLoadRacingInvalidation() {
        CuratedItem stale = dish(1);
        CuratedItem fresh = dish(1).withRank(1);
        AtomicInteger loads = new AtomicInteger();
        when(delegate.fetchItems(dishes)).thenAnswer(inv -> {
            if (loads.incrementAndGet() == 1) {
                // a rank write lands while the first load is still in flight
                cache.onInvalidated(InvalidationEvent.items(RankScope.dishes(1, "main"), Set.of(1L)));
                return List.of(stale);
            }
            return List.of(fresh);
        });

        assertEquals(List.of(stale), cache.fetchItems(dishes));
        List<CuratedItem> second = cache.fetchItems(dishes);

        assertEquals(1, second.get(0).getRank());
        assertEquals(2, loads.get());
        assertEquals(List.of(fresh), cache.fetchItems(dishes));
        verify(delegate, times(2)).fetchItems(dishes);
    }

    @Test
    @DisplayName("Should invalidate both sides of a link even when the write fails")
    void testLinkWriteInvalidates() {
        when(delegate.fetchAssociatedDishes(5)).thenReturn(List.<LinkedItemRef>of());
        doThrow(new RuntimeException("down")).when(delegate).createLink(eq(1L), eq(5L), any());

        cache.fetchAssociatedDishes(5);
        assertThrows(RuntimeException.class, () -> cache.createLink(1, 5, LinkMetadata.defaults()));
        cache.fetchAssociatedDishes(5);

        verify(delegate, times(2)).fetchAssociatedDishes(5);
    }
}
