package com.dish.curation.event;

import com.dish.curation.core.model.ItemKind;
import com.dish.curation.core.model.RankScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InvalidationChannelTest {

    @Test
    @DisplayName("Should deliver events to every subscriber until unsubscribed")
    void testSubscribeAndClose() {
        InvalidationChannel channel = new InvalidationChannel();
        List<InvalidationEvent> first = new ArrayList<>();
        List<InvalidationEvent> second = new ArrayList<>();
        InvalidationChannel.Subscription subscription = channel.subscribe(first::add);
        channel.subscribe(second::add);

        channel.publish(InvalidationEvent.associations(Set.of(1L), Set.of(2L)));
        subscription.close();
        channel.publish(InvalidationEvent.associations(Set.of(3L), Set.of(4L)));

        assertEquals(1, first.size());
        assertEquals(2, second.size());
        assertEquals(1, channel.listenerCount());
    }

    @Test
    @DisplayName("Should keep delivering when a listener throws")
    void testFailingListener() {
        InvalidationChannel channel = new InvalidationChannel();
        List<InvalidationEvent> received = new ArrayList<>();
        channel.subscribe(event -> {
            throw new IllegalStateException("listener bug");
        });
        channel.subscribe(received::add);

        assertDoesNotThrow(() -> channel.publish(
                InvalidationEvent.items(RankScope.restaurants(1), Set.of(5L))));
        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("Should file item ids under the scope's kind")
    void testItemsEvent() {
        InvalidationEvent dishes = InvalidationEvent.items(RankScope.dishes(1, "Main"), Set.of(1L, 2L));
        InvalidationEvent restaurants = InvalidationEvent.items(RankScope.restaurants(1), Set.of(9L));

        assertEquals(Set.of(1L, 2L), dishes.ids(ItemKind.DISH));
        assertTrue(dishes.ids(ItemKind.RESTAURANT).isEmpty());
        assertEquals(Set.of(9L), restaurants.restaurantIds());
        assertEquals("main", dishes.scope().category());
    }
}
