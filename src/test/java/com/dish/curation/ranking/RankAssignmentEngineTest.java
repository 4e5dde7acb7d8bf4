package com.dish.curation.ranking;

import com.dish.curation.concurrency.InFlightRegistry;
import com.dish.curation.concurrency.OperationInFlightException;
import com.dish.curation.core.ValidationException;
import com.dish.curation.core.model.CuratedItem;
import com.dish.curation.core.model.ItemKind;
import com.dish.curation.core.model.RankScope;
import com.dish.curation.event.InvalidationChannel;
import com.dish.curation.event.InvalidationEvent;
import com.dish.curation.gateway.FaultInjectingGateway;
import com.dish.curation.gateway.InMemoryDataGateway;
import com.dish.curation.gateway.ItemPatch;
import com.dish.curation.gateway.ItemQuery;
import com.dish.curation.gateway.RemoteDataGateway;
import com.dish.curation.gateway.RemoteGatewayException;
import com.dish.curation.metrics.MicrometerCurationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RankAssignmentEngineTest {

    private static final long MUNICIPALITY = 7;

    private InMemoryDataGateway store;
    private InvalidationChannel channel;
    private List<InvalidationEvent> events;
    private RankAssignmentEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryDataGateway();
        store.put(dish(1, "X", 1));
        store.put(dish(2, "Y", null));
        store.put(dish(3, "Z", 2));
        store.put(dish(4, "Other category", 1).toBuilder().category("dessert").build());
        store.put(dish(5, "Other town", 1).toBuilder().municipalityId(99).build());

        channel = new InvalidationChannel();
        events = new ArrayList<>();
        channel.subscribe(events::add);
        engine = new RankAssignmentEngine(store, channel, new InFlightRegistry(), null);
    }

    private static CuratedItem dish(long id, String name, Integer rank) {
        return CuratedItem.dish()
                .id(id)
                .name(name)
                .municipalityId(MUNICIPALITY)
                .category("main")
                .rank(rank)
                .build();
    }

    private List<CuratedItem> allDishes() {
        return store.fetchItems(ItemQuery.all(ItemKind.DISH));
    }

    private Map<String, Integer> ranksInMain() {
        return allDishes().stream()
                .filter(RankScope.dishes(MUNICIPALITY, "main")::contains)
                .collect(Collectors.toMap(CuratedItem::getName,
                        i -> i.getRank() == null ? 0 : i.getRank()));
    }

    private CuratedItem stored(long id) {
        return store.get(ItemKind.DISH, id);
    }

    @Nested
    @DisplayName("Conflict flow")
    class ConflictTests {

        @Test
        @DisplayName("Should report a conflict without writing when the slot is held")
        void testConflictRequiresConfirmation() {
            RankOutcome outcome = engine.setRank(stored(2), 1, allDishes());

            assertEquals(RankOutcome.Status.CONFLICT_REQUIRES_CONFIRMATION, outcome.status());
            assertTrue(outcome.requiresConfirmation());
            assertFalse(outcome.isWritten());
            assertEquals(1L, outcome.change().getConflictingItem().getId());
            assertEquals(1, stored(1).getRank());
            assertNull(stored(2).getRank());
            assertTrue(events.isEmpty());
        }

        @Test
        @DisplayName("Should displace the holder and leave other slots untouched on confirmation")
        void testConfirmScenario() {
            RankOutcome pending = engine.setRank(stored(2), 1, allDishes());
            RankOutcome outcome = engine.confirm(pending.change());

            assertEquals(RankOutcome.Status.ASSIGNED, outcome.status());
            assertEquals(Map.of("X", 0, "Y", 1, "Z", 2), ranksInMain());
            assertFalse(stored(1).isFlagged());
            assertTrue(stored(2).isFlagged());
            assertEquals(1, outcome.displaced().size());
            assertNull(outcome.displaced().get(0).getRank());
        }

        @Test
        @DisplayName("Should leave everything unchanged when declined")
        void testDecline() {
            RankOutcome pending = engine.setRank(stored(2), 1, allDishes());
            RankOutcome outcome = engine.decline(pending.change());

            assertEquals(RankOutcome.Status.CONFLICT_DECLINED, outcome.status());
            assertEquals(Map.of("X", 1, "Y", 0, "Z", 2), ranksInMain());
            assertTrue(events.isEmpty());
        }

        @Test
        @DisplayName("Should apply the resolver decision in one call")
        void testResolverOverload() {
            RankOutcome declined = engine.setRank(stored(2), 2, allDishes(), ConflictResolver.DECLINE);
            assertEquals(RankOutcome.Status.CONFLICT_DECLINED, declined.status());
            assertEquals(2, stored(3).getRank());

            RankOutcome approved = engine.setRank(stored(2), 2, allDishes(), ConflictResolver.APPROVE);
            assertEquals(RankOutcome.Status.ASSIGNED, approved.status());
            assertEquals(Map.of("X", 1, "Y", 2, "Z", 0), ranksInMain());
        }

        @Test
        @DisplayName("Should ignore holders from other scopes")
        void testOtherScopesIgnored() {
            RankOutcome outcome = engine.setRank(stored(3), 1, List.of(stored(4), stored(5), stored(3)));

            assertEquals(RankOutcome.Status.ASSIGNED, outcome.status());
            assertEquals(1, stored(4).getRank());
            assertEquals(1, store.get(ItemKind.DISH, 5).getRank());
        }

        @Test
        @DisplayName("Should clear every holder when the store already holds duplicates")
        void testDuplicateHoldersCleared() {
            store.put(dish(6, "W", 1));

            RankOutcome outcome = engine.setRank(stored(2), 1, allDishes(), ConflictResolver.APPROVE);

            assertEquals(2, outcome.displaced().size());
            assertNull(stored(1).getRank());
            assertNull(stored(6).getRank());
            assertEquals(1, stored(2).getRank());
        }
    }

    @Nested
    @DisplayName("Free slots and toggle")
    class AssignmentTests {

        @Test
        @DisplayName("Should assign a free slot immediately")
        void testAssignFreeSlot() {
            RankOutcome outcome = engine.setRank(stored(2), 3, allDishes());

            assertEquals(RankOutcome.Status.ASSIGNED, outcome.status());
            assertEquals(3, outcome.item().getRank());
            assertTrue(outcome.item().isFlagged());
            assertTrue(outcome.displaced().isEmpty());
        }

        @Test
        @DisplayName("Should clear the rank when the held slot is selected again")
        void testToggleClear() {
            RankOutcome outcome = engine.setRank(stored(1), 1, allDishes());

            assertEquals(RankOutcome.Status.CLEARED, outcome.status());
            assertTrue(outcome.change().isToggleClear());
            assertNull(stored(1).getRank());
            assertFalse(stored(1).isFlagged());
        }

        @Test
        @DisplayName("Should clear the rank when null is requested")
        void testExplicitClear() {
            RankOutcome outcome = engine.setRank(stored(3), null, allDishes());

            assertEquals(RankOutcome.Status.CLEARED, outcome.status());
            assertFalse(outcome.change().isToggleClear());
            assertNull(stored(3).getRank());
        }

        @Test
        @DisplayName("Should move an item between slots without conflict")
        void testMoveToFreeSlot() {
            engine.setRank(stored(1), 3, allDishes());

            assertEquals(Map.of("X", 3, "Y", 0, "Z", 2), ranksInMain());
        }

        @Test
        @DisplayName("Should keep at most one holder per slot across a sequence of changes")
        void testUniquenessAfterSequence() {
            engine.setRank(stored(2), 1, allDishes(), ConflictResolver.APPROVE);
            engine.setRank(stored(1), 2, allDishes(), ConflictResolver.APPROVE);
            engine.setRank(stored(3), 1, allDishes(), ConflictResolver.APPROVE);
            engine.setRank(stored(2), 3, allDishes(), ConflictResolver.APPROVE);
            engine.setRank(stored(1), 2, allDishes(), ConflictResolver.APPROVE);

            Map<Integer, Long> holdersPerSlot = allDishes().stream()
                    .filter(RankScope.dishes(MUNICIPALITY, "main")::contains)
                    .filter(CuratedItem::isRanked)
                    .collect(Collectors.groupingBy(CuratedItem::getRank, Collectors.counting()));
            holdersPerSlot.values().forEach(count -> assertEquals(1L, count));
        }

        @Test
        @DisplayName("Should publish an items invalidation for the scope after writing")
        void testPublishesInvalidation() {
            engine.setRank(stored(2), 1, allDishes(), ConflictResolver.APPROVE);

            assertEquals(1, events.size());
            InvalidationEvent event = events.get(0);
            assertEquals(InvalidationEvent.Topic.ITEMS, event.topic());
            assertEquals(RankScope.dishes(MUNICIPALITY, "main"), event.scope());
            assertEquals(Set.of(1L, 2L), event.dishIds());
        }

        @Test
        @DisplayName("Should list ranked items of a scope ordered by slot")
        void testRankedInScope() {
            List<CuratedItem> ranked = engine.rankedInScope(RankScope.dishes(MUNICIPALITY, "Main"), allDishes());

            assertEquals(List.of("X", "Z"), ranked.stream().map(CuratedItem::getName).toList());
        }

        @Test
        @DisplayName("Should rank restaurants per municipality regardless of category")
        void testRestaurantScope() {
            CuratedItem a = CuratedItem.restaurant().id(10).name("A").municipalityId(MUNICIPALITY)
                    .category("cafe").rank(1).build();
            CuratedItem b = CuratedItem.restaurant().id(11).name("B").municipalityId(MUNICIPALITY)
                    .category("diner").build();
            store.put(a).put(b);

            RankOutcome outcome = engine.setRank(b, 1, List.of(a, b));

            assertEquals(RankOutcome.Status.CONFLICT_REQUIRES_CONFIRMATION, outcome.status());
        }
    }

    @Nested
    @DisplayName("Validation")
    @ExtendWith(MockitoExtension.class)
    class ValidationTests {

        @Mock
        private RemoteDataGateway gateway;

        @ParameterizedTest
        @ValueSource(ints = {0, 4, -1, 99})
        @DisplayName("Should reject ranks outside the slots before any gateway call")
        void testInvalidRank(int rank) {
            RankAssignmentEngine mocked = new RankAssignmentEngine(gateway);

            InvalidRankException e = assertThrows(InvalidRankException.class,
                    () -> mocked.setRank(dish(1, "X", null), rank, List.of()));
            assertEquals(rank, e.getRequestedRank());
            verifyNoInteractions(gateway);
        }

        @Test
        @DisplayName("Should treat invalid rank as a validation failure")
        void testInvalidRankIsValidation() {
            RankAssignmentEngine mocked = new RankAssignmentEngine(gateway);

            assertThrows(ValidationException.class, () -> mocked.setRank(dish(1, "X", null), 5, List.of()));
            assertThrows(ValidationException.class, () -> mocked.setRank(null, 1, List.of()));
            verifyNoInteractions(gateway);
        }

        @ParameterizedTest
        @ValueSource(ints = {1, 2, 3})
        @DisplayName("Should accept exactly the fixed slots and nothing beyond them")
        void testFixedSlots(int rank) {
            when(gateway.updateItem(any(CuratedItem.class), any(ItemPatch.class))).thenAnswer(inv -> {
                CuratedItem current = inv.getArgument(0);
                ItemPatch patch = inv.getArgument(1);
                return patch.applyTo(current);
            });
            RankAssignmentEngine mocked = new RankAssignmentEngine(gateway);

            RankOutcome outcome = mocked.setRank(dish(1, "X", null), rank, List.of());

            assertEquals(RankOutcome.Status.ASSIGNED, outcome.status());
            assertEquals(rank, outcome.item().getRank());
            assertTrue(outcome.item().isFlagged());
            assertThrows(InvalidRankException.class,
                    () -> mocked.setRank(dish(2, "Y", null), RankScope.SLOT_COUNT + 1, List.of()));
        }

        @Test
        @DisplayName("Should clear the holder before assigning the item")
        void testWriteOrder() {
            CuratedItem x = dish(1, "X", 1);
            CuratedItem y = dish(2, "Y", null);
            when(gateway.updateItem(any(CuratedItem.class), any(ItemPatch.class)))
                    .thenAnswer(inv -> {
                        CuratedItem current = inv.getArgument(0);
                        ItemPatch patch = inv.getArgument(1);
                        return patch.applyTo(current);
                    });
            RankAssignmentEngine mocked = new RankAssignmentEngine(gateway);

            mocked.setRank(y, 1, List.of(x, y), ConflictResolver.APPROVE);

            InOrder order = inOrder(gateway);
            order.verify(gateway).updateItem(argThat(item -> item.getId() == 1),
                    argThat(p -> p.hasRank() && p.getRank() == null));
            order.verify(gateway).updateItem(argThat(item -> item.getId() == 2),
                    argThat(p -> Integer.valueOf(1).equals(p.getRank())));
        }
    }

    @Nested
    @DisplayName("Partial failure")
    class PartialFailureTests {

        @Test
        @DisplayName("Should leave the slot empty when the second write fails and succeed on retry")
        void testSecondWriteFailsThenRetry() {
            FaultInjectingGateway faulty = new FaultInjectingGateway(store);
            RankAssignmentEngine fragile = new RankAssignmentEngine(faulty, channel, new InFlightRegistry(), null);
            faulty.failUpdate(ItemKind.DISH, 2);

            RemoteGatewayException e = assertThrows(RemoteGatewayException.class,
                    () -> fragile.setRank(stored(2), 1, allDishes(), ConflictResolver.APPROVE));
            assertEquals(500, e.getStatus());
            assertNull(stored(1).getRank());
            assertNull(stored(2).getRank());
            assertEquals(1, events.size());

            faulty.healUpdates();
            RankOutcome retried = fragile.setRank(stored(2), 1, allDishes(), ConflictResolver.APPROVE);

            assertEquals(RankOutcome.Status.ASSIGNED, retried.status());
            assertEquals(Map.of("X", 0, "Y", 1, "Z", 2), ranksInMain());
        }

        @Test
        @DisplayName("Should propagate a not-found update")
        void testNotFound() {
            CuratedItem ghost = dish(42, "Ghost", null);

            RemoteGatewayException e = assertThrows(RemoteGatewayException.class,
                    () -> engine.setRank(ghost, 3, allDishes()));
            assertTrue(e.isNotFound());
            assertFalse(engine.isInFlight(ghost));
        }
    }

    @Nested
    @DisplayName("In-flight guard")
    class InFlightTests {

        @Test
        @DisplayName("Should reject a second submission for the same item while the first is in flight")
        void testDuplicateSubmissionRejected() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            RemoteDataGateway blocking = new FaultInjectingGateway(store) {
                @Override
                public CuratedItem updateItem(CuratedItem current, ItemPatch patch) {
                    entered.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return super.updateItem(current, patch);
                }
            };
            RankAssignmentEngine slow = new RankAssignmentEngine(blocking);
            CuratedItem y = stored(2);

            Thread first = new Thread(() -> slow.setRank(y, 3, allDishes()));
            first.start();
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            assertTrue(slow.isInFlight(y));
            OperationInFlightException e = assertThrows(OperationInFlightException.class,
                    () -> slow.setRank(y, 3, allDishes()));
            assertEquals(RankAssignmentEngine.operationKey(y), e.getOperationKey());

            release.countDown();
            first.join(5000);
            assertFalse(slow.isInFlight(y));
            assertEquals(3, stored(2).getRank());
        }
    }

    @Nested
    @DisplayName("Metrics")
    class MetricsTests {

        @Test
        @DisplayName("Should count outcomes by status")
        void testOutcomeCounters() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            RankAssignmentEngine measured = new RankAssignmentEngine(store, channel, new InFlightRegistry(),
                    new MicrometerCurationMetrics(registry));

            RankOutcome pending = measured.setRank(stored(2), 1, allDishes());
            measured.confirm(pending.change());

            Function<String, Double> count = status -> registry.get("curation.rank.outcome")
                    .tag("status", status).counter().count();
            assertEquals(1.0, count.apply("CONFLICT_REQUIRES_CONFIRMATION"));
            assertEquals(1.0, count.apply("ASSIGNED"));
        }
    }
}
