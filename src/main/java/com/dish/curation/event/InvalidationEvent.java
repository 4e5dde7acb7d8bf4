package com.dish.curation.event;

import com.dish.curation.core.model.ItemKind;
import com.dish.curation.core.model.RankScope;

import java.util.Objects;
import java.util.Set;

/**
 * Signal that persisted state changed and dependent reads are stale.
 *
 * @param topic         the kind of data that changed
 * @param scope         the rank scope affected by an {@link Topic#ITEMS} signal, otherwise null
 * @param dishIds       dishes whose reads are stale
 * @param restaurantIds restaurants whose reads are stale
 */
public record InvalidationEvent(Topic topic, RankScope scope, Set<Long> dishIds, Set<Long> restaurantIds) {

    public enum Topic {
        ITEMS,
        ASSOCIATIONS
    }

    public InvalidationEvent {
        Objects.requireNonNull(topic, "topic is required");
        dishIds = dishIds != null ? Set.copyOf(dishIds) : Set.of();
        restaurantIds = restaurantIds != null ? Set.copyOf(restaurantIds) : Set.of();
    }

    /**
     * Items of a scope changed (rank or flag writes).
     */
    public static InvalidationEvent items(RankScope scope, Set<Long> ids) {
        return scope.kind() == ItemKind.DISH
                ? new InvalidationEvent(Topic.ITEMS, scope, ids, Set.of())
                : new InvalidationEvent(Topic.ITEMS, scope, Set.of(), ids);
    }

    /**
     * Associations between the given dishes and restaurants changed.
     */
    public static InvalidationEvent associations(Set<Long> dishIds, Set<Long> restaurantIds) {
        return new InvalidationEvent(Topic.ASSOCIATIONS, null, dishIds, restaurantIds);
    }

    public Set<Long> ids(ItemKind kind) {
        return kind == ItemKind.DISH ? dishIds : restaurantIds;
    }
}
