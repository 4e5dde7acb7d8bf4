package com.dish.curation.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Grouping key within which rank slots are unique: municipality and category for
 * dishes, municipality alone for restaurants.
 *
 * @param kind           the item kind
 * @param municipalityId the municipality id
 * @param category       normalized dish category, always null for restaurants
 */
public record RankScope(ItemKind kind, long municipalityId, String category) {

    /** Number of rank slots per scope; valid ranks are 1 through this value. */
    public static final int SLOT_COUNT = 3;

    public RankScope {
        Objects.requireNonNull(kind, "kind is required");
        if (kind == ItemKind.RESTAURANT) {
            category = null;
        } else {
            category = category != null ? category.trim().toLowerCase(Locale.ROOT) : null;
        }
    }

    public static RankScope of(CuratedItem item) {
        return new RankScope(item.getKind(), item.getMunicipalityId(), item.getCategory());
    }

    public static RankScope dishes(long municipalityId, String category) {
        return new RankScope(ItemKind.DISH, municipalityId, category);
    }

    public static RankScope restaurants(long municipalityId) {
        return new RankScope(ItemKind.RESTAURANT, municipalityId, null);
    }

    /**
     * Returns true when the item is ranked within this scope.
     */
    public boolean contains(CuratedItem item) {
        return item != null && equals(RankScope.of(item));
    }

    @Override
    public String toString() {
        return kind == ItemKind.DISH
                ? "dish:" + municipalityId + ":" + category
                : "restaurant:" + municipalityId;
    }
}
