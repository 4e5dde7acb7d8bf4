package com.dish.curation.query;

import com.dish.curation.core.model.CuratedItem;

import java.util.Comparator;
import java.util.Locale;

/**
 * Sort orders of the list views. Every order ends with ascending name so that
 * items equal on the primary key still come out in a total order.
 */
public enum SortKey {
    POPULARITY(Comparator.comparingLong(CuratedItem::getPopularity).reversed()
            .thenComparing(Comparator.comparingDouble(CuratedItem::getRating).reversed())
            .thenComparing(Comparator.comparingLong(CuratedItem::getRatingCount).reversed())
            .thenComparing(Orders.BY_NAME)),
    RATING(Comparator.comparingDouble(CuratedItem::getRating).reversed()
            .thenComparing(Comparator.comparingLong(CuratedItem::getRatingCount).reversed())
            .thenComparing(Comparator.comparingLong(CuratedItem::getPopularity).reversed())
            .thenComparing(Orders.BY_NAME)),
    NAME(Orders.BY_NAME),
    PRICE_LOW(Comparator.comparingDouble(CuratedItem::getPrice)
            .thenComparing(Orders.BY_NAME)),
    PRICE_HIGH(Comparator.comparingDouble(CuratedItem::getPrice).reversed()
            .thenComparing(Orders.BY_NAME)),
    /** Ranked items first by slot, then the popularity order. */
    FEATURED(Comparator.comparing(CuratedItem::isFlagged).reversed()
            .thenComparing(CuratedItem::getRank, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Comparator.comparingLong(CuratedItem::getPopularity).reversed())
            .thenComparing(Comparator.comparingDouble(CuratedItem::getRating).reversed())
            .thenComparing(Orders.BY_NAME));

    private final Comparator<CuratedItem> comparator;

    SortKey(Comparator<CuratedItem> comparator) {
        this.comparator = comparator;
    }

    public Comparator<CuratedItem> comparator() {
        return comparator;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a URL parameter value such as {@code "price_low"}; null, blank and unknown
     * values mean {@link #POPULARITY}.
     */
    public static SortKey fromValue(String value) {
        if (value == null || value.isBlank()) {
            return POPULARITY;
        }
        for (SortKey key : values()) {
            if (key.wireValue().equalsIgnoreCase(value.trim())) {
                return key;
            }
        }
        return POPULARITY;
    }

    // Holder so the constants above can reference it during enum initialization
    private static final class Orders {
        static final Comparator<CuratedItem> BY_NAME = Comparator.comparing(CuratedItem::getName);
    }
}
