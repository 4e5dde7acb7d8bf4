package com.dish.curation.query;

import com.dish.curation.core.model.CuratedItem;
import com.dish.curation.core.model.SpiceLevel;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Conjunction of the list filters. An unset constraint matches every item.
 *
 * <ul>
 *   <li>category: exact match (case-insensitive), null or {@code "all"} for any</li>
 *   <li>price bucket: see {@link PriceBucket}</li>
 *   <li>dietary tags: the item must carry every selected tag</li>
 *   <li>spice level: exact match, null for any</li>
 * </ul>
 */
public final class ItemFilter implements Predicate<CuratedItem> {

    private static final String ALL = "all";

    private final String category;
    private final PriceBucket priceBucket;
    private final Set<String> dietaryTags;
    private final SpiceLevel spiceLevel;

    private ItemFilter(Builder builder) {
        this.category = builder.category == null || builder.category.isBlank()
                || ALL.equalsIgnoreCase(builder.category.trim())
                ? null : builder.category.trim().toLowerCase(Locale.ROOT);
        this.priceBucket = builder.priceBucket != null ? builder.priceBucket : PriceBucket.ALL;
        this.dietaryTags = Set.copyOf(builder.dietaryTags);
        this.spiceLevel = builder.spiceLevel;
    }

    public static ItemFilter none() {
        return builder().build();
    }

    @Override
    public boolean test(CuratedItem item) {
        if (category != null && (item.getCategory() == null
                || !category.equals(item.getCategory().toLowerCase(Locale.ROOT)))) {
            return false;
        }
        if (!priceBucket.matches(item.getPrice())) {
            return false;
        }
        if (!dietaryTags.isEmpty() && !hasEveryTag(item.getDietaryTags())) {
            return false;
        }
        return spiceLevel == null || item.getSpiceLevel().map(spiceLevel::equals).orElse(false);
    }

    public Optional<String> getCategory() {
        return Optional.ofNullable(category);
    }

    public PriceBucket getPriceBucket() {
        return priceBucket;
    }

    public Set<String> getDietaryTags() {
        return dietaryTags;
    }

    public Optional<SpiceLevel> getSpiceLevel() {
        return Optional.ofNullable(spiceLevel);
    }

    public boolean isEmpty() {
        return category == null && priceBucket == PriceBucket.ALL && dietaryTags.isEmpty() && spiceLevel == null;
    }

    private boolean hasEveryTag(List<String> itemTags) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String tag : itemTags) {
            normalized.add(tag.toLowerCase(Locale.ROOT));
        }
        return normalized.containsAll(dietaryTags);
    }

    @Override
    public String toString() {
        return "ItemFilter{category=" + category +
                ", price=" + priceBucket +
                ", dietary=" + dietaryTags +
                ", spice=" + spiceLevel + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String category;
        private PriceBucket priceBucket;
        private final Set<String> dietaryTags = new LinkedHashSet<>();
        private SpiceLevel spiceLevel;

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder priceBucket(PriceBucket priceBucket) {
            this.priceBucket = priceBucket;
            return this;
        }

        public Builder dietaryTags(Iterable<String> tags) {
            for (String tag : tags) {
                dietaryTag(tag);
            }
            return this;
        }

        public Builder dietaryTag(String tag) {
            if (tag != null && !tag.isBlank()) {
                dietaryTags.add(tag.trim().toLowerCase(Locale.ROOT));
            }
            return this;
        }

        public Builder spiceLevel(SpiceLevel spiceLevel) {
            this.spiceLevel = spiceLevel;
            return this;
        }

        public ItemFilter build() {
            return new ItemFilter(this);
        }
    }
}
