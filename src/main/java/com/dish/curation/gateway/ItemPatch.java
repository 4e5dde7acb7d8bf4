package com.dish.curation.gateway;

import com.dish.curation.core.model.CuratedItem;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Partial update of a curated item. Only fields that were set are sent; a rank
 * that was explicitly set to null clears the slot.
 */
public final class ItemPatch {

    private final boolean rankSet;
    private final Integer rank;
    private final Boolean flag;
    private final String name;
    private final String description;
    private final Double price;

    private ItemPatch(Builder builder) {
        this.rankSet = builder.rankSet;
        this.rank = builder.rank;
        this.flag = builder.flag;
        this.name = builder.name;
        this.description = builder.description;
        this.price = builder.price;
    }

    /**
     * Patch setting the rank slot and the matching flag together.
     */
    public static ItemPatch rank(Integer rank) {
        return builder().rank(rank).flag(rank != null).build();
    }

    /**
     * Patch clearing the rank slot and the flag.
     */
    public static ItemPatch clearRank() {
        return rank(null);
    }

    public boolean hasRank() {
        return rankSet;
    }

    public Integer getRank() {
        return rank;
    }

    public Optional<Boolean> getFlag() {
        return Optional.ofNullable(flag);
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public Optional<Double> getPrice() {
        return Optional.ofNullable(price);
    }

    public boolean isEmpty() {
        return !rankSet && flag == null && name == null && description == null && price == null;
    }

    /**
     * Returns a copy of the item with the set fields applied.
     */
    public CuratedItem applyTo(CuratedItem current) {
        CuratedItem.Builder builder = current.toBuilder();
        if (rankSet) {
            builder.rank(rank);
        }
        if (flag != null) {
            builder.flag(flag);
        }
        if (name != null) {
            builder.name(name);
        }
        if (description != null) {
            builder.description(description);
        }
        if (price != null) {
            builder.price(price);
        }
        return builder.build();
    }

    /**
     * Returns the set fields keyed by the given column names for rank and flag.
     */
    public Map<String, Object> toFields(String rankField, String flagField) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (rankSet) {
            fields.put(rankField, rank);
        }
        if (flag != null) {
            fields.put(flagField, flag ? 1 : 0);
        }
        if (name != null) {
            fields.put("name", name);
        }
        if (description != null) {
            fields.put("description", description);
        }
        if (price != null) {
            fields.put("price", price);
        }
        return fields;
    }

    @Override
    public String toString() {
        return "ItemPatch" + toFields("rank", "flag");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean rankSet;
        private Integer rank;
        private Boolean flag;
        private String name;
        private String description;
        private Double price;

        public Builder rank(Integer rank) {
            this.rankSet = true;
            this.rank = rank;
            return this;
        }

        public Builder flag(boolean flag) {
            this.flag = flag;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder price(double price) {
            this.price = price;
            return this;
        }

        public ItemPatch build() {
            return new ItemPatch(this);
        }
    }
}
