package com.dish.curation.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A dish or restaurant eligible for curation.
 *
 * Instances are immutable. The {@code flag} (signature dish / featured restaurant)
 * always mirrors whether a rank is held: use {@link #withRank(Integer)} to derive a
 * re-ranked copy. A null rank means unranked.
 */
public final class CuratedItem {

    private final long id;
    private final ItemKind kind;
    private final String name;
    private final String slug;
    private final long municipalityId;
    private final String municipalityName;
    private final String category;
    private final String description;
    private final List<String> ingredients;
    private final List<String> dietaryTags;
    private final SpiceLevel spiceLevel;
    private final Integer rank;
    private final boolean flag;
    private final double rating;
    private final long ratingCount;
    private final long popularity;
    private final double price;

    private CuratedItem(Builder builder) {
        this.id = builder.id;
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.slug = builder.slug;
        this.municipalityId = builder.municipalityId;
        this.municipalityName = builder.municipalityName;
        this.category = builder.category;
        this.description = builder.description;
        this.ingredients = builder.ingredients != null ? List.copyOf(builder.ingredients) : List.of();
        this.dietaryTags = builder.dietaryTags != null ? List.copyOf(builder.dietaryTags) : List.of();
        this.spiceLevel = builder.spiceLevel;
        this.rank = builder.rank;
        this.flag = builder.flag != null ? builder.flag : builder.rank != null;
        this.rating = builder.rating;
        this.ratingCount = builder.ratingCount;
        this.popularity = builder.popularity;
        this.price = builder.price;
    }

    public long getId() {
        return id;
    }

    public ItemKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public String getSlug() {
        return slug;
    }

    public long getMunicipalityId() {
        return municipalityId;
    }

    public String getMunicipalityName() {
        return municipalityName;
    }

    public String getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getIngredients() {
        return ingredients;
    }

    public List<String> getDietaryTags() {
        return dietaryTags;
    }

    public Optional<SpiceLevel> getSpiceLevel() {
        return Optional.ofNullable(spiceLevel);
    }

    /**
     * Returns the held rank slot, or null when unranked.
     */
    public Integer getRank() {
        return rank;
    }

    public boolean isRanked() {
        return rank != null;
    }

    /**
     * Signature flag for dishes, featured flag for restaurants.
     */
    public boolean isFlagged() {
        return flag;
    }

    public double getRating() {
        return rating;
    }

    public long getRatingCount() {
        return ratingCount;
    }

    public long getPopularity() {
        return popularity;
    }

    public double getPrice() {
        return price;
    }

    /**
     * Returns the scope this item is ranked in.
     */
    public RankScope scope() {
        return RankScope.of(this);
    }

    /**
     * Returns true when both refer to the same stored record.
     */
    public boolean sameRecordAs(CuratedItem other) {
        return other != null && id == other.id && kind == other.kind;
    }

    /**
     * Returns a copy holding the given rank, with the flag derived from it.
     */
    public CuratedItem withRank(Integer newRank) {
        return toBuilder().rank(newRank).flag(newRank != null).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .kind(kind)
                .name(name)
                .slug(slug)
                .municipalityId(municipalityId)
                .municipalityName(municipalityName)
                .category(category)
                .description(description)
                .ingredients(ingredients)
                .dietaryTags(dietaryTags)
                .spiceLevel(spiceLevel)
                .rank(rank)
                .flag(flag)
                .rating(rating)
                .ratingCount(ratingCount)
                .popularity(popularity)
                .price(price);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CuratedItem that = (CuratedItem) o;
        return id == that.id && kind == that.kind
                && Objects.equals(rank, that.rank) && flag == that.flag;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, rank, flag);
    }

    @Override
    public String toString() {
        return "CuratedItem{" +
                "id=" + id +
                ", kind=" + kind +
                ", name='" + name + '\'' +
                ", municipalityId=" + municipalityId +
                ", category='" + category + '\'' +
                ", rank=" + rank +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder dish() {
        return new Builder().kind(ItemKind.DISH);
    }

    public static Builder restaurant() {
        return new Builder().kind(ItemKind.RESTAURANT);
    }

    public static class Builder {
        private long id;
        private ItemKind kind;
        private String name;
        private String slug;
        private long municipalityId;
        private String municipalityName;
        private String category;
        private String description;
        private List<String> ingredients;
        private List<String> dietaryTags;
        private SpiceLevel spiceLevel;
        private Integer rank;
        private Boolean flag;
        private double rating;
        private long ratingCount;
        private long popularity;
        private double price;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder kind(ItemKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder slug(String slug) {
            this.slug = slug;
            return this;
        }

        public Builder municipalityId(long municipalityId) {
            this.municipalityId = municipalityId;
            return this;
        }

        public Builder municipalityName(String municipalityName) {
            this.municipalityName = municipalityName;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder ingredients(List<String> ingredients) {
            this.ingredients = ingredients;
            return this;
        }

        public Builder dietaryTags(List<String> dietaryTags) {
            this.dietaryTags = dietaryTags;
            return this;
        }

        public Builder spiceLevel(SpiceLevel spiceLevel) {
            this.spiceLevel = spiceLevel;
            return this;
        }

        public Builder rank(Integer rank) {
            this.rank = rank;
            return this;
        }

        /**
         * Overrides the flag. Stores with inconsistent history may report a flag that
         * disagrees with the rank; engine writes always realign them.
         */
        public Builder flag(boolean flag) {
            this.flag = flag;
            return this;
        }

        public Builder rating(double rating) {
            this.rating = rating;
            return this;
        }

        public Builder ratingCount(long ratingCount) {
            this.ratingCount = ratingCount;
            return this;
        }

        public Builder popularity(long popularity) {
            this.popularity = popularity;
            return this;
        }

        public Builder price(double price) {
            this.price = price;
            return this;
        }

        public CuratedItem build() {
            return new CuratedItem(this);
        }
    }
}
