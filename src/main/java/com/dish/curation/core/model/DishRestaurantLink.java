package com.dish.curation.core.model;

import java.util.Objects;

/**
 * Association row between a dish and a restaurant. Identity is the
 * (dishId, restaurantId) pair; metadata does not take part in equality.
 */
public final class DishRestaurantLink {

    private final long dishId;
    private final long restaurantId;
    private final LinkMetadata metadata;

    public DishRestaurantLink(long dishId, long restaurantId, LinkMetadata metadata) {
        this.dishId = dishId;
        this.restaurantId = restaurantId;
        this.metadata = metadata != null ? metadata : LinkMetadata.defaults();
    }

    public long getDishId() {
        return dishId;
    }

    public long getRestaurantId() {
        return restaurantId;
    }

    public LinkMetadata getMetadata() {
        return metadata;
    }

    public LinkPair pair() {
        return new LinkPair(dishId, restaurantId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DishRestaurantLink that = (DishRestaurantLink) o;
        return dishId == that.dishId && restaurantId == that.restaurantId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(dishId, restaurantId);
    }

    @Override
    public String toString() {
        return "DishRestaurantLink{" +
                "dishId=" + dishId +
                ", restaurantId=" + restaurantId +
                ", availability=" + metadata.availability() +
                '}';
    }
}
