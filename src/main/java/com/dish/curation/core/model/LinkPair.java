package com.dish.curation.core.model;

/**
 * Composite key of a dish-restaurant association.
 */
public record LinkPair(long dishId, long restaurantId) {

    @Override
    public String toString() {
        return "(" + dishId + "," + restaurantId + ")";
    }
}
