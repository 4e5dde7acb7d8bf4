package com.dish.curation.core.model;

/**
 * Kinds of curated items. Dishes are ranked per municipality and category,
 * restaurants per municipality only.
 */
public enum ItemKind {
    DISH("Dish"),
    RESTAURANT("Restaurant");

    private final String label;

    ItemKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
