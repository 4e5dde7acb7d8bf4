package com.dish.curation.core.model;

import java.util.Locale;

/**
 * How a restaurant offers a linked dish.
 */
public enum Availability {
    REGULAR,
    SEASONAL,
    PREORDER;

    /**
     * Returns the lower-case value used on the wire.
     */
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire value, falling back to {@link #REGULAR} for null or unknown values.
     */
    public static Availability fromValue(String value) {
        if (value == null || value.isBlank()) {
            return REGULAR;
        }
        for (Availability a : values()) {
            if (a.name().equalsIgnoreCase(value.trim())) {
                return a;
            }
        }
        return REGULAR;
    }
}
