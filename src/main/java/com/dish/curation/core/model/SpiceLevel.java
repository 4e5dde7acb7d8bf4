package com.dish.curation.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Spice levels a dish can be tagged with.
 */
public enum SpiceLevel {
    NOT_SPICY,
    MILD,
    MEDIUM,
    HOT,
    VERY_HOT;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire value such as {@code "very_hot"}. Returns empty for null, blank,
     * {@code "all"} or unknown values.
     */
    public static Optional<SpiceLevel> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (SpiceLevel level : values()) {
            if (level.name().equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
