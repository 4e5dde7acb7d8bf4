package com.dish.curation.query;

import java.util.Locale;

/**
 * Price ranges offered by the list filter.
 */
public enum PriceBucket {
    /** No price constraint. */
    ALL,
    /** price &lt; 100 */
    BUDGET,
    /** 100 &lt;= price &lt;= 300 */
    MID,
    /** price &gt; 300 */
    PREMIUM;

    public boolean matches(double price) {
        return switch (this) {
            case ALL -> true;
            case BUDGET -> price < 100;
            case MID -> price >= 100 && price <= 300;
            case PREMIUM -> price > 300;
        };
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a URL parameter value; null, blank and unknown values mean {@link #ALL}.
     */
    public static PriceBucket fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        for (PriceBucket bucket : values()) {
            if (bucket.name().equalsIgnoreCase(value.trim())) {
                return bucket;
            }
        }
        return ALL;
    }
}
