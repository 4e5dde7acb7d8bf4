package com.dish.curation.ranking;

import com.dish.curation.core.ValidationException;

/**
 * Thrown when a requested rank is not one of the rank slots or null.
 */
public class InvalidRankException extends ValidationException {

    private final Integer requestedRank;

    public InvalidRankException(Integer requestedRank, int maxRank) {
        super("Rank must be between 1 and " + maxRank + " or null, got " + requestedRank);
        this.requestedRank = requestedRank;
    }

    public Integer getRequestedRank() {
        return requestedRank;
    }
}
