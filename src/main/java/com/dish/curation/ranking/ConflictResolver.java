package com.dish.curation.ranking;

/**
 * Decides whether the current holder of a rank slot may be displaced.
 * Typically backed by a confirmation dialog.
 */
@FunctionalInterface
public interface ConflictResolver {

    /**
     * @param change the pending change; {@link RankChange#getConflictingItem()} names the holder
     * @return true to clear the holder and assign the slot, false to leave everything unchanged
     */
    boolean approveDisplacement(RankChange change);

    ConflictResolver APPROVE = change -> true;

    ConflictResolver DECLINE = change -> false;
}
