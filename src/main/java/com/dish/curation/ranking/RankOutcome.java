package com.dish.curation.ranking;

import com.dish.curation.core.model.CuratedItem;

import java.util.List;

/**
 * Result of a rank assignment.
 *
 * @param status    what happened
 * @param item      the item as stored after the change, or unchanged when nothing was written
 * @param displaced items whose rank was cleared to free the slot, as stored after the change
 * @param change    the planned change this outcome belongs to
 */
public record RankOutcome(Status status, CuratedItem item, List<CuratedItem> displaced, RankChange change) {

    public enum Status {
        /** The item now holds the requested slot. */
        ASSIGNED,
        /** The item's rank was cleared. */
        CLEARED,
        /** Another item holds the slot; nothing was written, a decision is required. */
        CONFLICT_REQUIRES_CONFIRMATION,
        /** The displacement was declined; nothing was written. */
        CONFLICT_DECLINED
    }

    public RankOutcome {
        displaced = displaced != null ? List.copyOf(displaced) : List.of();
    }

    static RankOutcome written(CuratedItem updated, List<CuratedItem> displaced, RankChange change) {
        Status status = change.getEffectiveRank() != null ? Status.ASSIGNED : Status.CLEARED;
        return new RankOutcome(status, updated, displaced, change);
    }

    static RankOutcome conflict(RankChange change) {
        return new RankOutcome(Status.CONFLICT_REQUIRES_CONFIRMATION, change.getItem(), List.of(), change);
    }

    static RankOutcome declined(RankChange change) {
        return new RankOutcome(Status.CONFLICT_DECLINED, change.getItem(), List.of(), change);
    }

    public boolean requiresConfirmation() {
        return status == Status.CONFLICT_REQUIRES_CONFIRMATION;
    }

    /**
     * True when gateway writes were made.
     */
    public boolean isWritten() {
        return status == Status.ASSIGNED || status == Status.CLEARED;
    }
}
