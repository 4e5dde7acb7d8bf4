package com.dish.curation.ranking;

import com.dish.curation.core.model.CuratedItem;
import com.dish.curation.core.model.RankScope;

import java.util.List;
import java.util.Objects;

/**
 * A validated, not yet written rank change.
 *
 * <p>Produced by {@link RankAssignmentEngine#plan}. When {@link #hasConflict()} is true
 * the change waits for {@link RankAssignmentEngine#confirm(RankChange)} or
 * {@link RankAssignmentEngine#decline(RankChange)}.</p>
 */
public final class RankChange {

    private final CuratedItem item;
    private final Integer requestedRank;
    private final Integer effectiveRank;
    private final List<CuratedItem> conflicting;

    RankChange(CuratedItem item, Integer requestedRank, Integer effectiveRank, List<CuratedItem> conflicting) {
        this.item = Objects.requireNonNull(item, "item is required");
        this.requestedRank = requestedRank;
        this.effectiveRank = effectiveRank;
        this.conflicting = List.copyOf(conflicting);
    }

    public CuratedItem getItem() {
        return item;
    }

    /**
     * The rank the caller asked for.
     */
    public Integer getRequestedRank() {
        return requestedRank;
    }

    /**
     * The rank that will be written; null when the change clears the slot.
     */
    public Integer getEffectiveRank() {
        return effectiveRank;
    }

    /**
     * True when the requested rank was already held by the item, so the change clears it.
     */
    public boolean isToggleClear() {
        return requestedRank != null && effectiveRank == null;
    }

    public boolean hasConflict() {
        return !conflicting.isEmpty();
    }

    /**
     * The item currently holding the requested slot, or null.
     */
    public CuratedItem getConflictingItem() {
        return conflicting.isEmpty() ? null : conflicting.get(0);
    }

    /**
     * Every scope item currently holding the slot. More than one only when the store
     * already violates slot uniqueness; all of them are cleared on confirmation.
     */
    public List<CuratedItem> getConflictingItems() {
        return conflicting;
    }

    public RankScope getScope() {
        return item.scope();
    }

    @Override
    public String toString() {
        return "RankChange{itemId=" + item.getId() +
                ", kind=" + item.getKind() +
                ", requested=" + requestedRank +
                ", effective=" + effectiveRank +
                ", conflicting=" + conflicting.stream().map(CuratedItem::getId).toList() + '}';
    }
}
