package com.dish.curation.ranking;

import com.dish.curation.core.model.CuratedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rank change applied optimistically to an {@link ItemSnapshot}.
 *
 * <p>The snapshot shows the new ranks (tagged pending) while the gateway writes run.
 * On success the entries are replaced by the stored items; on failure the previous
 * entries are put back and the exception is rethrown.</p>
 *
 * <pre>
 * RankOutcome outcome = new RankCommand(engine, snapshot, dish, 1).execute(ConflictResolver.APPROVE);
 * </pre>
 */
public class RankCommand {
    private static final Logger log = LoggerFactory.getLogger(RankCommand.class);

    private final RankAssignmentEngine engine;
    private final ItemSnapshot snapshot;
    private final CuratedItem item;
    private final Integer desiredRank;
    private final List<CuratedItem> previous = new ArrayList<>();

    public RankCommand(RankAssignmentEngine engine, ItemSnapshot snapshot, CuratedItem item, Integer desiredRank) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot is required");
        this.item = item;
        this.desiredRank = desiredRank;
    }

    public RankOutcome execute(ConflictResolver resolver) {
        RankChange change = engine.plan(item, desiredRank, snapshot.items());
        if (change.hasConflict() && !resolver.approveDisplacement(change)) {
            return engine.decline(change);
        }

        apply(change);
        try {
            RankOutcome outcome = engine.confirm(change);
            reconcile(outcome);
            return outcome;
        } catch (RuntimeException e) {
            undo();
            throw e;
        }
    }

    private void apply(RankChange change) {
        for (CuratedItem holder : change.getConflictingItems()) {
            speculate(holder, null);
        }
        speculate(change.getItem(), change.getEffectiveRank());
    }

    private void speculate(CuratedItem target, Integer rank) {
        CuratedItem current = snapshot.find(target).orElse(target);
        previous.add(current);
        if (snapshot.replace(current.withRank(rank))) {
            snapshot.markPending(current);
        }
    }

    private void reconcile(RankOutcome outcome) {
        for (CuratedItem stored : outcome.displaced()) {
            snapshot.replace(stored);
            snapshot.settle(stored);
        }
        snapshot.replace(outcome.item());
        snapshot.settle(outcome.item());
        previous.clear();
    }

    /**
     * Restores the entries changed by the speculative apply.
     */
    void undo() {
        log.warn("rank.undo itemId={} kind={} restored={}", item.getId(), item.getKind(), previous.size());
        for (CuratedItem original : previous) {
            snapshot.replace(original);
            snapshot.settle(original);
        }
        previous.clear();
    }
}
