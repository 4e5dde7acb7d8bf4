package com.dish.curation.ranking;

import com.dish.curation.concurrency.InFlightRegistry;
import com.dish.curation.core.ValidationException;
import com.dish.curation.core.model.CuratedItem;
import com.dish.curation.core.model.RankScope;
import com.dish.curation.event.InvalidationChannel;
import com.dish.curation.event.InvalidationEvent;
import com.dish.curation.gateway.ItemPatch;
import com.dish.curation.gateway.RemoteDataGateway;
import com.dish.curation.gateway.RemoteGatewayException;
import com.dish.curation.logging.LogContext;
import com.dish.curation.metrics.CurationMetrics;
import com.dish.curation.metrics.NoOpCurationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Assigns rank slots so that each slot of a scope has at most one holder.
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>The requested rank is validated: a slot number or null, anything else is an
 *       {@link InvalidRankException} raised before any gateway call.</li>
 *   <li>Re-selecting the slot the item already holds clears it.</li>
 *   <li>If another item of the same scope holds the slot the outcome is
 *       {@link RankOutcome.Status#CONFLICT_REQUIRES_CONFIRMATION} and nothing is
 *       written until {@link #confirm(RankChange)} or {@link #decline(RankChange)}.</li>
 *   <li>Writes are two sequential gateway updates: the holder is cleared first, then
 *       the item is assigned. They are not transactional; if the second fails the slot
 *       stays empty and the same call can simply be repeated.</li>
 * </ol>
 *
 * <p>The engine never fetches: callers pass the items of the scope, and entries from
 * other scopes are ignored.</p>
 */
public class RankAssignmentEngine {
    private static final Logger log = LoggerFactory.getLogger(RankAssignmentEngine.class);

    private final RemoteDataGateway gateway;
    private final InvalidationChannel channel;
    private final InFlightRegistry inFlight;
    private final CurationMetrics metrics;

    public RankAssignmentEngine(RemoteDataGateway gateway) {
        this(gateway, new InvalidationChannel(), new InFlightRegistry(), new NoOpCurationMetrics());
    }

    public RankAssignmentEngine(RemoteDataGateway gateway, InvalidationChannel channel,
                                InFlightRegistry inFlight, CurationMetrics metrics) {
        this.gateway = Objects.requireNonNull(gateway, "gateway is required");
        this.channel = Objects.requireNonNull(channel, "channel is required");
        this.inFlight = Objects.requireNonNull(inFlight, "inFlight is required");
        this.metrics = metrics != null ? metrics : new NoOpCurationMetrics();
    }

    /**
     * Validates and plans a rank change without writing anything.
     *
     * @param item        the item being changed
     * @param desiredRank a slot number or null to clear
     * @param scopeItems  items sharing the item's scope; others are ignored
     * @throws InvalidRankException if the rank is not a slot number or null
     */
    public RankChange plan(CuratedItem item, Integer desiredRank, List<CuratedItem> scopeItems) {
        if (item == null) {
            throw new ValidationException("item is required");
        }
        validateRank(desiredRank);

        Integer effective = Objects.equals(item.getRank(), desiredRank) ? null : desiredRank;

        List<CuratedItem> holders = new ArrayList<>();
        if (effective != null && scopeItems != null) {
            RankScope scope = item.scope();
            for (CuratedItem other : scopeItems) {
                if (other != null && !other.sameRecordAs(item) && scope.contains(other)
                        && effective.equals(other.getRank())) {
                    holders.add(other);
                }
            }
            if (holders.size() > 1) {
                log.warn("rank.duplicate-holders scope={} rank={} holders={}",
                        scope, effective, holders.stream().map(CuratedItem::getId).toList());
            }
        }
        return new RankChange(item, desiredRank, effective, holders);
    }

    /**
     * Requests a rank change. Writes immediately when the slot is free; otherwise
     * returns a {@link RankOutcome.Status#CONFLICT_REQUIRES_CONFIRMATION} outcome.
     */
    public RankOutcome setRank(CuratedItem item, Integer desiredRank, List<CuratedItem> scopeItems) {
        RankChange change = plan(item, desiredRank, scopeItems);
        if (change.hasConflict()) {
            log.info("rank.conflict itemId={} kind={} rank={} holderId={}",
                    item.getId(), item.getKind(), change.getEffectiveRank(),
                    change.getConflictingItem().getId());
            return record(RankOutcome.conflict(change));
        }
        return commit(change);
    }

    /**
     * Requests a rank change and lets the resolver decide on a conflict right away.
     */
    public RankOutcome setRank(CuratedItem item, Integer desiredRank, List<CuratedItem> scopeItems,
                               ConflictResolver resolver) {
        RankChange change = plan(item, desiredRank, scopeItems);
        if (change.hasConflict()) {
            return resolver.approveDisplacement(change) ? confirm(change) : decline(change);
        }
        return commit(change);
    }

    /**
     * Approves a pending change: clears the current holder(s), then assigns the item.
     */
    public RankOutcome confirm(RankChange change) {
        return commit(change);
    }

    /**
     * Declines a pending change. Nothing is written.
     */
    public RankOutcome decline(RankChange change) {
        log.info("rank.declined itemId={} kind={} rank={}",
                change.getItem().getId(), change.getItem().getKind(), change.getEffectiveRank());
        return record(RankOutcome.declined(change));
    }

    /**
     * Returns the ranked items of the scope ordered by slot.
     */
    public List<CuratedItem> rankedInScope(RankScope scope, List<CuratedItem> items) {
        return items.stream()
                .filter(scope::contains)
                .filter(CuratedItem::isRanked)
                .sorted(Comparator.comparing(CuratedItem::getRank).thenComparing(CuratedItem::getName))
                .toList();
    }

    /**
     * Key under which a rank change of the item is tracked while in flight.
     */
    public static String operationKey(CuratedItem item) {
        return "rank:" + item.getKind() + ":" + item.getId();
    }

    public boolean isInFlight(CuratedItem item) {
        return inFlight.isInFlight(operationKey(item));
    }

    private RankOutcome commit(RankChange change) {
        CuratedItem item = change.getItem();
        return inFlight.run(operationKey(item), () -> {
            try (LogContext ignored = LogContext.forRankChange(
                    LogContext.generateCorrelationId(), item.getKind().name(), item.getId())) {
                return record(write(change));
            }
        });
    }

    private RankOutcome write(RankChange change) {
        CuratedItem item = change.getItem();
        Set<Long> touched = new LinkedHashSet<>();
        List<CuratedItem> displaced = new ArrayList<>();
        try {
            for (CuratedItem holder : change.getConflictingItems()) {
                displaced.add(gateway.updateItem(holder, ItemPatch.clearRank()));
                touched.add(holder.getId());
                log.info("rank.displaced itemId={} kind={} previousRank={}",
                        holder.getId(), holder.getKind(), holder.getRank());
            }

            CuratedItem updated;
            try {
                updated = gateway.updateItem(item, ItemPatch.rank(change.getEffectiveRank()));
            } catch (RemoteGatewayException e) {
                if (!displaced.isEmpty()) {
                    log.warn("rank.partial itemId={} kind={} rank={} status={}: slot cleared but not reassigned, retry the same change",
                            item.getId(), item.getKind(), change.getEffectiveRank(), e.getStatus());
                }
                throw e;
            }
            touched.add(item.getId());

            if (change.getEffectiveRank() != null) {
                log.info("rank.assigned itemId={} kind={} rank={} scope={}",
                        item.getId(), item.getKind(), change.getEffectiveRank(), change.getScope());
            } else {
                log.info("rank.cleared itemId={} kind={} toggle={} scope={}",
                        item.getId(), item.getKind(), change.isToggleClear(), change.getScope());
            }
            return RankOutcome.written(updated, displaced, change);
        } finally {
            if (!touched.isEmpty()) {
                channel.publish(InvalidationEvent.items(change.getScope(), touched));
            }
        }
    }

    private RankOutcome record(RankOutcome outcome) {
        metrics.recordRankOutcome(outcome.item().getKind(), outcome.status());
        return outcome;
    }

    private void validateRank(Integer rank) {
        if (rank != null && (rank < 1 || rank > RankScope.SLOT_COUNT)) {
            throw new InvalidRankException(rank, RankScope.SLOT_COUNT);
        }
    }
}
