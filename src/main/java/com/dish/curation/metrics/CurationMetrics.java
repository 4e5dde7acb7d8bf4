package com.dish.curation.metrics;

import com.dish.curation.core.model.ItemKind;
import com.dish.curation.query.SortKey;
import com.dish.curation.ranking.RankOutcome;

import java.time.Duration;

/**
 * Interface for recording curation metrics.
 * The default {@link NoOpCurationMetrics} does nothing, so the library works
 * without a metrics registry.
 */
public interface CurationMetrics {

    void recordRankOutcome(ItemKind kind, RankOutcome.Status status);

    void incrementLinkCreated();

    void incrementLinkRemoved();

    void incrementLinkFailed();

    void recordBulkLinkSize(int pairs);

    void recordPipelineDuration(SortKey sortKey, Duration duration);

    void incrementStaleResponseDropped();

    void recordCacheHit();

    void recordCacheMiss();
}
