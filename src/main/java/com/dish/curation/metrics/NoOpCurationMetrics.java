package com.dish.curation.metrics;

import com.dish.curation.core.model.ItemKind;
import com.dish.curation.query.SortKey;
import com.dish.curation.ranking.RankOutcome;

import java.time.Duration;

/**
 * {@link CurationMetrics} that records nothing.
 */
public class NoOpCurationMetrics implements CurationMetrics {

    @Override
    public void recordRankOutcome(ItemKind kind, RankOutcome.Status status) {
    }

    @Override
    public void incrementLinkCreated() {
    }

    @Override
    public void incrementLinkRemoved() {
    }

    @Override
    public void incrementLinkFailed() {
    }

    @Override
    public void recordBulkLinkSize(int pairs) {
    }

    @Override
    public void recordPipelineDuration(SortKey sortKey, Duration duration) {
    }

    @Override
    public void incrementStaleResponseDropped() {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
