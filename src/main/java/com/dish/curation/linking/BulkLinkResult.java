package com.dish.curation.linking;

import com.dish.curation.core.model.LinkPair;

import java.util.List;

/**
 * Result of a bulk link operation. Per-pair failures are reported here, never thrown.
 *
 * @param succeeded pairs that are linked after the call
 * @param failed    pairs whose link attempt failed
 */
public record BulkLinkResult(List<LinkPair> succeeded, List<LinkFailure> failed) {

    public BulkLinkResult {
        succeeded = succeeded != null ? List.copyOf(succeeded) : List.of();
        failed = failed != null ? List.copyOf(failed) : List.of();
    }

    public int successCount() {
        return succeeded.size();
    }

    public int failureCount() {
        return failed.size();
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    public List<LinkPair> failedPairs() {
        return failed.stream().map(LinkFailure::pair).toList();
    }

    /**
     * A pair whose link attempt failed.
     *
     * @param pair    the dish-restaurant pair
     * @param status  gateway status, 0 when the store was unreachable
     * @param message the gateway message
     */
    public record LinkFailure(LinkPair pair, int status, String message) {}

    @Override
    public String toString() {
        return "BulkLinkResult{succeeded=" + succeeded.size() +
                ", failed=" + failedPairs() + '}';
    }
}
