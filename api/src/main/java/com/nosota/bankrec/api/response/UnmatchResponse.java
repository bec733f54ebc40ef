package com.nosota.bankrec.api.response;

import java.util.List;

/**
 * Result of a successful unmatch.
 *
 * @param unmatchedIds IDs returned to the unreconciled pool
 * @param skippedIds   IDs that were already unreconciled
 * @param summaries    Recalculated summary of every draft the transactions were released from
 */
public record UnmatchResponse(
        List<Long> unmatchedIds,
        List<Long> skippedIds,
        List<ReconciliationSummaryResponse> summaries
) {
}
