package com.nosota.bankrec.dto;

import java.util.List;
import java.util.UUID;

/**
 * @param unmatchedIds              Transactions returned to the unreconciled pool
 * @param skippedIds                Transactions that were already unreconciled
 * @param affectedReconciliationIds Drafts the transactions were released from
 */
public record UnmatchResult(
        List<Long> unmatchedIds,
        List<Long> skippedIds,
        List<UUID> affectedReconciliationIds
) {
}
