package com.nosota.bankrec.api.response;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Result of a successful match.
 *
 * @param reconciliationId Draft the transactions were matched under
 * @param matchedCount     Number of transactions claimed
 * @param statementSum     Signed sum of the statement side
 * @param systemSum        Signed sum of the system side
 * @param summary          Summary recalculated after the match
 */
public record MatchResponse(
        UUID reconciliationId,
        int matchedCount,
        BigDecimal statementSum,
        BigDecimal systemSum,
        ReconciliationSummaryResponse summary
) {
}
