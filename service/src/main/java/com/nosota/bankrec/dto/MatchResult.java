package com.nosota.bankrec.dto;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * @param reconciliationId Draft the transactions were matched under
 * @param matchedCount     Number of transactions claimed
 * @param statementSum     Signed sum of the statement side
 * @param systemSum        Signed sum of the system side
 */
public record MatchResult(
        UUID reconciliationId,
        int matchedCount,
        BigDecimal statementSum,
        BigDecimal systemSum
) {
}
