package com.nosota.bankrec.api.response;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Bank reconciliation summary figures derived from the current unreconciled pools.
 *
 * <pre>
 * adjustedBookBalance = glBalance + interestNotInBook - chargesNotInBook
 * adjustedBankBalance = statementEndingBalance + depositsInTransit - outstandingWithdrawals
 * difference          = adjustedBankBalance - adjustedBookBalance
 * </pre>
 *
 * @param reconciliationId       Draft the summary was computed for
 * @param statementDate          Statement date
 * @param glBalance              GL balance of the linked account as of the statement date
 * @param statementEndingBalance Statement ending balance
 * @param interestNotInBook      Unreconciled statement credits
 * @param chargesNotInBook       Unreconciled statement debits (absolute)
 * @param depositsInTransit      Unreconciled system deposits
 * @param outstandingWithdrawals Unreconciled system withdrawals (absolute)
 * @param adjustedBookBalance    Book side after adjustments
 * @param adjustedBankBalance    Bank side after adjustments
 * @param difference             Residual difference, must be within tolerance to finalize
 * @param tolerance              Tolerance used
 * @param balanced               true if |difference| is below tolerance
 * @param unreconciledStatementItems Number of unreconciled statement items
 * @param unreconciledSystemItems    Number of unreconciled system items
 */
public record ReconciliationSummaryResponse(
        UUID reconciliationId,
        LocalDate statementDate,
        BigDecimal glBalance,
        BigDecimal statementEndingBalance,
        BigDecimal interestNotInBook,
        BigDecimal chargesNotInBook,
        BigDecimal depositsInTransit,
        BigDecimal outstandingWithdrawals,
        BigDecimal adjustedBookBalance,
        BigDecimal adjustedBankBalance,
        BigDecimal difference,
        BigDecimal tolerance,
        boolean balanced,
        int unreconciledStatementItems,
        int unreconciledSystemItems
) {
}
