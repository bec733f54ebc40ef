package com.nosota.bankrec.dto;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Internal DTO for reconciliation summary figures.
 *
 * <p>Derived on every request from the GL balance and the current unreconciled pools;
 * never stored. For API responses, use
 * {@link com.nosota.bankrec.api.response.ReconciliationSummaryResponse}.
 *
 * @param reconciliationId           Reconciliation the figures were computed for (null for a bare calculation)
 * @param statementDate              Statement date
 * @param glBalance                  GL balance of the linked account as of the statement date
 * @param statementEndingBalance     Statement ending balance
 * @param interestNotInBook          Unreconciled positive statement items
 * @param chargesNotInBook           Unreconciled negative statement items, absolute
 * @param depositsInTransit          Unreconciled positive system items
 * @param outstandingWithdrawals     Unreconciled negative system items, absolute
 * @param adjustedBookBalance        glBalance + interestNotInBook - chargesNotInBook
 * @param adjustedBankBalance        statementEndingBalance + depositsInTransit - outstandingWithdrawals
 * @param difference                 adjustedBankBalance - adjustedBookBalance
 * @param tolerance                  Tolerance used for {@code balanced}
 * @param balanced                   |difference| &lt; tolerance
 * @param unreconciledStatementItems Number of unreconciled statement items
 * @param unreconciledSystemItems    Number of unreconciled system items
 */
@Builder(toBuilder = true)
public record ReconciliationSummary(
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
