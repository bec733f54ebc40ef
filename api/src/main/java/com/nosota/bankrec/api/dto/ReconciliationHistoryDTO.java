package com.nosota.bankrec.api.dto;

import com.nosota.bankrec.api.model.ReconciliationStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * DTO for reconciliation history entries.
 *
 * <p>Simplified version of {@link com.nosota.bankrec.api.response.ReconciliationResponse}
 * used for listing finalized reconciliations of a bank account.
 *
 * @param id                     Reconciliation UUID
 * @param bankAccountId          Bank account ID
 * @param statementDate          Statement date that was reconciled
 * @param statementEndingBalance Agreed statement ending balance
 * @param calculatedBookBalance  Adjusted book balance at finalization
 * @param difference             Residual difference at finalization (within tolerance)
 * @param status                 Always FINALIZED for history entries
 * @param finalizedAt            Timestamp of finalization
 */
public record ReconciliationHistoryDTO(
        UUID id,
        Integer bankAccountId,
        LocalDate statementDate,
        BigDecimal statementEndingBalance,
        BigDecimal calculatedBookBalance,
        BigDecimal difference,
        ReconciliationStatus status,
        LocalDateTime finalizedAt
) {
}
