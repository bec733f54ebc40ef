package com.nosota.bankrec.api.response;

import com.nosota.bankrec.api.model.ReconciliationStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Response DTO for a reconciliation record.
 *
 * @param id                     Reconciliation UUID
 * @param bankAccountId          Bank account ID
 * @param statementDate          Statement date being reconciled
 * @param statementEndingBalance Statement ending balance
 * @param calculatedBookBalance  Adjusted book balance (null until finalized)
 * @param difference             Residual difference (null until finalized)
 * @param status                 DRAFT or FINALIZED
 * @param notes                  Notes stored at finalization
 * @param createdBy              ID of the user who opened the draft
 * @param createdAt              Timestamp when the draft was opened
 * @param finalizedAt            Timestamp of finalization (null while DRAFT)
 */
public record ReconciliationResponse(
        UUID id,
        Integer bankAccountId,
        LocalDate statementDate,
        BigDecimal statementEndingBalance,
        BigDecimal calculatedBookBalance,
        BigDecimal difference,
        ReconciliationStatus status,
        String notes,
        Long createdBy,
        LocalDateTime createdAt,
        LocalDateTime finalizedAt
) {
}
