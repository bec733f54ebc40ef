package com.nosota.bankrec.api.request;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Request for finalizing a draft reconciliation.
 *
 * <p>The statement ending balance must be confirmed explicitly in this call.
 * Book balance and difference are the figures the caller displayed; the service
 * recalculates both before finalizing.
 *
 * @param statementEndingBalance Confirmed statement ending balance
 * @param bookBalance            Adjusted book balance as displayed to the caller
 * @param difference             Difference as displayed to the caller
 * @param actorId                ID of the user finalizing
 * @param notes                  Optional free-text notes stored with the reconciliation
 */
public record FinalizeRequest(
        @NotNull(message = "Statement ending balance must be confirmed")
        @Digits(integer = 13, fraction = 2)
        BigDecimal statementEndingBalance,

        BigDecimal bookBalance,

        @NotNull(message = "Difference is required")
        BigDecimal difference,

        @NotNull(message = "Actor ID is required")
        Long actorId,

        @Size(max = 2000)
        String notes
) {
}
