package com.nosota.bankrec.api.request;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request for opening (or resuming) a draft reconciliation.
 *
 * <p>If a draft already exists for the bank account and statement date, it is
 * reused and its statement ending balance is replaced with the supplied value.
 *
 * @param bankAccountId          Bank account to reconcile
 * @param statementDate          End date of the bank statement
 * @param statementEndingBalance Closing balance printed on the statement
 * @param actorId                ID of the user performing the operation
 */
public record DraftRequest(
        @NotNull(message = "Bank account ID is required")
        Integer bankAccountId,

        @NotNull(message = "Statement date is required")
        LocalDate statementDate,

        @NotNull(message = "Statement ending balance is required")
        @Digits(integer = 13, fraction = 2, message = "Statement ending balance must have at most 2 decimal places")
        BigDecimal statementEndingBalance,

        @NotNull(message = "Actor ID is required")
        Long actorId
) {
}
