package com.nosota.bankrec.api.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.List;

/**
 * Selection group to match under a draft reconciliation.
 *
 * <p>The signed sum of the statement-side transactions must equal the signed sum of
 * the system-side transactions within the configured tolerance. One-to-one,
 * one-to-many and many-to-one selections are all expressed the same way.
 *
 * @param statementTransactionIds IDs of statement-sourced transactions
 * @param systemTransactionIds    IDs of system-sourced transactions
 * @param statementDate           Statement date stamped as reconciled date; defaults to the draft's date
 * @param actorId                 ID of the user performing the match
 */
public record MatchRequest(
        @NotEmpty(message = "At least one statement transaction is required")
        List<@NotNull Long> statementTransactionIds,

        @NotEmpty(message = "At least one system transaction is required")
        List<@NotNull Long> systemTransactionIds,

        LocalDate statementDate,

        @NotNull(message = "Actor ID is required")
        Long actorId
) {
}
