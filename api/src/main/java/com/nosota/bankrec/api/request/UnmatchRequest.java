package com.nosota.bankrec.api.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request for releasing provisional matches.
 *
 * @param transactionIds IDs of transactions to return to the unreconciled pool
 * @param actorId        ID of the user performing the operation
 */
public record UnmatchRequest(
        @NotEmpty(message = "At least one transaction is required")
        List<@NotNull Long> transactionIds,

        @NotNull(message = "Actor ID is required")
        Long actorId
) {
}
