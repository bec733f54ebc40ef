package com.nosota.bankrec.api.request;

import jakarta.validation.constraints.NotNull;

/**
 * Request for booking a statement-only item (bank fee, interest) into the books.
 *
 * @param contraGlAccountId GL account for the contra line (e.g. bank charges expense, interest income)
 * @param actorId           ID of the user booking the item
 * @param matchImmediately  If true, the created system transaction is matched with the statement item
 */
public record BookStatementItemRequest(
        @NotNull(message = "Contra GL account ID is required")
        Integer contraGlAccountId,

        @NotNull(message = "Actor ID is required")
        Long actorId,

        boolean matchImmediately
) {
}
