package com.nosota.bankrec.api.response;

import java.util.UUID;

/**
 * Result of booking a statement-only item.
 *
 * @param journalEntryId      Journal entry created for the item
 * @param systemTransactionId System-sourced bank transaction created from the journal entry
 * @param matched             true if the statement item was matched with the new transaction
 */
public record BookedStatementItemResponse(
        UUID journalEntryId,
        Long systemTransactionId,
        boolean matched
) {
}
