package com.nosota.bankrec.dto;

import java.util.UUID;

/**
 * Outcome of booking a statement-only item into the books.
 *
 * @param journalEntryId      Posted journal entry
 * @param systemTransactionId System-sourced transaction recorded from the entry
 * @param matched             true if the statement item was matched in the same call
 */
public record BookingResult(
        UUID journalEntryId,
        Long systemTransactionId,
        boolean matched
) {
}
