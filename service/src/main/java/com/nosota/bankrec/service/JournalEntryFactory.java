package com.nosota.bankrec.service;

import com.nosota.bankrec.dto.JournalLine;
import com.nosota.bankrec.error.InvalidRequestException;
import com.nosota.bankrec.error.JournalEntryNotBalancedException;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Creates and posts journal entries to the general ledger.
 */
public interface JournalEntryFactory {

    /**
     * Creates a journal entry and posts it immediately.
     *
     * @param lines       At least two lines; total debits must equal total credits
     * @param entryDate   Entry date
     * @param description Entry description
     * @param actorId     ID of the user posting the entry
     * @return ID of the posted entry
     * @throws InvalidRequestException          if there are fewer than two lines or a line is malformed
     * @throws JournalEntryNotBalancedException if debits and credits differ
     */
    UUID createAndPost(List<JournalLine> lines, LocalDate entryDate, String description, Long actorId)
            throws InvalidRequestException, JournalEntryNotBalancedException;
}
