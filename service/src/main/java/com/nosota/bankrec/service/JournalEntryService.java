package com.nosota.bankrec.service;

import com.nosota.bankrec.dto.JournalLine;
import com.nosota.bankrec.error.InvalidRequestException;
import com.nosota.bankrec.error.JournalEntryNotBalancedException;
import com.nosota.bankrec.model.JournalEntry;
import com.nosota.bankrec.model.JournalEntryLine;
import com.nosota.bankrec.repository.JournalEntryLineRepository;
import com.nosota.bankrec.repository.JournalEntryRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Minimal general ledger: posts balanced journal entries.
 *
 * <p>Double-entry rule: the debits of an entry must equal its credits. An entry that
 * does not zero out is rejected as a whole.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class JournalEntryService implements JournalEntryFactory {

    private final JournalEntryRepository journalEntryRepository;
    private final JournalEntryLineRepository journalEntryLineRepository;

    @Override
    @Transactional(rollbackOn = Exception.class)
    public UUID createAndPost(@NotNull List<JournalLine> lines,
                              @NotNull LocalDate entryDate,
                              @NotBlank String description,
                              @NotNull Long actorId)
            throws InvalidRequestException, JournalEntryNotBalancedException {
        if (lines.size() < 2) {
            throw new InvalidRequestException("Journal entry requires at least two lines, got " + lines.size());
        }

        BigDecimal totalDebits = BigDecimal.ZERO;
        BigDecimal totalCredits = BigDecimal.ZERO;
        for (JournalLine line : lines) {
            validateLine(line);
            totalDebits = totalDebits.add(line.debitAmount());
            totalCredits = totalCredits.add(line.creditAmount());
        }
        if (totalDebits.compareTo(totalCredits) != 0) {
            log.warn("Rejected journal entry '{}': debits {} != credits {}", description, totalDebits, totalCredits);
            throw new JournalEntryNotBalancedException(totalDebits, totalCredits);
        }

        JournalEntry entry = new JournalEntry();
        entry.setEntryDate(entryDate);
        entry.setDescription(description);
        entry.setCreatedBy(actorId);
        entry.setCreatedAt(LocalDateTime.now());
        JournalEntry saved = journalEntryRepository.save(entry);

        for (JournalLine line : lines) {
            JournalEntryLine entryLine = new JournalEntryLine();
            entryLine.setJournalEntryId(saved.getId());
            entryLine.setGlAccountId(line.glAccountId());
            entryLine.setDebitAmount(line.debitAmount());
            entryLine.setCreditAmount(line.creditAmount());
            entryLine.setDescription(line.description());
            entryLine.setCurrencyCode(line.currencyCode());
            journalEntryLineRepository.save(entryLine);
        }

        log.info("Posted journal entry {} dated {} with {} lines, total {}",
                saved.getId(), entryDate, lines.size(), totalDebits);
        return saved.getId();
    }

    private void validateLine(JournalLine line) throws InvalidRequestException {
        if (line.glAccountId() == null || line.debitAmount() == null || line.creditAmount() == null) {
            throw new InvalidRequestException("Journal line requires GL account, debit and credit amounts");
        }
        boolean debit = line.debitAmount().signum() > 0;
        boolean credit = line.creditAmount().signum() > 0;
        if (debit == credit || line.debitAmount().signum() < 0 || line.creditAmount().signum() < 0) {
            throw new InvalidRequestException(String.format(
                    "Journal line for GL account %d must carry exactly one positive amount (debit %s, credit %s)",
                    line.glAccountId(), line.debitAmount(), line.creditAmount()));
        }
    }
}
