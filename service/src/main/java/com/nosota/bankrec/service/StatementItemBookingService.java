package com.nosota.bankrec.service;

import com.nosota.bankrec.dto.BookingResult;
import com.nosota.bankrec.dto.JournalLine;
import com.nosota.bankrec.error.ImmutableRecordException;
import com.nosota.bankrec.error.InvalidRequestException;
import com.nosota.bankrec.error.ReconciliationException;
import com.nosota.bankrec.model.BankAccount;
import com.nosota.bankrec.model.BankTransaction;
import com.nosota.bankrec.model.Reconciliation;
import com.nosota.bankrec.repository.BankTransactionRepository;
import com.nosota.bankrec.repository.ReconciliationRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Books statement-only items (bank fees, interest) into the general ledger.
 *
 * <p>Booking workflow:
 * <pre>
 * 1. Lock the draft and the statement item
 * 2. Post a two-line journal entry:
 *      inflow:  Dr bank GL / Cr contra GL
 *      outflow: Dr contra GL / Cr bank GL
 * 3. Record a system-sourced transaction linked to the entry
 * 4. Optionally match the statement item against it
 * </pre>
 *
 * <p>All steps run in one transaction.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class StatementItemBookingService {

    static final String DESCRIPTION_PREFIX = "Bank Rec: ";

    private final ReconciliationRepository reconciliationRepository;
    private final BankTransactionRepository bankTransactionRepository;
    private final BankAccountDirectory bankAccountDirectory;
    private final JournalEntryFactory journalEntryFactory;
    private final BankTransactionService bankTransactionService;
    private final MatchingService matchingService;

    /**
     * Books a statement item that has no counterpart in the books.
     *
     * @param reconciliationId       Draft reconciliation ID
     * @param statementTransactionId Statement-sourced transaction ID
     * @param contraGlAccountId      GL account for the contra line
     * @param actorId                ID of the user
     * @param matchImmediately       Match the statement item with the new system transaction
     * @return Journal entry ID, system transaction ID and match flag
     * @throws ImmutableRecordException if the reconciliation is not a DRAFT
     * @throws InvalidRequestException  if the item cannot be booked under this draft
     * @throws ReconciliationException  if posting or matching fails
     */
    @Transactional(rollbackOn = Exception.class)
    public BookingResult bookStatementItem(@NotNull UUID reconciliationId,
                                           @NotNull Long statementTransactionId,
                                           @NotNull Integer contraGlAccountId,
                                           @NotNull Long actorId,
                                           boolean matchImmediately) throws ReconciliationException {
        Reconciliation draft = reconciliationRepository.findByIdForUpdate(reconciliationId)
                .orElseThrow(() -> new EntityNotFoundException(
                        String.format("Reconciliation with ID %s not found", reconciliationId)));
        if (!draft.isDraft()) {
            throw new ImmutableRecordException(statementTransactionId, reconciliationId);
        }

        BankTransaction item = bankTransactionRepository.findAllByIdForUpdate(List.of(statementTransactionId))
                .stream()
                .findFirst()
                .orElseThrow(() -> new InvalidRequestException("Unknown transaction", List.of(statementTransactionId)));
        validateItem(draft, item);

        BankAccount account = bankAccountDirectory.getById(draft.getBankAccountId());
        if (account.getGlAccountId().equals(contraGlAccountId)) {
            throw new InvalidRequestException(String.format(
                    "Contra GL account %d is the bank's own GL account", contraGlAccountId));
        }

        String description = DESCRIPTION_PREFIX + item.getDescription();
        UUID journalEntryId = journalEntryFactory.createAndPost(
                buildLines(account, contraGlAccountId, item.getAmount(), description),
                item.getTransactionDate(), description, actorId);

        BankTransaction systemItem = bankTransactionService.recordFromJournalEntry(item, journalEntryId, actorId);

        if (matchImmediately) {
            matchingService.match(reconciliationId, List.of(item.getId()), List.of(systemItem.getId()),
                    draft.getStatementDate(), actorId);
        }

        log.info("Booked statement item {} ({}) under reconciliation {} as journal entry {}, system transaction {}, matched={}",
                item.getId(), item.getAmount(), reconciliationId, journalEntryId, systemItem.getId(), matchImmediately);
        return new BookingResult(journalEntryId, systemItem.getId(), matchImmediately);
    }

    /**
     * Bank line on the side of the cash movement, contra line on the opposite side.
     */
    static List<JournalLine> buildLines(BankAccount account, Integer contraGlAccountId,
                                        BigDecimal amount, String description) {
        BigDecimal absolute = amount.abs();
        String currency = account.getCurrencyCode();
        if (amount.signum() > 0) {
            return List.of(
                    JournalLine.debit(account.getGlAccountId(), absolute, description, currency),
                    JournalLine.credit(contraGlAccountId, absolute, description, currency));
        }
        return List.of(
                JournalLine.credit(account.getGlAccountId(), absolute, description, currency),
                JournalLine.debit(contraGlAccountId, absolute, description, currency));
    }

    private void validateItem(Reconciliation draft, BankTransaction item) throws InvalidRequestException {
        List<Long> ids = List.of(item.getId());
        if (!item.isFromStatement()) {
            throw new InvalidRequestException("Only statement-sourced transactions can be booked", ids);
        }
        if (item.isReconciled()) {
            throw new InvalidRequestException("Transaction is already reconciled", ids);
        }
        if (!draft.getBankAccountId().equals(item.getBankAccountId())) {
            throw new InvalidRequestException(String.format(
                    "Transaction does not belong to bank account %d", draft.getBankAccountId()), ids);
        }
        if (item.getTransactionDate().isAfter(draft.getStatementDate())) {
            throw new InvalidRequestException(String.format(
                    "Transaction is dated after statement date %s", draft.getStatementDate()), ids);
        }
    }
}
