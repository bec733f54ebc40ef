package com.nosota.bankrec.service;

import com.nosota.bankrec.api.model.TransactionType;
import com.nosota.bankrec.api.request.RecordBankTransactionRequest;
import com.nosota.bankrec.error.InvalidRequestException;
import com.nosota.bankrec.model.BankAccount;
import com.nosota.bankrec.model.BankTransaction;
import com.nosota.bankrec.repository.BankTransactionRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Records bank transactions.
 *
 * <p>This is the only place where the amount's sign is checked against the transaction
 * type. Everything downstream (matching, summary) trusts the stored sign.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class BankTransactionService {

    private final BankTransactionRepository bankTransactionRepository;
    private final BankAccountDirectory bankAccountDirectory;

    /**
     * Records a statement-sourced or system-sourced transaction.
     *
     * @param bankAccountId Bank account ID
     * @param request       Transaction details
     * @return Persisted, unreconciled transaction
     * @throws InvalidRequestException if the account is inactive or the amount's sign
     *                                 does not agree with the type
     * @throws jakarta.persistence.EntityNotFoundException if the account does not exist
     */
    @Transactional(rollbackOn = Exception.class)
    public BankTransaction recordTransaction(@NotNull Integer bankAccountId,
                                             @NotNull @Valid RecordBankTransactionRequest request)
            throws InvalidRequestException {
        return record(bankAccountId, request.transactionDate(), request.valueDate(), request.amount(),
                request.description(), request.reference(), request.transactionType(),
                request.fromStatement(), null, request.actorId());
    }

    /**
     * Records the system-sourced counterpart of a statement item booked through a journal entry.
     * Amount, type and dates are copied from the statement item.
     *
     * @param statementItem  Statement-sourced transaction that was booked
     * @param journalEntryId Journal entry posted for it
     * @param actorId        ID of the user booking the item
     * @return Persisted, unreconciled system-sourced transaction
     * @throws InvalidRequestException if the account is inactive
     */
    @Transactional(rollbackOn = Exception.class)
    public BankTransaction recordFromJournalEntry(@NotNull BankTransaction statementItem,
                                                  @NotNull UUID journalEntryId,
                                                  @NotNull Long actorId) throws InvalidRequestException {
        return record(statementItem.getBankAccountId(), statementItem.getTransactionDate(),
                statementItem.getValueDate(), statementItem.getAmount(),
                statementItem.getDescription(), statementItem.getReference(),
                statementItem.getTransactionType(), false, journalEntryId, actorId);
    }

    private BankTransaction record(Integer bankAccountId, LocalDate transactionDate, LocalDate valueDate,
                                   BigDecimal amount, String description, String reference,
                                   TransactionType type, boolean fromStatement, UUID journalEntryId,
                                   Long actorId) throws InvalidRequestException {
        BankAccount account = bankAccountDirectory.getById(bankAccountId);
        if (!account.isActive()) {
            log.warn("Rejected transaction for inactive bank account {}", bankAccountId);
            throw new InvalidRequestException(
                    String.format("Bank account %d is inactive", bankAccountId));
        }
        if (!type.acceptsAmount(amount)) {
            log.warn("Rejected {} transaction with amount {} for bank account {}", type, amount, bankAccountId);
            throw new InvalidRequestException(String.format(
                    "Amount %s is not allowed for transaction type %s", amount, type));
        }

        LocalDateTime now = LocalDateTime.now();
        BankTransaction transaction = new BankTransaction();
        transaction.setBankAccountId(bankAccountId);
        transaction.setTransactionDate(transactionDate);
        transaction.setValueDate(valueDate);
        transaction.setAmount(amount);
        transaction.setDescription(description);
        transaction.setReference(reference);
        transaction.setTransactionType(type);
        transaction.setFromStatement(fromStatement);
        transaction.setReconciled(false);
        transaction.setJournalEntryId(journalEntryId);
        transaction.setCreatedBy(actorId);
        transaction.setCreatedAt(now);
        transaction.setUpdatedBy(actorId);
        transaction.setUpdatedAt(now);

        BankTransaction saved = bankTransactionRepository.save(transaction);
        log.info("Recorded {} transaction {} on bank account {}: {} {} ({})",
                fromStatement ? "statement" : "system", saved.getId(), bankAccountId,
                type, amount, transactionDate);
        return saved;
    }
}
