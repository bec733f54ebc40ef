package com.nosota.bankrec.service;

import com.nosota.bankrec.api.model.ReconciliationStatus;
import com.nosota.bankrec.error.InvalidRequestException;
import com.nosota.bankrec.model.BankAccount;
import com.nosota.bankrec.model.Reconciliation;
import com.nosota.bankrec.repository.ReconciliationRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Draft store for reconciliations.
 *
 * <p>The service provides:
 * <ul>
 *   <li>Open or resume - one DRAFT per bank account and statement date</li>
 *   <li>Lookup by ID</li>
 *   <li>History - FINALIZED reconciliations, newest statement date first</li>
 * </ul>
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class ReconciliationDraftService {

    private final ReconciliationRepository reconciliationRepository;
    private final BankAccountDirectory bankAccountDirectory;

    @Value("${reconciliation.history.max-page-size:100}")
    private int maxPageSize;

    /**
     * Returns the DRAFT for the bank account and statement date, creating it if none exists.
     *
     * <p>An existing draft is resumed and its statement ending balance replaced with the
     * supplied value. Concurrent calls for the same key converge on a single row:
     * the insert is a no-op when the draft exists, and the following read locks the row.
     *
     * @param bankAccountId          Bank account ID
     * @param statementDate          Statement date
     * @param statementEndingBalance Statement ending balance
     * @param actorId                ID of the user
     * @return The draft reconciliation
     * @throws InvalidRequestException if the bank account is inactive
     * @throws EntityNotFoundException if the bank account does not exist
     */
    @Transactional(rollbackOn = Exception.class)
    public Reconciliation getOrCreateDraft(@NotNull Integer bankAccountId,
                                           @NotNull LocalDate statementDate,
                                           @NotNull BigDecimal statementEndingBalance,
                                           @NotNull Long actorId) throws InvalidRequestException {
        BankAccount account = bankAccountDirectory.getById(bankAccountId);
        if (!account.isActive()) {
            throw new InvalidRequestException(String.format("Bank account %d is inactive", bankAccountId));
        }

        LocalDateTime now = LocalDateTime.now();
        int inserted = reconciliationRepository.insertDraftIfAbsent(
                UUID.randomUUID(), bankAccountId, statementDate, statementEndingBalance, actorId, now);

        Reconciliation draft = reconciliationRepository
                .findForUpdate(bankAccountId, statementDate, ReconciliationStatus.DRAFT)
                .orElseThrow(() -> new IllegalStateException(String.format(
                        "Draft for bank account %d and statement date %s vanished", bankAccountId, statementDate)));

        if (inserted == 1) {
            log.info("Opened draft reconciliation {} for bank account {} statement date {} ending balance {}",
                    draft.getId(), bankAccountId, statementDate, statementEndingBalance);
        } else {
            draft.setStatementEndingBalance(statementEndingBalance);
            draft.setUpdatedAt(now);
            reconciliationRepository.save(draft);
            log.info("Resumed draft reconciliation {} for bank account {} statement date {} ending balance {}",
                    draft.getId(), bankAccountId, statementDate, statementEndingBalance);
        }
        return draft;
    }

    public Reconciliation getReconciliation(@NotNull UUID reconciliationId) {
        return reconciliationRepository.findById(reconciliationId)
                .orElseThrow(() -> new EntityNotFoundException(
                        String.format("Reconciliation with ID %s not found", reconciliationId)));
    }

    /**
     * Lists FINALIZED reconciliations of a bank account, newest statement date first.
     *
     * @param bankAccountId Bank account ID
     * @param page          Page number (0-indexed)
     * @param size          Page size, capped at {@code reconciliation.history.max-page-size}
     * @return Page of finalized reconciliations
     */
    public Page<Reconciliation> listHistory(@NotNull Integer bankAccountId, int page, int size) {
        if (page < 0) {
            throw new IllegalArgumentException("Page number must not be negative");
        }
        if (size < 1) {
            throw new IllegalArgumentException("Page size must be positive");
        }
        bankAccountDirectory.getById(bankAccountId);

        int effectiveSize = Math.min(size, maxPageSize);
        return reconciliationRepository.findByBankAccountIdAndStatusOrderByStatementDateDescFinalizedAtDesc(
                bankAccountId, ReconciliationStatus.FINALIZED, PageRequest.of(page, effectiveSize));
    }
}
