package com.nosota.bankrec.service;

import com.nosota.bankrec.api.model.ReconciliationStatus;
import com.nosota.bankrec.dto.MatchResult;
import com.nosota.bankrec.dto.UnmatchResult;
import com.nosota.bankrec.error.ImmutableRecordException;
import com.nosota.bankrec.error.InvalidRequestException;
import com.nosota.bankrec.error.ReconciliationException;
import com.nosota.bankrec.error.UnbalancedSelectionException;
import com.nosota.bankrec.model.BankTransaction;
import com.nosota.bankrec.model.MatchState;
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
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Matching engine.
 *
 * <p>A selection group pairs statement-sourced transactions with system-sourced
 * transactions of the same bank account. The group is accepted only when the signed sums
 * of both sides agree within the tolerance; one-to-one, one-to-many and many-to-one
 * groups follow the same rule.
 *
 * <p>Matching workflow:
 * <pre>
 * 1. Validate the selection (non-empty, no duplicates, known IDs)
 * 2. Lock the draft; reject if it is not DRAFT
 * 3. Lock the transactions in ID order
 * 4. Validate side, account, state and date of every transaction
 * 5. Check the signed-sum rule
 * 6. Claim every transaction for the draft
 * </pre>
 *
 * <p>Nothing is written unless every check passes. Locks are taken reconciliation first,
 * transactions second, in both match and unmatch.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class MatchingService {

    private final BankTransactionRepository bankTransactionRepository;
    private final ReconciliationRepository reconciliationRepository;
    private final BalanceCalculator balanceCalculator;
    private final MatchStateMachine matchStateMachine;

    /**
     * Matches a selection group under a draft reconciliation.
     *
     * @param reconciliationId      Draft reconciliation ID
     * @param statementTransactionIds Statement-sourced transaction IDs
     * @param systemTransactionIds  System-sourced transaction IDs
     * @param statementDate         Statement date to stamp; null means the draft's statement date
     * @param actorId               ID of the user
     * @return Match result with both sums
     * @throws InvalidRequestException      if the selection fails a precondition
     * @throws ImmutableRecordException     if the reconciliation is not a DRAFT
     * @throws UnbalancedSelectionException if the signed sums differ by more than the tolerance
     * @throws EntityNotFoundException      if the reconciliation does not exist
     */
    @Transactional(rollbackOn = Exception.class)
    public MatchResult match(@NotNull UUID reconciliationId,
                             List<Long> statementTransactionIds,
                             List<Long> systemTransactionIds,
                             LocalDate statementDate,
                             @NotNull Long actorId) throws ReconciliationException {
        validateSelection(statementTransactionIds, systemTransactionIds);

        Reconciliation draft = reconciliationRepository.findByIdForUpdate(reconciliationId)
                .orElseThrow(() -> new EntityNotFoundException(
                        String.format("Reconciliation with ID %s not found", reconciliationId)));
        if (!draft.isDraft()) {
            throw new ImmutableRecordException(null, reconciliationId);
        }
        if (statementDate != null && !statementDate.equals(draft.getStatementDate())) {
            throw new InvalidRequestException(String.format(
                    "Statement date %s does not match the draft's statement date %s",
                    statementDate, draft.getStatementDate()));
        }

        List<Long> allIds = new ArrayList<>(statementTransactionIds);
        allIds.addAll(systemTransactionIds);
        Map<Long, BankTransaction> locked = lockTransactions(allIds);

        List<BankTransaction> statementSide = statementTransactionIds.stream().map(locked::get).toList();
        List<BankTransaction> systemSide = systemTransactionIds.stream().map(locked::get).toList();

        checkSide(statementSide, true);
        checkSide(systemSide, false);
        checkCandidates(draft, locked.values());

        BigDecimal statementSum = BalanceCalculator.sum(statementSide);
        BigDecimal systemSum = BalanceCalculator.sum(systemSide);
        if (!balanceCalculator.sumsAgree(statementSum, systemSum)) {
            log.warn("Rejected unbalanced selection under reconciliation {}: statement {} vs system {}",
                    reconciliationId, statementSum, systemSum);
            throw new UnbalancedSelectionException(statementSum, systemSum, balanceCalculator.getTolerance());
        }

        LocalDateTime now = LocalDateTime.now();
        for (BankTransaction transaction : locked.values()) {
            transaction.setReconciled(true);
            transaction.setReconciliationId(reconciliationId);
            transaction.setReconciledDate(draft.getStatementDate());
            transaction.setUpdatedBy(actorId);
            transaction.setUpdatedAt(now);
        }
        bankTransactionRepository.saveAll(locked.values());

        draft.setUpdatedAt(now);
        reconciliationRepository.save(draft);

        log.info("Matched {} statement and {} system transactions under reconciliation {}: {} = {}",
                statementSide.size(), systemSide.size(), reconciliationId, statementSum, systemSum);
        return new MatchResult(reconciliationId, locked.size(), statementSum, systemSum);
    }

    /**
     * Returns provisionally matched transactions to the unreconciled pool.
     *
     * <p>All or nothing: a single transaction claimed by a FINALIZED reconciliation rejects
     * the whole request. Transactions that are already unreconciled are skipped.
     *
     * @param transactionIds Transaction IDs
     * @param actorId        ID of the user
     * @return Unmatched and skipped IDs
     * @throws InvalidRequestException  if the list is empty, has duplicates or unknown IDs
     * @throws ImmutableRecordException if a transaction belongs to a finalized reconciliation
     */
    @Transactional(rollbackOn = Exception.class)
    public UnmatchResult unmatch(List<Long> transactionIds, @NotNull Long actorId) throws ReconciliationException {
        if (transactionIds == null || transactionIds.isEmpty()) {
            throw new InvalidRequestException("At least one transaction is required");
        }
        List<Long> duplicates = findDuplicates(transactionIds);
        if (!duplicates.isEmpty()) {
            throw new InvalidRequestException("Transactions listed more than once", duplicates);
        }

        // Lock owning reconciliations before the rows, same order as match
        Set<UUID> ownerIds = new TreeSet<>(bankTransactionRepository.findReconciliationIdsByIdIn(transactionIds));
        Map<UUID, Reconciliation> owners = new HashMap<>();
        if (!ownerIds.isEmpty()) {
            reconciliationRepository.findAllByIdForUpdate(ownerIds).forEach(r -> owners.put(r.getId(), r));
        }

        Map<Long, BankTransaction> locked = lockTransactions(transactionIds);

        List<BankTransaction> toReset = new ArrayList<>();
        List<Long> skippedIds = new ArrayList<>();
        for (Long id : transactionIds) {
            BankTransaction transaction = locked.get(id);
            MatchState state = matchStateMachine.stateOf(transaction, ownerStatus(transaction, owners));
            if (state == MatchState.UNRECONCILED) {
                skippedIds.add(id);
            } else if (matchStateMachine.isFinalState(state)) {
                log.warn("Rejected unmatch of transaction {} in state {} (reconciliation {})",
                        id, state, transaction.getReconciliationId());
                throw new ImmutableRecordException(id, transaction.getReconciliationId());
            } else if (matchStateMachine.isTransitionAllowed(state, MatchState.UNRECONCILED)) {
                toReset.add(transaction);
            } else {
                throw new IllegalStateException(String.format(
                        "Transaction %d in state %s cannot be unmatched", id, state));
            }
        }

        Set<UUID> affected = new TreeSet<>();
        LocalDateTime now = LocalDateTime.now();
        for (BankTransaction transaction : toReset) {
            if (transaction.getReconciliationId() != null) {
                affected.add(transaction.getReconciliationId());
            }
            transaction.setReconciled(false);
            transaction.setReconciliationId(null);
            transaction.setReconciledDate(null);
            transaction.setUpdatedBy(actorId);
            transaction.setUpdatedAt(now);
        }
        bankTransactionRepository.saveAll(toReset);

        List<Long> unmatchedIds = toReset.stream().map(BankTransaction::getId).toList();
        log.info("Unmatched transactions {} (skipped {})", unmatchedIds, skippedIds);
        return new UnmatchResult(unmatchedIds, skippedIds, new ArrayList<>(affected));
    }

    private void validateSelection(List<Long> statementTransactionIds, List<Long> systemTransactionIds)
            throws InvalidRequestException {
        if (statementTransactionIds == null || statementTransactionIds.isEmpty()) {
            throw new InvalidRequestException("At least one statement transaction is required");
        }
        if (systemTransactionIds == null || systemTransactionIds.isEmpty()) {
            throw new InvalidRequestException("At least one system transaction is required");
        }
        List<Long> all = new ArrayList<>(statementTransactionIds);
        all.addAll(systemTransactionIds);
        if (all.contains(null)) {
            throw new InvalidRequestException("Transaction IDs must not be null");
        }
        List<Long> duplicates = findDuplicates(all);
        if (!duplicates.isEmpty()) {
            throw new InvalidRequestException("Transactions listed more than once or on both sides", duplicates);
        }
    }

    private Map<Long, BankTransaction> lockTransactions(List<Long> ids) throws InvalidRequestException {
        Map<Long, BankTransaction> locked = bankTransactionRepository.findAllByIdForUpdate(ids).stream()
                .collect(Collectors.toMap(BankTransaction::getId, Function.identity(),
                        (a, b) -> a, LinkedHashMap::new));
        List<Long> missing = ids.stream().filter(id -> !locked.containsKey(id)).toList();
        if (!missing.isEmpty()) {
            throw new InvalidRequestException("Unknown transactions", missing);
        }
        return locked;
    }

    private void checkSide(List<BankTransaction> side, boolean fromStatement) throws InvalidRequestException {
        List<Long> wrongSide = side.stream()
                .filter(t -> t.isFromStatement() != fromStatement)
                .map(BankTransaction::getId)
                .toList();
        if (!wrongSide.isEmpty()) {
            throw new InvalidRequestException(fromStatement
                    ? "Statement side contains system-sourced transactions"
                    : "System side contains statement-sourced transactions", wrongSide);
        }
    }

    private void checkCandidates(Reconciliation draft, Collection<BankTransaction> transactions)
            throws InvalidRequestException {
        List<Long> otherAccount = new ArrayList<>();
        List<Long> notUnreconciled = new ArrayList<>();
        List<Long> afterStatementDate = new ArrayList<>();
        for (BankTransaction transaction : transactions) {
            if (!draft.getBankAccountId().equals(transaction.getBankAccountId())) {
                otherAccount.add(transaction.getId());
            }
            MatchState state = matchStateMachine.stateOf(transaction, null);
            if (!matchStateMachine.isTransitionAllowed(state, MatchState.PROVISIONALLY_MATCHED)) {
                notUnreconciled.add(transaction.getId());
            }
            if (transaction.getTransactionDate().isAfter(draft.getStatementDate())) {
                afterStatementDate.add(transaction.getId());
            }
        }
        if (!otherAccount.isEmpty()) {
            throw new InvalidRequestException(String.format(
                    "Transactions do not belong to bank account %d", draft.getBankAccountId()), otherAccount);
        }
        if (!notUnreconciled.isEmpty()) {
            throw new InvalidRequestException("Transactions are already reconciled", notUnreconciled);
        }
        if (!afterStatementDate.isEmpty()) {
            throw new InvalidRequestException(String.format(
                    "Transactions are dated after statement date %s", draft.getStatementDate()), afterStatementDate);
        }
    }

    private ReconciliationStatus ownerStatus(BankTransaction transaction, Map<UUID, Reconciliation> owners) {
        UUID ownerId = transaction.getReconciliationId();
        if (ownerId == null) {
            return null;
        }
        Reconciliation owner = owners.get(ownerId);
        if (owner == null) {
            // claimed after the owners were locked
            owner = reconciliationRepository.findByIdForUpdate(ownerId)
                    .orElseThrow(() -> new IllegalStateException(
                            String.format("Transaction %d references missing reconciliation %s",
                                    transaction.getId(), ownerId)));
        }
        return owner.getStatus();
    }

    private static List<Long> findDuplicates(List<Long> ids) {
        Set<Long> seen = new HashSet<>();
        return ids.stream().filter(id -> !seen.add(id)).distinct().toList();
    }
}
