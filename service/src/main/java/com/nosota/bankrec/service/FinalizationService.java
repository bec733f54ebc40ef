package com.nosota.bankrec.service;

import com.nosota.bankrec.api.model.ReconciliationStatus;
import com.nosota.bankrec.dto.ReconciliationSummary;
import com.nosota.bankrec.dto.TransactionPartition;
import com.nosota.bankrec.error.AlreadyFinalizedException;
import com.nosota.bankrec.error.InvalidRequestException;
import com.nosota.bankrec.error.NotBalancedException;
import com.nosota.bankrec.error.ReconciliationException;
import com.nosota.bankrec.model.BankTransaction;
import com.nosota.bankrec.model.MatchState;
import com.nosota.bankrec.model.Reconciliation;
import com.nosota.bankrec.repository.ReconciliationRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Finalizes draft reconciliations.
 *
 * <p>Finalization is irreversible. It is allowed only when both the difference shown to
 * the caller and the difference recalculated from the store are within tolerance.
 * Transactions claimed by the draft are not touched: their FINALIZED state follows from
 * the reconciliation status. Each of them must be provisionally matched at that point.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class FinalizationService {

    private final ReconciliationRepository reconciliationRepository;
    private final ReconciliationSummaryService reconciliationSummaryService;
    private final BalanceCalculator balanceCalculator;
    private final BankAccountService bankAccountService;
    private final TransactionPool transactionPool;
    private final MatchStateMachine matchStateMachine;

    /**
     * Finalizes a draft reconciliation.
     *
     * @param reconciliationId       Draft reconciliation ID
     * @param statementEndingBalance Confirmed statement ending balance
     * @param bookBalance            Adjusted book balance shown to the caller, informational
     * @param difference             Difference shown to the caller
     * @param actorId                ID of the user
     * @param notes                  Optional notes
     * @return The finalized reconciliation
     * @throws InvalidRequestException    if the statement ending balance or difference is missing
     * @throws AlreadyFinalizedException  if the reconciliation is already finalized
     * @throws NotBalancedException       if either difference is not within tolerance
     * @throws EntityNotFoundException    if the reconciliation does not exist
     */
    @Transactional(rollbackOn = Exception.class)
    public Reconciliation finalizeReconciliation(@NotNull UUID reconciliationId,
                                                 BigDecimal statementEndingBalance,
                                                 BigDecimal bookBalance,
                                                 BigDecimal difference,
                                                 @NotNull Long actorId,
                                                 String notes) throws ReconciliationException {
        if (statementEndingBalance == null) {
            throw new InvalidRequestException("Statement ending balance must be confirmed to finalize");
        }
        if (difference == null) {
            throw new InvalidRequestException("Difference is required to finalize");
        }

        Reconciliation reconciliation = reconciliationRepository.findByIdForUpdate(reconciliationId)
                .orElseThrow(() -> new EntityNotFoundException(
                        String.format("Reconciliation with ID %s not found", reconciliationId)));
        if (reconciliation.getStatus() == ReconciliationStatus.FINALIZED) {
            throw new AlreadyFinalizedException(reconciliationId, reconciliation.getFinalizedAt());
        }

        BigDecimal tolerance = balanceCalculator.getTolerance();
        if (!balanceCalculator.isBalanced(difference)) {
            log.warn("Rejected finalization of reconciliation {}: difference {}", reconciliationId, difference);
            throw new NotBalancedException(difference, null, tolerance);
        }

        ReconciliationSummary summary = reconciliationSummaryService.summarize(reconciliation, statementEndingBalance);
        if (!summary.balanced()) {
            log.warn("Rejected finalization of reconciliation {}: supplied difference {}, recalculated {}",
                    reconciliationId, difference, summary.difference());
            throw new NotBalancedException(difference, summary.difference(), tolerance);
        }
        if (bookBalance != null && bookBalance.compareTo(summary.adjustedBookBalance()) != 0) {
            log.debug("Reconciliation {}: supplied book balance {} differs from recalculated {}",
                    reconciliationId, bookBalance, summary.adjustedBookBalance());
        }

        TransactionPartition claimed = transactionPool.getItemsForReconciliation(reconciliationId);
        List<BankTransaction> claimedItems = new ArrayList<>(claimed.statementItems());
        claimedItems.addAll(claimed.systemItems());
        for (BankTransaction transaction : claimedItems) {
            MatchState state = matchStateMachine.stateOf(transaction, reconciliation.getStatus());
            if (!matchStateMachine.isTransitionAllowed(state, MatchState.FINALIZED)) {
                throw new IllegalStateException(String.format(
                        "Transaction %d in state %s cannot be finalized with reconciliation %s",
                        transaction.getId(), state, reconciliationId));
            }
        }

        LocalDateTime now = LocalDateTime.now();
        reconciliation.setStatementEndingBalance(statementEndingBalance);
        reconciliation.setCalculatedBookBalance(summary.adjustedBookBalance());
        reconciliation.setDifference(summary.difference());
        reconciliation.setStatus(ReconciliationStatus.FINALIZED);
        reconciliation.setFinalizedBy(actorId);
        reconciliation.setFinalizedAt(now);
        reconciliation.setUpdatedAt(now);
        if (notes != null) {
            reconciliation.setNotes(notes);
        }
        Reconciliation saved = reconciliationRepository.save(reconciliation);

        bankAccountService.markReconciled(saved.getBankAccountId(), saved.getStatementDate(), statementEndingBalance);

        log.info("Finalized reconciliation {} for bank account {} statement date {} with {} transactions: statement {}, book {}, difference {}",
                reconciliationId, saved.getBankAccountId(), saved.getStatementDate(), claimedItems.size(),
                statementEndingBalance, summary.adjustedBookBalance(), summary.difference());
        return saved;
    }
}
