package com.nosota.bankrec.service;

import com.nosota.bankrec.dto.ReconciliationSummary;
import com.nosota.bankrec.dto.TransactionPartition;
import com.nosota.bankrec.model.BankAccount;
import com.nosota.bankrec.model.Reconciliation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Recomputes reconciliation summaries from the store.
 *
 * <p>Figures are derived from the GL balance and the unreconciled pool as of the
 * statement date every time they are requested; nothing is cached.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationSummaryService {

    private final BankAccountDirectory bankAccountDirectory;
    private final BalanceOracle balanceOracle;
    private final TransactionPool transactionPool;
    private final BalanceCalculator balanceCalculator;

    public ReconciliationSummary summarize(Reconciliation reconciliation) {
        return summarize(reconciliation, reconciliation.getStatementEndingBalance());
    }

    /**
     * Computes the summary with a statement ending balance that may differ from the stored one.
     *
     * @param reconciliation         Reconciliation
     * @param statementEndingBalance Statement ending balance to use
     * @return Summary figures
     */
    public ReconciliationSummary summarize(Reconciliation reconciliation, BigDecimal statementEndingBalance) {
        BankAccount account = bankAccountDirectory.getById(reconciliation.getBankAccountId());
        BigDecimal glBalance = balanceOracle.getAccountBalance(
                account.getGlAccountId(), reconciliation.getStatementDate());
        TransactionPartition pool = transactionPool.getUnreconciled(
                reconciliation.getBankAccountId(), reconciliation.getStatementDate());

        ReconciliationSummary summary = balanceCalculator
                .calculate(glBalance, statementEndingBalance, pool.statementItems(), pool.systemItems())
                .toBuilder()
                .reconciliationId(reconciliation.getId())
                .statementDate(reconciliation.getStatementDate())
                .build();

        log.debug("Reconciliation {} summary: book {}, bank {}, difference {}",
                reconciliation.getId(), summary.adjustedBookBalance(),
                summary.adjustedBankBalance(), summary.difference());
        return summary;
    }
}
