package com.nosota.bankrec.service;

import com.nosota.bankrec.dto.ReconciliationSummary;
import com.nosota.bankrec.model.BankTransaction;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Bank reconciliation arithmetic.
 *
 * <p>Unreconciled items are classified by origin and sign:
 * <pre>
 *                 positive                 negative (absolute)
 * statement       interest not in book     charges not in book
 * system          deposits in transit      outstanding withdrawals
 * </pre>
 *
 * <p>and the two balances are brought together:
 * <pre>
 * adjustedBookBalance = glBalance + interestNotInBook - chargesNotInBook
 * adjustedBankBalance = statementEndingBalance + depositsInTransit - outstandingWithdrawals
 * difference          = adjustedBankBalance - adjustedBookBalance
 * </pre>
 *
 * <p>The calculator holds no state besides the configured tolerance.
 */
@Component
public class BalanceCalculator {

    private final BigDecimal tolerance;

    public BalanceCalculator(@Value("${reconciliation.tolerance:0.01}") BigDecimal tolerance) {
        if (tolerance == null || tolerance.signum() <= 0) {
            throw new IllegalArgumentException("Reconciliation tolerance must be positive, got " + tolerance);
        }
        this.tolerance = tolerance;
    }

    public BigDecimal getTolerance() {
        return tolerance;
    }

    /**
     * Computes the summary figures. The result carries no reconciliation ID or statement date.
     *
     * @param glBalance              GL balance of the bank account's GL account as of the statement date
     * @param statementEndingBalance Statement ending balance
     * @param statementItems         Unreconciled statement-sourced transactions
     * @param systemItems            Unreconciled system-sourced transactions
     * @return Summary figures
     */
    public ReconciliationSummary calculate(BigDecimal glBalance,
                                           BigDecimal statementEndingBalance,
                                           List<BankTransaction> statementItems,
                                           List<BankTransaction> systemItems) {
        BigDecimal interestNotInBook = BigDecimal.ZERO;
        BigDecimal chargesNotInBook = BigDecimal.ZERO;
        for (BankTransaction item : statementItems) {
            if (item.getAmount().signum() > 0) {
                interestNotInBook = interestNotInBook.add(item.getAmount());
            } else {
                chargesNotInBook = chargesNotInBook.add(item.getAmount().abs());
            }
        }

        BigDecimal depositsInTransit = BigDecimal.ZERO;
        BigDecimal outstandingWithdrawals = BigDecimal.ZERO;
        for (BankTransaction item : systemItems) {
            if (item.getAmount().signum() > 0) {
                depositsInTransit = depositsInTransit.add(item.getAmount());
            } else {
                outstandingWithdrawals = outstandingWithdrawals.add(item.getAmount().abs());
            }
        }

        BigDecimal adjustedBookBalance = glBalance.add(interestNotInBook).subtract(chargesNotInBook);
        BigDecimal adjustedBankBalance = statementEndingBalance.add(depositsInTransit).subtract(outstandingWithdrawals);
        BigDecimal difference = adjustedBankBalance.subtract(adjustedBookBalance);

        return ReconciliationSummary.builder()
                .glBalance(glBalance)
                .statementEndingBalance(statementEndingBalance)
                .interestNotInBook(interestNotInBook)
                .chargesNotInBook(chargesNotInBook)
                .depositsInTransit(depositsInTransit)
                .outstandingWithdrawals(outstandingWithdrawals)
                .adjustedBookBalance(adjustedBookBalance)
                .adjustedBankBalance(adjustedBankBalance)
                .difference(difference)
                .tolerance(tolerance)
                .balanced(isBalanced(difference))
                .unreconciledStatementItems(statementItems.size())
                .unreconciledSystemItems(systemItems.size())
                .build();
    }

    /**
     * Checks the signed-sum rule of a selection group: {@code |statementSum - systemSum| <= tolerance}.
     */
    public boolean sumsAgree(BigDecimal statementSum, BigDecimal systemSum) {
        return statementSum.subtract(systemSum).abs().compareTo(tolerance) <= 0;
    }

    /**
     * A reconciliation may be finalized only when {@code |difference| < tolerance}.
     */
    public boolean isBalanced(BigDecimal difference) {
        return difference.abs().compareTo(tolerance) < 0;
    }

    public static BigDecimal sum(List<BankTransaction> transactions) {
        return transactions.stream()
                .map(BankTransaction::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
