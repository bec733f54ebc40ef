package com.nosota.bankrec.error;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Journal entry lines do not zero out: total debits differ from total credits.
 */
@Getter
public class JournalEntryNotBalancedException extends ReconciliationException {

    private final BigDecimal totalDebits;
    private final BigDecimal totalCredits;

    public JournalEntryNotBalancedException(BigDecimal totalDebits, BigDecimal totalCredits) {
        super(String.format("Journal entry is not balanced: debits %s, credits %s", totalDebits, totalCredits));
        this.totalDebits = totalDebits;
        this.totalCredits = totalCredits;
        addDetail("totalDebits", totalDebits);
        addDetail("totalCredits", totalCredits);
    }

    @Override
    public String getErrorCode() {
        return "JOURNAL_NOT_BALANCED";
    }
}
