package com.nosota.bankrec.dto;

import java.math.BigDecimal;

/**
 * One line of a journal entry to be posted. Exactly one of debit and credit is positive.
 *
 * @param glAccountId  GL account
 * @param debitAmount  Debit amount, zero for a credit line
 * @param creditAmount Credit amount, zero for a debit line
 * @param description  Line description
 * @param currencyCode ISO 4217 currency code
 */
public record JournalLine(
        Integer glAccountId,
        BigDecimal debitAmount,
        BigDecimal creditAmount,
        String description,
        String currencyCode
) {
    public static JournalLine debit(Integer glAccountId, BigDecimal amount, String description, String currencyCode) {
        return new JournalLine(glAccountId, amount, BigDecimal.ZERO, description, currencyCode);
    }

    public static JournalLine credit(Integer glAccountId, BigDecimal amount, String description, String currencyCode) {
        return new JournalLine(glAccountId, BigDecimal.ZERO, amount, description, currencyCode);
    }
}
