package com.nosota.bankrec.service;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Source of general-ledger balances.
 */
public interface BalanceOracle {

    /**
     * Returns the balance of a GL account as of a date, inclusive.
     * An account with no postings has a zero balance.
     *
     * @param glAccountId GL account ID
     * @param asOf        As-of date
     * @return Signed balance (debit positive)
     */
    BigDecimal getAccountBalance(Integer glAccountId, LocalDate asOf);
}
