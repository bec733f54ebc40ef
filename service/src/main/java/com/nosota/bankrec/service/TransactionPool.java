package com.nosota.bankrec.service;

import com.nosota.bankrec.dto.TransactionPartition;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Read access to the bank transactions the engine reconciles.
 */
public interface TransactionPool {

    /**
     * Unreconciled transactions of an account dated on or before {@code asOf},
     * ordered by date then ID.
     */
    TransactionPartition getUnreconciled(Integer bankAccountId, LocalDate asOf);

    /**
     * Transactions claimed by a reconciliation.
     */
    TransactionPartition getItemsForReconciliation(UUID reconciliationId);
}
