package com.nosota.bankrec.dto;

import com.nosota.bankrec.model.BankTransaction;

import java.util.List;

/**
 * Bank transactions split by origin.
 *
 * @param statementItems Statement-sourced transactions
 * @param systemItems    System-sourced transactions
 */
public record TransactionPartition(
        List<BankTransaction> statementItems,
        List<BankTransaction> systemItems
) {
}
