package com.nosota.bankrec.api.response;

import com.nosota.bankrec.api.dto.BankTransactionDTO;

import java.util.List;

/**
 * Bank transactions split into statement-sourced and system-sourced items.
 *
 * @param statementItems Items that mirror the bank statement
 * @param systemItems    Items recorded by the organization
 */
public record ReconciliationItemsResponse(
        List<BankTransactionDTO> statementItems,
        List<BankTransactionDTO> systemItems
) {
}
