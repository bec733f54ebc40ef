package com.nosota.bankrec.api.model;

import java.math.BigDecimal;

/**
 * Type of a bank transaction.
 *
 * <p>The type fixes the sign of the amount at the moment a transaction is recorded:
 * <ul>
 *   <li>DEPOSIT, INTEREST - inflows, amount must be positive</li>
 *   <li>WITHDRAWAL, FEE - outflows, amount must be negative</li>
 *   <li>TRANSFER, ADJUSTMENT - either direction</li>
 * </ul>
 *
 * <p>Once recorded, the reconciliation engine trusts the sign of the stored amount.
 */
public enum TransactionType {
    DEPOSIT(1),
    WITHDRAWAL(-1),
    INTEREST(1),
    FEE(-1),
    TRANSFER(0),
    ADJUSTMENT(0);

    /**
     * Required signum of the amount; 0 means both directions are allowed.
     */
    private final int requiredSign;

    TransactionType(int requiredSign) {
        this.requiredSign = requiredSign;
    }

    public int getRequiredSign() {
        return requiredSign;
    }

    /**
     * Checks a signed amount against this type. Zero is never accepted.
     *
     * @param amount signed amount (positive inflow, negative outflow)
     * @return true if the amount's sign is allowed for this type
     */
    public boolean acceptsAmount(BigDecimal amount) {
        if (amount == null || amount.signum() == 0) {
            return false;
        }
        return requiredSign == 0 || amount.signum() == requiredSign;
    }
}
