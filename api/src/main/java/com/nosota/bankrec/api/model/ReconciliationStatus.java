package com.nosota.bankrec.api.model;

/**
 * Status of a statement-period reconciliation.
 */
public enum ReconciliationStatus {
    /**
     * DRAFT: Open reconciliation session for one bank account and statement date.
     * Transactions may be matched and unmatched against it.
     * At most one DRAFT exists per (bank account, statement date).
     */
    DRAFT,

    /**
     * FINALIZED: Reconciliation agreed and locked in.
     * The record and every transaction claimed by it are immutable.
     * This is a final state.
     */
    FINALIZED
}
