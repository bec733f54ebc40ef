package com.nosota.bankrec.model;

/**
 * Reconciliation state of a single bank transaction, derived from its
 * reconciled flag and the status of the reconciliation that claimed it.
 */
public enum MatchState {
    /**
     * Not claimed by any reconciliation.
     */
    UNRECONCILED,

    /**
     * Claimed by a DRAFT reconciliation. Can still be unmatched.
     */
    PROVISIONALLY_MATCHED,

    /**
     * Claimed by a FINALIZED reconciliation. Final state.
     */
    FINALIZED
}
