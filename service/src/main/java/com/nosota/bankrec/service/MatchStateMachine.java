package com.nosota.bankrec.service;

import com.nosota.bankrec.api.model.ReconciliationStatus;
import com.nosota.bankrec.model.BankTransaction;
import com.nosota.bankrec.model.MatchState;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating {@link MatchState} transitions of a bank transaction.
 *
 * <p>State diagram:
 * <pre>
 * UNRECONCILED ──match──> PROVISIONALLY_MATCHED ──finalize──> FINALIZED
 *       ^                          |
 *       +─────────unmatch──────────+
 * </pre>
 *
 * <p>The state is not stored. It follows from the transaction's reconciled flag and
 * the status of the reconciliation that claimed it, see {@link #stateOf}.
 */
@Component
public class MatchStateMachine {

    private static final Map<MatchState, Set<MatchState>> ALLOWED_TRANSITIONS = Map.of(
            MatchState.UNRECONCILED, EnumSet.of(MatchState.PROVISIONALLY_MATCHED),
            MatchState.PROVISIONALLY_MATCHED, EnumSet.of(MatchState.UNRECONCILED, MatchState.FINALIZED)
            // FINALIZED is final
    );

    /**
     * Derives the state of a transaction.
     *
     * @param transaction Bank transaction
     * @param ownerStatus Status of the reconciliation referenced by the transaction, ignored if unreconciled
     * @return Current match state
     */
    public MatchState stateOf(BankTransaction transaction, ReconciliationStatus ownerStatus) {
        if (!transaction.isReconciled()) {
            return MatchState.UNRECONCILED;
        }
        return ownerStatus == ReconciliationStatus.FINALIZED
                ? MatchState.FINALIZED
                : MatchState.PROVISIONALLY_MATCHED;
    }

    /**
     * Validates if a transition is allowed. Staying in the same state is not a transition.
     */
    public boolean isTransitionAllowed(MatchState from, MatchState to) {
        if (from == null || to == null) {
            return false;
        }
        Set<MatchState> allowedTargets = ALLOWED_TRANSITIONS.get(from);
        return allowedTargets != null && allowedTargets.contains(to);
    }

    public boolean isFinalState(MatchState state) {
        return state == MatchState.FINALIZED;
    }
}
