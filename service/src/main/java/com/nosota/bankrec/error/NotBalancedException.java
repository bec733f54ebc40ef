package com.nosota.bankrec.error;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Reconciliation cannot be finalized because the residual difference is not within tolerance.
 *
 * <p>{@code recalculatedDifference} is null when the caller's own figure was already rejected.
 */
@Getter
public class NotBalancedException extends ReconciliationException {

    private final BigDecimal difference;
    private final BigDecimal recalculatedDifference;
    private final BigDecimal tolerance;

    public NotBalancedException(BigDecimal difference, BigDecimal recalculatedDifference, BigDecimal tolerance) {
        super(recalculatedDifference == null
                ? String.format("Reconciliation is not balanced: difference %s, tolerance %s", difference, tolerance)
                : String.format("Reconciliation is not balanced: difference %s, recalculated difference %s, tolerance %s",
                        difference, recalculatedDifference, tolerance));
        this.difference = difference;
        this.recalculatedDifference = recalculatedDifference;
        this.tolerance = tolerance;
        addDetail("difference", difference);
        addDetail("recalculatedDifference", recalculatedDifference);
        addDetail("tolerance", tolerance);
    }

    @Override
    public String getErrorCode() {
        return "NOT_BALANCED";
    }
}
