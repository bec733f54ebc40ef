package com.nosota.bankrec.error;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Signed sums of the two sides of a selection group differ by more than the tolerance.
 */
@Getter
public class UnbalancedSelectionException extends ReconciliationException {

    private final BigDecimal statementSum;
    private final BigDecimal systemSum;
    private final BigDecimal tolerance;

    public UnbalancedSelectionException(BigDecimal statementSum, BigDecimal systemSum, BigDecimal tolerance) {
        super(String.format("Selection is not balanced: statement sum %s, system sum %s, tolerance %s",
                statementSum, systemSum, tolerance));
        this.statementSum = statementSum;
        this.systemSum = systemSum;
        this.tolerance = tolerance;
        addDetail("statementSum", statementSum);
        addDetail("systemSum", systemSum);
        addDetail("tolerance", tolerance);
    }

    @Override
    public String getErrorCode() {
        return "UNBALANCED_SELECTION";
    }
}
