package com.nosota.bankrec.error;

import lombok.Getter;

import java.util.UUID;

/**
 * Attempt to change a finalized reconciliation or a transaction claimed by one.
 */
@Getter
public class ImmutableRecordException extends ReconciliationException {

    private final Long transactionId;
    private final UUID reconciliationId;

    public ImmutableRecordException(Long transactionId, UUID reconciliationId) {
        super(transactionId == null
                ? String.format("Reconciliation %s is finalized and cannot be changed", reconciliationId)
                : String.format("Transaction %d belongs to finalized reconciliation %s and cannot be changed",
                        transactionId, reconciliationId));
        this.transactionId = transactionId;
        this.reconciliationId = reconciliationId;
        addDetail("transactionId", transactionId);
        addDetail("reconciliationId", reconciliationId);
    }

    @Override
    public String getErrorCode() {
        return "IMMUTABLE_RECORD";
    }
}
