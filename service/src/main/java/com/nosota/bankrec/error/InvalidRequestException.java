package com.nosota.bankrec.error;

import java.util.Collection;
import java.util.List;

/**
 * Request failed a precondition (empty or overlapping selection, wrong side,
 * wrong account, already reconciled, unknown IDs). Nothing was changed.
 */
public class InvalidRequestException extends ReconciliationException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Collection<Long> transactionIds) {
        super(message);
        addDetail("transactionIds", transactionIds == null ? null : List.copyOf(transactionIds));
    }

    @Override
    public String getErrorCode() {
        return "VALIDATION_ERROR";
    }
}
