package com.nosota.bankrec.error;

import lombok.Getter;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
public class AlreadyFinalizedException extends ReconciliationException {

    private final UUID reconciliationId;
    private final LocalDateTime finalizedAt;

    public AlreadyFinalizedException(UUID reconciliationId, LocalDateTime finalizedAt) {
        super(String.format("Reconciliation %s was already finalized at %s", reconciliationId, finalizedAt));
        this.reconciliationId = reconciliationId;
        this.finalizedAt = finalizedAt;
        addDetail("reconciliationId", reconciliationId);
        addDetail("finalizedAt", finalizedAt);
    }

    @Override
    public String getErrorCode() {
        return "ALREADY_FINALIZED";
    }
}
