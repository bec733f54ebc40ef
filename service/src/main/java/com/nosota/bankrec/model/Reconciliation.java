package com.nosota.bankrec.model;

import com.nosota.bankrec.api.model.ReconciliationStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Reconciliation entity - one statement-period reconciliation of one bank account.
 *
 * <p>Lifecycle:
 * <pre>
 * DRAFT ──finalize──> FINALIZED
 * </pre>
 *
 * <p>While DRAFT the statement ending balance may be revised and transactions may be
 * matched and unmatched against it. FINALIZED is irreversible: the record and all
 * transactions pointing to it are immutable.
 *
 * <p>The ID is assigned by the service before the row is inserted, so draft creation can
 * be done with a single conflict-tolerant insert.
 */
@Entity
@Table(name = "reconciliation")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Reconciliation {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "bank_account_id", nullable = false, updatable = false)
    private Integer bankAccountId;

    @Column(name = "statement_date", nullable = false, updatable = false)
    private LocalDate statementDate;

    @Column(name = "statement_ending_balance", nullable = false, precision = 15, scale = 2)
    private BigDecimal statementEndingBalance;

    /**
     * Adjusted book balance at finalization. Null while DRAFT.
     */
    @Column(name = "calculated_book_balance", precision = 15, scale = 2)
    private BigDecimal calculatedBookBalance;

    /**
     * Residual difference at finalization. Null while DRAFT.
     */
    @Column(name = "difference", precision = 15, scale = 2)
    private BigDecimal difference;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private ReconciliationStatus status;

    @Column(name = "notes", columnDefinition = "text")
    private String notes;

    @Column(name = "created_by", nullable = false, updatable = false)
    private Long createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "finalized_by")
    private Long finalizedBy;

    @Column(name = "finalized_at")
    private LocalDateTime finalizedAt;

    public boolean isDraft() {
        return status == ReconciliationStatus.DRAFT;
    }
}
