package com.nosota.bankrec.model;

import com.nosota.bankrec.api.model.TransactionType;
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
 * A single movement on a bank account.
 *
 * <p>Two kinds of rows live in the same table:
 * <ul>
 *   <li>statement-sourced ({@code fromStatement = true}) - lines mirroring the bank statement</li>
 *   <li>system-sourced ({@code fromStatement = false}) - movements recorded in the organization's books</li>
 * </ul>
 *
 * <p>Amount is signed: positive for inflows (deposit, interest), negative for outflows
 * (withdrawal, fee).
 *
 * <p>Reconciliation columns ({@code reconciled}, {@code reconciliationId},
 * {@code reconciledDate}) are written only by the matching engine and always change
 * together; a database check constraint rejects any other combination.
 */
@Entity
@Table(name = "bank_transaction")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class BankTransaction {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "bank_account_id", nullable = false)
    private Integer bankAccountId;

    @Column(name = "transaction_date", nullable = false)
    private LocalDate transactionDate;

    @Column(name = "value_date")
    private LocalDate valueDate;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 200)
    private String description;

    @Column(length = 100)
    private String reference;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, length = 20)
    private TransactionType transactionType;

    @Column(name = "is_from_statement", nullable = false)
    private boolean fromStatement;

    @Column(name = "is_reconciled", nullable = false)
    private boolean reconciled;

    /**
     * Statement date of the reconciliation that claimed this row (not a wall-clock timestamp).
     */
    @Column(name = "reconciled_date")
    private LocalDate reconciledDate;

    @Column(name = "reconciliation_id")
    private UUID reconciliationId;

    /**
     * Journal entry this row was booked from, for system-sourced rows created during reconciliation.
     */
    @Column(name = "journal_entry_id")
    private UUID journalEntryId;

    @Column(name = "created_by", nullable = false)
    private Long createdBy;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_by", nullable = false)
    private Long updatedBy;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
