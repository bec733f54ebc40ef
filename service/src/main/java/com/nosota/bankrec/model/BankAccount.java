package com.nosota.bankrec.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Bank account whose activity is reconciled.
 *
 * <p>Each bank account is linked to exactly one general-ledger account; the GL balance
 * of that account is the book side of every reconciliation.
 */
@Entity
@Table(name = "bank_account")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class BankAccount {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "account_name", nullable = false, length = 100)
    private String accountName;

    @Column(name = "account_number", nullable = false, length = 50)
    private String accountNumber;

    @Column(name = "bank_name", nullable = false, length = 100)
    private String bankName;

    /**
     * Ledger currency of the account (ISO 4217). All amounts on the account are
     * expressed in this currency.
     */
    @Column(name = "currency_code", nullable = false, length = 3)
    private String currencyCode;

    @Column(name = "gl_account_id", nullable = false)
    private Integer glAccountId;

    private boolean active;

    /**
     * Statement date of the latest finalized reconciliation.
     */
    @Column(name = "last_reconciled_date")
    private LocalDate lastReconciledDate;

    /**
     * Statement ending balance of the latest finalized reconciliation.
     */
    @Column(name = "last_reconciled_balance", precision = 15, scale = 2)
    private BigDecimal lastReconciledBalance;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
