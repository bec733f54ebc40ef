package com.nosota.bankrec.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One debit or credit line of a journal entry.
 */
@Entity
@Table(name = "journal_entry_line")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class JournalEntryLine {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "journal_entry_id", nullable = false)
    private UUID journalEntryId;

    @Column(name = "gl_account_id", nullable = false)
    private Integer glAccountId;

    @Column(name = "debit_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal debitAmount;

    @Column(name = "credit_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal creditAmount;

    @Column(length = 250)
    private String description;

    @Column(name = "currency_code", length = 3)
    private String currencyCode;
}
