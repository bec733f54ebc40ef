package com.nosota.bankrec.api.dto;

import com.nosota.bankrec.api.model.TransactionType;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class BankTransactionDTO {
    private Long id;
    private Integer bankAccountId;
    private LocalDate transactionDate;
    private LocalDate valueDate;
    private BigDecimal amount;
    private String description;
    private String reference;
    private TransactionType transactionType;
    private boolean fromStatement;
    private boolean reconciled;
    private LocalDate reconciledDate;
    private UUID reconciliationId;
    private UUID journalEntryId;
    private LocalDateTime updatedAt;
}
