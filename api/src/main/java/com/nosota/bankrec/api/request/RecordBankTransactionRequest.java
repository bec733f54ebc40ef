package com.nosota.bankrec.api.request;

import com.nosota.bankrec.api.model.TransactionType;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request for recording a bank transaction.
 *
 * <p>The amount is signed (positive inflow, negative outflow) and must agree with
 * the sign fixed by {@link TransactionType}.
 *
 * @param transactionDate Booking date
 * @param valueDate       Optional value date
 * @param amount          Signed amount
 * @param description     Description
 * @param reference       Optional external reference
 * @param transactionType Transaction type
 * @param fromStatement   true if the line mirrors the bank statement, false if recorded by the organization
 * @param actorId         ID of the user recording the transaction
 */
public record RecordBankTransactionRequest(
        @NotNull LocalDate transactionDate,
        LocalDate valueDate,
        @NotNull @Digits(integer = 13, fraction = 2) BigDecimal amount,
        @NotBlank @Size(max = 200) String description,
        @Size(max = 100) String reference,
        @NotNull TransactionType transactionType,
        boolean fromStatement,
        @NotNull Long actorId
) {
}
