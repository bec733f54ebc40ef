package com.nosota.bankrec.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Request for registering a bank account with the reconciliation engine.
 *
 * @param accountName   Display name
 * @param accountNumber Account number at the bank
 * @param bankName      Name of the bank
 * @param currencyCode  ISO 4217 currency code of the account's ledger currency
 * @param glAccountId   Linked general-ledger account
 */
public record CreateBankAccountRequest(
        @NotBlank @Size(max = 100)
        String accountName,

        @NotBlank @Size(max = 50)
        String accountNumber,

        @NotBlank @Size(max = 100)
        String bankName,

        @NotNull @Pattern(regexp = "[A-Z]{3}", message = "Currency must be an ISO 4217 code")
        String currencyCode,

        @NotNull(message = "GL account ID is required")
        Integer glAccountId
) {
}
