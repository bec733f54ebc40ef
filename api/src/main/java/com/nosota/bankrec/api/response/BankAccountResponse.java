package com.nosota.bankrec.api.response;

import java.math.BigDecimal;
import java.time.LocalDate;

public record BankAccountResponse(
        Integer id,
        String accountName,
        String accountNumber,
        String bankName,
        String currencyCode,
        Integer glAccountId,
        boolean active,
        LocalDate lastReconciledDate,
        BigDecimal lastReconciledBalance
) {
}
