package com.nosota.bankrec.service;

import com.nosota.bankrec.model.BankAccount;
import com.nosota.bankrec.repository.BankAccountRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Bank account registry used by the reconciliation engine.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class BankAccountService implements BankAccountDirectory {

    private final BankAccountRepository bankAccountRepository;

    @Transactional
    public BankAccount createBankAccount(@NotBlank String accountName,
                                         @NotBlank String accountNumber,
                                         @NotBlank String bankName,
                                         @NotBlank String currencyCode,
                                         @NotNull Integer glAccountId) {
        BankAccount account = new BankAccount();
        account.setAccountName(accountName);
        account.setAccountNumber(accountNumber);
        account.setBankName(bankName);
        account.setCurrencyCode(currencyCode);
        account.setGlAccountId(glAccountId);
        account.setActive(true);
        account.setCreatedAt(LocalDateTime.now());

        BankAccount saved = bankAccountRepository.save(account);
        log.info("Created bank account {} ({} at {}) linked to GL account {}",
                saved.getId(), accountNumber, bankName, glAccountId);
        return saved;
    }

    @Override
    public BankAccount getById(@NotNull Integer bankAccountId) {
        return bankAccountRepository.findById(bankAccountId)
                .orElseThrow(() -> new EntityNotFoundException(
                        String.format("Bank account with ID %d not found", bankAccountId)));
    }

    /**
     * Stamps the latest finalized statement onto the account. An older statement date
     * never overwrites a newer stamp.
     *
     * @param bankAccountId          Bank account ID
     * @param statementDate          Finalized statement date
     * @param statementEndingBalance Finalized statement ending balance
     */
    @Transactional
    public void markReconciled(@NotNull Integer bankAccountId,
                               @NotNull LocalDate statementDate,
                               @NotNull BigDecimal statementEndingBalance) {
        BankAccount account = getById(bankAccountId);
        LocalDate last = account.getLastReconciledDate();
        if (last != null && statementDate.isBefore(last)) {
            log.info("Bank account {} already reconciled through {}, keeping stamp (finalized {})",
                    bankAccountId, last, statementDate);
            return;
        }
        account.setLastReconciledDate(statementDate);
        account.setLastReconciledBalance(statementEndingBalance);
        bankAccountRepository.save(account);
    }
}
