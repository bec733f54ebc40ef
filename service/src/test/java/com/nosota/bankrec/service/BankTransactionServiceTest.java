package com.nosota.bankrec.service;

import com.nosota.bankrec.api.model.TransactionType;
import com.nosota.bankrec.api.request.RecordBankTransactionRequest;
import com.nosota.bankrec.error.InvalidRequestException;
import com.nosota.bankrec.model.BankAccount;
import com.nosota.bankrec.model.BankTransaction;
import com.nosota.bankrec.repository.BankTransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BankTransactionServiceTest {

    @Mock
    private BankTransactionRepository bankTransactionRepository;

    @Mock
    private BankAccountDirectory bankAccountDirectory;

    private BankTransactionService bankTransactionService;
    private BankAccount account;

    @BeforeEach
    void setUp() {
        bankTransactionService = new BankTransactionService(bankTransactionRepository, bankAccountDirectory);
        account = new BankAccount();
        account.setId(1);
        account.setActive(true);
        when(bankAccountDirectory.getById(1)).thenReturn(account);
        when(bankTransactionRepository.save(any(BankTransaction.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @ParameterizedTest(name = "{0} {1} accepted={2}")
    @DisplayName("T-1: amount sign must agree with the transaction type")
    @CsvSource({
            "DEPOSIT, 100.00, true",
            "DEPOSIT, -100.00, false",
            "INTEREST, 1.25, true",
            "WITHDRAWAL, -50.00, true",
            "WITHDRAWAL, 50.00, false",
            "FEE, -15.00, true",
            "FEE, 15.00, false",
            "TRANSFER, -10.00, true",
            "TRANSFER, 10.00, true",
            "ADJUSTMENT, 0.00, false"
    })
    void enforcesSign(TransactionType type, BigDecimal amount, boolean accepted) throws Exception {
        RecordBankTransactionRequest request = new RecordBankTransactionRequest(
                LocalDate.of(2024, 3, 1), null, amount, "test", null, type, true, 9L);

        if (accepted) {
            BankTransaction saved = bankTransactionService.recordTransaction(1, request);
            assertThat(saved.getAmount()).isEqualByComparingTo(amount);
            assertThat(saved.isReconciled()).isFalse();
            assertThat(saved.getReconciliationId()).isNull();
            assertThat(saved.getCreatedBy()).isEqualTo(9L);
        } else {
            assertThatThrownBy(() -> bankTransactionService.recordTransaction(1, request))
                    .isInstanceOf(InvalidRequestException.class);
            verify(bankTransactionRepository, never()).save(any());
        }
    }

    @Test
    @DisplayName("T-2: inactive accounts take no new transactions")
    void rejectsInactiveAccount() {
        account.setActive(false);
        RecordBankTransactionRequest request = new RecordBankTransactionRequest(
                LocalDate.of(2024, 3, 1), null, new BigDecimal("100.00"), "test", null,
                TransactionType.DEPOSIT, false, 9L);

        assertThatThrownBy(() -> bankTransactionService.recordTransaction(1, request))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("inactive");
    }
}
