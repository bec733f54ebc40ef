package com.nosota.bankrec.tests;

import com.nosota.bankrec.TestBase;
import com.nosota.bankrec.api.model.ReconciliationStatus;
import com.nosota.bankrec.api.model.TransactionType;
import com.nosota.bankrec.api.request.FinalizeRequest;
import com.nosota.bankrec.config.CorrelationIdFilter;
import com.nosota.bankrec.model.BankAccount;
import com.nosota.bankrec.model.BankTransaction;
import com.nosota.bankrec.model.Reconciliation;
import com.nosota.bankrec.service.BankAccountService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.MediaType;
import org.springframework.test.util.AopTestUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Storage failures surface as 503 with a correlation id, and nothing written before the
 * failure survives.
 */
public class PersistenceErrorTest extends TestBase {

    private static final LocalDate STATEMENT_DATE = LocalDate.of(2024, 6, 30);

    @SpyBean
    private BankAccountService spiedBankAccountService;

    private Integer bankAccountId;

    @BeforeEach
    public void setupAccount() throws Exception {
        bankAccountId = createBankAccount();
        postOpeningBalance(bankAccountId, "1000.00", LocalDate.of(2024, 6, 1));
    }

    @Test
    public void finalize_WhenStorageFails_ShouldReturn503AndRollBack() throws Exception {
        BankTransaction statement = statementItem(bankAccountId, "-40.00", TransactionType.WITHDRAWAL, LocalDate.of(2024, 6, 10), "Card");
        BankTransaction system = bookItem(bankAccountId, "-40.00", TransactionType.WITHDRAWAL, LocalDate.of(2024, 6, 9), "Card");
        Reconciliation draft = draftService.getOrCreateDraft(bankAccountId, STATEMENT_DATE, new BigDecimal("960.00"), ACTOR_ID);
        matchingService.match(draft.getId(), List.of(statement.getId()), List.of(system.getId()), null, ACTOR_ID);

        // Fails after the reconciliation row and the claimed transactions were already updated
        BankAccountService target = AopTestUtils.getUltimateTargetObject(spiedBankAccountService);
        doThrow(new CannotAcquireLockException("lock wait timeout"))
                .when(target).markReconciled(any(), any(), any());

        FinalizeRequest request = new FinalizeRequest(new BigDecimal("960.00"), new BigDecimal("960.00"),
                BigDecimal.ZERO, ACTOR_ID, null);
        mockMvc.perform(post("/api/v1/reconciliation/{id}/finalize", draft.getId())
                        .header(CorrelationIdFilter.CORRELATION_ID_HEADER, "finalize-503")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string(CorrelationIdFilter.CORRELATION_ID_HEADER, "finalize-503"))
                .andExpect(jsonPath("$.code").value("PERSISTENCE_ERROR"))
                .andExpect(jsonPath("$.details.correlationId").value("finalize-503"));

        Reconciliation stored = reconciliationRepository.findById(draft.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(ReconciliationStatus.DRAFT);
        assertThat(stored.getFinalizedAt()).isNull();
        assertThat(stored.getFinalizedBy()).isNull();

        for (BankTransaction claimed : List.of(statement, system)) {
            BankTransaction reloaded = reload(claimed);
            assertThat(reloaded.isReconciled()).isFalse();
            assertThat(reloaded.getReconciliationId()).isEqualTo(draft.getId());
        }

        BankAccount account = bankAccountService.getById(bankAccountId);
        assertThat(account.getLastReconciledDate()).isNull();
        assertThat(account.getLastReconciledBalance()).isNull();
    }
}
