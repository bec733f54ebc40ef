package com.nosota.bankrec.tests;

import com.fasterxml.jackson.databind.JsonNode;
import com.nosota.bankrec.TestBase;
import com.nosota.bankrec.api.model.TransactionType;
import com.nosota.bankrec.api.request.BookStatementItemRequest;
import com.nosota.bankrec.api.request.DraftRequest;
import com.nosota.bankrec.api.request.FinalizeRequest;
import com.nosota.bankrec.api.request.MatchRequest;
import com.nosota.bankrec.api.request.UnmatchRequest;
import com.nosota.bankrec.config.CorrelationIdFilter;
import com.nosota.bankrec.model.BankTransaction;
import com.nosota.bankrec.model.Reconciliation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.ResultActions;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for ReconciliationController via REST API with MockMvc.
 *
 * <p>Covers the HTTP contract: status codes, error codes and the structured
 * details carried by {@code ErrorResponse}.
 */
public class ReconciliationControllerTest extends TestBase {

    private static final LocalDate STATEMENT_DATE = LocalDate.of(2024, 6, 30);

    private Integer bankAccountId;

    @BeforeEach
    public void setupAccount() throws Exception {
        bankAccountId = createBankAccount();
        postOpeningBalance(bankAccountId, "1000.00", LocalDate.of(2024, 6, 1));
    }

    // ==================== Drafts ====================

    @Test
    public void createDraft_Twice_ShouldReturnSameDraft() throws Exception {
        DraftRequest request = new DraftRequest(bankAccountId, STATEMENT_DATE, new BigDecimal("1000.00"), ACTOR_ID);

        JsonNode first = readJson(postJson("/api/v1/reconciliation/drafts", request)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DRAFT")));
        JsonNode second = readJson(postJson("/api/v1/reconciliation/drafts", request)
                .andExpect(status().isOk()));

        assertThat(second.get("id").asText()).isEqualTo(first.get("id").asText());
        assertThat(first.get("statementDate").asText()).isEqualTo("2024-06-30");
    }

    @Test
    public void createDraft_WithMissingFields_ShouldReturn400() throws Exception {
        DraftRequest request = new DraftRequest(bankAccountId, null, null, ACTOR_ID);

        postJson("/api/v1/reconciliation/drafts", request)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.fields.statementDate").exists());
    }

    @Test
    public void createDraft_ForUnknownAccount_ShouldReturn404() throws Exception {
        DraftRequest request = new DraftRequest(Integer.MAX_VALUE, STATEMENT_DATE, BigDecimal.ZERO, ACTOR_ID);

        postJson("/api/v1/reconciliation/drafts", request)
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    public void getReconciliation_WhenNotFound_ShouldReturn404() throws Exception {
        mockMvc.perform(get("/api/v1/reconciliation/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound());
    }

    @Test
    public void getSummary_ShouldReportUnreconciledFigures() throws Exception {
        statementItem(bankAccountId, "-25.00", TransactionType.FEE, LocalDate.of(2024, 6, 28), "Fee");
        record(bankAccountId, "300.00", TransactionType.DEPOSIT, LocalDate.of(2024, 6, 29), "Late deposit", false);
        Reconciliation draft = draftService.getOrCreateDraft(bankAccountId, STATEMENT_DATE, new BigDecimal("975.00"), ACTOR_ID);

        JsonNode summary = readJson(mockMvc.perform(get("/api/v1/reconciliation/{id}/summary", draft.getId()))
                .andExpect(status().isOk()));

        assertThat(summary.get("glBalance").decimalValue()).isEqualByComparingTo("1000.00");
        assertThat(summary.get("chargesNotInBook").decimalValue()).isEqualByComparingTo("25.00");
        assertThat(summary.get("depositsInTransit").decimalValue()).isEqualByComparingTo("300.00");
        assertThat(summary.get("adjustedBookBalance").decimalValue()).isEqualByComparingTo("975.00");
        assertThat(summary.get("adjustedBankBalance").decimalValue()).isEqualByComparingTo("1275.00");
        assertThat(summary.get("difference").decimalValue()).isEqualByComparingTo("300.00");
        assertThat(summary.get("balanced").asBoolean()).isFalse();
    }

    // ==================== Matching ====================

    @Test
    public void match_WhenBalanced_ShouldReturnSumsAndSummary() throws Exception {
        BankTransaction statement = statementItem(bankAccountId, "-40.00", TransactionType.WITHDRAWAL, LocalDate.of(2024, 6, 10), "Card");
        BankTransaction system = bookItem(bankAccountId, "-40.00", TransactionType.WITHDRAWAL, LocalDate.of(2024, 6, 9), "Card");
        Reconciliation draft = draftService.getOrCreateDraft(bankAccountId, STATEMENT_DATE, new BigDecimal("960.00"), ACTOR_ID);

        MatchRequest request = new MatchRequest(List.of(statement.getId()), List.of(system.getId()), null, ACTOR_ID);
        JsonNode response = readJson(postJson("/api/v1/reconciliation/{id}/match", request, draft.getId())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matchedCount").value(2)));

        assertThat(response.get("statementSum").decimalValue()).isEqualByComparingTo("-40.00");
        assertThat(response.get("summary").get("difference").decimalValue()).isEqualByComparingTo("0");
        assertThat(response.get("summary").get("balanced").asBoolean()).isTrue();

        JsonNode claimed = readJson(mockMvc.perform(get("/api/v1/reconciliation/{id}/transactions", draft.getId()))
                .andExpect(status().isOk()));
        assertThat(claimed.get("statementItems")).hasSize(1);
        assertThat(claimed.get("systemItems")).hasSize(1);
    }

    @Test
    public void match_WhenUnbalanced_ShouldReturn422WithSums() throws Exception {
        BankTransaction statement = statementItem(bankAccountId, "100.00", TransactionType.DEPOSIT, LocalDate.of(2024, 6, 5), "Deposit");
        BankTransaction system = record(bankAccountId, "99.00", TransactionType.DEPOSIT, LocalDate.of(2024, 6, 5), "Deposit", false);
        Reconciliation draft = draftService.getOrCreateDraft(bankAccountId, STATEMENT_DATE, new BigDecimal("1000.00"), ACTOR_ID);

        MatchRequest request = new MatchRequest(List.of(statement.getId()), List.of(system.getId()), null, ACTOR_ID);
        JsonNode error = readJson(postJson("/api/v1/reconciliation/{id}/match", request, draft.getId())
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("UNBALANCED_SELECTION")));

        assertThat(error.get("details").get("statementSum").decimalValue()).isEqualByComparingTo("100.00");
        assertThat(error.get("details").get("systemSum").decimalValue()).isEqualByComparingTo("99.00");
        assertThat(reload(statement).isReconciled()).isFalse();
        assertThat(reload(system).isReconciled()).isFalse();
    }

    @Test
    public void match_WithSystemItemOnStatementSide_ShouldReturn400WithIds() throws Exception {
        BankTransaction system = record(bankAccountId, "10.00", TransactionType.DEPOSIT, LocalDate.of(2024, 6, 5), "Deposit", false);
        BankTransaction other = record(bankAccountId, "10.00", TransactionType.DEPOSIT, LocalDate.of(2024, 6, 5), "Deposit", false);
        Reconciliation draft = draftService.getOrCreateDraft(bankAccountId, STATEMENT_DATE, new BigDecimal("1000.00"), ACTOR_ID);

        MatchRequest request = new MatchRequest(List.of(system.getId()), List.of(other.getId()), null, ACTOR_ID);
        postJson("/api/v1/reconciliation/{id}/match", request, draft.getId())
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.transactionIds[0]").value(system.getId()));
    }

    @Test
    public void match_WithEmptySide_ShouldReturn400() throws Exception {
        Reconciliation draft = draftService.getOrCreateDraft(bankAccountId, STATEMENT_DATE, new BigDecimal("1000.00"), ACTOR_ID);

        MatchRequest request = new MatchRequest(List.of(), List.of(1L), null, ACTOR_ID);
        postJson("/api/v1/reconciliation/{id}/match", request, draft.getId())
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    public void unmatch_AfterFinalize_ShouldReturn409() throws Exception {
        BankTransaction statement = statementItem(bankAccountId, "60.00", TransactionType.DEPOSIT, LocalDate.of(2024, 6, 12), "Transfer");
        BankTransaction system = bookItem(bankAccountId, "60.00", TransactionType.DEPOSIT, LocalDate.of(2024, 6, 12), "Transfer");
        Reconciliation draft = draftService.getOrCreateDraft(bankAccountId, STATEMENT_DATE, new BigDecimal("1060.00"), ACTOR_ID);
        matchingService.match(draft.getId(), List.of(statement.getId()), List.of(system.getId()), null, ACTOR_ID);
        finalizationService.finalizeReconciliation(draft.getId(), new BigDecimal("1060.00"), null, BigDecimal.ZERO, ACTOR_ID, null);

        UnmatchRequest request = new UnmatchRequest(List.of(system.getId()), ACTOR_ID);
        postJson("/api/v1/reconciliation/unmatch", request)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("IMMUTABLE_RECORD"))
                .andExpect(jsonPath("$.details.transactionId").value(system.getId()))
                .andExpect(jsonPath("$.details.reconciliationId").value(draft.getId().toString()));

        assertThat(reload(system).getReconciliationId()).isEqualTo(draft.getId());
    }

    @Test
    public void unmatch_ShouldSkipUnreconciledRows() throws Exception {
        BankTransaction statement = statementItem(bankAccountId, "5.00", TransactionType.INTEREST, LocalDate.of(2024, 6, 30), "Interest");

        UnmatchRequest request = new UnmatchRequest(List.of(statement.getId()), ACTOR_ID);
        postJson("/api/v1/reconciliation/unmatch", request)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unmatchedIds").isEmpty())
                .andExpect(jsonPath("$.skippedIds[0]").value(statement.getId()))
                .andExpect(jsonPath("$.summaries").isEmpty());
    }

    @Test
    public void unmatch_ShouldReturnRecalculatedDraftSummary() throws Exception {
        BankTransaction statement = statementItem(bankAccountId, "-7.00", TransactionType.FEE, LocalDate.of(2024, 6, 20), "Fee");
        BankTransaction system = bookItem(bankAccountId, "-7.00", TransactionType.FEE, LocalDate.of(2024, 6, 20), "Fee");
        Reconciliation draft = draftService.getOrCreateDraft(bankAccountId, STATEMENT_DATE, new BigDecimal("993.00"), ACTOR_ID);
        matchingService.match(draft.getId(), List.of(statement.getId()), List.of(system.getId()), null, ACTOR_ID);

        UnmatchRequest request = new UnmatchRequest(List.of(statement.getId(), system.getId()), ACTOR_ID);
        JsonNode response = readJson(postJson("/api/v1/reconciliation/unmatch", request)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unmatchedIds.length()").value(2)));

        JsonNode summary = response.get("summaries").get(0);
        assertThat(summary.get("reconciliationId").asText()).isEqualTo(draft.getId().toString());
        assertThat(summary.get("chargesNotInBook").decimalValue()).isEqualByComparingTo("7.00");
        assertThat(summary.get("outstandingWithdrawals").decimalValue()).isEqualByComparingTo("7.00");
        assertThat(summary.get("difference").decimalValue()).isEqualByComparingTo("0");
    }

    // ==================== Booking statement items ====================

    @Test
    public void bookStatementItem_ShouldReturn201AndMatch() throws Exception {
        BankTransaction interest = statementItem(bankAccountId, "4.20", TransactionType.INTEREST, LocalDate.of(2024, 6, 30), "Interest");
        Reconciliation draft = draftService.getOrCreateDraft(bankAccountId, STATEMENT_DATE, new BigDecimal("1004.20"), ACTOR_ID);

        BookStatementItemRequest request = new BookStatementItemRequest(7000, ACTOR_ID, true);
        postJson("/api/v1/reconciliation/{id}/statement-items/{transactionId}/journal-entry",
                request, draft.getId(), interest.getId())
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.journalEntryId").exists())
                .andExpect(jsonPath("$.matched").value(true));

        assertThat(reload(interest).getReconciliationId()).isEqualTo(draft.getId());
        assertThat(summaryService.summarize(draft).glBalance()).isEqualByComparingTo("1004.20");
    }

    @Test
    public void bookStatementItem_AgainstBankGl_ShouldReturn400() throws Exception {
        BankTransaction fee = statementItem(bankAccountId, "-3.00", TransactionType.FEE, LocalDate.of(2024, 6, 30), "Fee");
        Reconciliation draft = draftService.getOrCreateDraft(bankAccountId, STATEMENT_DATE, new BigDecimal("997.00"), ACTOR_ID);

        BookStatementItemRequest request = new BookStatementItemRequest(glAccountOf(bankAccountId), ACTOR_ID, false);
        postJson("/api/v1/reconciliation/{id}/statement-items/{transactionId}/journal-entry",
                request, draft.getId(), fee.getId())
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    // ==================== Finalization ====================

    @Test
    public void finalize_WhenDifferenceAboveTolerance_ShouldReturn422() throws Exception {
        Reconciliation draft = draftService.getOrCreateDraft(bankAccountId, STATEMENT_DATE, new BigDecimal("1000.02"), ACTOR_ID);

        FinalizeRequest request = new FinalizeRequest(new BigDecimal("1000.02"), new BigDecimal("1000.00"),
                new BigDecimal("0.02"), ACTOR_ID, null);
        JsonNode error = readJson(postJson("/api/v1/reconciliation/{id}/finalize", request, draft.getId())
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("NOT_BALANCED")));

        assertThat(error.get("details").get("difference").decimalValue()).isEqualByComparingTo("0.02");
        assertThat(error.get("details").get("tolerance").decimalValue()).isEqualByComparingTo("0.01");

        mockMvc.perform(get("/api/v1/reconciliation/{id}", draft.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DRAFT"));
    }

    @Test
    public void finalize_Twice_ShouldReturn409() throws Exception {
        Reconciliation draft = draftService.getOrCreateDraft(bankAccountId, STATEMENT_DATE, new BigDecimal("1000.00"), ACTOR_ID);
        FinalizeRequest request = new FinalizeRequest(new BigDecimal("1000.00"), new BigDecimal("1000.00"),
                BigDecimal.ZERO, ACTOR_ID, "June");

        postJson("/api/v1/reconciliation/{id}/finalize", request, draft.getId())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FINALIZED"))
                .andExpect(jsonPath("$.notes").value("June"));

        postJson("/api/v1/reconciliation/{id}/finalize", request, draft.getId())
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_FINALIZED"));

        mockMvc.perform(get("/api/v1/bank-accounts/{id}", bankAccountId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lastReconciledDate").value("2024-06-30"));
    }

    @Test
    public void finalize_WithoutConfirmedBalance_ShouldReturn400() throws Exception {
        Reconciliation draft = draftService.getOrCreateDraft(bankAccountId, STATEMENT_DATE, new BigDecimal("1000.00"), ACTOR_ID);
        FinalizeRequest request = new FinalizeRequest(null, null, BigDecimal.ZERO, ACTOR_ID, null);

        postJson("/api/v1/reconciliation/{id}/finalize", request, draft.getId())
                .andExpect(status().isBadRequest());
    }

    // ==================== History and pool ====================

    @Test
    public void getHistory_ShouldPageFinalizedReconciliations() throws Exception {
        for (int month = 1; month <= 3; month++) {
            LocalDate date = LocalDate.of(2024, 6, 1).plusMonths(month).minusDays(1);
            Reconciliation draft = draftService.getOrCreateDraft(bankAccountId, date, new BigDecimal("1000.00"), ACTOR_ID);
            finalizationService.finalizeReconciliation(draft.getId(), new BigDecimal("1000.00"), null, BigDecimal.ZERO, ACTOR_ID, null);
        }

        mockMvc.perform(get("/api/v1/reconciliation/bank-accounts/{id}/history", bankAccountId)
                        .param("page", "0")
                        .param("size", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].statementDate").value("2024-08-31"))
                .andExpect(jsonPath("$.totalRecords").value(3))
                .andExpect(jsonPath("$.totalPages").value(2));
    }

    @Test
    public void getHistory_WithInvalidPage_ShouldReturn400() throws Exception {
        mockMvc.perform(get("/api/v1/reconciliation/bank-accounts/{id}/history", bankAccountId)
                        .param("page", "-1"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void getUnreconciled_ShouldSplitBySource() throws Exception {
        statementItem(bankAccountId, "12.00", TransactionType.DEPOSIT, LocalDate.of(2024, 6, 3), "Cash");
        record(bankAccountId, "-8.00", TransactionType.WITHDRAWAL, LocalDate.of(2024, 6, 4), "Card", false);

        mockMvc.perform(get("/api/v1/reconciliation/bank-accounts/{id}/unreconciled", bankAccountId)
                        .param("asOf", "2024-06-30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.statementItems.length()").value(1))
                .andExpect(jsonPath("$.systemItems.length()").value(1))
                .andExpect(jsonPath("$.systemItems[0].description").value("Card"));
    }

    @Test
    public void correlationId_ShouldBeEchoed() throws Exception {
        mockMvc.perform(get("/api/v1/reconciliation/{id}", UUID.randomUUID())
                        .header(CorrelationIdFilter.CORRELATION_ID_HEADER, "rec-test-1"))
                .andExpect(header().string(CorrelationIdFilter.CORRELATION_ID_HEADER, "rec-test-1"));
    }

    @Test
    public void apiDocs_WithoutDevProfile_ShouldBeForbidden() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isForbidden());
    }

    private ResultActions postJson(String url, Object body, Object... uriVariables) throws Exception {
        return mockMvc.perform(post(url, uriVariables)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)));
    }

    private JsonNode readJson(ResultActions result) throws Exception {
        return objectMapper.readTree(result.andReturn().getResponse().getContentAsString());
    }
}
