package com.nosota.bankrec.api;

import com.nosota.bankrec.api.dto.PagedResponse;
import com.nosota.bankrec.api.dto.ReconciliationHistoryDTO;
import com.nosota.bankrec.api.request.BookStatementItemRequest;
import com.nosota.bankrec.api.request.DraftRequest;
import com.nosota.bankrec.api.request.FinalizeRequest;
import com.nosota.bankrec.api.request.MatchRequest;
import com.nosota.bankrec.api.request.UnmatchRequest;
import com.nosota.bankrec.api.response.BookedStatementItemResponse;
import com.nosota.bankrec.api.response.MatchResponse;
import com.nosota.bankrec.api.response.ReconciliationItemsResponse;
import com.nosota.bankrec.api.response.ReconciliationResponse;
import com.nosota.bankrec.api.response.ReconciliationSummaryResponse;
import com.nosota.bankrec.api.response.UnmatchResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Bank reconciliation API.
 *
 * <p>Defines REST endpoints for the reconciliation lifecycle:
 * <ul>
 *   <li>Draft management (open or resume, read, summary)</li>
 *   <li>Matching (match, unmatch, booking statement-only items)</li>
 *   <li>Finalization and history</li>
 * </ul>
 *
 * <p>Business-rule failures are returned as {@link com.nosota.bankrec.api.response.ErrorResponse}
 * bodies with a machine-readable {@code code} and structured {@code details}.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>ReconciliationController - in service module (server-side implementation)</li>
 *   <li>ReconciliationClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/reconciliation")
public interface ReconciliationApi {

    // ==================== Draft Operations ====================

    /**
     * Opens a draft reconciliation or resumes the existing one for the same
     * bank account and statement date.
     *
     * @param request Bank account, statement date, statement ending balance, actor
     * @return The draft reconciliation
     */
    @PostMapping("/drafts")
    ResponseEntity<ReconciliationResponse> getOrCreateDraft(
            @RequestBody @Valid DraftRequest request) throws Exception;

    /**
     * Gets a reconciliation by ID.
     *
     * @param reconciliationId Reconciliation UUID
     * @return Reconciliation response
     */
    @GetMapping("/{reconciliationId}")
    ResponseEntity<ReconciliationResponse> getReconciliation(
            @PathVariable("reconciliationId") UUID reconciliationId);

    /**
     * Recalculates the reconciliation summary from the current unreconciled pools.
     *
     * @param reconciliationId Reconciliation UUID
     * @return Summary figures
     */
    @GetMapping("/{reconciliationId}/summary")
    ResponseEntity<ReconciliationSummaryResponse> getSummary(
            @PathVariable("reconciliationId") UUID reconciliationId);

    /**
     * Gets the transactions claimed by a reconciliation.
     *
     * @param reconciliationId Reconciliation UUID
     * @return Statement and system items
     */
    @GetMapping("/{reconciliationId}/transactions")
    ResponseEntity<ReconciliationItemsResponse> getItemsForReconciliation(
            @PathVariable("reconciliationId") UUID reconciliationId);

    // ==================== Matching Operations ====================

    /**
     * Matches a group of statement transactions against a group of system transactions.
     *
     * @param reconciliationId Draft reconciliation UUID
     * @param request          Selection group
     * @return Match result with recalculated summary
     */
    @PostMapping("/{reconciliationId}/match")
    ResponseEntity<MatchResponse> match(
            @PathVariable("reconciliationId") UUID reconciliationId,
            @RequestBody @Valid MatchRequest request) throws Exception;

    /**
     * Returns provisionally matched transactions to the unreconciled pool.
     *
     * @param request Transaction IDs and actor
     * @return Unmatch result
     */
    @PostMapping("/unmatch")
    ResponseEntity<UnmatchResponse> unmatch(
            @RequestBody @Valid UnmatchRequest request) throws Exception;

    /**
     * Books a statement-only item (fee, interest) as a journal entry and records the
     * matching system transaction.
     *
     * @param reconciliationId Draft reconciliation UUID
     * @param transactionId    Statement transaction ID
     * @param request          Contra account, actor, auto-match flag
     * @return Created journal entry and system transaction
     */
    @PostMapping("/{reconciliationId}/statement-items/{transactionId}/journal-entry")
    ResponseEntity<BookedStatementItemResponse> bookStatementItem(
            @PathVariable("reconciliationId") UUID reconciliationId,
            @PathVariable("transactionId") Long transactionId,
            @RequestBody @Valid BookStatementItemRequest request) throws Exception;

    // ==================== Finalization Operations ====================

    /**
     * Finalizes a draft reconciliation. Irreversible.
     *
     * @param reconciliationId Draft reconciliation UUID
     * @param request          Confirmed statement balance and displayed figures
     * @return The finalized reconciliation
     */
    @PostMapping("/{reconciliationId}/finalize")
    ResponseEntity<ReconciliationResponse> finalizeReconciliation(
            @PathVariable("reconciliationId") UUID reconciliationId,
            @RequestBody @Valid FinalizeRequest request) throws Exception;

    // ==================== Query Operations ====================

    /**
     * Gets finalized reconciliations of a bank account, newest statement date first.
     *
     * @param bankAccountId Bank account ID
     * @param page          Page number (0-indexed)
     * @param size          Page size
     * @return Paginated history
     */
    @GetMapping("/bank-accounts/{bankAccountId}/history")
    ResponseEntity<PagedResponse<ReconciliationHistoryDTO>> getHistory(
            @PathVariable("bankAccountId") Integer bankAccountId,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size);

    /**
     * Gets unreconciled transactions of a bank account up to a date.
     *
     * @param bankAccountId Bank account ID
     * @param asOf          Inclusive upper bound on transaction date
     * @return Statement and system items
     */
    @GetMapping("/bank-accounts/{bankAccountId}/unreconciled")
    ResponseEntity<ReconciliationItemsResponse> getUnreconciled(
            @PathVariable("bankAccountId") Integer bankAccountId,
            @RequestParam("asOf") @NotNull @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf);
}
