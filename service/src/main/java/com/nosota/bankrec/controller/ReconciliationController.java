package com.nosota.bankrec.controller;

import com.nosota.bankrec.api.ReconciliationApi;
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
import com.nosota.bankrec.dto.BookingResult;
import com.nosota.bankrec.dto.MatchResult;
import com.nosota.bankrec.dto.UnmatchResult;
import com.nosota.bankrec.mapper.BankTransactionMapper;
import com.nosota.bankrec.mapper.ReconciliationMapper;
import com.nosota.bankrec.model.Reconciliation;
import com.nosota.bankrec.service.BankAccountService;
import com.nosota.bankrec.service.FinalizationService;
import com.nosota.bankrec.service.MatchingService;
import com.nosota.bankrec.service.ReconciliationDraftService;
import com.nosota.bankrec.service.ReconciliationSummaryService;
import com.nosota.bankrec.service.StatementItemBookingService;
import com.nosota.bankrec.service.TransactionPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class ReconciliationController implements ReconciliationApi {

    private final ReconciliationDraftService draftService;
    private final ReconciliationSummaryService summaryService;
    private final MatchingService matchingService;
    private final StatementItemBookingService bookingService;
    private final FinalizationService finalizationService;
    private final BankAccountService bankAccountService;
    private final TransactionPool transactionPool;

    @Override
    public ResponseEntity<ReconciliationResponse> getOrCreateDraft(DraftRequest request) throws Exception {
        Reconciliation draft = draftService.getOrCreateDraft(
                request.bankAccountId(), request.statementDate(),
                request.statementEndingBalance(), request.actorId());
        return ResponseEntity.ok(ReconciliationMapper.INSTANCE.toResponse(draft));
    }

    @Override
    public ResponseEntity<ReconciliationResponse> getReconciliation(UUID reconciliationId) {
        Reconciliation reconciliation = draftService.getReconciliation(reconciliationId);
        return ResponseEntity.ok(ReconciliationMapper.INSTANCE.toResponse(reconciliation));
    }

    @Override
    public ResponseEntity<ReconciliationSummaryResponse> getSummary(UUID reconciliationId) {
        return ResponseEntity.ok(summaryOf(reconciliationId));
    }

    @Override
    public ResponseEntity<ReconciliationItemsResponse> getItemsForReconciliation(UUID reconciliationId) {
        draftService.getReconciliation(reconciliationId);
        return ResponseEntity.ok(BankTransactionMapper.INSTANCE.toItemsResponse(
                transactionPool.getItemsForReconciliation(reconciliationId)));
    }

    @Override
    public ResponseEntity<MatchResponse> match(UUID reconciliationId, MatchRequest request) throws Exception {
        MatchResult result = matchingService.match(reconciliationId,
                request.statementTransactionIds(), request.systemTransactionIds(),
                request.statementDate(), request.actorId());
        return ResponseEntity.ok(new MatchResponse(result.reconciliationId(), result.matchedCount(),
                result.statementSum(), result.systemSum(), summaryOf(reconciliationId)));
    }

    @Override
    public ResponseEntity<UnmatchResponse> unmatch(UnmatchRequest request) throws Exception {
        UnmatchResult result = matchingService.unmatch(request.transactionIds(), request.actorId());
        List<ReconciliationSummaryResponse> summaries = result.affectedReconciliationIds().stream()
                .map(this::summaryOf)
                .toList();
        return ResponseEntity.ok(new UnmatchResponse(result.unmatchedIds(), result.skippedIds(), summaries));
    }

    @Override
    public ResponseEntity<BookedStatementItemResponse> bookStatementItem(UUID reconciliationId,
                                                                         Long transactionId,
                                                                         BookStatementItemRequest request) throws Exception {
        BookingResult result = bookingService.bookStatementItem(reconciliationId, transactionId,
                request.contraGlAccountId(), request.actorId(), request.matchImmediately());
        return ResponseEntity.status(HttpStatus.CREATED).body(new BookedStatementItemResponse(
                result.journalEntryId(), result.systemTransactionId(), result.matched()));
    }

    @Override
    public ResponseEntity<ReconciliationResponse> finalizeReconciliation(UUID reconciliationId,
                                                                         FinalizeRequest request) throws Exception {
        Reconciliation finalized = finalizationService.finalizeReconciliation(reconciliationId,
                request.statementEndingBalance(), request.bookBalance(), request.difference(),
                request.actorId(), request.notes());
        return ResponseEntity.ok(ReconciliationMapper.INSTANCE.toResponse(finalized));
    }

    @Override
    public ResponseEntity<PagedResponse<ReconciliationHistoryDTO>> getHistory(Integer bankAccountId, int page, int size) {
        Page<Reconciliation> history = draftService.listHistory(bankAccountId, page, size);
        PagedResponse<ReconciliationHistoryDTO> response = new PagedResponse<>(
                ReconciliationMapper.INSTANCE.toHistoryDTOList(history.getContent()),
                history.getNumber(),
                history.getSize(),
                history.getTotalElements());
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<ReconciliationItemsResponse> getUnreconciled(Integer bankAccountId, LocalDate asOf) {
        bankAccountService.getById(bankAccountId);
        return ResponseEntity.ok(BankTransactionMapper.INSTANCE.toItemsResponse(
                transactionPool.getUnreconciled(bankAccountId, asOf)));
    }

    private ReconciliationSummaryResponse summaryOf(UUID reconciliationId) {
        Reconciliation reconciliation = draftService.getReconciliation(reconciliationId);
        return ReconciliationMapper.INSTANCE.toSummaryResponse(summaryService.summarize(reconciliation));
    }
}
