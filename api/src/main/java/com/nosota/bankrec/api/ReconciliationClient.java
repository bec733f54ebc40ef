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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.LocalDate;
import java.util.UUID;

/**
 * WebClient-based implementation of ReconciliationApi for consuming the reconciliation service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class BankRecClientConfig {
 *     @Bean
 *     public WebClient bankRecWebClient(WebClient.Builder builder,
 *                                       @Value("${services.bankrec.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public ReconciliationClient reconciliationClient(WebClient bankRecWebClient) {
 *         return new ReconciliationClient(bankRecWebClient);
 *     }
 * }
 * }
 * </pre>
 *
 * <p>Failed requests surface as {@code WebClientResponseException}; the response body is an
 * {@link com.nosota.bankrec.api.response.ErrorResponse}.
 */
@RequiredArgsConstructor
@Slf4j
public class ReconciliationClient implements ReconciliationApi {

    private static final String BASE_PATH = "/api/v1/reconciliation";

    private final WebClient webClient;

    @Override
    public ResponseEntity<ReconciliationResponse> getOrCreateDraft(DraftRequest request) {
        log.debug("Calling getOrCreateDraft: bankAccountId={}, statementDate={}, statementEndingBalance={}",
                request.bankAccountId(), request.statementDate(), request.statementEndingBalance());

        return webClient.post()
                .uri(BASE_PATH + "/drafts")
                .bodyValue(request)
                .retrieve()
                .toEntity(ReconciliationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ReconciliationResponse> getReconciliation(UUID reconciliationId) {
        log.debug("Calling getReconciliation: reconciliationId={}", reconciliationId);

        return webClient.get()
                .uri(BASE_PATH + "/{reconciliationId}", reconciliationId)
                .retrieve()
                .toEntity(ReconciliationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ReconciliationSummaryResponse> getSummary(UUID reconciliationId) {
        log.debug("Calling getSummary: reconciliationId={}", reconciliationId);

        return webClient.get()
                .uri(BASE_PATH + "/{reconciliationId}/summary", reconciliationId)
                .retrieve()
                .toEntity(ReconciliationSummaryResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ReconciliationItemsResponse> getItemsForReconciliation(UUID reconciliationId) {
        log.debug("Calling getItemsForReconciliation: reconciliationId={}", reconciliationId);

        return webClient.get()
                .uri(BASE_PATH + "/{reconciliationId}/transactions", reconciliationId)
                .retrieve()
                .toEntity(ReconciliationItemsResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<MatchResponse> match(UUID reconciliationId, MatchRequest request) {
        log.debug("Calling match: reconciliationId={}, statementIds={}, systemIds={}",
                reconciliationId, request.statementTransactionIds(), request.systemTransactionIds());

        return webClient.post()
                .uri(BASE_PATH + "/{reconciliationId}/match", reconciliationId)
                .bodyValue(request)
                .retrieve()
                .toEntity(MatchResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<UnmatchResponse> unmatch(UnmatchRequest request) {
        log.debug("Calling unmatch: transactionIds={}", request.transactionIds());

        return webClient.post()
                .uri(BASE_PATH + "/unmatch")
                .bodyValue(request)
                .retrieve()
                .toEntity(UnmatchResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BookedStatementItemResponse> bookStatementItem(
            UUID reconciliationId, Long transactionId, BookStatementItemRequest request) {
        log.debug("Calling bookStatementItem: reconciliationId={}, transactionId={}, contraGlAccountId={}",
                reconciliationId, transactionId, request.contraGlAccountId());

        return webClient.post()
                .uri(BASE_PATH + "/{reconciliationId}/statement-items/{transactionId}/journal-entry",
                        reconciliationId, transactionId)
                .bodyValue(request)
                .retrieve()
                .toEntity(BookedStatementItemResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ReconciliationResponse> finalizeReconciliation(UUID reconciliationId, FinalizeRequest request) {
        log.debug("Calling finalizeReconciliation: reconciliationId={}, statementEndingBalance={}, difference={}",
                reconciliationId, request.statementEndingBalance(), request.difference());

        return webClient.post()
                .uri(BASE_PATH + "/{reconciliationId}/finalize", reconciliationId)
                .bodyValue(request)
                .retrieve()
                .toEntity(ReconciliationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<ReconciliationHistoryDTO>> getHistory(Integer bankAccountId, int page, int size) {
        log.debug("Calling getHistory: bankAccountId={}, page={}, size={}", bankAccountId, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE_PATH + "/bank-accounts/{bankAccountId}/history")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build(bankAccountId))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<ReconciliationHistoryDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<ReconciliationItemsResponse> getUnreconciled(Integer bankAccountId, LocalDate asOf) {
        log.debug("Calling getUnreconciled: bankAccountId={}, asOf={}", bankAccountId, asOf);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE_PATH + "/bank-accounts/{bankAccountId}/unreconciled")
                        .queryParam("asOf", asOf)
                        .build(bankAccountId))
                .retrieve()
                .toEntity(ReconciliationItemsResponse.class)
                .block();
    }
}
