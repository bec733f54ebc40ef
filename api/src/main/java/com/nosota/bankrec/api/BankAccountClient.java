package com.nosota.bankrec.api;

import com.nosota.bankrec.api.dto.BankTransactionDTO;
import com.nosota.bankrec.api.request.CreateBankAccountRequest;
import com.nosota.bankrec.api.request.RecordBankTransactionRequest;
import com.nosota.bankrec.api.response.BankAccountResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of BankAccountApi.
 *
 * <p>Not a Spring @Component; register it as a bean the same way as {@link ReconciliationClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class BankAccountClient implements BankAccountApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<BankAccountResponse> createBankAccount(CreateBankAccountRequest request) {
        log.debug("Calling createBankAccount: accountNumber={}, glAccountId={}",
                request.accountNumber(), request.glAccountId());

        return webClient.post()
                .uri("/api/v1/bank-accounts")
                .bodyValue(request)
                .retrieve()
                .toEntity(BankAccountResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BankAccountResponse> getBankAccount(Integer bankAccountId) {
        log.debug("Calling getBankAccount: bankAccountId={}", bankAccountId);

        return webClient.get()
                .uri("/api/v1/bank-accounts/{bankAccountId}", bankAccountId)
                .retrieve()
                .toEntity(BankAccountResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BankTransactionDTO> recordTransaction(Integer bankAccountId, RecordBankTransactionRequest request) {
        log.debug("Calling recordTransaction: bankAccountId={}, amount={}, type={}, fromStatement={}",
                bankAccountId, request.amount(), request.transactionType(), request.fromStatement());

        return webClient.post()
                .uri("/api/v1/bank-accounts/{bankAccountId}/transactions", bankAccountId)
                .bodyValue(request)
                .retrieve()
                .toEntity(BankTransactionDTO.class)
                .block();
    }
}
