package com.nosota.bankrec.controller;

import com.nosota.bankrec.api.BankAccountApi;
import com.nosota.bankrec.api.dto.BankTransactionDTO;
import com.nosota.bankrec.api.request.CreateBankAccountRequest;
import com.nosota.bankrec.api.request.RecordBankTransactionRequest;
import com.nosota.bankrec.api.response.BankAccountResponse;
import com.nosota.bankrec.mapper.BankTransactionMapper;
import com.nosota.bankrec.model.BankAccount;
import com.nosota.bankrec.model.BankTransaction;
import com.nosota.bankrec.service.BankAccountService;
import com.nosota.bankrec.service.BankTransactionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class BankAccountController implements BankAccountApi {

    private final BankAccountService bankAccountService;
    private final BankTransactionService bankTransactionService;

    @Override
    public ResponseEntity<BankAccountResponse> createBankAccount(CreateBankAccountRequest request) {
        BankAccount account = bankAccountService.createBankAccount(request.accountName(), request.accountNumber(),
                request.bankName(), request.currencyCode(), request.glAccountId());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(account));
    }

    @Override
    public ResponseEntity<BankAccountResponse> getBankAccount(Integer bankAccountId) {
        return ResponseEntity.ok(toResponse(bankAccountService.getById(bankAccountId)));
    }

    @Override
    public ResponseEntity<BankTransactionDTO> recordTransaction(Integer bankAccountId,
                                                                RecordBankTransactionRequest request) throws Exception {
        BankTransaction transaction = bankTransactionService.recordTransaction(bankAccountId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(BankTransactionMapper.INSTANCE.toDTO(transaction));
    }

    private BankAccountResponse toResponse(BankAccount account) {
        return new BankAccountResponse(account.getId(), account.getAccountName(), account.getAccountNumber(),
                account.getBankName(), account.getCurrencyCode(), account.getGlAccountId(), account.isActive(),
                account.getLastReconciledDate(), account.getLastReconciledBalance());
    }
}
