package com.nosota.bankrec.api;

import com.nosota.bankrec.api.dto.BankTransactionDTO;
import com.nosota.bankrec.api.request.CreateBankAccountRequest;
import com.nosota.bankrec.api.request.RecordBankTransactionRequest;
import com.nosota.bankrec.api.response.BankAccountResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Bank account API.
 *
 * <p>Registers bank accounts and records bank transactions (statement lines and
 * system-recorded movements) that the reconciliation engine works on.
 */
@RequestMapping("/api/v1/bank-accounts")
public interface BankAccountApi {

    /**
     * Registers a bank account linked to a GL account.
     *
     * @param request Account details
     * @return Created bank account
     */
    @PostMapping
    ResponseEntity<BankAccountResponse> createBankAccount(
            @RequestBody @Valid CreateBankAccountRequest request);

    /**
     * Gets a bank account by ID.
     *
     * @param bankAccountId Bank account ID
     * @return Bank account
     */
    @GetMapping("/{bankAccountId}")
    ResponseEntity<BankAccountResponse> getBankAccount(
            @PathVariable("bankAccountId") Integer bankAccountId);

    /**
     * Records a bank transaction. The amount's sign must agree with the transaction type.
     *
     * @param bankAccountId Bank account ID
     * @param request       Transaction details
     * @return Recorded transaction
     */
    @PostMapping("/{bankAccountId}/transactions")
    ResponseEntity<BankTransactionDTO> recordTransaction(
            @PathVariable("bankAccountId") Integer bankAccountId,
            @RequestBody @Valid RecordBankTransactionRequest request) throws Exception;
}
