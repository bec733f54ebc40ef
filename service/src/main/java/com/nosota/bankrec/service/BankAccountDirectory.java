package com.nosota.bankrec.service;

import com.nosota.bankrec.model.BankAccount;

public interface BankAccountDirectory {

    /**
     * @param bankAccountId Bank account ID
     * @return The bank account
     * @throws jakarta.persistence.EntityNotFoundException if the account does not exist
     */
    BankAccount getById(Integer bankAccountId);
}
