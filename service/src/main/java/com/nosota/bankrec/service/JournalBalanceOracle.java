package com.nosota.bankrec.service;

import com.nosota.bankrec.repository.JournalEntryLineRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * {@link BalanceOracle} backed by posted journal entry lines.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalBalanceOracle implements BalanceOracle {

    private final JournalEntryLineRepository journalEntryLineRepository;

    @Override
    public BigDecimal getAccountBalance(Integer glAccountId, LocalDate asOf) {
        BigDecimal balance = journalEntryLineRepository.sumBalance(glAccountId, asOf);
        if (balance == null) {
            balance = BigDecimal.ZERO;
        }
        log.debug("GL account {} balance as of {}: {}", glAccountId, asOf, balance);
        return balance;
    }
}
