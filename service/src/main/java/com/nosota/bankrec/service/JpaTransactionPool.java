package com.nosota.bankrec.service;

import com.nosota.bankrec.dto.TransactionPartition;
import com.nosota.bankrec.model.BankTransaction;
import com.nosota.bankrec.repository.BankTransactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class JpaTransactionPool implements TransactionPool {

    private final BankTransactionRepository bankTransactionRepository;

    @Override
    public TransactionPartition getUnreconciled(Integer bankAccountId, LocalDate asOf) {
        return partition(bankTransactionRepository.findUnreconciled(bankAccountId, asOf));
    }

    @Override
    public TransactionPartition getItemsForReconciliation(UUID reconciliationId) {
        return partition(bankTransactionRepository.findByReconciliationIdOrderByTransactionDateAscIdAsc(reconciliationId));
    }

    // partitioningBy keeps encounter order within each side
    private TransactionPartition partition(List<BankTransaction> transactions) {
        Map<Boolean, List<BankTransaction>> bySource = transactions.stream()
                .collect(Collectors.partitioningBy(BankTransaction::isFromStatement));
        return new TransactionPartition(bySource.get(true), bySource.get(false));
    }
}
