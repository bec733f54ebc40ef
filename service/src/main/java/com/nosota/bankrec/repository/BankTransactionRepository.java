package com.nosota.bankrec.repository;

import com.nosota.bankrec.model.BankTransaction;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface BankTransactionRepository extends JpaRepository<BankTransaction, Long> {

    /**
     * Retrieves unreconciled transactions of a bank account dated on or before the given date.
     *
     * <p>Both statement-sourced and system-sourced rows are returned, ordered by
     * transaction date and then by ID so repeated reads list items the same way.
     *
     * @param bankAccountId The bank account ID
     * @param asOf          Inclusive upper bound on the transaction date
     * @return Unreconciled transactions
     */
    @Query("SELECT t FROM BankTransaction t WHERE t.bankAccountId = :bankAccountId " +
            "AND t.reconciled = false AND t.transactionDate <= :asOf " +
            "ORDER BY t.transactionDate ASC, t.id ASC")
    List<BankTransaction> findUnreconciled(@Param("bankAccountId") Integer bankAccountId,
                                           @Param("asOf") LocalDate asOf);

    List<BankTransaction> findByReconciliationIdOrderByTransactionDateAscIdAsc(UUID reconciliationId);

    /**
     * Returns the reconciliations referenced by the given transactions without loading the
     * transactions themselves.
     */
    @Query("SELECT DISTINCT t.reconciliationId FROM BankTransaction t " +
            "WHERE t.id IN :ids AND t.reconciliationId IS NOT NULL")
    List<UUID> findReconciliationIdsByIdIn(@Param("ids") Collection<Long> ids);

    /**
     * Loads transactions and takes a row-level write lock on each of them.
     *
     * <p>Rows are locked in ID order, so two requests touching overlapping sets
     * wait on each other instead of deadlocking. The lock is released when the
     * surrounding transaction ends.
     *
     * @param ids Transaction IDs
     * @return Locked transactions that exist, ordered by ID
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM BankTransaction t WHERE t.id IN :ids ORDER BY t.id ASC")
    List<BankTransaction> findAllByIdForUpdate(@Param("ids") Collection<Long> ids);
}
