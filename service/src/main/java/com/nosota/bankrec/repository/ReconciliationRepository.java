package com.nosota.bankrec.repository;

import com.nosota.bankrec.api.model.ReconciliationStatus;
import com.nosota.bankrec.model.Reconciliation;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for {@link Reconciliation} entity operations.
 *
 * <p>Provides data access methods for:
 * <ul>
 *   <li>Conflict-tolerant draft creation</li>
 *   <li>Locking reads used by matching and finalization</li>
 *   <li>Paginated history queries</li>
 * </ul>
 */
@Repository
public interface ReconciliationRepository extends JpaRepository<Reconciliation, UUID> {

    /**
     * Inserts a DRAFT reconciliation unless one already exists for the same bank account
     * and statement date.
     *
     * <p>Relies on the partial unique index {@code uq_reconciliation_draft}: a concurrent
     * insert of the same key waits for the other transaction and then does nothing.
     *
     * @return 1 if a row was inserted, 0 if a draft already existed
     */
    @Modifying
    @Query(value = "INSERT INTO reconciliation (id, bank_account_id, statement_date, statement_ending_balance, " +
            "status, created_by, created_at, updated_at) " +
            "VALUES (:id, :bankAccountId, :statementDate, :statementEndingBalance, 'DRAFT', :createdBy, :now, :now) " +
            "ON CONFLICT (bank_account_id, statement_date) WHERE status = 'DRAFT' DO NOTHING",
            nativeQuery = true)
    int insertDraftIfAbsent(@Param("id") UUID id,
                            @Param("bankAccountId") Integer bankAccountId,
                            @Param("statementDate") LocalDate statementDate,
                            @Param("statementEndingBalance") BigDecimal statementEndingBalance,
                            @Param("createdBy") Long createdBy,
                            @Param("now") LocalDateTime now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Reconciliation r WHERE r.bankAccountId = :bankAccountId " +
            "AND r.statementDate = :statementDate AND r.status = :status")
    Optional<Reconciliation> findForUpdate(@Param("bankAccountId") Integer bankAccountId,
                                           @Param("statementDate") LocalDate statementDate,
                                           @Param("status") ReconciliationStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Reconciliation r WHERE r.id = :id")
    Optional<Reconciliation> findByIdForUpdate(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Reconciliation r WHERE r.id IN :ids ORDER BY r.id ASC")
    List<Reconciliation> findAllByIdForUpdate(@Param("ids") Collection<UUID> ids);

    /**
     * Finds reconciliations of a bank account with a given status, newest statement date first.
     *
     * @param bankAccountId The bank account ID
     * @param status        The reconciliation status
     * @param pageable      Pagination information
     * @return Page of reconciliations
     */
    Page<Reconciliation> findByBankAccountIdAndStatusOrderByStatementDateDescFinalizedAtDesc(
            Integer bankAccountId, ReconciliationStatus status, Pageable pageable);
}
