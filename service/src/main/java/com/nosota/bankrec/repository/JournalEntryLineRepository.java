package com.nosota.bankrec.repository;

import com.nosota.bankrec.model.JournalEntryLine;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface JournalEntryLineRepository extends JpaRepository<JournalEntryLine, Long> {

    List<JournalEntryLine> findByJournalEntryIdOrderByIdAsc(UUID journalEntryId);

    /**
     * Sums debits minus credits posted to a GL account by entries dated on or before {@code asOf}.
     *
     * @param glAccountId The GL account ID
     * @param asOf        Inclusive entry date bound
     * @return Balance, or null if the account has no lines in range
     */
    @Query("SELECT SUM(l.debitAmount - l.creditAmount) FROM JournalEntryLine l, JournalEntry e " +
            "WHERE l.journalEntryId = e.id AND l.glAccountId = :glAccountId AND e.entryDate <= :asOf")
    BigDecimal sumBalance(@Param("glAccountId") Integer glAccountId, @Param("asOf") LocalDate asOf);
}
