package com.nosota.bankrec.service;

import com.nosota.bankrec.dto.JournalLine;
import com.nosota.bankrec.error.InvalidRequestException;
import com.nosota.bankrec.error.JournalEntryNotBalancedException;
import com.nosota.bankrec.repository.JournalEntryLineRepository;
import com.nosota.bankrec.repository.JournalEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class JournalEntryServiceTest {

    @Mock
    private JournalEntryRepository journalEntryRepository;

    @Mock
    private JournalEntryLineRepository journalEntryLineRepository;

    private JournalEntryService journalEntryService;

    @BeforeEach
    void setUp() {
        journalEntryService = new JournalEntryService(journalEntryRepository, journalEntryLineRepository);
    }

    @Test
    @DisplayName("J-1: debits must equal credits")
    void rejectsUnbalancedEntry() {
        List<JournalLine> lines = List.of(
                JournalLine.debit(1010, new BigDecimal("100.00"), "x", "USD"),
                JournalLine.credit(3000, new BigDecimal("99.00"), "x", "USD"));

        assertThatThrownBy(() -> journalEntryService.createAndPost(lines, LocalDate.now(), "x", 1L))
                .isInstanceOfSatisfying(JournalEntryNotBalancedException.class, ex -> {
                    assertThat(ex.getTotalDebits()).isEqualByComparingTo("100.00");
                    assertThat(ex.getTotalCredits()).isEqualByComparingTo("99.00");
                });
        verifyNoInteractions(journalEntryRepository, journalEntryLineRepository);
    }

    @Test
    @DisplayName("J-2: an entry needs at least two lines")
    void rejectsSingleLine() {
        List<JournalLine> lines = List.of(JournalLine.debit(1010, new BigDecimal("100.00"), "x", "USD"));

        assertThatThrownBy(() -> journalEntryService.createAndPost(lines, LocalDate.now(), "x", 1L))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    @DisplayName("J-3: a line carries exactly one positive amount")
    void rejectsLineWithBothSides() {
        List<JournalLine> lines = List.of(
                new JournalLine(1010, new BigDecimal("10.00"), new BigDecimal("10.00"), "x", "USD"),
                JournalLine.credit(3000, new BigDecimal("0.00"), "x", "USD"));

        assertThatThrownBy(() -> journalEntryService.createAndPost(lines, LocalDate.now(), "x", 1L))
                .isInstanceOf(InvalidRequestException.class);
    }
}
