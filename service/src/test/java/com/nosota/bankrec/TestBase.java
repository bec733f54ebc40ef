package com.nosota.bankrec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.bankrec.api.model.TransactionType;
import com.nosota.bankrec.api.request.RecordBankTransactionRequest;
import com.nosota.bankrec.dto.JournalLine;
import com.nosota.bankrec.model.BankTransaction;
import com.nosota.bankrec.repository.BankTransactionRepository;
import com.nosota.bankrec.repository.ReconciliationRepository;
import com.nosota.bankrec.service.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base class for integration tests against a PostgreSQL container.
 *
 * <p>Tests do not roll back: every test works on its own bank account, so committed data
 * of other tests never shows up in its pools or history.
 */
@SpringBootTest(
        classes = BankRecApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.MOCK
)
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
public abstract class TestBase {
    protected static final DockerImageName DOCKER_IMAGE = DockerImageName.parse("postgres:16.6")
            .asCompatibleSubstituteFor("postgres");
    protected static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>(DOCKER_IMAGE);

    protected static final Long ACTOR_ID = 42L;
    protected static final Integer EQUITY_GL = 3000;
    protected static final Integer BANK_CHARGES_GL = 6100;

    @Autowired
    protected BankAccountService bankAccountService;

    @Autowired
    protected BankTransactionService bankTransactionService;

    @Autowired
    protected JournalEntryFactory journalEntryFactory;

    @Autowired
    protected ReconciliationDraftService draftService;

    @Autowired
    protected ReconciliationSummaryService summaryService;

    @Autowired
    protected MatchingService matchingService;

    @Autowired
    protected FinalizationService finalizationService;

    @Autowired
    protected StatementItemBookingService bookingService;

    @Autowired
    protected TransactionPool transactionPool;

    @Autowired
    protected BankTransactionRepository bankTransactionRepository;

    @Autowired
    protected ReconciliationRepository reconciliationRepository;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    // Each bank account gets its own GL account so balances never mix between tests
    private static final AtomicInteger glAccountCounter = new AtomicInteger(10000);

    /**
     * Creates an active bank account linked to a fresh GL account.
     */
    protected Integer createBankAccount() {
        return bankAccountService.createBankAccount("Operating", "ACC-" + glAccountCounter.get(),
                "First Bank", "USD", glAccountCounter.getAndIncrement()).getId();
    }

    protected Integer glAccountOf(Integer bankAccountId) {
        return bankAccountService.getById(bankAccountId).getGlAccountId();
    }

    /**
     * Posts an opening balance to the bank's GL account against equity.
     */
    protected void postOpeningBalance(Integer bankAccountId, String amount, LocalDate date) throws Exception {
        BigDecimal value = new BigDecimal(amount);
        journalEntryFactory.createAndPost(List.of(
                        JournalLine.debit(glAccountOf(bankAccountId), value, "Opening balance", "USD"),
                        JournalLine.credit(EQUITY_GL, value, "Opening balance", "USD")),
                date, "Opening balance", ACTOR_ID);
    }

    protected BankTransaction statementItem(Integer bankAccountId, String amount, TransactionType type,
                                            LocalDate date, String description) throws Exception {
        return record(bankAccountId, amount, type, date, description, true);
    }

    /**
     * Records a system-sourced transaction together with its journal entry so that the
     * GL balance includes it.
     */
    protected BankTransaction bookItem(Integer bankAccountId, String amount, TransactionType type,
                                       LocalDate date, String description) throws Exception {
        BigDecimal value = new BigDecimal(amount);
        Integer bankGl = glAccountOf(bankAccountId);
        List<JournalLine> lines = value.signum() > 0
                ? List.of(JournalLine.debit(bankGl, value, description, "USD"),
                JournalLine.credit(EQUITY_GL, value, description, "USD"))
                : List.of(JournalLine.credit(bankGl, value.abs(), description, "USD"),
                JournalLine.debit(EQUITY_GL, value.abs(), description, "USD"));
        journalEntryFactory.createAndPost(lines, date, description, ACTOR_ID);
        return record(bankAccountId, amount, type, date, description, false);
    }

    protected BankTransaction record(Integer bankAccountId, String amount, TransactionType type,
                                     LocalDate date, String description, boolean fromStatement) throws Exception {
        return bankTransactionService.recordTransaction(bankAccountId, new RecordBankTransactionRequest(
                date, null, new BigDecimal(amount), description, null, type, fromStatement, ACTOR_ID));
    }

    protected BankTransaction reload(BankTransaction transaction) {
        return bankTransactionRepository.findById(transaction.getId()).orElseThrow();
    }
}
