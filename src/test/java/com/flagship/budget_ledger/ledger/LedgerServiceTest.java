package com.flagship.budget_ledger.ledger;

import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.account.AccountType;
import com.flagship.budget_ledger.account.CurrencyCode;
import com.flagship.budget_ledger.account.Party;
import com.flagship.budget_ledger.budget.BudgetMonth;
import com.flagship.budget_ledger.exception.DuplicateResourceException;
import com.flagship.budget_ledger.exception.ValidationException;
import com.flagship.budget_ledger.spend.SpendAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.NestedRuntimeException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the journal. Every rejected write must leave no rows
 * behind, and the database must refuse unbalanced entries even when the
 * service is bypassed.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class LedgerServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_budget_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("rollover.retry.enabled", () -> "false");
    }

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JournalService journalService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private SpendAggregator spendAggregator;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private UUID owner;
    private Account cash;
    private Account groceries;

    @BeforeEach
    void setUp() {
        owner = accountService.createParty(Party.PartyType.USER, "Ledger test").getId();
        cash = accountService.getOrCreateAccount(owner, "Cash", AccountType.ASSET);
        groceries = accountService.createAccount(owner, "Groceries", AccountType.EXPENSE, null, CurrencyCode.USD);
    }

    @Test
    @DisplayName("Balanced postings are stored and move both balances")
    void recordsBalancedTransaction() {
        RecordedTransaction recorded = ledgerService.recordTransaction(owner, purchase("Weekly shop", "64.20", null));

        assertFalse(recorded.isDuplicate());
        assertEquals(2, ledgerService.getLedgerEntriesForTransaction(recorded.getTransaction().getId()).size());
        assertEquals(0, new BigDecimal("-64.20").compareTo(ledgerService.getAccountBalance(cash.getId())));
        assertEquals(0, new BigDecimal("64.20").compareTo(ledgerService.getAccountBalance(groceries.getId())));
    }

    @Test
    @DisplayName("Postings summing to -5 are rejected and nothing is written")
    void rejectsUnbalancedPostings() {
        JournalRequest request = JournalRequest.builder()
            .description("Off by five")
            .occurredAt(Instant.parse("2024-01-10T12:00:00Z"))
            .posting(JournalRequest.Posting.of(cash.getId(), new BigDecimal("-50")))
            .posting(JournalRequest.Posting.of(groceries.getId(), new BigDecimal("45")))
            .build();

        assertThrows(ValidationException.class, () -> ledgerService.recordTransaction(owner, request));

        assertEquals(0, countEntries(cash.getId()));
        assertEquals(0, countEntries(groceries.getId()));
        assertEquals(0, countTransactions());
    }

    @Test
    @DisplayName("The database refuses an unbalanced write that bypasses the service")
    void databaseRejectsUnbalancedCommit() {
        UUID transactionId = UUID.randomUUID();

        // Given: a header and a single entry written directly
        // When: the transaction commits
        // Then: the deferred balance trigger aborts it
        assertThrows(NestedRuntimeException.class, () -> transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.update(
                "INSERT INTO ledger_transactions (id, owner_id, occurred_at, description) " +
                "VALUES (?, ?, CURRENT_TIMESTAMP, 'Half a transaction')",
                transactionId, owner);
            jdbcTemplate.update(
                "INSERT INTO ledger_entries (id, transaction_id, account_id, amount) VALUES (?, ?, ?, 25.00)",
                UUID.randomUUID(), transactionId, groceries.getId());
        }));

        assertEquals(0, countTransactions());
        assertEquals(0, countEntries(groceries.getId()));
    }

    @Test
    @DisplayName("Recording the same external id twice returns the first transaction")
    void externalIdIsIdempotent() {
        RecordedTransaction first = ledgerService.recordTransaction(owner, purchase("Bakery", "8.50", "bank-4711"));
        RecordedTransaction second = ledgerService.recordTransaction(owner, purchase("Bakery", "8.50", "bank-4711"));

        assertFalse(first.isDuplicate());
        assertTrue(second.isDuplicate());
        assertEquals(first.getTransaction().getId(), second.getTransaction().getId());
        assertEquals(1, countTransactions());
    }

    @Test
    @DisplayName("A soft-deleted transaction disappears from lists, balances and spend")
    void softDeleteHidesTransaction() {
        UUID id = journalService.record(owner, purchase("Market", "30.00", null)).getTransaction().getId();

        LedgerTransaction before = journalService.delete(owner, id, false);

        assertFalse(before.isDeleted());
        assertTrue(ledgerService.listTransactions(owner, null, null).isEmpty());
        assertEquals(0, BigDecimal.ZERO.compareTo(ledgerService.getAccountBalance(groceries.getId())));
        assertEquals(0, BigDecimal.ZERO.compareTo(
            spendAggregator.spendForMonth(owner, groceries.getId(), BudgetMonth.parse("2024-01"))));
        assertEquals(1, countTransactions());
    }

    @Test
    @DisplayName("A hard delete removes the header and its entries")
    void hardDeleteRemovesRows() {
        UUID id = journalService.record(owner, purchase("Market", "30.00", null)).getTransaction().getId();

        journalService.delete(owner, id, true);

        assertEquals(0, countTransactions());
        assertEquals(0, countEntries(groceries.getId()));
    }

    @Test
    @DisplayName("An update replaces every entry and keeps the external id")
    void updateReplacesEntries() {
        UUID id = ledgerService.recordTransaction(owner, purchase("Market", "30.00", "bank-1")).getTransaction().getId();
        Account dining = accountService.createAccount(owner, "Dining", AccountType.EXPENSE, null, CurrencyCode.USD);

        JournalRequest revised = JournalRequest.builder()
            .description("Market and lunch")
            .occurredAt(Instant.parse("2024-01-11T12:00:00Z"))
            .posting(JournalRequest.Posting.credit(cash.getId(), new BigDecimal("42.00")))
            .posting(JournalRequest.Posting.debit(groceries.getId(), new BigDecimal("30.00")))
            .posting(JournalRequest.Posting.debit(dining.getId(), new BigDecimal("12.00")))
            .build();
        TransactionRevision revision = ledgerService.updateTransaction(owner, id, revised);

        assertEquals(2, revision.getPrevious().getEntries().size());
        assertEquals(3, revision.getCurrent().getEntries().size());
        assertEquals("bank-1", revision.getCurrent().getExternalId());
        assertEquals(0, new BigDecimal("-42.00").compareTo(ledgerService.getAccountBalance(cash.getId())));
    }

    @Test
    @DisplayName("Listing by date range is inclusive on both ends")
    void listByDateRange() {
        ledgerService.recordTransaction(owner, purchaseOn("2024-01-31T23:30:00Z"));
        ledgerService.recordTransaction(owner, purchaseOn("2024-02-01T00:00:00Z"));
        ledgerService.recordTransaction(owner, purchaseOn("2024-02-29T12:00:00Z"));

        List<LedgerTransaction> february = ledgerService.listTransactions(owner,
            LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 29));

        assertEquals(2, february.size());
        assertTrue(february.get(0).getOccurredAt().isAfter(february.get(1).getOccurredAt()));
    }

    @Test
    @DisplayName("Concurrent get-or-create calls share one account")
    void getOrCreateAccountIsRaceFree() throws InterruptedException {
        int threadCount = 6;
        Set<UUID> ids = ConcurrentHashMap.newKeySet();
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    ids.add(accountService.getOrCreateAccount(owner, "Savings", AccountType.ASSET).getId());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, ids.size());
        Integer rows = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM accounts WHERE owner_id = ? AND name = 'Savings'", Integer.class, owner);
        assertEquals(1, rows);
        assertEquals(ids.iterator().next(),
            accountService.getOrCreateAccount(owner, "Savings", AccountType.ASSET).getId());
    }

    @Test
    @DisplayName("A second active account with the same name is refused until the first is deactivated")
    void accountNamesAreUniquePerOwner() {
        assertThrows(DuplicateResourceException.class,
            () -> accountService.createAccount(owner, "Groceries", AccountType.EXPENSE, null, CurrencyCode.USD));

        accountService.deactivateAccount(owner, groceries.getId());
        Account replacement = accountService.createAccount(owner, "Groceries", AccountType.EXPENSE, null,
            CurrencyCode.USD);

        assertNotEquals(groceries.getId(), replacement.getId());
    }

    private JournalRequest purchase(String description, String amount, String externalId) {
        return JournalRequest.builder()
            .description(description)
            .occurredAt(Instant.parse("2024-01-10T12:00:00Z"))
            .externalId(externalId)
            .posting(JournalRequest.Posting.credit(cash.getId(), new BigDecimal(amount)))
            .posting(JournalRequest.Posting.debit(groceries.getId(), new BigDecimal(amount)))
            .build();
    }

    private JournalRequest purchaseOn(String instant) {
        return purchase("Dated purchase", "10.00", null).toBuilder()
            .occurredAt(Instant.parse(instant))
            .build();
    }

    private int countTransactions() {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_transactions WHERE owner_id = ?", Integer.class, owner);
        return count != null ? count : 0;
    }

    private int countEntries(UUID accountId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE account_id = ?", Integer.class, accountId);
        return count != null ? count : 0;
    }
}
