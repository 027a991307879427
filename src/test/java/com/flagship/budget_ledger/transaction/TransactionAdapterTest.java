package com.flagship.budget_ledger.transaction;

import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.account.AccountType;
import com.flagship.budget_ledger.account.Category;
import com.flagship.budget_ledger.account.CurrencyCode;
import com.flagship.budget_ledger.exception.ValidationException;
import com.flagship.budget_ledger.ledger.JournalRequest;
import com.flagship.budget_ledger.ledger.JournalService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TransactionAdapterTest {

    @Mock
    private AccountService accountService;

    @Mock
    private JournalService journalService;

    @InjectMocks
    private TransactionAdapter adapter;

    private final UUID owner = UUID.randomUUID();
    private final Account cash = account("Cash", AccountType.ASSET);
    private final Account reimbursable = account("Reimbursable", AccountType.ASSET);
    private final Account groceries = account("Groceries", AccountType.EXPENSE);
    private final Account dining = account("Dining", AccountType.EXPENSE);

    @BeforeEach
    void setUp() {
        when(accountService.getOrCreateAccount(owner, "Cash", AccountType.ASSET)).thenReturn(cash);
        when(accountService.getOrCreateAccount(owner, "Reimbursable", AccountType.ASSET)).thenReturn(reimbursable);
        when(accountService.requireCategory(owner, groceries.getId())).thenReturn(Category.fromAccount(groceries));
        when(accountService.requireCategory(owner, dining.getId())).thenReturn(Category.fromAccount(dining));
    }

    @Test
    @DisplayName("An expense without a source credits Cash and debits the category")
    void expenseDefaultsToCash() {
        List<JournalRequest> requests = adapter.buildRequests(owner, command(TransactionKind.EXPENSE)
            .amount(new BigDecimal("-42.10"))
            .categoryId(groceries.getId())
            .build());

        assertEquals(1, requests.size());
        JournalRequest request = requests.get(0);
        assertTrue(request.isBalanced());
        assertPosting(request, 0, cash.getId(), "-42.10");
        assertPosting(request, 1, groceries.getId(), "42.10");
    }

    @Test
    @DisplayName("A transfer needs a destination")
    void transferRequiresDestination() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> adapter.buildRequests(owner, command(TransactionKind.TRANSFER).amount(BigDecimal.TEN).build()));

        assertTrue(e.getDetails().containsKey("destination_account_id"));
    }

    @Test
    @DisplayName("Each split becomes its own balanced transaction with a derived external id")
    void splitsBecomeSeparateTransactions() {
        List<JournalRequest> requests = adapter.buildRequests(owner, command(TransactionKind.SPLIT)
            .externalId("bank-991")
            .split(new TransactionCommand.SplitLine(groceries.getId(), new BigDecimal("30.00"), "Food"))
            .split(new TransactionCommand.SplitLine(dining.getId(), new BigDecimal("12.00"), null))
            .build());

        assertEquals(2, requests.size());
        assertTrue(requests.stream().allMatch(JournalRequest::isBalanced));
        assertEquals("Food", requests.get(0).getDescription());
        assertEquals("Market run", requests.get(1).getDescription());
        assertEquals("bank-991#1", requests.get(0).getExternalId());
        assertEquals("bank-991#2", requests.get(1).getExternalId());
    }

    @Test
    @DisplayName("A split is recorded through the all-or-nothing batch")
    void splitUsesBatch() {
        adapter.record(owner, command(TransactionKind.SPLIT)
            .split(new TransactionCommand.SplitLine(groceries.getId(), new BigDecimal("30.00"), null))
            .split(new TransactionCommand.SplitLine(dining.getId(), new BigDecimal("12.00"), null))
            .build());

        verify(journalService).recordAll(any(), any());
        verify(journalService, never()).record(any(), any());
    }

    @Nested
    @DisplayName("Shared expenses")
    class Shared {

        @Test
        @DisplayName("An equal split between three rounds the personal share to cents")
        void equalShare() {
            JournalRequest request = shared(ShareMethod.EQUAL, "3", "100.00");

            assertTrue(request.isBalanced());
            assertPosting(request, 0, cash.getId(), "-100.00");
            assertPosting(request, 1, groceries.getId(), "33.33");
            assertPosting(request, 2, reimbursable.getId(), "66.67");
            assertFalse(request.getPostings().get(2).isReportable());
        }

        @Test
        @DisplayName("A percentage share of the total")
        void percentageShare() {
            JournalRequest request = shared(ShareMethod.PERCENTAGE, "25", "80.00");

            assertPosting(request, 1, groceries.getId(), "20.00");
            assertPosting(request, 2, reimbursable.getId(), "60.00");
        }

        @Test
        @DisplayName("A fixed share equal to the total needs no reimbursable posting")
        void fixedShareCoversEverything() {
            JournalRequest request = shared(ShareMethod.FIXED, "80.00", "80.00");

            assertEquals(2, request.getPostings().size());
            verify(accountService, never()).getOrCreateAccount(owner, "Reimbursable", AccountType.ASSET);
        }

        @Test
        @DisplayName("A fixed share a cent over the total is capped at the total")
        void fixedShareWithinToleranceIsCapped() {
            assertEquals(new BigDecimal("50.00"),
                TransactionAdapter.personalShare(new BigDecimal("50.00"), ShareMethod.FIXED, new BigDecimal("50.01")));

            JournalRequest request = shared(ShareMethod.FIXED, "50.01", "50.00");

            assertTrue(request.isBalanced());
            assertEquals(2, request.getPostings().size());
            assertPosting(request, 1, groceries.getId(), "50.00");
            verify(accountService, never()).getOrCreateAccount(owner, "Reimbursable", AccountType.ASSET);
        }

        @Test
        @DisplayName("Zero or negative people count as one")
        void equalWithNoPeopleMeansOne() {
            assertEquals(new BigDecimal("50.00"),
                TransactionAdapter.personalShare(new BigDecimal("50.00"), ShareMethod.EQUAL, BigDecimal.ZERO));
        }

        @Test
        @DisplayName("A personal share above the total or below zero is rejected")
        void rejectsImpossibleShares() {
            assertThrows(ValidationException.class,
                () -> TransactionAdapter.personalShare(new BigDecimal("50.00"), ShareMethod.FIXED, new BigDecimal("50.02")));
            assertThrows(ValidationException.class,
                () -> TransactionAdapter.personalShare(new BigDecimal("50.00"), ShareMethod.PERCENTAGE, new BigDecimal("-10")));
            assertDoesNotThrow(
                () -> TransactionAdapter.personalShare(new BigDecimal("50.00"), ShareMethod.FIXED, new BigDecimal("50.01")));
        }

        private JournalRequest shared(ShareMethod method, String value, String amount) {
            return adapter.buildRequests(owner, command(TransactionKind.SHARED)
                .amount(new BigDecimal(amount))
                .categoryId(groceries.getId())
                .shareMethod(method)
                .shareValue(new BigDecimal(value))
                .build()).get(0);
        }
    }

    private TransactionCommand.TransactionCommandBuilder command(TransactionKind kind) {
        return TransactionCommand.builder()
            .kind(kind)
            .description("Market run")
            .occurredAt(Instant.parse("2024-01-12T10:00:00Z"));
    }

    private static void assertPosting(JournalRequest request, int index, UUID accountId, String amount) {
        JournalRequest.Posting posting = request.getPostings().get(index);
        assertEquals(accountId, posting.getAccountId());
        assertEquals(0, new BigDecimal(amount).compareTo(posting.getAmount()),
            "posting " + index + " was " + posting.getAmount());
    }

    private Account account(String name, AccountType type) {
        return new Account(UUID.randomUUID(), owner, name, type, null, true, CurrencyCode.USD, Instant.now());
    }
}
