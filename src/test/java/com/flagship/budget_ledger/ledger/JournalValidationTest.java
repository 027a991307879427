package com.flagship.budget_ledger.ledger;

import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.account.AccountType;
import com.flagship.budget_ledger.account.CurrencyCode;
import com.flagship.budget_ledger.exception.ValidationException;
import com.flagship.budget_ledger.spend.DateNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Input checks that run before the journal writes anything.
 */
@ExtendWith(MockitoExtension.class)
class JournalValidationTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private AccountService accountService;

    @Mock
    private IdempotencyService idempotencyService;

    private LedgerService ledgerService;

    private final UUID owner = UUID.randomUUID();
    private final UUID cash = UUID.randomUUID();
    private final UUID groceries = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        ledgerService = new LedgerService(jdbcTemplate, accountService, idempotencyService, new DateNormalizer("UTC"));
        lenient().when(accountService.getAccount(cash))
            .thenReturn(Optional.of(account(cash, owner, AccountType.ASSET, true)));
        lenient().when(accountService.getAccount(groceries))
            .thenReturn(Optional.of(account(groceries, owner, AccountType.EXPENSE, true)));
    }

    @Test
    @DisplayName("Unbalanced postings are rejected before any write")
    void rejectsUnbalanced() {
        JournalRequest request = request()
            .posting(JournalRequest.Posting.of(cash, new BigDecimal("-50")))
            .posting(JournalRequest.Posting.of(groceries, new BigDecimal("45")))
            .build();

        ValidationException e = assertThrows(ValidationException.class,
            () -> ledgerService.recordTransaction(owner, request));

        assertTrue(e.getMessage().contains("not balanced"));
        assertTrue(e.getMessage().contains("-5"));
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    @DisplayName("A difference within the tolerance still balances")
    void acceptsWithinTolerance() {
        JournalRequest request = request()
            .posting(JournalRequest.Posting.of(cash, new BigDecimal("-10.0000")))
            .posting(JournalRequest.Posting.of(groceries, new BigDecimal("9.9999")))
            .build();

        assertTrue(request.isBalanced());
        assertDoesNotThrow(() -> ledgerService.validate(owner, request));
    }

    @Test
    @DisplayName("A single posting is not a transaction")
    void rejectsSinglePosting() {
        JournalRequest request = request()
            .posting(JournalRequest.Posting.of(cash, BigDecimal.ZERO))
            .build();

        ValidationException e = assertThrows(ValidationException.class, () -> ledgerService.validate(owner, request));
        assertTrue(e.getDetails().containsKey("entries"));
    }

    @Test
    @DisplayName("Zero amounts and more than four decimals are field errors")
    void rejectsBadAmounts() {
        JournalRequest request = request()
            .posting(JournalRequest.Posting.of(cash, BigDecimal.ZERO))
            .posting(JournalRequest.Posting.of(groceries, new BigDecimal("0.00001")))
            .build();

        ValidationException e = assertThrows(ValidationException.class, () -> ledgerService.validate(owner, request));
        assertTrue(e.getDetails().containsKey("entries[0].amount"));
        assertTrue(e.getDetails().containsKey("entries[1].amount"));
    }

    @Test
    @DisplayName("Accounts of other owners and inactive accounts are refused")
    void rejectsForeignAndInactiveAccounts() {
        UUID foreign = UUID.randomUUID();
        UUID inactive = UUID.randomUUID();
        lenient().when(accountService.getAccount(foreign))
            .thenReturn(Optional.of(account(foreign, UUID.randomUUID(), AccountType.ASSET, true)));
        lenient().when(accountService.getAccount(inactive))
            .thenReturn(Optional.of(account(inactive, owner, AccountType.EXPENSE, false)));

        JournalRequest request = request()
            .posting(JournalRequest.Posting.of(foreign, new BigDecimal("-20")))
            .posting(JournalRequest.Posting.of(inactive, new BigDecimal("20")))
            .build();

        ValidationException e = assertThrows(ValidationException.class, () -> ledgerService.validate(owner, request));
        assertTrue(e.getDetails().get("entries[0].account_id").startsWith("Account not found"));
        assertTrue(e.getDetails().get("entries[1].account_id").startsWith("Account is inactive"));
    }

    @Test
    @DisplayName("Description and date are required")
    void requiresHeaderFields() {
        JournalRequest request = JournalRequest.builder()
            .posting(JournalRequest.Posting.debit(groceries, BigDecimal.TEN))
            .posting(JournalRequest.Posting.credit(cash, BigDecimal.TEN))
            .build();

        ValidationException e = assertThrows(ValidationException.class, () -> ledgerService.validate(owner, request));
        assertTrue(e.getDetails().containsKey("description"));
        assertTrue(e.getDetails().containsKey("date"));
    }

    @Test
    @DisplayName("Debit and credit helpers produce conventional signs")
    void postingHelpers() {
        assertEquals(new BigDecimal("12.50"), JournalRequest.Posting.debit(groceries, new BigDecimal("-12.50")).getAmount());
        assertEquals(new BigDecimal("-12.50"), JournalRequest.Posting.credit(cash, new BigDecimal("12.50")).getAmount());
        assertEquals(EntryType.CREDIT,
            new LedgerEntry(null, null, cash, new BigDecimal("-1"), true, 1L).getEntryType());
    }

    private JournalRequest.JournalRequestBuilder request() {
        return JournalRequest.builder()
            .description("Weekly shop")
            .occurredAt(Instant.parse("2024-01-10T12:00:00Z"));
    }

    private static Account account(UUID id, UUID ownerId, AccountType type, boolean active) {
        return new Account(id, ownerId, type.name(), type, null, active, CurrencyCode.USD, Instant.now());
    }
}
