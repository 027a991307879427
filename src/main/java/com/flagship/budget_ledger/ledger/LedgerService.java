package com.flagship.budget_ledger.ledger;

import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.exception.NotFoundException;
import com.flagship.budget_ledger.exception.ValidationException;
import com.flagship.budget_ledger.spend.DateNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The journal: the only writer of ledger transactions and entries.
 *
 * Invariants:
 * 1. The signed entries of every transaction sum to zero within
 *    {@link JournalRequest#BALANCE_TOLERANCE}
 * 2. A transaction and its entries are written in one database transaction,
 *    never partially
 * 3. Balances are derived from entries, never stored
 *
 * Validation happens here before any write; the deferred trigger on
 * {@code ledger_entries} re-checks the balance law at commit.
 */
@Service
@Slf4j
public class LedgerService {

    private static final int MAX_AMOUNT_SCALE = 4;
    private static final LocalDate EARLIEST_DATE = LocalDate.of(1900, 1, 1);
    private static final LocalDate LATEST_DATE = LocalDate.of(2999, 12, 31);

    private static final String TRANSACTION_COLUMNS =
        "id, owner_id, occurred_at, description, notes, external_id, deleted_at, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final AccountService accountService;
    private final IdempotencyService idempotencyService;
    private final DateNormalizer dateNormalizer;

    public LedgerService(JdbcTemplate jdbcTemplate,
                         AccountService accountService,
                         IdempotencyService idempotencyService,
                         DateNormalizer dateNormalizer) {
        this.jdbcTemplate = jdbcTemplate;
        this.accountService = accountService;
        this.idempotencyService = idempotencyService;
        this.dateNormalizer = dateNormalizer;
    }

    /**
     * Records a balanced transaction.
     *
     * If the request carries an external id that was already recorded for
     * this owner, the existing transaction is returned and nothing is written.
     *
     * @throws ValidationException if the postings are unbalanced or invalid
     */
    @Transactional
    public RecordedTransaction recordTransaction(UUID ownerId, JournalRequest request) {
        if (request.hasExternalId()) {
            Optional<UUID> existingId = idempotencyService.findTransactionId(ownerId, request.getExternalId());
            if (existingId.isPresent()) {
                log.info("External id {} already recorded as transaction {}",
                    request.getExternalId(), existingId.get());
                return RecordedTransaction.duplicate(loadTransaction(ownerId, existingId.get(), true));
            }
        }

        validate(ownerId, request);

        UUID transactionId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO ledger_transactions (id, owner_id, occurred_at, description, notes, external_id, " +
            "created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
            transactionId,
            ownerId,
            toTimestamp(request.getOccurredAt()),
            request.getDescription().trim(),
            request.getNotes(),
            request.hasExternalId() ? request.getExternalId() : null
        );
        insertEntries(transactionId, request.getPostings());

        if (request.hasExternalId()) {
            idempotencyService.rememberAfterCommit(ownerId, request.getExternalId(), transactionId);
        }

        log.info("Recorded transaction: id={}, owner={}, entries={}, occurredAt={}",
            transactionId, ownerId, request.getPostings().size(), request.getOccurredAt());

        return RecordedTransaction.created(loadTransaction(ownerId, transactionId, false));
    }

    /**
     * Records several transactions as one unit: either all are written or none.
     */
    @Transactional
    public List<RecordedTransaction> recordTransactions(UUID ownerId, List<JournalRequest> requests) {
        if (requests.isEmpty()) {
            throw new ValidationException("At least one transaction is required");
        }
        List<RecordedTransaction> recorded = new ArrayList<>();
        for (JournalRequest request : requests) {
            recorded.add(recordTransaction(ownerId, request));
        }
        return recorded;
    }

    /**
     * Replaces the header fields and all entries of a transaction. The
     * external id, if any, is kept.
     */
    @Transactional
    public TransactionRevision updateTransaction(UUID ownerId, UUID transactionId, JournalRequest request) {
        LedgerTransaction previous = loadTransaction(ownerId, transactionId, false);
        validate(ownerId, request);

        jdbcTemplate.update(
            "UPDATE ledger_transactions SET occurred_at = ?, description = ?, notes = ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            toTimestamp(request.getOccurredAt()),
            request.getDescription().trim(),
            request.getNotes(),
            transactionId
        );
        jdbcTemplate.update("DELETE FROM ledger_entries WHERE transaction_id = ?", transactionId);
        insertEntries(transactionId, request.getPostings());

        log.info("Updated transaction: id={}, owner={}, entries={}", transactionId, ownerId,
            request.getPostings().size());

        return new TransactionRevision(previous, loadTransaction(ownerId, transactionId, false));
    }

    /**
     * Deletes a transaction. A soft delete stamps {@code deleted_at} and keeps
     * the rows; a hard delete removes the header and, by cascade, its entries.
     *
     * @return the transaction as it was before deletion
     */
    @Transactional
    public LedgerTransaction deleteTransaction(UUID ownerId, UUID transactionId, boolean hard) {
        LedgerTransaction existing = loadTransaction(ownerId, transactionId, hard);

        if (hard) {
            jdbcTemplate.update("DELETE FROM ledger_transactions WHERE id = ?", transactionId);
            idempotencyService.forget(ownerId, existing.getExternalId());
        } else {
            jdbcTemplate.update(
                "UPDATE ledger_transactions SET deleted_at = CURRENT_TIMESTAMP, updated_at = CURRENT_TIMESTAMP " +
                "WHERE id = ? AND deleted_at IS NULL",
                transactionId
            );
        }

        log.info("Deleted transaction: id={}, owner={}, hard={}", transactionId, ownerId, hard);
        return existing;
    }

    @Transactional(readOnly = true)
    public LedgerTransaction getTransaction(UUID ownerId, UUID transactionId) {
        return loadTransaction(ownerId, transactionId, false);
    }

    /**
     * Lists live transactions of the owner, optionally limited to an
     * inclusive date range, newest first.
     */
    @Transactional(readOnly = true)
    public List<LedgerTransaction> listTransactions(UUID ownerId, LocalDate from, LocalDate to) {
        DateNormalizer.DateWindow window = dateNormalizer.window(
            from != null ? from : EARLIEST_DATE,
            to != null ? to : LATEST_DATE);
        Instant start = window.getStart();
        Instant end = window.getEndExclusive();

        List<LedgerTransaction> headers = jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM ledger_transactions " +
            "WHERE owner_id = ? AND deleted_at IS NULL AND occurred_at >= ? AND occurred_at < ? " +
            "ORDER BY occurred_at DESC, created_at DESC",
            transactionRowMapper(),
            ownerId,
            toTimestamp(start),
            toTimestamp(end)
        );

        Map<UUID, List<LedgerEntry>> entriesByTransaction = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT e.id, e.transaction_id, e.account_id, e.amount, e.is_reportable, e.sequence_number " +
            "FROM ledger_entries e JOIN ledger_transactions t ON t.id = e.transaction_id " +
            "WHERE t.owner_id = ? AND t.deleted_at IS NULL AND t.occurred_at >= ? AND t.occurred_at < ? " +
            "ORDER BY e.sequence_number",
            rs -> {
                LedgerEntry entry = mapEntry(rs);
                entriesByTransaction.computeIfAbsent(entry.getTransactionId(), id -> new ArrayList<>()).add(entry);
            },
            ownerId,
            toTimestamp(start),
            toTimestamp(end)
        );

        return headers.stream()
            .map(header -> header.withEntries(entriesByTransaction.getOrDefault(header.getId(), List.of())))
            .toList();
    }

    /**
     * Signed balance of an account (debits positive), derived from the
     * entries of live transactions.
     */
    public BigDecimal getAccountBalance(UUID accountId) {
        BigDecimal balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(e.amount), 0) FROM ledger_entries e " +
            "JOIN ledger_transactions t ON t.id = e.transaction_id " +
            "WHERE e.account_id = ? AND t.deleted_at IS NULL",
            BigDecimal.class,
            accountId
        );
        return balance != null ? balance : BigDecimal.ZERO;
    }

    public List<LedgerEntry> getLedgerEntriesForTransaction(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT id, transaction_id, account_id, amount, is_reportable, sequence_number " +
            "FROM ledger_entries WHERE transaction_id = ? ORDER BY sequence_number",
            (rs, rowNum) -> mapEntry(rs),
            transactionId
        );
    }

    void validate(UUID ownerId, JournalRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();

        if (request.getDescription() == null || request.getDescription().isBlank()) {
            errors.put("description", "Description is required");
        }
        if (request.getOccurredAt() == null) {
            errors.put("date", "Date is required");
        }

        List<JournalRequest.Posting> postings = request.getPostings();
        if (postings == null || postings.size() < 2) {
            errors.put("entries", "A transaction needs at least two entries");
            throw new ValidationException("A transaction needs at least two entries", errors);
        }

        for (int i = 0; i < postings.size(); i++) {
            JournalRequest.Posting posting = postings.get(i);
            if (posting.getAccountId() == null) {
                errors.put("entries[" + i + "].account_id", "Account is required");
            }
            BigDecimal amount = posting.getAmount();
            if (amount == null || amount.signum() == 0) {
                errors.put("entries[" + i + "].amount", "Amount must be non-zero");
            } else if (amount.stripTrailingZeros().scale() > MAX_AMOUNT_SCALE) {
                errors.put("entries[" + i + "].amount", "Amount has more than " + MAX_AMOUNT_SCALE + " decimal places");
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Transaction is invalid", errors);
        }

        if (!request.isBalanced()) {
            throw new ValidationException(
                String.format("Transaction is not balanced: sum of entries = %s", request.getTotal().toPlainString()),
                Map.of("entries", "Entry amounts must sum to zero"));
        }

        for (int i = 0; i < postings.size(); i++) {
            UUID accountId = postings.get(i).getAccountId();
            Optional<Account> account = accountService.getAccount(accountId)
                .filter(candidate -> candidate.isOwnedBy(ownerId));
            if (account.isEmpty()) {
                errors.put("entries[" + i + "].account_id", "Account not found: " + accountId);
            } else if (!account.get().isActive()) {
                errors.put("entries[" + i + "].account_id", "Account is inactive: " + accountId);
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Transaction references invalid accounts", errors);
        }
    }

    private void insertEntries(UUID transactionId, List<JournalRequest.Posting> postings) {
        for (JournalRequest.Posting posting : postings) {
            jdbcTemplate.update(
                "INSERT INTO ledger_entries (id, transaction_id, account_id, amount, is_reportable, created_at) " +
                "VALUES (?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
                UUID.randomUUID(),
                transactionId,
                posting.getAccountId(),
                posting.getAmount(),
                posting.isReportable()
            );
        }
    }

    private LedgerTransaction loadTransaction(UUID ownerId, UUID transactionId, boolean includeDeleted) {
        LedgerTransaction header = jdbcTemplate.query(
                "SELECT " + TRANSACTION_COLUMNS + " FROM ledger_transactions WHERE id = ? AND owner_id = ?",
                transactionRowMapper(),
                transactionId,
                ownerId
            ).stream()
            .filter(transaction -> includeDeleted || !transaction.isDeleted())
            .findFirst()
            .orElseThrow(() -> NotFoundException.of("Transaction", transactionId));
        return header.withEntries(getLedgerEntriesForTransaction(transactionId));
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    private static LedgerEntry mapEntry(ResultSet rs) throws SQLException {
        return new LedgerEntry(
            rs.getObject("id", UUID.class),
            rs.getObject("transaction_id", UUID.class),
            rs.getObject("account_id", UUID.class),
            rs.getBigDecimal("amount"),
            rs.getBoolean("is_reportable"),
            rs.getLong("sequence_number")
        );
    }

    private RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new LedgerTransaction(
            rs.getObject("id", UUID.class),
            rs.getObject("owner_id", UUID.class),
            toInstant(rs, "occurred_at"),
            rs.getString("description"),
            rs.getString("notes"),
            rs.getString("external_id"),
            toInstant(rs, "deleted_at"),
            toInstant(rs, "created_at"),
            toInstant(rs, "updated_at"),
            List.of()
        );
    }
}
