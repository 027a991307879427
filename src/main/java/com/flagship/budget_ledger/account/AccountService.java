package com.flagship.budget_ledger.account;

import com.flagship.budget_ledger.exception.DuplicateResourceException;
import com.flagship.budget_ledger.exception.NotFoundException;
import com.flagship.budget_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Chart of accounts: parties, accounts and the category view of expense
 * accounts. Plain JDBC, like the ledger it feeds.
 */
@Service
@Slf4j
public class AccountService {

    /**
     * Accounts every new party gets when seeding is requested, in creation order.
     */
    static final Map<String, AccountType> DEFAULT_ACCOUNTS = defaultAccounts();

    private static final String ACCOUNT_COLUMNS =
        "id, owner_id, name, account_type, parent_id, is_active, currency, created_at";

    private static final String INSERT_ACCOUNT =
        "INSERT INTO accounts (id, owner_id, name, account_type, parent_id, is_active, currency, created_at) " +
        "VALUES (?, ?, ?, ?, ?, TRUE, ?, CURRENT_TIMESTAMP)";

    private final JdbcTemplate jdbcTemplate;

    public AccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public Party createParty(Party.PartyType partyType, String name) {
        UUID partyId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO parties (id, party_type, name, created_at) VALUES (?, ?, ?, CURRENT_TIMESTAMP)",
            partyId,
            partyType.name(),
            name
        );
        log.info("Created party: id={}, type={}", partyId, partyType);
        return requireParty(partyId);
    }

    public Optional<Party> getParty(UUID partyId) {
        return jdbcTemplate.query(
            "SELECT id, party_type, name, created_at FROM parties WHERE id = ?",
            partyRowMapper(),
            partyId
        ).stream().findFirst();
    }

    public Party requireParty(UUID partyId) {
        return getParty(partyId).orElseThrow(() -> NotFoundException.of("Party", partyId));
    }

    @Transactional
    public Account createAccount(UUID ownerId, String name, AccountType accountType,
                                 UUID parentId, CurrencyCode currency) {
        requireParty(ownerId);
        if (name == null || name.isBlank()) {
            throw ValidationException.forField("name", "Account name is required");
        }
        if (parentId != null) {
            requireAccount(ownerId, parentId);
        }

        UUID accountId = UUID.randomUUID();
        try {
            jdbcTemplate.update(
                INSERT_ACCOUNT,
                accountId,
                ownerId,
                name.trim(),
                accountType.name(),
                parentId,
                (currency != null ? currency : CurrencyCode.USD).name()
            );
        } catch (DuplicateKeyException e) {
            throw new DuplicateResourceException("Account already exists: " + name.trim());
        }
        log.debug("Created account: id={}, owner={}, name={}, type={}", accountId, ownerId, name, accountType);
        return requireAccount(ownerId, accountId);
    }

    /**
     * Creates the default chart of accounts for a party, skipping names that
     * already exist.
     */
    @Transactional
    public List<Account> seedDefaultAccounts(UUID ownerId) {
        List<Account> accounts = new ArrayList<>();
        DEFAULT_ACCOUNTS.forEach((name, type) -> accounts.add(getOrCreateAccount(ownerId, name, type)));
        return accounts;
    }

    /**
     * Returns the active account with this name, creating it when missing.
     * Concurrent callers for the same name end up with the same account: the
     * insert yields to whichever one the unique index saw first.
     */
    @Transactional
    public Account getOrCreateAccount(UUID ownerId, String name, AccountType accountType) {
        Optional<Account> existing = getAccountByName(ownerId, name);
        if (existing.isPresent()) {
            return existing.get();
        }
        requireParty(ownerId);

        int inserted = jdbcTemplate.update(
            INSERT_ACCOUNT + " ON CONFLICT (owner_id, name) WHERE is_active DO NOTHING",
            UUID.randomUUID(),
            ownerId,
            name,
            accountType.name(),
            null,
            CurrencyCode.USD.name()
        );
        if (inserted == 0) {
            log.debug("Account created concurrently: owner={}, name={}", ownerId, name);
        }
        return getAccountByName(ownerId, name)
            .orElseThrow(() -> new IllegalStateException("Account " + name + " missing after insert"));
    }

    public Optional<Account> getAccount(UUID accountId) {
        return jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE id = ?",
            accountRowMapper(),
            accountId
        ).stream().findFirst();
    }

    /**
     * Returns the account if it exists and belongs to the owner.
     * Accounts of other parties are reported as missing.
     */
    public Account requireAccount(UUID ownerId, UUID accountId) {
        return getAccount(accountId)
            .filter(account -> account.isOwnedBy(ownerId))
            .orElseThrow(() -> NotFoundException.of("Account", accountId));
    }

    public Optional<Account> getAccountByName(UUID ownerId, String name) {
        return jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE owner_id = ? AND name = ? AND is_active " +
            "ORDER BY created_at LIMIT 1",
            accountRowMapper(),
            ownerId,
            name
        ).stream().findFirst();
    }

    /**
     * Lists active accounts of the owner, optionally restricted to one type.
     */
    public List<Account> getAccounts(UUID ownerId, AccountType accountType) {
        if (accountType == null) {
            return jdbcTemplate.query(
                "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE owner_id = ? AND is_active ORDER BY name",
                accountRowMapper(),
                ownerId
            );
        }
        return jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM accounts " +
            "WHERE owner_id = ? AND account_type = ? AND is_active ORDER BY name",
            accountRowMapper(),
            ownerId,
            accountType.name()
        );
    }

    public List<Category> getCategories(UUID ownerId) {
        return getAccounts(ownerId, AccountType.EXPENSE).stream()
            .map(Category::fromAccount)
            .toList();
    }

    /**
     * Resolves an account id to a category of the owner.
     *
     * @throws NotFoundException if the account does not exist for this owner
     * @throws ValidationException if the account is not an EXPENSE account
     */
    public Category requireCategory(UUID ownerId, UUID accountId) {
        return Category.fromAccount(requireAccount(ownerId, accountId));
    }

    /**
     * Soft-deletes an account. Existing entries keep pointing at it; it can
     * no longer receive new postings.
     */
    @Transactional
    public void deactivateAccount(UUID ownerId, UUID accountId) {
        requireAccount(ownerId, accountId);
        jdbcTemplate.update("UPDATE accounts SET is_active = FALSE WHERE id = ?", accountId);
        log.info("Deactivated account: id={}, owner={}", accountId, ownerId);
    }

    private static Map<String, AccountType> defaultAccounts() {
        Map<String, AccountType> accounts = new LinkedHashMap<>();
        accounts.put("Assets", AccountType.ASSET);
        accounts.put("Liabilities", AccountType.LIABILITY);
        accounts.put("Income", AccountType.INCOME);
        accounts.put("Expenses", AccountType.EXPENSE);
        accounts.put("Cash", AccountType.ASSET);
        accounts.put("Groceries", AccountType.EXPENSE);
        accounts.put("Salary", AccountType.INCOME);
        return accounts;
    }

    private RowMapper<Party> partyRowMapper() {
        return (rs, rowNum) -> new Party(
            rs.getObject("id", UUID.class),
            Party.PartyType.valueOf(rs.getString("party_type")),
            rs.getString("name"),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> {
            Timestamp createdAt = rs.getTimestamp("created_at");
            return new Account(
                rs.getObject("id", UUID.class),
                rs.getObject("owner_id", UUID.class),
                rs.getString("name"),
                AccountType.valueOf(rs.getString("account_type")),
                rs.getObject("parent_id", UUID.class),
                rs.getBoolean("is_active"),
                CurrencyCode.valueOf(rs.getString("currency").trim()),
                createdAt != null ? createdAt.toInstant() : null
            );
        };
    }
}
