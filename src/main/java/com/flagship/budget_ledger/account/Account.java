package com.flagship.budget_ledger.account;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An account in a party's chart of accounts.
 *
 * Accounts may form a tree through {@code parentId}; the tree is used for
 * lookup and display only and never for balance roll-ups.
 */
@Value
public class Account {
    UUID id;
    UUID ownerId;
    String name;
    AccountType accountType;
    UUID parentId;
    boolean active;
    CurrencyCode currency;
    Instant createdAt;

    public boolean isCategory() {
        return accountType == AccountType.EXPENSE;
    }

    public boolean isOwnedBy(UUID partyId) {
        return ownerId.equals(partyId);
    }
}
