package com.flagship.budget_ledger.account;

import com.flagship.budget_ledger.exception.ValidationException;
import lombok.Value;

import java.util.UUID;

/**
 * Budgeting view of an EXPENSE account.
 *
 * Budgets and spend queries work with categories; the only way to get one
 * is {@link #fromAccount(Account)}, which refuses any other account type.
 */
@Value
public class Category {
    UUID id;
    UUID ownerId;
    String name;
    UUID parentId;
    boolean active;

    public static Category fromAccount(Account account) {
        if (!account.isCategory()) {
            throw ValidationException.forField("category_id",
                String.format("Account %s is a %s account, not an expense category",
                    account.getId(), account.getAccountType()));
        }
        return new Category(account.getId(), account.getOwnerId(), account.getName(),
            account.getParentId(), account.isActive());
    }
}
