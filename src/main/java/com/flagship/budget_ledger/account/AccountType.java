package com.flagship.budget_ledger.account;

/**
 * Classification of an account in the chart of accounts.
 *
 * Positive ledger amounts are debits: they increase ASSET and EXPENSE
 * accounts and decrease LIABILITY and INCOME accounts.
 */
public enum AccountType {
    ASSET,
    LIABILITY,
    INCOME,
    EXPENSE
}
