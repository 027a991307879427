package com.flagship.budget_ledger.ledger;

/**
 * Side of a ledger entry, derived from the sign of its amount.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
