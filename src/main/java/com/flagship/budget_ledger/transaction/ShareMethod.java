package com.flagship.budget_ledger.transaction;

/**
 * How the personal part of a shared expense is derived from the total.
 */
public enum ShareMethod {
    /** The value is the personal amount itself. */
    FIXED,
    /** The value is the personal percentage of the total. */
    PERCENTAGE,
    /** The value is the number of people sharing equally. */
    EQUAL
}
