package com.flagship.budget_ledger.account;

/**
 * ISO-4217 currency of an account.
 *
 * Amounts are never converted between currencies; the code is carried for
 * display and to keep invalid codes out of the database.
 */
public enum CurrencyCode {
    USD,
    EUR,
    GBP,
    INR,
    JPY,
    CAD,
    AUD
}
