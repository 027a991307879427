package com.flagship.budget_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One signed posting of a ledger transaction. Positive amounts are debits,
 * negative amounts are credits.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID transactionId;
    UUID accountId;
    BigDecimal amount;
    boolean reportable;
    Long sequenceNumber;

    public EntryType getEntryType() {
        return amount.signum() > 0 ? EntryType.DEBIT : EntryType.CREDIT;
    }
}
