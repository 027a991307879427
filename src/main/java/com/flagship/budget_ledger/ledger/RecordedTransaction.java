package com.flagship.budget_ledger.ledger;

import lombok.Value;

/**
 * Outcome of recording a transaction. {@code duplicate} is set when the
 * external id had already been recorded and nothing new was written.
 */
@Value
public class RecordedTransaction {
    LedgerTransaction transaction;
    boolean duplicate;

    public static RecordedTransaction created(LedgerTransaction transaction) {
        return new RecordedTransaction(transaction, false);
    }

    public static RecordedTransaction duplicate(LedgerTransaction transaction) {
        return new RecordedTransaction(transaction, true);
    }
}
