package com.flagship.budget_ledger.ledger;

import lombok.Value;

/**
 * A transaction before and after an edit.
 */
@Value
public class TransactionRevision {
    LedgerTransaction previous;
    LedgerTransaction current;
}
