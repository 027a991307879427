package com.flagship.budget_ledger.transaction;

public enum TransactionKind {
    EXPENSE,
    TRANSFER,
    SPLIT,
    SHARED
}
