package com.flagship.budget_ledger.rollover;

/**
 * Why a rollover was (re)computed. Recorded on every history row.
 */
public enum RolloverReason {
    CREATION,
    MANUAL_RECALCULATION,
    CHAIN_PROPAGATION,
    BUDGET_EDIT,
    TRANSACTION_EDIT,
    RETRY
}
