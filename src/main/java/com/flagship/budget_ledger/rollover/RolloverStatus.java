package com.flagship.budget_ledger.rollover;

import com.flagship.budget_ledger.budget.BudgetMonth;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class RolloverStatus {
    UUID budgetId;
    BudgetMonth yearMonth;
    Instant lastCalculated;
    boolean needsRecalc;
}
