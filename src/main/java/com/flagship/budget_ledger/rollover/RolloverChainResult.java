package com.flagship.budget_ledger.rollover;

import com.flagship.budget_ledger.budget.BudgetMonth;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * What a chain walk did: every month it touched, in the order it touched
 * them, and whether each one committed.
 */
@Value
public class RolloverChainResult {
    UUID userId;
    BudgetMonth changedMonth;
    RolloverReason reason;
    List<MonthResult> months;

    public boolean isFullySucceeded() {
        return months.stream().allMatch(MonthResult::isSucceeded);
    }

    public List<MonthResult> getFailedMonths() {
        return months.stream().filter(month -> !month.isSucceeded()).toList();
    }

    @Value
    public static class MonthResult {
        UUID budgetId;
        BudgetMonth yearMonth;
        boolean succeeded;
        int categoriesRecalculated;
        int categoriesUpdated;
        String error;

        static MonthResult succeeded(UUID budgetId, BudgetMonth yearMonth, MonthRecomputer.Outcome outcome) {
            return new MonthResult(budgetId, yearMonth, true, outcome.getCategoriesRecalculated(),
                outcome.getCategoriesUpdated(), null);
        }

        static MonthResult failed(UUID budgetId, BudgetMonth yearMonth, String error) {
            return new MonthResult(budgetId, yearMonth, false, 0, 0, error);
        }
    }
}
