package com.flagship.budget_ledger.budget;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Budget against actual spend for one month.
 */
@Value
@Builder
public class BudgetReport {
    UUID userId;
    UUID budgetId;
    BudgetMonth yearMonth;
    BigDecimal totalBudget;
    BigDecimal totalSpent;
    BigDecimal totalRemaining;
    BigDecimal percentageUsed;
    BudgetStatus status;
    @Singular
    List<CategoryStatus> categories;

    @Value
    @Builder
    public static class CategoryStatus {
        UUID categoryId;
        String categoryName;
        BigDecimal budgetAmount;
        BigDecimal rolloverAmount;
        BigDecimal effectiveBudget;
        BigDecimal spent;
        BigDecimal remaining;
        BigDecimal percentageUsed;
        BudgetStatus status;
    }
}
