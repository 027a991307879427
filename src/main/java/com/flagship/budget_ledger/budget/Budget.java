package com.flagship.budget_ledger.budget;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A user's budget for one month. At most one exists per (user, month).
 */
@Value
public class Budget {
    UUID id;
    UUID userId;
    BudgetMonth yearMonth;
    Instant rolloverLastCalculated;
    boolean rolloverNeedsRecalc;
    Instant createdAt;
    Instant updatedAt;
    List<CategoryBudget> categories;

    public Optional<CategoryBudget> findCategory(UUID categoryId) {
        return categories.stream()
            .filter(category -> category.getCategoryId().equals(categoryId))
            .findFirst();
    }
}
