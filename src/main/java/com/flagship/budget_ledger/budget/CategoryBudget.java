package com.flagship.budget_ledger.budget;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A category's allocation within one monthly budget.
 *
 * {@code rolloverAmount} is derived and cached by the rollover engine;
 * users only set {@code budgetAmount} and {@code rolloverEnabled}.
 */
@Value
public class CategoryBudget {
    UUID id;
    UUID budgetId;
    UUID categoryId;
    BigDecimal budgetAmount;
    boolean rolloverEnabled;
    BigDecimal rolloverAmount;

    public BigDecimal getEffectiveBudget() {
        return budgetAmount.add(rolloverAmount);
    }
}
