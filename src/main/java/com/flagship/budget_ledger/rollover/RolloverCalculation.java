package com.flagship.budget_ledger.rollover;

import com.flagship.budget_ledger.budget.BudgetMonth;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One rollover computation with every intermediate value.
 *
 * {@code sourceMonth} is the month whose leftover or overspend produced
 * {@code rolloverAmount}; {@code baseBudget}, {@code prevRollover},
 * {@code effectiveBudget} and {@code spentAmount} describe that month.
 * {@code id} is null until the row is appended to the history.
 */
@Value
public class RolloverCalculation {
    UUID id;
    UUID budgetId;
    UUID categoryId;
    Instant calculatedAt;
    BigDecimal rolloverAmount;
    BudgetMonth sourceMonth;
    RolloverReason reason;
    BigDecimal baseBudget;
    BigDecimal prevRollover;
    BigDecimal effectiveBudget;
    BigDecimal spentAmount;

    /**
     * No budget, or no allocation for the category, in the source month:
     * nothing rolls forward.
     */
    static RolloverCalculation noPriorAllocation(UUID budgetId, UUID categoryId, BudgetMonth sourceMonth,
                                                 RolloverReason reason) {
        return new RolloverCalculation(null, budgetId, categoryId, Instant.now(), BigDecimal.ZERO, sourceMonth,
            reason, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }
}
