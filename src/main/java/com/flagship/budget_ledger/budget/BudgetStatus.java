package com.flagship.budget_ledger.budget;

import java.math.BigDecimal;

public enum BudgetStatus {
    UNDER_BUDGET,
    NEAR_LIMIT,
    OVER_BUDGET,
    NO_BUDGETS;

    static final BigDecimal NEAR_LIMIT_PERCENT = new BigDecimal("80");
    static final BigDecimal OVER_BUDGET_PERCENT = new BigDecimal("100");

    /**
     * Classifies spend against an effective budget. A budget of zero or less
     * is over as soon as anything is spent.
     */
    static BudgetStatus of(BigDecimal effectiveBudget, BigDecimal spent, BigDecimal percentageUsed) {
        if (effectiveBudget.signum() <= 0) {
            return spent.signum() > 0 ? OVER_BUDGET : UNDER_BUDGET;
        }
        if (percentageUsed.compareTo(OVER_BUDGET_PERCENT) >= 0) {
            return OVER_BUDGET;
        }
        return percentageUsed.compareTo(NEAR_LIMIT_PERCENT) >= 0 ? NEAR_LIMIT : UNDER_BUDGET;
    }
}
