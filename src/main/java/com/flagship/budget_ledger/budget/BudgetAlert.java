package com.flagship.budget_ledger.budget;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class BudgetAlert {
    UUID categoryId;
    String categoryName;
    AlertType alertType;
    Severity severity;
    BigDecimal effectiveBudget;
    BigDecimal spent;
    BigDecimal percentageUsed;
    String message;

    public enum AlertType {
        APPROACHING_LIMIT,
        OVER_BUDGET
    }

    public enum Severity {
        MEDIUM,
        HIGH
    }
}
