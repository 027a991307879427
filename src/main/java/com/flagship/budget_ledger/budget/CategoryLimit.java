package com.flagship.budget_ledger.budget;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * User-entered allocation for one category when creating a budget.
 */
@Value
public class CategoryLimit {
    UUID categoryId;
    BigDecimal budgetAmount;
    boolean rolloverEnabled;
}
