package com.flagship.budget_ledger.budget.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Either field may be omitted to leave it unchanged.
 */
@Value
public class UpdateCategoryBudgetRequest {

    @JsonProperty("budget_amount")
    BigDecimal budgetAmount;

    @JsonProperty("rollover_enabled")
    Boolean rolloverEnabled;
}
