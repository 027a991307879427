package com.flagship.budget_ledger.budget.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
public class CreateBudgetRequest {

    @NotBlank(message = "Year-month is required")
    @JsonProperty("year_month")
    String yearMonth;

    @NotNull(message = "Categories are required")
    @JsonProperty("categories")
    List<@Valid CategoryLimitRequest> categories;

    @Value
    public static class CategoryLimitRequest {

        @NotNull(message = "Category ID is required")
        @JsonProperty("category_id")
        UUID categoryId;

        @NotNull(message = "Budget amount is required")
        @JsonProperty("budget_amount")
        BigDecimal budgetAmount;

        @JsonProperty("rollover_enabled")
        Boolean rolloverEnabled;
    }
}
