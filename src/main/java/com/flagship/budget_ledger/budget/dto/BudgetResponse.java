package com.flagship.budget_ledger.budget.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.budget.Budget;
import com.flagship.budget_ledger.budget.CategoryBudget;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class BudgetResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("year_month")
    String yearMonth;

    @JsonProperty("rollover_last_calculated")
    Instant rolloverLastCalculated;

    @JsonProperty("rollover_needs_recalc")
    boolean rolloverNeedsRecalc;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("categories")
    List<CategoryBudgetResponse> categories;

    public static BudgetResponse from(Budget budget) {
        return BudgetResponse.builder()
            .id(budget.getId())
            .userId(budget.getUserId())
            .yearMonth(budget.getYearMonth().toString())
            .rolloverLastCalculated(budget.getRolloverLastCalculated())
            .rolloverNeedsRecalc(budget.isRolloverNeedsRecalc())
            .createdAt(budget.getCreatedAt())
            .updatedAt(budget.getUpdatedAt())
            .categories(budget.getCategories().stream().map(CategoryBudgetResponse::from).toList())
            .build();
    }

    @Value
    @Builder
    public static class CategoryBudgetResponse {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("category_id")
        UUID categoryId;

        @JsonProperty("budget_amount")
        BigDecimal budgetAmount;

        @JsonProperty("rollover_enabled")
        boolean rolloverEnabled;

        @JsonProperty("rollover_amount")
        BigDecimal rolloverAmount;

        @JsonProperty("effective_budget")
        BigDecimal effectiveBudget;

        static CategoryBudgetResponse from(CategoryBudget category) {
            return CategoryBudgetResponse.builder()
                .id(category.getId())
                .categoryId(category.getCategoryId())
                .budgetAmount(category.getBudgetAmount())
                .rolloverEnabled(category.isRolloverEnabled())
                .rolloverAmount(category.getRolloverAmount())
                .effectiveBudget(category.getEffectiveBudget())
                .build();
        }
    }
}
