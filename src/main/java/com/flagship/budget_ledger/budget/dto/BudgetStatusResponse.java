package com.flagship.budget_ledger.budget.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.budget.BudgetReport;
import com.flagship.budget_ledger.budget.BudgetStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class BudgetStatusResponse {

    @JsonProperty("budget_id")
    UUID budgetId;

    @JsonProperty("year_month")
    String yearMonth;

    @JsonProperty("total_budget")
    BigDecimal totalBudget;

    @JsonProperty("total_spent")
    BigDecimal totalSpent;

    @JsonProperty("total_remaining")
    BigDecimal totalRemaining;

    @JsonProperty("percentage_used")
    BigDecimal percentageUsed;

    @JsonProperty("overall_status")
    BudgetStatus status;

    @JsonProperty("categories")
    List<CategoryStatusResponse> categories;

    public static BudgetStatusResponse from(BudgetReport report) {
        return BudgetStatusResponse.builder()
            .budgetId(report.getBudgetId())
            .yearMonth(report.getYearMonth().toString())
            .totalBudget(report.getTotalBudget())
            .totalSpent(report.getTotalSpent())
            .totalRemaining(report.getTotalRemaining())
            .percentageUsed(report.getPercentageUsed())
            .status(report.getStatus())
            .categories(report.getCategories().stream().map(CategoryStatusResponse::from).toList())
            .build();
    }

    @Value
    @Builder
    public static class CategoryStatusResponse {

        @JsonProperty("category_id")
        UUID categoryId;

        @JsonProperty("category_name")
        String categoryName;

        @JsonProperty("budget_amount")
        BigDecimal budgetAmount;

        @JsonProperty("rollover_amount")
        BigDecimal rolloverAmount;

        @JsonProperty("effective_budget")
        BigDecimal effectiveBudget;

        @JsonProperty("spent")
        BigDecimal spent;

        @JsonProperty("remaining")
        BigDecimal remaining;

        @JsonProperty("percentage_used")
        BigDecimal percentageUsed;

        @JsonProperty("status")
        BudgetStatus status;

        static CategoryStatusResponse from(BudgetReport.CategoryStatus category) {
            return CategoryStatusResponse.builder()
                .categoryId(category.getCategoryId())
                .categoryName(category.getCategoryName())
                .budgetAmount(category.getBudgetAmount())
                .rolloverAmount(category.getRolloverAmount())
                .effectiveBudget(category.getEffectiveBudget())
                .spent(category.getSpent())
                .remaining(category.getRemaining())
                .percentageUsed(category.getPercentageUsed())
                .status(category.getStatus())
                .build();
        }
    }
}
