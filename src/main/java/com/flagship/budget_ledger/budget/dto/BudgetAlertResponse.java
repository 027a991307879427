package com.flagship.budget_ledger.budget.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.budget.BudgetAlert;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class BudgetAlertResponse {

    @JsonProperty("category_id")
    UUID categoryId;

    @JsonProperty("category_name")
    String categoryName;

    @JsonProperty("alert_type")
    BudgetAlert.AlertType alertType;

    @JsonProperty("severity")
    BudgetAlert.Severity severity;

    @JsonProperty("effective_budget")
    BigDecimal effectiveBudget;

    @JsonProperty("spent")
    BigDecimal spent;

    @JsonProperty("percentage_used")
    BigDecimal percentageUsed;

    @JsonProperty("message")
    String message;

    public static BudgetAlertResponse from(BudgetAlert alert) {
        return BudgetAlertResponse.builder()
            .categoryId(alert.getCategoryId())
            .categoryName(alert.getCategoryName())
            .alertType(alert.getAlertType())
            .severity(alert.getSeverity())
            .effectiveBudget(alert.getEffectiveBudget())
            .spent(alert.getSpent())
            .percentageUsed(alert.getPercentageUsed())
            .message(alert.getMessage())
            .build();
    }
}
