package com.flagship.budget_ledger.rollover.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.rollover.RolloverCalculation;
import com.flagship.budget_ledger.rollover.RolloverReason;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One rollover computation: the amount carried into a month and the inputs
 * it was derived from.
 */
@Value
@Builder
public class RolloverCalculationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("budget_id")
    UUID budgetId;

    @JsonProperty("category_id")
    UUID categoryId;

    @JsonProperty("calculated_at")
    Instant calculatedAt;

    @JsonProperty("rollover_amount")
    BigDecimal rolloverAmount;

    @JsonProperty("source_month")
    String sourceMonth;

    @JsonProperty("reason")
    RolloverReason reason;

    @JsonProperty("base_budget")
    BigDecimal baseBudget;

    @JsonProperty("prev_rollover")
    BigDecimal prevRollover;

    @JsonProperty("effective_budget")
    BigDecimal effectiveBudget;

    @JsonProperty("spent_amount")
    BigDecimal spentAmount;

    public static RolloverCalculationResponse from(RolloverCalculation calculation) {
        return RolloverCalculationResponse.builder()
            .id(calculation.getId())
            .budgetId(calculation.getBudgetId())
            .categoryId(calculation.getCategoryId())
            .calculatedAt(calculation.getCalculatedAt())
            .rolloverAmount(calculation.getRolloverAmount())
            .sourceMonth(calculation.getSourceMonth().toString())
            .reason(calculation.getReason())
            .baseBudget(calculation.getBaseBudget())
            .prevRollover(calculation.getPrevRollover())
            .effectiveBudget(calculation.getEffectiveBudget())
            .spentAmount(calculation.getSpentAmount())
            .build();
    }
}
