package com.flagship.budget_ledger.budget.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class CopyBudgetRequest {

    @NotBlank(message = "Source month is required")
    @JsonProperty("source_month")
    String sourceMonth;

    @NotBlank(message = "Target month is required")
    @JsonProperty("target_month")
    String targetMonth;
}
