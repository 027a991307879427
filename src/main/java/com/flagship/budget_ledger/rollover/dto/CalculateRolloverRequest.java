package com.flagship.budget_ledger.rollover.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class CalculateRolloverRequest {

    @NotNull(message = "Category ID is required")
    @JsonProperty("category_id")
    UUID categoryId;

    @NotBlank(message = "Year-month is required")
    @JsonProperty("year_month")
    String yearMonth;
}
