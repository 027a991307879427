package com.flagship.budget_ledger.rollover.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.rollover.RolloverReason;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Recomputes every budget strictly after {@code changed_month}.
 */
@Value
public class RecomputeChainRequest {

    @NotBlank(message = "Changed month is required")
    @JsonProperty("changed_month")
    String changedMonth;

    @JsonProperty("reason")
    RolloverReason reason;
}
