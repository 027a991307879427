package com.flagship.budget_ledger.rollover.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.rollover.RolloverStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class RolloverStatusResponse {

    @JsonProperty("budget_id")
    UUID budgetId;

    @JsonProperty("year_month")
    String yearMonth;

    @JsonProperty("rollover_last_calculated")
    Instant lastCalculated;

    @JsonProperty("rollover_needs_recalc")
    boolean needsRecalc;

    public static RolloverStatusResponse from(RolloverStatus status) {
        return RolloverStatusResponse.builder()
            .budgetId(status.getBudgetId())
            .yearMonth(status.getYearMonth().toString())
            .lastCalculated(status.getLastCalculated())
            .needsRecalc(status.isNeedsRecalc())
            .build();
    }
}
