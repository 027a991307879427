package com.flagship.budget_ledger.rollover.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.rollover.RolloverChainResult;
import com.flagship.budget_ledger.rollover.RolloverReason;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class RolloverChainResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("changed_month")
    String changedMonth;

    @JsonProperty("reason")
    RolloverReason reason;

    @JsonProperty("succeeded")
    boolean succeeded;

    @JsonProperty("months")
    List<MonthResponse> months;

    public static RolloverChainResponse from(RolloverChainResult result) {
        return RolloverChainResponse.builder()
            .userId(result.getUserId())
            .changedMonth(result.getChangedMonth().toString())
            .reason(result.getReason())
            .succeeded(result.isFullySucceeded())
            .months(result.getMonths().stream().map(MonthResponse::from).toList())
            .build();
    }

    @Value
    @Builder
    public static class MonthResponse {

        @JsonProperty("budget_id")
        UUID budgetId;

        @JsonProperty("year_month")
        String yearMonth;

        @JsonProperty("succeeded")
        boolean succeeded;

        @JsonProperty("categories_recalculated")
        int categoriesRecalculated;

        @JsonProperty("categories_updated")
        int categoriesUpdated;

        @JsonProperty("error")
        String error;

        static MonthResponse from(RolloverChainResult.MonthResult month) {
            return MonthResponse.builder()
                .budgetId(month.getBudgetId())
                .yearMonth(month.getYearMonth().toString())
                .succeeded(month.isSucceeded())
                .categoriesRecalculated(month.getCategoriesRecalculated())
                .categoriesUpdated(month.getCategoriesUpdated())
                .error(month.getError())
                .build();
        }
    }
}
