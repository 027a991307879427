package com.flagship.budget_ledger.rollover;

import com.flagship.budget_ledger.budget.BudgetMonth;
import com.flagship.budget_ledger.rollover.dto.CalculateRolloverRequest;
import com.flagship.budget_ledger.rollover.dto.RecomputeChainRequest;
import com.flagship.budget_ledger.rollover.dto.RolloverCalculationResponse;
import com.flagship.budget_ledger.rollover.dto.RolloverChainResponse;
import com.flagship.budget_ledger.rollover.dto.RolloverStatusResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Rollover inspection and manual recomputation.
 */
@RestController
@RequestMapping("/api/rollover")
@RequiredArgsConstructor
@Slf4j
public class RolloverController {

    private static final String USER_HEADER = "X-User-Id";

    private final RolloverEngine rolloverEngine;

    @GetMapping("/budgets/{id}/status")
    public RolloverStatusResponse getStatus(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable("id") UUID budgetId) {
        return RolloverStatusResponse.from(rolloverEngine.getRolloverStatus(userId, budgetId));
    }

    @GetMapping("/budgets/{id}/history")
    public List<RolloverCalculationResponse> getHistory(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable("id") UUID budgetId,
            @RequestParam(value = "category_id", required = false) UUID categoryId) {
        return rolloverEngine.getHistory(userId, budgetId, categoryId).stream()
            .map(RolloverCalculationResponse::from)
            .toList();
    }

    @PostMapping("/calculate")
    public RolloverCalculationResponse calculate(
            @RequestHeader(USER_HEADER) UUID userId,
            @Valid @RequestBody CalculateRolloverRequest request) {
        BudgetMonth month = BudgetMonth.parse(request.getYearMonth());
        return RolloverCalculationResponse.from(
            rolloverEngine.calculateRollover(userId, request.getCategoryId(), month));
    }

    @PostMapping("/recompute")
    public RolloverChainResponse recomputeChain(
            @RequestHeader(USER_HEADER) UUID userId,
            @Valid @RequestBody RecomputeChainRequest request) {
        BudgetMonth changedMonth = BudgetMonth.parse(request.getChangedMonth());
        RolloverReason reason = request.getReason() != null
            ? request.getReason()
            : RolloverReason.MANUAL_RECALCULATION;
        log.info("Manual chain recomputation after {} requested by {}", changedMonth, userId);
        return RolloverChainResponse.from(rolloverEngine.invalidateAndRecomputeChain(userId, changedMonth, reason));
    }

    @PostMapping("/recalculate")
    public RolloverChainResponse recalculateMonth(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestParam("year_month") String yearMonth) {
        return RolloverChainResponse.from(rolloverEngine.recalculateMonth(userId, BudgetMonth.parse(yearMonth)));
    }
}
