package com.flagship.budget_ledger.budget;

import com.flagship.budget_ledger.budget.dto.BudgetAlertResponse;
import com.flagship.budget_ledger.budget.dto.BudgetResponse;
import com.flagship.budget_ledger.budget.dto.BudgetStatusResponse;
import com.flagship.budget_ledger.budget.dto.CopyBudgetRequest;
import com.flagship.budget_ledger.budget.dto.CreateBudgetRequest;
import com.flagship.budget_ledger.budget.dto.UpdateCategoryBudgetRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Monthly budgets. Without {@code year_month}, GET lists every budget of
 * the user.
 */
@RestController
@RequestMapping("/api/budgets")
@RequiredArgsConstructor
public class BudgetController {

    private static final String USER_HEADER = "X-User-Id";

    private final BudgetService budgetService;
    private final BudgetStatusService statusService;

    @PostMapping
    public ResponseEntity<BudgetResponse> createBudget(
            @RequestHeader(USER_HEADER) UUID userId,
            @Valid @RequestBody CreateBudgetRequest request) {
        List<CategoryLimit> limits = request.getCategories().stream()
            .map(category -> new CategoryLimit(category.getCategoryId(), category.getBudgetAmount(),
                category.getRolloverEnabled() == null || category.getRolloverEnabled()))
            .toList();
        Budget budget = budgetService.createBudget(userId, BudgetMonth.parse(request.getYearMonth()), limits);
        return ResponseEntity.status(HttpStatus.CREATED).body(BudgetResponse.from(budget));
    }

    @PostMapping("/copy")
    public ResponseEntity<BudgetResponse> copyBudget(
            @RequestHeader(USER_HEADER) UUID userId,
            @Valid @RequestBody CopyBudgetRequest request) {
        Budget budget = budgetService.copyBudget(userId, BudgetMonth.parse(request.getSourceMonth()),
            BudgetMonth.parse(request.getTargetMonth()));
        return ResponseEntity.status(HttpStatus.CREATED).body(BudgetResponse.from(budget));
    }

    @GetMapping
    public List<BudgetResponse> getBudgets(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestParam(value = "year_month", required = false) String yearMonth) {
        if (yearMonth == null) {
            return budgetService.listBudgets(userId).stream().map(BudgetResponse::from).toList();
        }
        return List.of(BudgetResponse.from(budgetService.getBudget(userId, BudgetMonth.parse(yearMonth))));
    }

    @PutMapping("/{id}/categories/{categoryId}")
    public BudgetResponse updateCategoryBudget(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable("id") UUID budgetId,
            @PathVariable("categoryId") UUID categoryId,
            @RequestBody UpdateCategoryBudgetRequest request) {
        return BudgetResponse.from(budgetService.updateCategoryBudget(userId, budgetId, categoryId,
            request.getBudgetAmount(), request.getRolloverEnabled()));
    }

    @GetMapping("/status")
    public BudgetStatusResponse getStatus(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestParam("year_month") String yearMonth) {
        return BudgetStatusResponse.from(statusService.getStatus(userId, BudgetMonth.parse(yearMonth)));
    }

    @GetMapping("/alerts")
    public List<BudgetAlertResponse> getAlerts(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestParam("year_month") String yearMonth) {
        return statusService.getAlerts(userId, BudgetMonth.parse(yearMonth)).stream()
            .map(BudgetAlertResponse::from)
            .toList();
    }
}
