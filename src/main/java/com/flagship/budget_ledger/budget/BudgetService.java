package com.flagship.budget_ledger.budget;

import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.exception.ValidationException;
import com.flagship.budget_ledger.rollover.RolloverEngine;
import com.flagship.budget_ledger.rollover.RolloverReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Budget lifecycle. Every change that can move a rollover is committed
 * first and then handed to the {@link RolloverEngine}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetService {

    private final BudgetPersistenceService persistenceService;
    private final AccountService accountService;
    private final RolloverEngine rolloverEngine;

    /**
     * Creates a budget, computes its own rollovers from the month before and
     * re-walks every later month.
     */
    public Budget createBudget(UUID userId, BudgetMonth month, List<CategoryLimit> limits) {
        accountService.requireParty(userId);
        validateLimits(userId, limits);

        Budget created = persistenceService.create(userId, month, limits);
        log.info("Created budget {} for {} with {} categories", created.getId(), month, limits.size());

        rolloverEngine.recomputeFrom(userId, month, RolloverReason.CREATION);
        return persistenceService.requireById(userId, created.getId());
    }

    /**
     * Creates {@code targetMonth} with the category limits and rollover flags
     * of {@code sourceMonth}. Rollover amounts are not copied; they are
     * recomputed.
     */
    public Budget copyBudget(UUID userId, BudgetMonth sourceMonth, BudgetMonth targetMonth) {
        if (sourceMonth.equals(targetMonth)) {
            throw ValidationException.forField("target_month", "Target month must differ from source month");
        }
        Budget source = persistenceService.requireByMonth(userId, sourceMonth);
        List<CategoryLimit> limits = source.getCategories().stream()
            .map(category -> new CategoryLimit(category.getCategoryId(), category.getBudgetAmount(),
                category.isRolloverEnabled()))
            .toList();
        log.info("Copying budget {} to {}", sourceMonth, targetMonth);
        return createBudget(userId, targetMonth, limits);
    }

    /**
     * Changes the limit or rollover flag of a category in a budget, or adds
     * the category if the budget does not have it yet.
     */
    public Budget updateCategoryBudget(UUID userId, UUID budgetId, UUID categoryId,
                                       BigDecimal budgetAmount, Boolean rolloverEnabled) {
        Budget budget = persistenceService.requireById(userId, budgetId);
        accountService.requireCategory(userId, categoryId);
        if (budgetAmount != null) {
            requireNonNegative(budgetAmount, "budget_amount");
        }
        boolean adding = budget.findCategory(categoryId).isEmpty();
        if (adding && budgetAmount == null) {
            throw ValidationException.forField("budget_amount", "Budget amount is required for a new category");
        }

        persistenceService.upsertCategory(budgetId, categoryId, budgetAmount, rolloverEnabled);
        log.info("{} category {} in budget {} ({})", adding ? "Added" : "Updated", categoryId, budgetId,
            budget.getYearMonth());

        if (adding) {
            rolloverEngine.recomputeFrom(userId, budget.getYearMonth(), RolloverReason.BUDGET_EDIT);
        } else {
            rolloverEngine.invalidateAndRecomputeChain(userId, budget.getYearMonth(), RolloverReason.BUDGET_EDIT);
        }
        return persistenceService.requireById(userId, budgetId);
    }

    public Budget getBudget(UUID userId, BudgetMonth month) {
        return persistenceService.requireByMonth(userId, month);
    }

    public List<Budget> listBudgets(UUID userId) {
        return persistenceService.findAll(userId);
    }

    private void validateLimits(UUID userId, List<CategoryLimit> limits) {
        Map<String, String> errors = new LinkedHashMap<>();
        Set<UUID> seen = new HashSet<>();
        for (int i = 0; i < limits.size(); i++) {
            CategoryLimit limit = limits.get(i);
            String prefix = "categories[" + i + "]";
            if (limit.getCategoryId() == null) {
                errors.put(prefix + ".category_id", "Category is required");
                continue;
            }
            if (!seen.add(limit.getCategoryId())) {
                errors.put(prefix + ".category_id", "Category appears more than once");
            }
            if (limit.getBudgetAmount() == null || limit.getBudgetAmount().signum() < 0) {
                errors.put(prefix + ".budget_amount", "Budget amount must be zero or more");
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid budget categories", errors);
        }
        limits.forEach(limit -> accountService.requireCategory(userId, limit.getCategoryId()));
    }

    private static void requireNonNegative(BigDecimal amount, String field) {
        if (amount.signum() < 0) {
            throw ValidationException.forField(field, "Budget amount must be zero or more");
        }
    }
}
