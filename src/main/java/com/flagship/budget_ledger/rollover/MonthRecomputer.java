package com.flagship.budget_ledger.rollover;

import com.flagship.budget_ledger.budget.BudgetEntity;
import com.flagship.budget_ledger.budget.BudgetMonth;
import com.flagship.budget_ledger.budget.BudgetRepository;
import com.flagship.budget_ledger.budget.CategoryBudgetEntity;
import com.flagship.budget_ledger.budget.CategoryBudgetRepository;
import com.flagship.budget_ledger.exception.NotFoundException;
import com.flagship.budget_ledger.notification.RolloverUpdatedEvent;
import com.flagship.budget_ledger.outbox.OutboxService;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Recomputes the rollovers of one budget month as one database transaction.
 *
 * Every method starts its own transaction so that a chain walk commits
 * month by month: a failure rolls back only the month it happened in.
 */
@Service
@Slf4j
public class MonthRecomputer {

    static final String AGGREGATE_TYPE = "Budget";

    private final BudgetRepository budgetRepository;
    private final CategoryBudgetRepository categoryBudgetRepository;
    private final RolloverCalculator calculator;
    private final OutboxService outboxService;
    private final BigDecimal updateThreshold;

    public MonthRecomputer(BudgetRepository budgetRepository,
                           CategoryBudgetRepository categoryBudgetRepository,
                           RolloverCalculator calculator,
                           OutboxService outboxService,
                           @org.springframework.beans.factory.annotation.Value("${rollover.update-threshold:0.01}")
                           BigDecimal updateThreshold) {
        this.budgetRepository = budgetRepository;
        this.categoryBudgetRepository = categoryBudgetRepository;
        this.calculator = calculator;
        this.outboxService = outboxService;
        this.updateThreshold = updateThreshold;
    }

    /**
     * Flags the budget before it is recomputed. Committed on its own, so the
     * flag survives if the recomputation that follows rolls back.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markNeedsRecalc(UUID budgetId) {
        if (budgetRepository.markNeedsRecalc(budgetId) == 0) {
            throw NotFoundException.of("Budget", budgetId);
        }
    }

    /**
     * Recomputes every category of the budget, rewrites cached rollovers
     * that moved by more than the update threshold, clears the recalculation
     * flag and queues a {@link RolloverUpdatedEvent}, all in one commit.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Outcome recompute(UUID budgetId, RolloverReason reason) {
        BudgetEntity budget = budgetRepository.findById(budgetId)
            .orElseThrow(() -> NotFoundException.of("Budget", budgetId));
        BudgetMonth month = budget.getMonth();

        List<CategoryBudgetEntity> categories = categoryBudgetRepository.findByBudgetIdOrderByCategoryIdAsc(budgetId);
        int updated = 0;
        for (CategoryBudgetEntity category : categories) {
            RolloverCalculation calculation = calculator.calculate(
                budget.getUserId(), budgetId, category.getCategoryId(), month, reason);
            if (applyIfChanged(category, calculation)) {
                updated++;
            }
        }

        budget.markRecalculated(Instant.now());
        budgetRepository.save(budget);

        outboxService.saveEvent(AGGREGATE_TYPE, budgetId, RolloverUpdatedEvent.EVENT_TYPE,
            RolloverUpdatedEvent.of(budget.getUserId(), budgetId, month, reason));

        log.debug("Recomputed {} ({}): {} categories, {} updated", month, reason, categories.size(), updated);
        return new Outcome(categories.size(), updated);
    }

    /**
     * Recomputes a single category of a budget month and records it in the
     * history.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<CategoryOutcome> recomputeCategory(UUID userId, BudgetMonth month, UUID categoryId,
                                                       RolloverReason reason) {
        Optional<BudgetEntity> budget = budgetRepository.findByUserIdAndYearMonth(userId, month.toString());
        Optional<CategoryBudgetEntity> category = budget
            .flatMap(found -> categoryBudgetRepository.findByBudgetIdAndCategoryId(found.getId(), categoryId));
        if (category.isEmpty()) {
            return Optional.empty();
        }

        RolloverCalculation calculation = calculator.calculate(userId, budget.get().getId(), categoryId, month, reason);
        boolean updated = applyIfChanged(category.get(), calculation);
        return Optional.of(new CategoryOutcome(calculation, updated));
    }

    private boolean applyIfChanged(CategoryBudgetEntity category, RolloverCalculation calculation) {
        BigDecimal delta = calculation.getRolloverAmount().subtract(category.getRolloverAmount()).abs();
        if (delta.compareTo(updateThreshold) <= 0) {
            return false;
        }
        log.debug("Rollover of category {} in budget {}: {} -> {}", category.getCategoryId(),
            category.getBudgetId(), category.getRolloverAmount(), calculation.getRolloverAmount());
        category.applyRollover(calculation.getRolloverAmount());
        categoryBudgetRepository.save(category);
        return true;
    }

    @Value
    public static class Outcome {
        int categoriesRecalculated;
        int categoriesUpdated;
    }

    @Value
    public static class CategoryOutcome {
        RolloverCalculation calculation;
        /** Whether the cached rollover moved by more than the update threshold. */
        boolean updated;
    }
}
