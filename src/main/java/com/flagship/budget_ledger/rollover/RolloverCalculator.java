package com.flagship.budget_ledger.rollover;

import com.flagship.budget_ledger.budget.BudgetMonth;
import com.flagship.budget_ledger.budget.BudgetRepository;
import com.flagship.budget_ledger.budget.CategoryBudgetEntity;
import com.flagship.budget_ledger.budget.CategoryBudgetRepository;
import com.flagship.budget_ledger.spend.SpendAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Computes the rollover of one category into one month.
 *
 * <pre>
 * effective(M-1) = budget(M-1) + rollover(M-1)
 * rollover(M)    = effective(M-1) - spend(M-1)   if M-1 has rollover enabled
 *                = 0                             otherwise, or if M-1 has no allocation
 * </pre>
 *
 * rollover(M-1) is read from the stored value, never recomputed here; the
 * chain walk guarantees it is already current.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RolloverCalculator {

    private final BudgetRepository budgetRepository;
    private final CategoryBudgetRepository categoryBudgetRepository;
    private final SpendAggregator spendAggregator;
    private final RolloverCalculationRepository calculationRepository;

    /**
     * Computes without recording anything.
     *
     * @param budgetId budget of {@code month} the result belongs to, or null if there is none
     */
    public RolloverCalculation compute(UUID userId, UUID categoryId, BudgetMonth month,
                                       UUID budgetId, RolloverReason reason) {
        BudgetMonth sourceMonth = month.previous();

        Optional<CategoryBudgetEntity> source = budgetRepository
            .findByUserIdAndYearMonth(userId, sourceMonth.toString())
            .flatMap(budget -> categoryBudgetRepository.findByBudgetIdAndCategoryId(budget.getId(), categoryId));

        if (source.isEmpty()) {
            log.debug("No allocation for category {} in {}, rollover into {} is 0", categoryId, sourceMonth, month);
            return RolloverCalculation.noPriorAllocation(budgetId, categoryId, sourceMonth, reason);
        }

        CategoryBudgetEntity previous = source.get();
        BigDecimal effective = previous.getBudgetAmount().add(previous.getRolloverAmount());
        BigDecimal spent = spendAggregator.spendForMonth(userId, categoryId, sourceMonth);
        BigDecimal difference = effective.subtract(spent);
        BigDecimal rollover = previous.isRolloverEnabled() ? difference : BigDecimal.ZERO;

        log.debug("Rollover {} -> {} for category {}: effective={}, spent={}, rollover={}",
            sourceMonth, month, categoryId, effective, spent, rollover);

        return new RolloverCalculation(
            null,
            budgetId,
            categoryId,
            Instant.now(),
            rollover,
            sourceMonth,
            reason,
            previous.getBudgetAmount(),
            previous.getRolloverAmount(),
            effective,
            spent
        );
    }

    /**
     * Computes and appends the result to the rollover history of the budget.
     * Must run inside the caller's transaction.
     */
    public RolloverCalculation calculate(UUID userId, UUID budgetId, UUID categoryId,
                                         BudgetMonth month, RolloverReason reason) {
        RolloverCalculation calculation = compute(userId, categoryId, month, budgetId, reason);
        return calculationRepository.save(RolloverCalculationEntity.fromDomain(calculation)).toDomain();
    }
}
