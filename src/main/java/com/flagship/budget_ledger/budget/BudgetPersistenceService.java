package com.flagship.budget_ledger.budget;

import com.flagship.budget_ledger.exception.DuplicateResourceException;
import com.flagship.budget_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges budget domain objects and their JPA entities.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetPersistenceService {

    private final BudgetRepository budgetRepository;
    private final CategoryBudgetRepository categoryBudgetRepository;

    /**
     * Stores a new budget with zero rollovers.
     *
     * @throws DuplicateResourceException if the user already has a budget for the month
     */
    @Transactional
    public Budget create(UUID userId, BudgetMonth month, List<CategoryLimit> limits) {
        if (budgetRepository.findByUserIdAndYearMonth(userId, month.toString()).isPresent()) {
            throw new DuplicateResourceException("A budget for " + month + " already exists");
        }

        BudgetEntity budget = budgetRepository.save(BudgetEntity.create(userId, month));
        for (CategoryLimit limit : limits) {
            categoryBudgetRepository.save(CategoryBudgetEntity.create(budget.getId(), limit));
        }

        log.debug("Saved budget {} for user {} month {} with {} categories",
            budget.getId(), userId, month, limits.size());
        return load(budget);
    }

    /**
     * Sets the limit or rollover flag of a category, adding the category to
     * the budget if it is not there yet.
     *
     * @return true if the category was added
     */
    @Transactional
    public boolean upsertCategory(UUID budgetId, UUID categoryId, BigDecimal budgetAmount, Boolean rolloverEnabled) {
        Optional<CategoryBudgetEntity> existing =
            categoryBudgetRepository.findByBudgetIdAndCategoryId(budgetId, categoryId);

        if (existing.isPresent()) {
            CategoryBudgetEntity entity = existing.get();
            entity.updateLimit(budgetAmount, rolloverEnabled);
            categoryBudgetRepository.save(entity);
            log.debug("Updated category {} of budget {}", categoryId, budgetId);
            return false;
        }

        CategoryLimit limit = new CategoryLimit(categoryId, budgetAmount,
            rolloverEnabled == null || rolloverEnabled);
        categoryBudgetRepository.save(CategoryBudgetEntity.create(budgetId, limit));
        log.debug("Added category {} to budget {}", categoryId, budgetId);
        return true;
    }

    @Transactional(readOnly = true)
    public Optional<Budget> findByMonth(UUID userId, BudgetMonth month) {
        return budgetRepository.findByUserIdAndYearMonth(userId, month.toString())
            .map(this::load);
    }

    @Transactional(readOnly = true)
    public Budget requireByMonth(UUID userId, BudgetMonth month) {
        return findByMonth(userId, month)
            .orElseThrow(() -> new NotFoundException("No budget found for " + month));
    }

    /**
     * Loads a budget of the user; budgets of other users are reported as missing.
     */
    @Transactional(readOnly = true)
    public Budget requireById(UUID userId, UUID budgetId) {
        return budgetRepository.findByIdAndUserId(budgetId, userId)
            .map(this::load)
            .orElseThrow(() -> NotFoundException.of("Budget", budgetId));
    }

    @Transactional(readOnly = true)
    public List<Budget> findAll(UUID userId) {
        return budgetRepository.findByUserIdOrderByYearMonthAsc(userId).stream()
            .map(this::load)
            .toList();
    }

    private Budget load(BudgetEntity budget) {
        List<CategoryBudget> categories = categoryBudgetRepository.findByBudgetIdOrderByCategoryIdAsc(budget.getId())
            .stream()
            .map(CategoryBudgetEntity::toDomain)
            .toList();
        return budget.toDomain(categories);
    }
}
