package com.flagship.budget_ledger.budget;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CategoryBudgetRepository extends JpaRepository<CategoryBudgetEntity, UUID> {

    List<CategoryBudgetEntity> findByBudgetIdOrderByCategoryIdAsc(UUID budgetId);

    Optional<CategoryBudgetEntity> findByBudgetIdAndCategoryId(UUID budgetId, UUID categoryId);
}
