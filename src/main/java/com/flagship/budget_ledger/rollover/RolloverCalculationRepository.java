package com.flagship.budget_ledger.rollover;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Insert and read only. Rows are never updated or deleted.
 */
@Repository
public interface RolloverCalculationRepository extends JpaRepository<RolloverCalculationEntity, UUID> {

    List<RolloverCalculationEntity> findByBudgetIdOrderByCalculatedAtAsc(UUID budgetId);

    List<RolloverCalculationEntity> findByBudgetIdAndCategoryIdOrderByCalculatedAtAsc(UUID budgetId, UUID categoryId);
}
