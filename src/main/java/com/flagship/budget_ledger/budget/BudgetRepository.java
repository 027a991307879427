package com.flagship.budget_ledger.budget;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Budgets are looked up by their zero-padded {@code YYYY-MM} string, so
 * string comparison on {@code yearMonth} is chronological comparison.
 */
@Repository
public interface BudgetRepository extends JpaRepository<BudgetEntity, UUID> {

    Optional<BudgetEntity> findByUserIdAndYearMonth(UUID userId, String yearMonth);

    Optional<BudgetEntity> findByIdAndUserId(UUID id, UUID userId);

    List<BudgetEntity> findByUserIdOrderByYearMonthAsc(UUID userId);

    /**
     * Every budget of the user after the given month, oldest first.
     * This is the work list of a chain walk.
     */
    List<BudgetEntity> findByUserIdAndYearMonthGreaterThanOrderByYearMonthAsc(UUID userId, String yearMonth);

    List<BudgetEntity> findByRolloverNeedsRecalcTrueOrderByYearMonthAsc();

    long countByRolloverNeedsRecalcTrue();

    @Modifying
    @Query("UPDATE BudgetEntity b SET b.rolloverNeedsRecalc = true WHERE b.id = :id")
    int markNeedsRecalc(@Param("id") UUID id);
}
