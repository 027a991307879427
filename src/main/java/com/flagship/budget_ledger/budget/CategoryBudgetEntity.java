package com.flagship.budget_ledger.budget;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "category_budgets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CategoryBudgetEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "budget_id", nullable = false, updatable = false)
    private UUID budgetId;

    @Column(name = "category_id", nullable = false, updatable = false)
    private UUID categoryId;

    @Column(name = "budget_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal budgetAmount;

    @Column(name = "rollover_enabled", nullable = false)
    private boolean rolloverEnabled;

    @Column(name = "rollover_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal rolloverAmount;

    static CategoryBudgetEntity create(UUID budgetId, CategoryLimit limit) {
        return new CategoryBudgetEntity(
            UUID.randomUUID(),
            budgetId,
            limit.getCategoryId(),
            limit.getBudgetAmount(),
            limit.isRolloverEnabled(),
            BigDecimal.ZERO
        );
    }

    void updateLimit(BigDecimal budgetAmount, Boolean rolloverEnabled) {
        if (budgetAmount != null) {
            this.budgetAmount = budgetAmount;
        }
        if (rolloverEnabled != null) {
            this.rolloverEnabled = rolloverEnabled;
        }
    }

    /**
     * Stores a freshly computed rollover. Only the rollover engine calls this.
     */
    public void applyRollover(BigDecimal rolloverAmount) {
        this.rolloverAmount = rolloverAmount;
    }

    public CategoryBudget toDomain() {
        return new CategoryBudget(id, budgetId, categoryId, budgetAmount, rolloverEnabled, rolloverAmount);
    }
}
