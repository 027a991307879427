package com.flagship.budget_ledger.budget;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for a monthly budget.
 *
 * No setters: after creation the rollover bookkeeping fields change only
 * through {@link #markRecalculated(Instant)} and
 * {@link BudgetRepository#markNeedsRecalc(UUID)}.
 */
@Entity
@Table(name = "budgets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BudgetEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "year_month", nullable = false, updatable = false, length = 7)
    private String yearMonth;

    @Column(name = "rollover_last_calculated")
    private Instant rolloverLastCalculated;

    @Column(name = "rollover_needs_recalc", nullable = false)
    private boolean rolloverNeedsRecalc;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * A new budget starts flagged for recalculation; its rollovers are
     * computed right after it is stored.
     */
    static BudgetEntity create(UUID userId, BudgetMonth month) {
        return new BudgetEntity(
            UUID.randomUUID(),
            userId,
            month.toString(),
            null,
            true,
            null,
            null
        );
    }

    public BudgetMonth getMonth() {
        return BudgetMonth.parse(yearMonth);
    }

    public void markRecalculated(Instant calculatedAt) {
        this.rolloverLastCalculated = calculatedAt;
        this.rolloverNeedsRecalc = false;
    }

    public Budget toDomain(List<CategoryBudget> categories) {
        return new Budget(
            id,
            userId,
            getMonth(),
            rolloverLastCalculated,
            rolloverNeedsRecalc,
            createdAt,
            updatedAt,
            List.copyOf(categories)
        );
    }
}
