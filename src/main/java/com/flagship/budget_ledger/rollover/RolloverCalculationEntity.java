package com.flagship.budget_ledger.rollover;

import com.flagship.budget_ledger.budget.BudgetMonth;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only rollover history row.
 *
 * Mapped {@link Immutable} and without setters; the table additionally
 * rejects UPDATE and DELETE with a trigger. Implements {@link Persistable}
 * so that saving a new row is a plain insert.
 */
@Entity
@Immutable
@Table(name = "rollover_calculations")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RolloverCalculationEntity implements Persistable<UUID> {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "budget_id", nullable = false)
    private UUID budgetId;

    @Column(name = "category_id", nullable = false)
    private UUID categoryId;

    @Column(name = "calculated_at", nullable = false)
    private Instant calculatedAt;

    @Column(name = "rollover_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal rolloverAmount;

    @Column(name = "source_month", nullable = false, length = 7)
    private String sourceMonth;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private RolloverReason reason;

    @Column(name = "base_budget", nullable = false, precision = 19, scale = 4)
    private BigDecimal baseBudget;

    @Column(name = "prev_rollover", nullable = false, precision = 19, scale = 4)
    private BigDecimal prevRollover;

    @Column(name = "effective_budget", nullable = false, precision = 19, scale = 4)
    private BigDecimal effectiveBudget;

    @Column(name = "spent_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal spentAmount;

    @Transient
    private boolean newRow;

    static RolloverCalculationEntity fromDomain(RolloverCalculation calculation) {
        if (calculation.getBudgetId() == null) {
            throw new IllegalArgumentException("A history row needs the budget it belongs to");
        }
        return new RolloverCalculationEntity(
            UUID.randomUUID(),
            calculation.getBudgetId(),
            calculation.getCategoryId(),
            calculation.getCalculatedAt(),
            calculation.getRolloverAmount(),
            calculation.getSourceMonth().toString(),
            calculation.getReason(),
            calculation.getBaseBudget(),
            calculation.getPrevRollover(),
            calculation.getEffectiveBudget(),
            calculation.getSpentAmount(),
            true
        );
    }

    public RolloverCalculation toDomain() {
        return new RolloverCalculation(
            id,
            budgetId,
            categoryId,
            calculatedAt,
            rolloverAmount,
            BudgetMonth.parse(sourceMonth),
            reason,
            baseBudget,
            prevRollover,
            effectiveBudget,
            spentAmount
        );
    }

    @Override
    public boolean isNew() {
        return newRow;
    }

    @PostLoad
    @PostPersist
    void markStored() {
        this.newRow = false;
    }
}
