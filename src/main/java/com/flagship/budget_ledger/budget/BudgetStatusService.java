package com.flagship.budget_ledger.budget;

import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.spend.SpendAggregator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Compares a month's budget with what was actually spent.
 */
@Service
@RequiredArgsConstructor
public class BudgetStatusService {

    static final BigDecimal ALERT_PERCENT = new BigDecimal("75");

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final BudgetPersistenceService persistenceService;
    private final SpendAggregator spendAggregator;
    private final AccountService accountService;

    public BudgetReport getStatus(UUID userId, BudgetMonth month) {
        Optional<Budget> budget = persistenceService.findByMonth(userId, month);
        if (budget.isEmpty() || budget.get().getCategories().isEmpty()) {
            return BudgetReport.builder()
                .userId(userId)
                .budgetId(budget.map(Budget::getId).orElse(null))
                .yearMonth(month)
                .totalBudget(BigDecimal.ZERO)
                .totalSpent(BigDecimal.ZERO)
                .totalRemaining(BigDecimal.ZERO)
                .percentageUsed(BigDecimal.ZERO)
                .status(BudgetStatus.NO_BUDGETS)
                .build();
        }

        Map<UUID, BigDecimal> spendByCategory = spendAggregator.spendByAccountForMonth(userId, month);
        BudgetReport.BudgetReportBuilder report = BudgetReport.builder()
            .userId(userId)
            .budgetId(budget.get().getId())
            .yearMonth(month);

        BigDecimal totalBudget = BigDecimal.ZERO;
        BigDecimal totalSpent = BigDecimal.ZERO;
        for (CategoryBudget category : budget.get().getCategories()) {
            BigDecimal effective = category.getEffectiveBudget();
            BigDecimal spent = spendByCategory.getOrDefault(category.getCategoryId(), BigDecimal.ZERO);
            BigDecimal percentage = percentageUsed(spent, effective);

            report.category(BudgetReport.CategoryStatus.builder()
                .categoryId(category.getCategoryId())
                .categoryName(categoryName(category.getCategoryId()))
                .budgetAmount(category.getBudgetAmount())
                .rolloverAmount(category.getRolloverAmount())
                .effectiveBudget(effective)
                .spent(spent)
                .remaining(effective.subtract(spent))
                .percentageUsed(percentage)
                .status(BudgetStatus.of(effective, spent, percentage))
                .build());

            totalBudget = totalBudget.add(effective);
            totalSpent = totalSpent.add(spent);
        }

        BigDecimal totalPercentage = percentageUsed(totalSpent, totalBudget);
        return report
            .totalBudget(totalBudget)
            .totalSpent(totalSpent)
            .totalRemaining(totalBudget.subtract(totalSpent))
            .percentageUsed(totalPercentage)
            .status(BudgetStatus.of(totalBudget, totalSpent, totalPercentage))
            .build();
    }

    /**
     * Categories at or above 75% of their effective budget.
     */
    public List<BudgetAlert> getAlerts(UUID userId, BudgetMonth month) {
        List<BudgetAlert> alerts = new ArrayList<>();
        for (BudgetReport.CategoryStatus category : getStatus(userId, month).getCategories()) {
            boolean over = category.getStatus() == BudgetStatus.OVER_BUDGET;
            if (!over && category.getPercentageUsed().compareTo(ALERT_PERCENT) < 0) {
                continue;
            }
            String name = category.getCategoryName() != null ? category.getCategoryName() : "Category";
            alerts.add(BudgetAlert.builder()
                .categoryId(category.getCategoryId())
                .categoryName(category.getCategoryName())
                .alertType(over ? BudgetAlert.AlertType.OVER_BUDGET : BudgetAlert.AlertType.APPROACHING_LIMIT)
                .severity(over ? BudgetAlert.Severity.HIGH : BudgetAlert.Severity.MEDIUM)
                .effectiveBudget(category.getEffectiveBudget())
                .spent(category.getSpent())
                .percentageUsed(category.getPercentageUsed())
                .message(over
                    ? String.format("%s is over budget: spent %s of %s", name,
                        category.getSpent().toPlainString(), category.getEffectiveBudget().toPlainString())
                    : String.format("%s has used %s%% of its budget", name,
                        category.getPercentageUsed().toPlainString()))
                .build());
        }
        return alerts;
    }

    static BigDecimal percentageUsed(BigDecimal spent, BigDecimal effectiveBudget) {
        if (effectiveBudget.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return spent.multiply(HUNDRED).divide(effectiveBudget, 2, RoundingMode.HALF_UP);
    }

    private String categoryName(UUID categoryId) {
        return accountService.getAccount(categoryId).map(Account::getName).orElse(null);
    }
}
