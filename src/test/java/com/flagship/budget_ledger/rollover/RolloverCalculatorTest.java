package com.flagship.budget_ledger.rollover;

import com.flagship.budget_ledger.budget.BudgetEntity;
import com.flagship.budget_ledger.budget.BudgetMonth;
import com.flagship.budget_ledger.budget.BudgetRepository;
import com.flagship.budget_ledger.budget.CategoryBudgetEntity;
import com.flagship.budget_ledger.budget.CategoryBudgetRepository;
import com.flagship.budget_ledger.spend.SpendAggregator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RolloverCalculatorTest {

    @Mock
    private BudgetRepository budgetRepository;

    @Mock
    private CategoryBudgetRepository categoryBudgetRepository;

    @Mock
    private SpendAggregator spendAggregator;

    @Mock
    private RolloverCalculationRepository calculationRepository;

    @InjectMocks
    private RolloverCalculator calculator;

    private final UUID user = UUID.randomUUID();
    private final UUID groceries = UUID.randomUUID();
    private final UUID februaryBudget = UUID.randomUUID();
    private final BudgetMonth february = BudgetMonth.parse("2024-02");
    private final BudgetMonth january = BudgetMonth.parse("2024-01");

    @Test
    @DisplayName("Unused budget carries forward: 100 budgeted, 80 spent rolls +20")
    void leftoverRollsForward() {
        givenJanuary("100.00", "0", true);
        when(spendAggregator.spendForMonth(user, groceries, january)).thenReturn(new BigDecimal("80.00"));

        RolloverCalculation result = calculator.compute(user, groceries, february, februaryBudget,
            RolloverReason.CREATION);

        assertEquals(0, new BigDecimal("20.00").compareTo(result.getRolloverAmount()));
        assertEquals(0, new BigDecimal("100.00").compareTo(result.getEffectiveBudget()));
        assertEquals(0, new BigDecimal("80.00").compareTo(result.getSpentAmount()));
        assertEquals(january, result.getSourceMonth());
        assertEquals(februaryBudget, result.getBudgetId());
    }

    @Test
    @DisplayName("Overspend is deducted and the previous rollover is part of the effective budget")
    void overspendIncludesPreviousRollover() {
        givenJanuary("100.00", "20.00", true);
        when(spendAggregator.spendForMonth(user, groceries, january)).thenReturn(new BigDecimal("150.00"));

        RolloverCalculation result = calculator.compute(user, groceries, february, februaryBudget,
            RolloverReason.CHAIN_PROPAGATION);

        assertEquals(0, new BigDecimal("-30.00").compareTo(result.getRolloverAmount()));
        assertEquals(0, new BigDecimal("120.00").compareTo(result.getEffectiveBudget()));
        assertEquals(0, new BigDecimal("20.00").compareTo(result.getPrevRollover()));
    }

    @Test
    @DisplayName("Rollover is zero when the previous month has rollover disabled")
    void disabledRolloverIsZero() {
        givenJanuary("100.00", "0", false);
        when(spendAggregator.spendForMonth(user, groceries, january)).thenReturn(new BigDecimal("10.00"));

        RolloverCalculation result = calculator.compute(user, groceries, february, februaryBudget,
            RolloverReason.CREATION);

        assertEquals(0, BigDecimal.ZERO.compareTo(result.getRolloverAmount()));
        assertEquals(0, new BigDecimal("100.00").compareTo(result.getEffectiveBudget()));
    }

    @Test
    @DisplayName("No budget in the previous month is the base case: zero, no spend lookup")
    void noPreviousBudget() {
        when(budgetRepository.findByUserIdAndYearMonth(user, "2024-01")).thenReturn(Optional.empty());

        RolloverCalculation result = calculator.compute(user, groceries, february, februaryBudget,
            RolloverReason.CREATION);

        assertEquals(0, BigDecimal.ZERO.compareTo(result.getRolloverAmount()));
        assertEquals(january, result.getSourceMonth());
        verify(spendAggregator, never()).spendForMonth(any(), any(), any());
    }

    @Test
    @DisplayName("January looks back to December of the previous year")
    void januaryLooksAtDecember() {
        when(budgetRepository.findByUserIdAndYearMonth(user, "2023-12")).thenReturn(Optional.empty());

        RolloverCalculation result = calculator.compute(user, groceries, january, null, RolloverReason.CREATION);

        assertEquals(BudgetMonth.parse("2023-12"), result.getSourceMonth());
    }

    @Test
    @DisplayName("calculate appends a history row with the computed values")
    void calculateRecordsHistory() {
        givenJanuary("100.00", "0", true);
        when(spendAggregator.spendForMonth(user, groceries, january)).thenReturn(new BigDecimal("80.00"));
        when(calculationRepository.save(any(RolloverCalculationEntity.class)))
            .thenAnswer(invocation -> invocation.getArgument(0));

        RolloverCalculation stored = calculator.calculate(user, februaryBudget, groceries, february,
            RolloverReason.MANUAL_RECALCULATION);

        assertNotNull(stored.getId());
        assertEquals(RolloverReason.MANUAL_RECALCULATION, stored.getReason());
        assertEquals(0, new BigDecimal("20.00").compareTo(stored.getRolloverAmount()));
        verify(calculationRepository).save(any(RolloverCalculationEntity.class));
    }

    private void givenJanuary(String budgetAmount, String rolloverAmount, boolean rolloverEnabled) {
        UUID januaryBudgetId = UUID.randomUUID();
        BudgetEntity januaryBudget = mock(BudgetEntity.class);
        when(januaryBudget.getId()).thenReturn(januaryBudgetId);
        when(budgetRepository.findByUserIdAndYearMonth(user, "2024-01")).thenReturn(Optional.of(januaryBudget));

        CategoryBudgetEntity category = mock(CategoryBudgetEntity.class);
        when(category.getBudgetAmount()).thenReturn(new BigDecimal(budgetAmount));
        when(category.getRolloverAmount()).thenReturn(new BigDecimal(rolloverAmount));
        when(category.isRolloverEnabled()).thenReturn(rolloverEnabled);
        when(categoryBudgetRepository.findByBudgetIdAndCategoryId(januaryBudgetId, groceries))
            .thenReturn(Optional.of(category));
    }
}
