package com.flagship.budget_ledger.rollover;

import com.flagship.budget_ledger.budget.BudgetEntity;
import com.flagship.budget_ledger.budget.BudgetMonth;
import com.flagship.budget_ledger.budget.BudgetRepository;
import com.flagship.budget_ledger.observability.RolloverMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RolloverEngineTest {

    @Mock
    private BudgetRepository budgetRepository;

    @Mock
    private MonthRecomputer monthRecomputer;

    @Mock
    private RolloverCalculator calculator;

    @Mock
    private RolloverCalculationRepository calculationRepository;

    @Mock
    private RolloverMetrics metrics;

    @InjectMocks
    private RolloverEngine engine;

    private final UUID user = UUID.randomUUID();

    @Test
    @DisplayName("Every later month is recomputed, oldest first, flagged before it is recomputed")
    void walksAscending() {
        BudgetEntity february = budget("2024-02");
        BudgetEntity march = budget("2024-03");
        BudgetEntity april = budget("2024-04");
        when(budgetRepository.findByUserIdAndYearMonthGreaterThanOrderByYearMonthAsc(user, "2024-01"))
            .thenReturn(List.of(february, march, april));
        when(monthRecomputer.recompute(any(), any())).thenReturn(new MonthRecomputer.Outcome(1, 1));

        RolloverChainResult result = engine.invalidateAndRecomputeChain(user, BudgetMonth.parse("2024-01"),
            RolloverReason.TRANSACTION_EDIT);

        UUID februaryId = february.getId();
        UUID marchId = march.getId();
        UUID aprilId = april.getId();
        InOrder order = inOrder(monthRecomputer);
        order.verify(monthRecomputer).markNeedsRecalc(februaryId);
        order.verify(monthRecomputer).recompute(februaryId, RolloverReason.TRANSACTION_EDIT);
        order.verify(monthRecomputer).markNeedsRecalc(marchId);
        order.verify(monthRecomputer).recompute(marchId, RolloverReason.CHAIN_PROPAGATION);
        order.verify(monthRecomputer).markNeedsRecalc(aprilId);
        order.verify(monthRecomputer).recompute(aprilId, RolloverReason.CHAIN_PROPAGATION);

        assertTrue(result.isFullySucceeded());
        assertEquals(List.of("2024-02", "2024-03", "2024-04"),
            result.getMonths().stream().map(month -> month.getYearMonth().toString()).toList());
    }

    @Test
    @DisplayName("A failing month is reported and the walk continues with the next one")
    void failureIsIsolated() {
        BudgetEntity february = budget("2024-02");
        BudgetEntity march = budget("2024-03");
        BudgetEntity april = budget("2024-04");
        UUID marchId = march.getId();
        UUID aprilId = april.getId();
        when(budgetRepository.findByUserIdAndYearMonthGreaterThanOrderByYearMonthAsc(user, "2024-01"))
            .thenReturn(List.of(february, march, april));
        when(monthRecomputer.recompute(any(), any())).thenReturn(new MonthRecomputer.Outcome(2, 0));
        when(monthRecomputer.recompute(eq(marchId), any()))
            .thenThrow(new DataAccessResourceFailureException("connection reset"));

        RolloverChainResult result = engine.invalidateAndRecomputeChain(user, BudgetMonth.parse("2024-01"),
            RolloverReason.BUDGET_EDIT);

        assertFalse(result.isFullySucceeded());
        assertEquals(1, result.getFailedMonths().size());
        RolloverChainResult.MonthResult failed = result.getFailedMonths().get(0);
        assertEquals(marchId, failed.getBudgetId());
        assertEquals("connection reset", failed.getError());

        verify(monthRecomputer).recompute(aprilId, RolloverReason.CHAIN_PROPAGATION);
        verify(metrics).recordMonth(RolloverReason.CHAIN_PROPAGATION.name(), false);
        verify(metrics).recordChainDuration(eq(RolloverReason.BUDGET_EDIT.name()), any());
    }

    @Test
    @DisplayName("recomputeFrom includes the month itself")
    void recomputeFromIncludesMonth() {
        when(budgetRepository.findByUserIdAndYearMonthGreaterThanOrderByYearMonthAsc(user, "2023-12"))
            .thenReturn(List.of());

        RolloverChainResult result = engine.recomputeFrom(user, BudgetMonth.parse("2024-01"),
            RolloverReason.CREATION);

        assertTrue(result.getMonths().isEmpty());
        assertEquals(BudgetMonth.parse("2023-12"), result.getChangedMonth());
    }

    @Test
    @DisplayName("Retry restarts each user's chain at their earliest flagged month")
    void retryStartsAtEarliestFlaggedMonth() {
        UUID otherUser = UUID.randomUUID();
        BudgetEntity userMarch = budget(user, "2024-03");
        BudgetEntity userMay = budget(user, "2024-05");
        BudgetEntity otherJune = budget(otherUser, "2024-06");
        when(budgetRepository.findByRolloverNeedsRecalcTrueOrderByYearMonthAsc())
            .thenReturn(List.of(userMarch, userMay, otherJune));
        when(budgetRepository.findByUserIdAndYearMonthGreaterThanOrderByYearMonthAsc(any(), any()))
            .thenReturn(List.of());

        List<RolloverChainResult> results = engine.retryPendingRecalculations();

        assertEquals(2, results.size());
        verify(budgetRepository).findByUserIdAndYearMonthGreaterThanOrderByYearMonthAsc(user, "2024-02");
        verify(budgetRepository).findByUserIdAndYearMonthGreaterThanOrderByYearMonthAsc(otherUser, "2024-05");
        assertTrue(results.stream().allMatch(result -> result.getReason() == RolloverReason.RETRY));
    }

    @Test
    @DisplayName("Without a budget holding the category, calculate only computes")
    void calculateWithoutBudgetDoesNotPersist() {
        UUID category = UUID.randomUUID();
        BudgetMonth march = BudgetMonth.parse("2024-03");
        RolloverCalculation computed = RolloverCalculation.noPriorAllocation(null, category, march.previous(),
            RolloverReason.MANUAL_RECALCULATION);
        when(monthRecomputer.recomputeCategory(user, march, category, RolloverReason.MANUAL_RECALCULATION))
            .thenReturn(Optional.empty());
        when(calculator.compute(user, category, march, null, RolloverReason.MANUAL_RECALCULATION))
            .thenReturn(computed);

        assertSame(computed, engine.calculateRollover(user, category, march));
        verify(calculator, never()).calculate(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("A calculation that changes the cached rollover walks the later months")
    void changedCalculationWalksLaterMonths() {
        UUID category = UUID.randomUUID();
        BudgetMonth march = BudgetMonth.parse("2024-03");
        BudgetEntity april = budget("2024-04");
        RolloverCalculation calculation = RolloverCalculation.noPriorAllocation(null, category, march.previous(),
            RolloverReason.MANUAL_RECALCULATION);
        when(monthRecomputer.recomputeCategory(user, march, category, RolloverReason.MANUAL_RECALCULATION))
            .thenReturn(Optional.of(new MonthRecomputer.CategoryOutcome(calculation, true)));
        when(budgetRepository.findByUserIdAndYearMonthGreaterThanOrderByYearMonthAsc(user, "2024-03"))
            .thenReturn(List.of(april));
        when(monthRecomputer.recompute(any(), any())).thenReturn(new MonthRecomputer.Outcome(1, 1));

        assertSame(calculation, engine.calculateRollover(user, category, march));

        UUID aprilId = april.getId();
        verify(monthRecomputer).recompute(aprilId, RolloverReason.MANUAL_RECALCULATION);
    }

    @Test
    @DisplayName("A calculation that leaves the cached rollover alone does not walk")
    void unchangedCalculationDoesNotWalk() {
        UUID category = UUID.randomUUID();
        BudgetMonth march = BudgetMonth.parse("2024-03");
        RolloverCalculation calculation = RolloverCalculation.noPriorAllocation(null, category, march.previous(),
            RolloverReason.MANUAL_RECALCULATION);
        when(monthRecomputer.recomputeCategory(user, march, category, RolloverReason.MANUAL_RECALCULATION))
            .thenReturn(Optional.of(new MonthRecomputer.CategoryOutcome(calculation, false)));

        assertSame(calculation, engine.calculateRollover(user, category, march));

        verify(budgetRepository, never()).findByUserIdAndYearMonthGreaterThanOrderByYearMonthAsc(any(), any());
        verify(monthRecomputer, never()).recompute(any(), any());
    }

    private BudgetEntity budget(String month) {
        return budget(user, month);
    }

    private BudgetEntity budget(UUID owner, String month) {
        BudgetEntity budget = mock(BudgetEntity.class);
        UUID id = UUID.randomUUID();
        lenient().when(budget.getId()).thenReturn(id);
        lenient().when(budget.getUserId()).thenReturn(owner);
        lenient().when(budget.getMonth()).thenReturn(BudgetMonth.parse(month));
        return budget;
    }
}
