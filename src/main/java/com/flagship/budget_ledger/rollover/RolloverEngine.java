package com.flagship.budget_ledger.rollover;

import com.flagship.budget_ledger.budget.BudgetEntity;
import com.flagship.budget_ledger.budget.BudgetMonth;
import com.flagship.budget_ledger.budget.BudgetRepository;
import com.flagship.budget_ledger.exception.NotFoundException;
import com.flagship.budget_ledger.observability.CorrelationContext;
import com.flagship.budget_ledger.observability.RolloverMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Propagates rollover changes forward through a user's budget months.
 *
 * A change in month M can change the rollover of M+1, which feeds M+2, and
 * so on. The engine materializes that dependency as a work list of every
 * budget after M, sorted ascending by month, and processes it iteratively:
 * each month reads the committed result of the month before it. Walks are
 * never parallel, and walks of the same user are serialized.
 *
 * Each month commits on its own (see {@link MonthRecomputer}). If one
 * fails, it stays flagged {@code rollover_needs_recalc}, keeps its old
 * rollovers, and the walk moves on to the next month.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RolloverEngine {

    private final BudgetRepository budgetRepository;
    private final MonthRecomputer monthRecomputer;
    private final RolloverCalculator calculator;
    private final RolloverCalculationRepository calculationRepository;
    private final RolloverMetrics metrics;

    private final ConcurrentMap<UUID, ReentrantLock> userLocks = new ConcurrentHashMap<>();

    /**
     * Recomputes every budget of the user strictly after {@code changedMonth},
     * oldest first. The first month records {@code reason}, the rest
     * {@link RolloverReason#CHAIN_PROPAGATION}.
     */
    public RolloverChainResult invalidateAndRecomputeChain(UUID userId, BudgetMonth changedMonth,
                                                           RolloverReason reason) {
        ReentrantLock lock = userLocks.computeIfAbsent(userId, id -> new ReentrantLock());
        lock.lock();
        long started = System.nanoTime();
        String previousUser = MDC.get(CorrelationContext.USER_ID_MDC_KEY);
        MDC.put(CorrelationContext.USER_ID_MDC_KEY, userId.toString());
        try {
            List<BudgetEntity> workList = budgetRepository
                .findByUserIdAndYearMonthGreaterThanOrderByYearMonthAsc(userId, changedMonth.toString());

            List<RolloverChainResult.MonthResult> results = new ArrayList<>();
            for (int i = 0; i < workList.size(); i++) {
                RolloverReason monthReason = i == 0 ? reason : RolloverReason.CHAIN_PROPAGATION;
                results.add(recomputeMonth(workList.get(i), monthReason));
            }

            RolloverChainResult result = new RolloverChainResult(userId, changedMonth, reason, List.copyOf(results));
            if (result.isFullySucceeded()) {
                log.info("Rollover chain after {} ({}) recomputed {} months", changedMonth, reason, results.size());
            } else {
                log.warn("Rollover chain after {} ({}) recomputed {} months, {} failed and stay flagged",
                    changedMonth, reason, results.size(), result.getFailedMonths().size());
            }
            return result;
        } finally {
            metrics.recordChainDuration(reason.name(), Duration.ofNanos(System.nanoTime() - started));
            restoreMdc(CorrelationContext.USER_ID_MDC_KEY, previousUser);
            lock.unlock();
        }
    }

    /**
     * Recomputes {@code fromMonth} itself and every month after it.
     */
    public RolloverChainResult recomputeFrom(UUID userId, BudgetMonth fromMonth, RolloverReason reason) {
        return invalidateAndRecomputeChain(userId, fromMonth.previous(), reason);
    }

    /**
     * Manual recalculation of a month and everything after it.
     */
    public RolloverChainResult recalculateMonth(UUID userId, BudgetMonth month) {
        return recomputeFrom(userId, month, RolloverReason.MANUAL_RECALCULATION);
    }

    /**
     * Computes the rollover of one category into one month. If the month has
     * a budget containing the category, the cached value and the history are
     * updated, and a changed value is walked forward through the later
     * months; otherwise the value is only computed.
     */
    public RolloverCalculation calculateRollover(UUID userId, UUID categoryId, BudgetMonth month) {
        ReentrantLock lock = userLocks.computeIfAbsent(userId, id -> new ReentrantLock());
        lock.lock();
        try {
            Optional<MonthRecomputer.CategoryOutcome> outcome = monthRecomputer.recomputeCategory(
                userId, month, categoryId, RolloverReason.MANUAL_RECALCULATION);
            if (outcome.isEmpty()) {
                return calculator.compute(userId, categoryId, month, null, RolloverReason.MANUAL_RECALCULATION);
            }
            if (outcome.get().isUpdated()) {
                invalidateAndRecomputeChain(userId, month, RolloverReason.MANUAL_RECALCULATION);
            }
            return outcome.get().getCalculation();
        } finally {
            lock.unlock();
        }
    }

    public RolloverStatus getRolloverStatus(UUID userId, UUID budgetId) {
        BudgetEntity budget = budgetRepository.findByIdAndUserId(budgetId, userId)
            .orElseThrow(() -> NotFoundException.of("Budget", budgetId));
        return new RolloverStatus(budget.getId(), budget.getMonth(), budget.getRolloverLastCalculated(),
            budget.isRolloverNeedsRecalc());
    }

    /**
     * History of a budget's rollover computations, oldest first, optionally
     * for one category only.
     */
    public List<RolloverCalculation> getHistory(UUID userId, UUID budgetId, UUID categoryId) {
        budgetRepository.findByIdAndUserId(budgetId, userId)
            .orElseThrow(() -> NotFoundException.of("Budget", budgetId));

        List<RolloverCalculationEntity> rows = categoryId == null
            ? calculationRepository.findByBudgetIdOrderByCalculatedAtAsc(budgetId)
            : calculationRepository.findByBudgetIdAndCategoryIdOrderByCalculatedAtAsc(budgetId, categoryId);
        return rows.stream().map(RolloverCalculationEntity::toDomain).toList();
    }

    /**
     * Re-runs the chain of every user with flagged budgets, starting at that
     * user's earliest flagged month.
     *
     * @return the walks that were run
     */
    public List<RolloverChainResult> retryPendingRecalculations() {
        Map<UUID, BudgetMonth> earliestByUser = new LinkedHashMap<>();
        for (BudgetEntity budget : budgetRepository.findByRolloverNeedsRecalcTrueOrderByYearMonthAsc()) {
            earliestByUser.merge(budget.getUserId(), budget.getMonth(),
                (current, candidate) -> candidate.compareTo(current) < 0 ? candidate : current);
        }

        List<RolloverChainResult> results = new ArrayList<>();
        earliestByUser.entrySet().stream()
            .sorted(Map.Entry.comparingByValue(Comparator.naturalOrder()))
            .forEach(entry -> results.add(recomputeFrom(entry.getKey(), entry.getValue(), RolloverReason.RETRY)));
        return results;
    }

    private RolloverChainResult.MonthResult recomputeMonth(BudgetEntity budget, RolloverReason reason) {
        BudgetMonth month = budget.getMonth();
        MDC.put(CorrelationContext.BUDGET_ID_MDC_KEY, budget.getId().toString());
        try {
            monthRecomputer.markNeedsRecalc(budget.getId());
            MonthRecomputer.Outcome outcome = monthRecomputer.recompute(budget.getId(), reason);
            metrics.recordMonth(reason.name(), true);
            return RolloverChainResult.MonthResult.succeeded(budget.getId(), month, outcome);
        } catch (RuntimeException e) {
            log.error("Rollover recomputation of {} (budget {}) failed; left flagged for retry",
                month, budget.getId(), e);
            metrics.recordMonth(reason.name(), false);
            return RolloverChainResult.MonthResult.failed(budget.getId(), month,
                e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            MDC.remove(CorrelationContext.BUDGET_ID_MDC_KEY);
        }
    }

    private static void restoreMdc(String key, String previous) {
        if (previous != null) {
            MDC.put(key, previous);
        } else {
            MDC.remove(key);
        }
    }
}
