package com.flagship.budget_ledger.observability;

import com.flagship.budget_ledger.budget.BudgetRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rollover engine metrics.
 *
 * - rollover.months{result,reason}: months recomputed by chain walks
 * - rollover.chain.duration{reason}: wall time of a whole walk
 * - rollover.backlog.size: budgets still flagged for recalculation
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RolloverMetrics {

    private final BudgetRepository budgetRepository;
    private final MeterRegistry meterRegistry;

    private final AtomicLong pendingBudgets = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("rollover.backlog.size", pendingBudgets, AtomicLong::get)
            .description("Number of budgets whose rollovers need recalculation")
            .register(meterRegistry);
    }

    public void recordMonth(String reason, boolean succeeded) {
        meterRegistry.counter("rollover.months",
            "reason", LedgerMetrics.sanitizeTag(reason),
            "result", succeeded ? "success" : "failure"
        ).increment();
    }

    public void recordChainDuration(String reason, Duration duration) {
        Timer.builder("rollover.chain.duration")
            .description("Time taken to walk a rollover chain")
            .tag("reason", LedgerMetrics.sanitizeTag(reason))
            .register(meterRegistry)
            .record(duration);
    }

    public void refreshMetrics() {
        try {
            pendingBudgets.set(budgetRepository.countByRolloverNeedsRecalcTrue());
        } catch (Exception e) {
            log.warn("Failed to refresh rollover metrics: {}", e.getMessage());
        }
    }

    public long getPendingBudgets() {
        return pendingBudgets.get();
    }
}
