package com.flagship.budget_ledger.ledger;

import com.flagship.budget_ledger.budget.BudgetMonth;
import com.flagship.budget_ledger.exception.ValidationException;
import com.flagship.budget_ledger.observability.CorrelationContext;
import com.flagship.budget_ledger.observability.LedgerMetrics;
import com.flagship.budget_ledger.rollover.RolloverEngine;
import com.flagship.budget_ledger.rollover.RolloverReason;
import com.flagship.budget_ledger.spend.DateNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point for every change to the ledger.
 *
 * Delegates the write to {@link LedgerService}, which commits it, and only
 * then propagates the change through the rollover chain: a transaction in
 * month M changes the spend of M and so every rollover after it. A failed
 * propagation does not undo the ledger write; the affected budgets stay
 * flagged and are picked up by the retry loop.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalService {

    private final LedgerService ledgerService;
    private final RolloverEngine rolloverEngine;
    private final DateNormalizer dateNormalizer;
    private final LedgerMetrics metrics;

    public RecordedTransaction record(UUID ownerId, JournalRequest request) {
        RecordedTransaction recorded = measure("record", () -> ledgerService.recordTransaction(ownerId, request));

        if (request.hasExternalId()) {
            if (recorded.isDuplicate()) {
                metrics.recordIdempotencyHit();
            } else {
                metrics.recordIdempotencyMiss();
            }
        }
        if (recorded.isDuplicate()) {
            metrics.recordTransaction("duplicate");
            return recorded;
        }

        metrics.recordTransaction("recorded");
        propagate(ownerId, recorded.getTransaction());
        return recorded;
    }

    /**
     * Records all requests atomically, then propagates once from the
     * earliest month any of them touched.
     */
    public List<RecordedTransaction> recordAll(UUID ownerId, List<JournalRequest> requests) {
        List<RecordedTransaction> recorded = measure("record_batch",
            () -> ledgerService.recordTransactions(ownerId, requests));

        recorded.forEach(result -> metrics.recordTransaction(result.isDuplicate() ? "duplicate" : "recorded"));
        recorded.stream()
            .filter(result -> !result.isDuplicate())
            .map(result -> monthOf(result.getTransaction()))
            .min(BudgetMonth::compareTo)
            .ifPresent(month -> propagate(ownerId, month, null));
        return recorded;
    }

    public TransactionRevision update(UUID ownerId, UUID transactionId, JournalRequest request) {
        TransactionRevision revision = measure("update",
            () -> ledgerService.updateTransaction(ownerId, transactionId, request));
        metrics.recordTransaction("updated");

        BudgetMonth before = monthOf(revision.getPrevious());
        BudgetMonth after = monthOf(revision.getCurrent());
        propagate(ownerId, before.compareTo(after) <= 0 ? before : after, transactionId);
        return revision;
    }

    public LedgerTransaction delete(UUID ownerId, UUID transactionId, boolean hard) {
        LedgerTransaction deleted = measure("delete",
            () -> ledgerService.deleteTransaction(ownerId, transactionId, hard));
        metrics.recordTransaction(hard ? "hard_deleted" : "deleted");

        if (!deleted.isDeleted()) {
            propagate(ownerId, deleted);
        }
        return deleted;
    }

    private <T> T measure(String operation, Supplier<T> action) {
        long startTime = System.currentTimeMillis();
        try {
            return action.get();
        } catch (ValidationException e) {
            metrics.recordTransaction("rejected");
            log.warn("Ledger {} rejected: {}", operation, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordTransaction("failed");
            log.error("Ledger {} failed: {}", operation, e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
        }
    }

    private void propagate(UUID ownerId, LedgerTransaction transaction) {
        propagate(ownerId, monthOf(transaction), transaction.getId());
    }

    private void propagate(UUID ownerId, BudgetMonth month, UUID transactionId) {
        Optional.ofNullable(transactionId)
            .map(Objects::toString)
            .ifPresent(id -> MDC.put(CorrelationContext.LEDGER_TRANSACTION_ID_MDC_KEY, id));
        try {
            rolloverEngine.invalidateAndRecomputeChain(ownerId, month, RolloverReason.TRANSACTION_EDIT);
        } catch (RuntimeException e) {
            log.error("Rollover propagation after ledger change in {} failed; budgets stay flagged for retry",
                month, e);
        } finally {
            MDC.remove(CorrelationContext.LEDGER_TRANSACTION_ID_MDC_KEY);
        }
    }

    private BudgetMonth monthOf(LedgerTransaction transaction) {
        return dateNormalizer.monthOf(transaction.getOccurredAt());
    }
}
