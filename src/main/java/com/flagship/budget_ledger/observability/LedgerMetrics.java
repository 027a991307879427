package com.flagship.budget_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Journal metrics.
 *
 * - ledger.transactions{result}: recorded, duplicate, rejected, failed
 * - ledger.latency{operation}: record, update, delete
 * - idempotency.cache{result}: hit, miss
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransaction(String result) {
        registry.counter("ledger.transactions", "result", sanitizeTag(result)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency", "operation", sanitizeTag(operation))
            .record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    static String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
