package com.flagship.budget_ledger.ledger;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A fully balanced set of postings to record as one ledger transaction.
 *
 * The journal never derives offsetting entries; callers supply every side.
 */
@Value
@Builder(toBuilder = true)
public class JournalRequest {

    /**
     * Largest absolute sum of entry amounts still treated as balanced.
     */
    public static final BigDecimal BALANCE_TOLERANCE = new BigDecimal("0.0001");

    String description;
    Instant occurredAt;
    String notes;
    String externalId;
    @Singular
    List<Posting> postings;

    public BigDecimal getTotal() {
        return postings.stream()
            .map(Posting::getAmount)
            .filter(Objects::nonNull)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isBalanced() {
        return getTotal().abs().compareTo(BALANCE_TOLERANCE) <= 0;
    }

    public boolean hasExternalId() {
        return externalId != null && !externalId.isBlank();
    }

    /**
     * A single signed posting against an account.
     */
    @Value
    public static class Posting {
        UUID accountId;
        BigDecimal amount;
        boolean reportable;

        public static Posting of(UUID accountId, BigDecimal amount) {
            return new Posting(accountId, amount, true);
        }

        public static Posting of(UUID accountId, BigDecimal amount, boolean reportable) {
            return new Posting(accountId, amount, reportable);
        }

        public static Posting debit(UUID accountId, BigDecimal amount) {
            return of(accountId, amount.abs());
        }

        public static Posting credit(UUID accountId, BigDecimal amount) {
            return of(accountId, amount.abs().negate());
        }
    }
}
