package com.flagship.budget_ledger.transaction;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * An expense-style transaction as a caller describes it, before it is turned
 * into balanced postings. Amounts are taken as absolute values.
 */
@Value
@Builder
public class TransactionCommand {
    TransactionKind kind;
    String description;
    Instant occurredAt;
    String notes;
    String externalId;
    BigDecimal amount;
    UUID categoryId;
    UUID sourceAccountId;
    UUID destinationAccountId;
    @Singular
    List<SplitLine> splits;
    ShareMethod shareMethod;
    BigDecimal shareValue;

    @Value
    public static class SplitLine {
        UUID categoryId;
        BigDecimal amount;
        String description;
    }
}
