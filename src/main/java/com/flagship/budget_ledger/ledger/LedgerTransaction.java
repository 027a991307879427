package com.flagship.budget_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A balanced economic event: a header plus two or more entries whose
 * amounts sum to zero.
 */
@Value
public class LedgerTransaction {
    UUID id;
    UUID ownerId;
    Instant occurredAt;
    String description;
    String notes;
    String externalId;
    Instant deletedAt;
    Instant createdAt;
    Instant updatedAt;
    List<LedgerEntry> entries;

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public BigDecimal getTotal() {
        return entries.stream()
            .map(LedgerEntry::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    LedgerTransaction withEntries(List<LedgerEntry> newEntries) {
        return new LedgerTransaction(id, ownerId, occurredAt, description, notes, externalId,
            deletedAt, createdAt, updatedAt, List.copyOf(newEntries));
    }
}
