package com.flagship.budget_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.ledger.EntryType;
import com.flagship.budget_ledger.ledger.LedgerEntry;
import com.flagship.budget_ledger.ledger.LedgerTransaction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class LedgerTransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("date")
    Instant occurredAt;

    @JsonProperty("description")
    String description;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("external_id")
    String externalId;

    @JsonProperty("deleted_at")
    Instant deletedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("duplicate")
    boolean duplicate;

    @JsonProperty("entries")
    List<EntryResponse> entries;

    public static LedgerTransactionResponse from(LedgerTransaction transaction) {
        return from(transaction, false);
    }

    public static LedgerTransactionResponse from(LedgerTransaction transaction, boolean duplicate) {
        return LedgerTransactionResponse.builder()
            .id(transaction.getId())
            .occurredAt(transaction.getOccurredAt())
            .description(transaction.getDescription())
            .notes(transaction.getNotes())
            .externalId(transaction.getExternalId())
            .deletedAt(transaction.getDeletedAt())
            .createdAt(transaction.getCreatedAt())
            .updatedAt(transaction.getUpdatedAt())
            .duplicate(duplicate)
            .entries(transaction.getEntries().stream().map(EntryResponse::from).toList())
            .build();
    }

    @Value
    @Builder
    public static class EntryResponse {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("entry_type")
        EntryType entryType;

        @JsonProperty("is_reportable")
        boolean reportable;

        static EntryResponse from(LedgerEntry entry) {
            return EntryResponse.builder()
                .id(entry.getId())
                .accountId(entry.getAccountId())
                .amount(entry.getAmount())
                .entryType(entry.getEntryType())
                .reportable(entry.isReportable())
                .build();
        }
    }
}
