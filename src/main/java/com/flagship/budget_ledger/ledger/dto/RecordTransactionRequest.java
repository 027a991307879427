package com.flagship.budget_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * A raw journal entry: every posting is given explicitly and must balance.
 */
@Value
public class RecordTransactionRequest {

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;

    @NotBlank(message = "Date is required")
    @JsonProperty("date")
    String date;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("external_id")
    String externalId;

    @NotEmpty(message = "Entries are required")
    @JsonProperty("entries")
    List<@Valid Entry> entries;

    @Value
    public static class Entry {

        @NotNull(message = "Account ID is required")
        @JsonProperty("account_id")
        UUID accountId;

        @NotNull(message = "Amount is required")
        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("is_reportable")
        Boolean reportable;
    }
}
