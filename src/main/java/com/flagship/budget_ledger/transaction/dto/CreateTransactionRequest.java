package com.flagship.budget_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.transaction.ShareMethod;
import com.flagship.budget_ledger.transaction.TransactionKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Expense-style transaction. Without an explicit {@code type} the kind is
 * SPLIT when splits are given, SHARED when a share is given, else EXPENSE.
 */
@Value
public class CreateTransactionRequest {

    @JsonProperty("type")
    TransactionKind type;

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;

    @NotBlank(message = "Date is required")
    @JsonProperty("occurred_on")
    String occurredOn;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("external_id")
    String externalId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("category_id")
    UUID categoryId;

    @JsonProperty("source_account_id")
    UUID sourceAccountId;

    @JsonProperty("destination_account_id")
    UUID destinationAccountId;

    @JsonProperty("splits")
    List<@Valid Split> splits;

    @Valid
    @JsonProperty("share")
    Share share;

    public TransactionKind resolveKind() {
        if (type != null) {
            return type;
        }
        if (splits != null && !splits.isEmpty()) {
            return TransactionKind.SPLIT;
        }
        return share != null ? TransactionKind.SHARED : TransactionKind.EXPENSE;
    }

    @Value
    public static class Split {

        @NotNull(message = "Split category is required")
        @JsonProperty("category_id")
        UUID categoryId;

        @NotNull(message = "Split amount is required")
        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("description")
        String description;
    }

    @Value
    public static class Share {

        @NotNull(message = "Share method is required")
        @JsonProperty("method")
        ShareMethod method;

        @NotNull(message = "Share value is required")
        @JsonProperty("value")
        BigDecimal value;
    }
}
