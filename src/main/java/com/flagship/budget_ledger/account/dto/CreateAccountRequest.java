package com.flagship.budget_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.account.AccountType;
import com.flagship.budget_ledger.account.CurrencyCode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class CreateAccountRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Account type is required")
    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("parent_id")
    UUID parentId;

    @JsonProperty("currency")
    CurrencyCode currency;
}
