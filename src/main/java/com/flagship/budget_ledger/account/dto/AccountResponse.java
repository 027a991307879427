package com.flagship.budget_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountType;
import com.flagship.budget_ledger.account.Category;
import com.flagship.budget_ledger.account.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("parent_id")
    UUID parentId;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("currency")
    CurrencyCode currency;

    @JsonProperty("balance")
    BigDecimal balance;

    public static AccountResponse from(Account account) {
        return from(account, null);
    }

    public static AccountResponse from(Account account, BigDecimal balance) {
        return AccountResponse.builder()
            .id(account.getId())
            .name(account.getName())
            .accountType(account.getAccountType())
            .parentId(account.getParentId())
            .active(account.isActive())
            .currency(account.getCurrency())
            .balance(balance)
            .build();
    }

    public static AccountResponse from(Category category) {
        return AccountResponse.builder()
            .id(category.getId())
            .name(category.getName())
            .accountType(AccountType.EXPENSE)
            .parentId(category.getParentId())
            .active(category.isActive())
            .build();
    }
}
