package com.flagship.budget_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.account.Party;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class CreatePartyRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    @JsonProperty("name")
    String name;

    @JsonProperty("party_type")
    Party.PartyType partyType;

    @JsonProperty("seed_default_accounts")
    boolean seedDefaultAccounts;
}
