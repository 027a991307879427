package com.flagship.budget_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.account.Party;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class PartyResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("party_type")
    Party.PartyType partyType;

    @JsonProperty("name")
    String name;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("accounts")
    List<AccountResponse> accounts;

    public static PartyResponse from(Party party, List<AccountResponse> accounts) {
        return PartyResponse.builder()
            .id(party.getId())
            .partyType(party.getPartyType())
            .name(party.getName())
            .createdAt(party.getCreatedAt())
            .accounts(accounts)
            .build();
    }
}
