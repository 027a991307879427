package com.flagship.budget_ledger.account;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An economic actor. Owns accounts, ledger transactions and budgets.
 */
@Value
public class Party {
    UUID id;
    PartyType partyType;
    String name;
    Instant createdAt;

    public enum PartyType {
        USER,
        HOUSEHOLD
    }
}
