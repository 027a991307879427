package com.flagship.budget_ledger.notification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.budget.BudgetMonth;
import com.flagship.budget_ledger.rollover.RolloverReason;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact: the rollovers of a user's budget for one month were recomputed and
 * committed. Emitted once per month touched by a chain walk.
 */
@Value
public class RolloverUpdatedEvent {

    public static final String EVENT_TYPE = "RolloverUpdated";

    UUID eventId;
    String eventType;
    UUID userId;
    UUID budgetId;
    String yearMonth;
    RolloverReason reason;
    Instant occurredAt;

    @JsonCreator
    public RolloverUpdatedEvent(@JsonProperty("eventId") UUID eventId,
                                @JsonProperty("eventType") String eventType,
                                @JsonProperty("userId") UUID userId,
                                @JsonProperty("budgetId") UUID budgetId,
                                @JsonProperty("yearMonth") String yearMonth,
                                @JsonProperty("reason") RolloverReason reason,
                                @JsonProperty("occurredAt") Instant occurredAt) {
        this.eventId = eventId;
        this.eventType = eventType;
        this.userId = userId;
        this.budgetId = budgetId;
        this.yearMonth = yearMonth;
        this.reason = reason;
        this.occurredAt = occurredAt;
    }

    public static RolloverUpdatedEvent of(UUID userId, UUID budgetId, BudgetMonth month, RolloverReason reason) {
        return new RolloverUpdatedEvent(UUID.randomUUID(), EVENT_TYPE, userId, budgetId, month.toString(),
            reason, Instant.now());
    }
}
