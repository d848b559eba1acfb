package com.flagship.expense_workflow.expense.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ExpenseRejectedEvent implements ExpenseEvent {
    UUID eventId;
    UUID expenseId;
    UUID rejectedBy;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ExpenseRejected";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ExpenseRejectedEvent of(UUID expenseId, UUID rejectedBy, String reason, Instant occurredAt) {
        return new ExpenseRejectedEvent(UUID.randomUUID(), expenseId, rejectedBy, reason, occurredAt);
    }
}
