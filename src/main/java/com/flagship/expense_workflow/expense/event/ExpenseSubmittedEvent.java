package com.flagship.expense_workflow.expense.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An expense left DRAFT and now waits for approval.
 */
@Value
public class ExpenseSubmittedEvent implements ExpenseEvent {
    UUID eventId;
    UUID expenseId;
    UUID submittedBy;
    BigDecimal amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ExpenseSubmitted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ExpenseSubmittedEvent of(UUID expenseId, UUID submittedBy, BigDecimal amount, Instant occurredAt) {
        return new ExpenseSubmittedEvent(UUID.randomUUID(), expenseId, submittedBy, amount, occurredAt);
    }
}
