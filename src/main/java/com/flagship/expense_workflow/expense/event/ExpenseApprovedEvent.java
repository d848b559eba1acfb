package com.flagship.expense_workflow.expense.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A submitted expense was approved. The amount now counts against budgets.
 */
@Value
public class ExpenseApprovedEvent implements ExpenseEvent {
    UUID eventId;
    UUID expenseId;
    UUID approvedBy;
    BigDecimal amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ExpenseApproved";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ExpenseApprovedEvent of(UUID expenseId, UUID approvedBy, BigDecimal amount, Instant occurredAt) {
        return new ExpenseApprovedEvent(UUID.randomUUID(), expenseId, approvedBy, amount, occurredAt);
    }
}
