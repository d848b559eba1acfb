package com.flagship.expense_workflow.expense.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact emitted by an expense state transition.
 *
 * Events are returned by the transition that produced them and written to
 * the outbox in the same transaction as the new state.
 */
public interface ExpenseEvent {

    /**
     * Unique per event instance, lets downstream consumers deduplicate.
     */
    UUID getEventId();

    UUID getExpenseId();

    Instant getOccurredAt();

    String getEventType();
}
