package com.flagship.expense_workflow.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A domain event waiting in the outbox.
 *
 * Rows are written in the same transaction as the expense change that
 * produced them. Relaying them to a broker happens outside this service;
 * publishedAt stays null until the relay marks the row.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // e.g., "ExpenseRequest"
    UUID aggregateId;
    String eventType;          // e.g., "ExpenseApproved"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            null   // sequence assigned by database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
