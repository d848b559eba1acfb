package com.flagship.expense_workflow.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.expense_workflow.observability.ExpenseMetrics;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Service for writing events to the outbox.
 *
 * Called within existing business transactions so that an expense
 * transition and the event describing it commit together:
 *
 * "If the transition commits, the event is guaranteed to be written."
 *
 * Usage:
 * 1. Call saveEvent() within your @Transactional business method
 * 2. The event is written to the database in the same transaction
 * 3. If the transaction rolls back, the event is also rolled back
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final ExpenseMetrics expenseMetrics;

    @PostConstruct
    void registerBacklogGauge() {
        expenseMetrics.registerOutboxBacklogGauge(repository::countUnpublished);
    }

    /**
     * Saves an event to the outbox within the current transaction.
     *
     * IMPORTANT: uses MANDATORY propagation, so calling it outside a
     * transaction fails instead of committing the event on its own.
     *
     * @param aggregateType Type of the aggregate (e.g., "ExpenseRequest")
     * @param aggregateId ID of the aggregate
     * @param eventType Type of the event (e.g., "ExpenseSubmitted")
     * @param payload Event payload object (will be serialized to JSON)
     * @return The saved event
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId,
                                 String eventType, Object payload) {
        String jsonPayload = serializePayload(payload);

        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, eventType, jsonPayload);
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
                eventType, aggregateType, aggregateId);

        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
                aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
