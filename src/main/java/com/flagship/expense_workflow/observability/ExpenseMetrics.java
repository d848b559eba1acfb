package com.flagship.expense_workflow.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer meters for the expense workflow.
 *
 * <ul>
 *   <li>expense.operations: counter tagged with operation and outcome
 *       (success, rejected, error)</li>
 *   <li>expense.operation.latency: timer tagged with operation</li>
 *   <li>expense.amount: distribution of amounts on create, tagged with operation</li>
 *   <li>outbox.backlog.size: gauge of events not yet relayed</li>
 * </ul>
 */
@Component
public class ExpenseMetrics {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_REJECTED = "rejected";
    public static final String OUTCOME_ERROR = "error";

    private final MeterRegistry registry;

    public ExpenseMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOperation(String operation, String outcome) {
        registry.counter("expense.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("expense.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordAmount(String operation, double amount) {
        registry.summary("expense.amount", "operation", sanitizeTag(operation)).record(amount);
    }

    public double operationCount(String operation, String outcome) {
        var counter = registry.find("expense.operations")
                .tags("operation", sanitizeTag(operation), "outcome", sanitizeTag(outcome))
                .counter();
        return counter != null ? counter.count() : 0.0;
    }

    public void registerOutboxBacklogGauge(Supplier<Number> supplier) {
        registry.gauge("outbox.backlog.size", Tags.empty(), supplier, s -> s.get().doubleValue());
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
