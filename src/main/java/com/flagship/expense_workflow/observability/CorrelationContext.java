package com.flagship.expense_workflow.observability;

import java.util.UUID;

/**
 * Thread-local holder for the request correlation ID.
 *
 * The ID is taken from the X-Correlation-ID header (or generated) by
 * {@link CorrelationIdFilter} and mirrored into the MDC, so every log line
 * written while serving the request carries it.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String EXPENSE_ID_MDC_KEY = "expenseId";
    public static final String BUDGET_ID_MDC_KEY = "budgetId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Returns the current correlation ID, generating one if none is bound.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form keeps log lines readable.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }
}
