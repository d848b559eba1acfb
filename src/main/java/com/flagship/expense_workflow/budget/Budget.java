package com.flagship.expense_workflow.budget;

import com.flagship.expense_workflow.exception.BusinessRuleException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * A spending allocation over a date range.
 *
 * userId null means the budget covers every user; categoryId null means it
 * covers every category. Utilization is never stored, see {@link BudgetStatus}.
 */
@Value
public class Budget {

    public static final int MAX_NAME_LENGTH = 200;

    UUID id;
    String name;
    String description;
    BigDecimal amount;
    LocalDate startDate;
    LocalDate endDate;
    UUID userId;
    UUID categoryId;
    boolean active;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates an active budget.
     *
     * @throws BusinessRuleException if the name is empty, the amount is not
     *                               positive or the start is not before the end
     */
    public static Budget create(String name, BigDecimal amount, LocalDate startDate, LocalDate endDate,
                                String description, UUID userId, UUID categoryId) {
        validate(name, amount, startDate, endDate);
        return new Budget(
            UUID.randomUUID(),
            name,
            description,
            amount,
            startDate,
            endDate,
            userId,
            categoryId,
            true,
            Instant.now(),
            null
        );
    }

    /**
     * Replaces name, amount, dates and description. Owner, category and the
     * active flag are kept.
     */
    public Budget update(String name, BigDecimal amount, LocalDate startDate, LocalDate endDate,
                         String description) {
        validate(name, amount, startDate, endDate);
        return new Budget(id, name, description, amount, startDate, endDate, userId, categoryId,
                active, createdAt, Instant.now());
    }

    public Budget activate() {
        return new Budget(id, name, description, amount, startDate, endDate, userId, categoryId,
                true, createdAt, Instant.now());
    }

    public Budget deactivate() {
        return new Budget(id, name, description, amount, startDate, endDate, userId, categoryId,
                false, createdAt, Instant.now());
    }

    /**
     * Active flag set and today inside [startDate, endDate].
     */
    public boolean isCurrentlyActive(LocalDate today) {
        return active && !today.isBefore(startDate) && !today.isAfter(endDate);
    }

    public boolean isGlobal() {
        return userId == null;
    }

    public boolean isOwnedBy(UUID candidate) {
        return userId != null && Objects.equals(userId, candidate);
    }

    private static void validate(String name, BigDecimal amount, LocalDate startDate, LocalDate endDate) {
        if (name == null || name.isBlank()) {
            throw new BusinessRuleException("Budget name cannot be empty.");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new BusinessRuleException("Budget name cannot exceed " + MAX_NAME_LENGTH + " characters.");
        }
        if (amount == null || amount.compareTo(BigDecimal.ZERO) <= 0) {
            throw new BusinessRuleException("Budget amount must be greater than zero.");
        }
        if (startDate == null || endDate == null) {
            throw new BusinessRuleException("Budget start and end dates are required.");
        }
        if (!startDate.isBefore(endDate)) {
            throw new BusinessRuleException("Start date must be before end date.");
        }
    }
}
