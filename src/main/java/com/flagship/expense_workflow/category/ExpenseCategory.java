package com.flagship.expense_workflow.category;

import com.flagship.expense_workflow.exception.BusinessRuleException;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Reference data for grouping expenses and scoping budgets.
 *
 * Deactivating a category hides it from new expenses; expenses and budgets
 * that already point at it stay valid.
 */
@Value
public class ExpenseCategory {

    public static final int MAX_NAME_LENGTH = 100;

    UUID id;
    String name;
    String description;
    String icon;
    String color;
    boolean active;
    Instant createdAt;

    public static ExpenseCategory create(String name, String description, String icon, String color) {
        if (name == null || name.isBlank()) {
            throw new BusinessRuleException("Category name cannot be empty.");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new BusinessRuleException("Category name cannot exceed " + MAX_NAME_LENGTH + " characters.");
        }
        return new ExpenseCategory(
            UUID.randomUUID(),
            name,
            description != null ? description : "",
            icon != null ? icon : "",
            color != null ? color : "",
            true,
            Instant.now()
        );
    }

    public ExpenseCategory activate() {
        return active ? this : new ExpenseCategory(id, name, description, icon, color, true, createdAt);
    }

    public ExpenseCategory deactivate() {
        return active ? new ExpenseCategory(id, name, description, icon, color, false, createdAt) : this;
    }
}
