package com.flagship.expense_workflow.identity;

import java.util.Locale;

/**
 * Role of a user as supplied by the identity provider.
 */
public enum UserRole {
    /**
     * Creates and submits own expenses.
     */
    EMPLOYEE,

    /**
     * Approves or rejects employees' expenses up to the approval ceiling.
     * Cannot approve own expenses or those of other managers.
     */
    MANAGER,

    /**
     * Approves or rejects any submitted expense.
     */
    ADMIN;

    public boolean canProcessExpenses() {
        return this == MANAGER || this == ADMIN;
    }

    /**
     * Parses a role name case-insensitively ("Manager", "MANAGER", "manager").
     *
     * @throws IllegalArgumentException if the value names no role
     */
    public static UserRole parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("User role is required");
        }
        try {
            return UserRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown user role: " + value);
        }
    }
}
