package com.flagship.expense_workflow.expense;

/**
 * Lifecycle state of an expense request.
 *
 * DRAFT → SUBMITTED → APPROVED | REJECTED. There is no way back.
 */
public enum ExpenseStatus {
    /**
     * Initial state. The creator may edit, attach receipts, submit or delete.
     */
    DRAFT,

    /**
     * Waiting for a manager or admin. Only approve/reject are possible.
     */
    SUBMITTED,

    /**
     * Terminal.
     */
    APPROVED,

    /**
     * Terminal.
     */
    REJECTED;

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED;
    }
}
