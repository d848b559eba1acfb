package com.flagship.expense_workflow.expense;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Tunable thresholds used by the expense state machine.
 *
 * receiptThreshold: amounts strictly above it need an attachment to be submitted.
 * approvalCeiling: amounts strictly above it can only be approved by an admin.
 * maxExpenseAgeDays: how far back an expense date may lie at creation; 0 disables the check.
 */
@Value
public class ExpenseRules {

    public static final BigDecimal DEFAULT_RECEIPT_THRESHOLD = new BigDecimal("100");
    public static final BigDecimal DEFAULT_APPROVAL_CEILING = new BigDecimal("1000");
    public static final int DEFAULT_MAX_EXPENSE_AGE_DAYS = 90;

    BigDecimal receiptThreshold;
    BigDecimal approvalCeiling;
    int maxExpenseAgeDays;

    public ExpenseRules(BigDecimal receiptThreshold, BigDecimal approvalCeiling, int maxExpenseAgeDays) {
        if (receiptThreshold == null || receiptThreshold.signum() < 0) {
            throw new IllegalArgumentException("Receipt threshold must be zero or positive");
        }
        if (approvalCeiling == null || approvalCeiling.signum() < 0) {
            throw new IllegalArgumentException("Approval ceiling must be zero or positive");
        }
        if (maxExpenseAgeDays < 0) {
            throw new IllegalArgumentException("Maximum expense age cannot be negative");
        }
        this.receiptThreshold = receiptThreshold;
        this.approvalCeiling = approvalCeiling;
        this.maxExpenseAgeDays = maxExpenseAgeDays;
    }

    public static ExpenseRules defaults() {
        return new ExpenseRules(DEFAULT_RECEIPT_THRESHOLD, DEFAULT_APPROVAL_CEILING, DEFAULT_MAX_EXPENSE_AGE_DAYS);
    }

    public boolean requiresReceipt(BigDecimal amount) {
        return amount.compareTo(receiptThreshold) > 0;
    }

    public boolean requiresAdminApproval(BigDecimal amount) {
        return amount.compareTo(approvalCeiling) > 0;
    }

    public boolean limitsExpenseAge() {
        return maxExpenseAgeDays > 0;
    }
}
