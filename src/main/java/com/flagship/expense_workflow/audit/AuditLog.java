package com.flagship.expense_workflow.audit;

import com.flagship.expense_workflow.expense.ExpenseRequest;
import com.flagship.expense_workflow.expense.ExpenseStatus;
import com.flagship.expense_workflow.identity.UserRole;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One entry in an expense's audit trail.
 *
 * Records are immutable and only built through the static factories below,
 * one per kind of mutating operation, so the (previousStatus, newStatus,
 * details) triple always matches the operation it documents.
 *
 * sequenceNumber is assigned by the database on insert and orders records
 * written within the same instant.
 */
@Value
public class AuditLog {

    public static final String ACTION_CREATED = "Created";
    public static final String ACTION_UPDATED = "Updated";
    public static final String ACTION_SUBMITTED = "Submitted";
    public static final String ACTION_APPROVED = "Approved";
    public static final String ACTION_REJECTED = "Rejected";
    public static final String ACTION_ATTACHMENT_ADDED = "AttachmentAdded";
    public static final String ACTION_ATTACHMENT_REMOVED = "AttachmentRemoved";
    public static final String ACTION_DELETED = "Deleted";

    UUID id;
    UUID expenseRequestId;
    UUID userId;
    String action;
    ExpenseStatus previousStatus;
    ExpenseStatus newStatus;
    String details;
    Instant timestamp;
    Long sequenceNumber;

    public static AuditLog forCreation(UUID expenseRequestId, UUID userId) {
        return of(expenseRequestId, userId, ACTION_CREATED,
                null, ExpenseStatus.DRAFT, "Expense request created");
    }

    /**
     * Documents an edit of a draft. Details list only the fields that changed,
     * or "No changes" when the edit was a no-op.
     */
    public static AuditLog forUpdate(ExpenseRequest before, ExpenseRequest after, UUID userId) {
        return of(after.getId(), userId, ACTION_UPDATED,
                null, null, describeChanges(before, after));
    }

    public static AuditLog forSubmission(UUID expenseRequestId, UUID userId) {
        return of(expenseRequestId, userId, ACTION_SUBMITTED,
                ExpenseStatus.DRAFT, ExpenseStatus.SUBMITTED, "Submitted for approval");
    }

    public static AuditLog forApproval(UUID expenseRequestId, UUID approverId, UserRole approverRole) {
        return of(expenseRequestId, approverId, ACTION_APPROVED,
                ExpenseStatus.SUBMITTED, ExpenseStatus.APPROVED, "Approved by " + approverRole);
    }

    public static AuditLog forRejection(UUID expenseRequestId, UUID rejecterId, UserRole rejecterRole,
                                        String reason) {
        return of(expenseRequestId, rejecterId, ACTION_REJECTED,
                ExpenseStatus.SUBMITTED, ExpenseStatus.REJECTED, "Rejected by " + rejecterRole + ": " + reason);
    }

    public static AuditLog forAttachmentAdded(UUID expenseRequestId, UUID userId, String attachmentUrl) {
        return of(expenseRequestId, userId, ACTION_ATTACHMENT_ADDED,
                null, null, "Added attachment: " + attachmentUrl);
    }

    public static AuditLog forAttachmentRemoved(UUID expenseRequestId, UUID userId, String attachmentUrl) {
        return of(expenseRequestId, userId, ACTION_ATTACHMENT_REMOVED,
                null, null, "Removed attachment: " + attachmentUrl);
    }

    /**
     * Documents removal of a draft. The record outlives the expense row.
     */
    public static AuditLog forDeletion(UUID expenseRequestId, UUID userId) {
        return of(expenseRequestId, userId, ACTION_DELETED,
                ExpenseStatus.DRAFT, null, "Draft expense request deleted");
    }

    public boolean isStatusChange() {
        return newStatus != null && newStatus != previousStatus;
    }

    private static AuditLog of(UUID expenseRequestId, UUID userId, String action,
                               ExpenseStatus previousStatus, ExpenseStatus newStatus, String details) {
        return new AuditLog(
            UUID.randomUUID(),
            expenseRequestId,
            userId,
            action,
            previousStatus,
            newStatus,
            details,
            Instant.now(),
            null  // assigned by database
        );
    }

    static String describeChanges(ExpenseRequest before, ExpenseRequest after) {
        List<String> changes = new ArrayList<>();
        if (!Objects.equals(before.getTitle(), after.getTitle())) {
            changes.add(String.format("Title: '%s' -> '%s'", before.getTitle(), after.getTitle()));
        }
        if (!Objects.equals(before.getDescription(), after.getDescription())) {
            changes.add(String.format("Description: '%s' -> '%s'", before.getDescription(), after.getDescription()));
        }
        if (!sameAmount(before.getAmount(), after.getAmount())) {
            changes.add(String.format("Amount: %s -> %s",
                    before.getAmount().toPlainString(), after.getAmount().toPlainString()));
        }
        if (!Objects.equals(before.getCategoryId(), after.getCategoryId())) {
            changes.add(String.format("Category: %s -> %s", before.getCategoryId(), after.getCategoryId()));
        }
        return changes.isEmpty() ? "No changes" : "Updated " + String.join("; ", changes);
    }

    // 50 and 50.00 are the same amount
    private static boolean sameAmount(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) == 0;
    }
}
