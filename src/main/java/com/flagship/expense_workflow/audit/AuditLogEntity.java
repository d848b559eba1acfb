package com.flagship.expense_workflow.audit;

import com.flagship.expense_workflow.expense.ExpenseStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Generated;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for audit_logs.
 *
 * Append-only: there is no update path. expense_request_id carries no
 * foreign key so the trail survives deletion of a draft.
 */
@Entity
@Table(
    name = "audit_logs",
    indexes = @Index(name = "idx_audit_logs_expense_request", columnList = "expense_request_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuditLogEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "expense_request_id", nullable = false, updatable = false)
    private UUID expenseRequestId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(nullable = false, updatable = false, length = 50)
    private String action;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", updatable = false, length = 20)
    private ExpenseStatus previousStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", updatable = false, length = 20)
    private ExpenseStatus newStatus;

    @Column(updatable = false, columnDefinition = "TEXT")
    private String details;

    @Column(nullable = false, updatable = false)
    private Instant timestamp;

    @Generated
    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    static AuditLogEntity fromDomain(AuditLog auditLog) {
        return new AuditLogEntity(
            auditLog.getId(),
            auditLog.getExpenseRequestId(),
            auditLog.getUserId(),
            auditLog.getAction(),
            auditLog.getPreviousStatus(),
            auditLog.getNewStatus(),
            auditLog.getDetails(),
            auditLog.getTimestamp(),
            null  // sequenceNumber is set by database
        );
    }

    public AuditLog toDomain() {
        return new AuditLog(
            id,
            expenseRequestId,
            userId,
            action,
            previousStatus,
            newStatus,
            details,
            timestamp,
            sequenceNumber
        );
    }
}
