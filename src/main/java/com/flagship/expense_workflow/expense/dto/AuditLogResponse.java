package com.flagship.expense_workflow.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_workflow.audit.AuditLog;
import com.flagship.expense_workflow.expense.ExpenseStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AuditLogResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("expense_request_id")
    UUID expenseRequestId;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("action")
    String action;

    @JsonProperty("previous_status")
    ExpenseStatus previousStatus;

    @JsonProperty("new_status")
    ExpenseStatus newStatus;

    @JsonProperty("details")
    String details;

    @JsonProperty("timestamp")
    Instant timestamp;

    public static AuditLogResponse from(AuditLog auditLog) {
        return new AuditLogResponse(
            auditLog.getId(),
            auditLog.getExpenseRequestId(),
            auditLog.getUserId(),
            auditLog.getAction(),
            auditLog.getPreviousStatus(),
            auditLog.getNewStatus(),
            auditLog.getDetails(),
            auditLog.getTimestamp()
        );
    }
}
