package com.flagship.expense_workflow.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_workflow.expense.ExpenseStatus;
import com.flagship.expense_workflow.expense.ExpenseView;
import com.flagship.expense_workflow.identity.UserRole;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for an expense request.
 */
@Value
@Builder
public class ExpenseResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("creator_id")
    UUID creatorId;

    @JsonProperty("creator_name")
    String creatorName;

    @JsonProperty("creator_role")
    UserRole creatorRole;

    @JsonProperty("category_id")
    UUID categoryId;

    @JsonProperty("title")
    String title;

    @JsonProperty("description")
    String description;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("expense_date")
    LocalDate expenseDate;

    @JsonProperty("status")
    ExpenseStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("submitted_at")
    Instant submittedAt;

    @JsonProperty("processed_at")
    Instant processedAt;

    @JsonProperty("processed_by")
    UUID processedBy;

    @JsonProperty("rejection_reason")
    String rejectionReason;

    @JsonProperty("attachment_urls")
    List<String> attachmentUrls;

    public static ExpenseResponse from(ExpenseView view) {
        return ExpenseResponse.builder()
            .id(view.getId())
            .creatorId(view.getCreatorId())
            .creatorName(view.getCreatorName())
            .creatorRole(view.getCreatorRole())
            .categoryId(view.getCategoryId())
            .title(view.getTitle())
            .description(view.getDescription())
            .amount(view.getAmount())
            .expenseDate(view.getExpenseDate())
            .status(view.getStatus())
            .createdAt(view.getCreatedAt())
            .updatedAt(view.getUpdatedAt())
            .submittedAt(view.getSubmittedAt())
            .processedAt(view.getProcessedAt())
            .processedBy(view.getProcessedBy())
            .rejectionReason(view.getRejectionReason())
            .attachmentUrls(view.getAttachmentUrls())
            .build();
    }
}
