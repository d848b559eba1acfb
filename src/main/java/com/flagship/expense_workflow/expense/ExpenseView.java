package com.flagship.expense_workflow.expense;

import com.flagship.expense_workflow.identity.UserRole;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Read model of an expense request enriched with the creator's display name.
 */
@Value
@Builder
public class ExpenseView {
    UUID id;
    UUID creatorId;
    String creatorName;
    UserRole creatorRole;
    UUID categoryId;
    String title;
    String description;
    BigDecimal amount;
    LocalDate expenseDate;
    ExpenseStatus status;
    Instant createdAt;
    Instant updatedAt;
    Instant submittedAt;
    Instant processedAt;
    UUID processedBy;
    String rejectionReason;
    List<String> attachmentUrls;

    public static ExpenseView of(ExpenseRequest expense, String creatorName) {
        return ExpenseView.builder()
            .id(expense.getId())
            .creatorId(expense.getCreatorId())
            .creatorName(creatorName)
            .creatorRole(expense.getCreatorRole())
            .categoryId(expense.getCategoryId())
            .title(expense.getTitle())
            .description(expense.getDescription())
            .amount(expense.getAmount())
            .expenseDate(expense.getExpenseDate())
            .status(expense.getStatus())
            .createdAt(expense.getCreatedAt())
            .updatedAt(expense.getUpdatedAt())
            .submittedAt(expense.getSubmittedAt())
            .processedAt(expense.getProcessedAt())
            .processedBy(expense.getProcessedBy())
            .rejectionReason(expense.getRejectionReason())
            .attachmentUrls(expense.getAttachmentUrls())
            .build();
    }
}
