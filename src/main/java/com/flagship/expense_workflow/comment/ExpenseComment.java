package com.flagship.expense_workflow.comment;

import com.flagship.expense_workflow.exception.BusinessRuleException;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A note left on an expense request. Comments are never edited; the
 * author's display name is captured when the comment is written.
 */
@Value
public class ExpenseComment {

    public static final int MAX_TEXT_LENGTH = 2000;

    UUID id;
    UUID expenseRequestId;
    UUID userId;
    String userName;
    String text;
    Instant createdAt;

    public static ExpenseComment create(UUID expenseRequestId, UUID userId, String userName, String text) {
        if (text == null || text.isBlank()) {
            throw new BusinessRuleException("Comment text cannot be empty.");
        }
        if (text.length() > MAX_TEXT_LENGTH) {
            throw new BusinessRuleException("Comment text cannot exceed " + MAX_TEXT_LENGTH + " characters.");
        }
        return new ExpenseComment(
            UUID.randomUUID(),
            expenseRequestId,
            userId,
            userName,
            text.trim(),
            Instant.now()
        );
    }
}
