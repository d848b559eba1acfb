package com.flagship.expense_workflow.comment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_workflow.comment.ExpenseComment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class CommentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("expense_request_id")
    UUID expenseRequestId;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("user_name")
    String userName;

    @JsonProperty("text")
    String text;

    @JsonProperty("created_at")
    Instant createdAt;

    public static CommentResponse from(ExpenseComment comment) {
        return new CommentResponse(
            comment.getId(),
            comment.getExpenseRequestId(),
            comment.getUserId(),
            comment.getUserName(),
            comment.getText(),
            comment.getCreatedAt()
        );
    }
}
