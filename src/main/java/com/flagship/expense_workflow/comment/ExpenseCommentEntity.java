package com.flagship.expense_workflow.comment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for expense_comments. Insert-only.
 */
@Entity
@Table(
    name = "expense_comments",
    indexes = @Index(name = "idx_expense_comments_expense_request", columnList = "expense_request_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExpenseCommentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "expense_request_id", nullable = false, updatable = false)
    private UUID expenseRequestId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "user_name", nullable = false, updatable = false, length = 200)
    private String userName;

    @Column(nullable = false, updatable = false, length = 2000)
    private String text;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static ExpenseCommentEntity fromDomain(ExpenseComment comment) {
        return new ExpenseCommentEntity(
            comment.getId(),
            comment.getExpenseRequestId(),
            comment.getUserId(),
            comment.getUserName(),
            comment.getText(),
            comment.getCreatedAt()
        );
    }

    public ExpenseComment toDomain() {
        return new ExpenseComment(id, expenseRequestId, userId, userName, text, createdAt);
    }
}
