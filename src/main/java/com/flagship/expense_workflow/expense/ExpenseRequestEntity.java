package com.flagship.expense_workflow.expense;

import com.flagship.expense_workflow.identity.UserRole;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for expense requests.
 *
 * Key design principles:
 * - No setters: state only changes through {@link #updateFromDomain}, after the
 *   domain object has validated the transition
 * - Controlled factory: {@link #fromDomain} is the only way to create instances
 * - Immutable columns (id, creator, created_at) are updatable = false
 * - Attachments live in expense_attachments, ordered by position
 */
@Entity
@Table(
    name = "expense_requests",
    indexes = {
        @Index(name = "idx_expense_requests_creator", columnList = "creator_id"),
        @Index(name = "idx_expense_requests_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExpenseRequestEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "creator_id", nullable = false, updatable = false)
    private UUID creatorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "creator_role", nullable = false, length = 20)
    private UserRole creatorRole;

    @Column(name = "category_id")
    private UUID categoryId;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false, length = 1000)
    private String description;

    @Column(nullable = false, precision = 18, scale = 2)
    private BigDecimal amount;

    @Column(name = "expense_date", nullable = false)
    private LocalDate expenseDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ExpenseStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "submitted_at")
    private Instant submittedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "processed_by")
    private UUID processedBy;

    @Column(name = "rejection_reason", length = 500)
    private String rejectionReason;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
        name = "expense_attachments",
        joinColumns = @JoinColumn(name = "expense_request_id")
    )
    @OrderColumn(name = "position")
    @Column(name = "url", nullable = false, length = 2048)
    private List<String> attachmentUrls = new ArrayList<>();

    static ExpenseRequestEntity fromDomain(ExpenseRequest expense) {
        return new ExpenseRequestEntity(
            expense.getId(),
            expense.getCreatorId(),
            expense.getCreatorRole(),
            expense.getCategoryId(),
            expense.getTitle(),
            expense.getDescription(),
            expense.getAmount(),
            expense.getExpenseDate(),
            expense.getStatus(),
            expense.getCreatedAt(),
            expense.getUpdatedAt(),
            expense.getSubmittedAt(),
            expense.getProcessedAt(),
            expense.getProcessedBy(),
            expense.getRejectionReason(),
            new ArrayList<>(expense.getAttachmentUrls())
        );
    }

    public ExpenseRequest toDomain() {
        return ExpenseRequest.restore(
            id,
            creatorId,
            creatorRole,
            categoryId,
            title,
            description,
            amount,
            expenseDate,
            status,
            createdAt,
            updatedAt,
            submittedAt,
            processedAt,
            processedBy,
            rejectionReason,
            attachmentUrls
        );
    }

    /**
     * Copies the mutable state of an already validated domain object.
     * id, creatorId and createdAt never change.
     */
    void updateFromDomain(ExpenseRequest expense) {
        this.creatorRole = expense.getCreatorRole();
        this.categoryId = expense.getCategoryId();
        this.title = expense.getTitle();
        this.description = expense.getDescription();
        this.amount = expense.getAmount();
        this.expenseDate = expense.getExpenseDate();
        this.status = expense.getStatus();
        this.updatedAt = expense.getUpdatedAt();
        this.submittedAt = expense.getSubmittedAt();
        this.processedAt = expense.getProcessedAt();
        this.processedBy = expense.getProcessedBy();
        this.rejectionReason = expense.getRejectionReason();
        // keep the managed collection instance so Hibernate diffs it in place
        this.attachmentUrls.clear();
        this.attachmentUrls.addAll(expense.getAttachmentUrls());
    }
}
