package com.flagship.expense_workflow.budget;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for budgets.
 *
 * Owner and category are fixed at creation (updatable = false); the rest
 * changes only through {@link #updateFromDomain}.
 */
@Entity
@Table(
    name = "budgets",
    indexes = @Index(name = "idx_budgets_user", columnList = "user_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BudgetEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 1000)
    private String description;

    @Column(nullable = false, precision = 18, scale = 2)
    private BigDecimal amount;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(name = "user_id", updatable = false)
    private UUID userId;

    @Column(name = "category_id", updatable = false)
    private UUID categoryId;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    static BudgetEntity fromDomain(Budget budget) {
        return new BudgetEntity(
            budget.getId(),
            budget.getName(),
            budget.getDescription(),
            budget.getAmount(),
            budget.getStartDate(),
            budget.getEndDate(),
            budget.getUserId(),
            budget.getCategoryId(),
            budget.isActive(),
            budget.getCreatedAt(),
            budget.getUpdatedAt()
        );
    }

    public Budget toDomain() {
        return new Budget(id, name, description, amount, startDate, endDate, userId, categoryId,
                active, createdAt, updatedAt);
    }

    void updateFromDomain(Budget budget) {
        this.name = budget.getName();
        this.description = budget.getDescription();
        this.amount = budget.getAmount();
        this.startDate = budget.getStartDate();
        this.endDate = budget.getEndDate();
        this.active = budget.isActive();
        this.updatedAt = budget.getUpdatedAt();
    }
}
