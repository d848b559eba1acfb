package com.flagship.expense_workflow.budget;

import com.flagship.expense_workflow.category.ExpenseCategory;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Utilization of a budget as of a given day. Computed on request, never stored.
 */
@Value
@Builder
public class BudgetStatus {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    UUID budgetId;
    String budgetName;
    String description;
    BigDecimal budgetAmount;
    BigDecimal spentAmount;
    BigDecimal remainingAmount;
    BigDecimal percentageUsed;
    UUID categoryId;
    String categoryName;
    String categoryIcon;
    LocalDate startDate;
    LocalDate endDate;
    long daysRemaining;
    boolean overBudget;
    boolean active;

    /**
     * @param spent    sum of approved expenses the budget covers
     * @param category the budget's category, or null for an all-category budget
     */
    public static BudgetStatus compute(Budget budget, BigDecimal spent, ExpenseCategory category, LocalDate today) {
        BigDecimal amount = budget.getAmount();
        BigDecimal percentage = amount.signum() > 0
            ? spent.multiply(HUNDRED).divide(amount, 2, RoundingMode.HALF_UP)
            : BigDecimal.ZERO.setScale(2);

        return BudgetStatus.builder()
            .budgetId(budget.getId())
            .budgetName(budget.getName())
            .description(budget.getDescription())
            .budgetAmount(amount)
            .spentAmount(spent)
            .remainingAmount(amount.subtract(spent))
            .percentageUsed(percentage)
            .categoryId(budget.getCategoryId())
            .categoryName(category != null ? category.getName() : null)
            .categoryIcon(category != null ? category.getIcon() : null)
            .startDate(budget.getStartDate())
            .endDate(budget.getEndDate())
            .daysRemaining(Math.max(0, ChronoUnit.DAYS.between(today, budget.getEndDate())))
            .overBudget(spent.compareTo(amount) > 0)
            .active(budget.isCurrentlyActive(today))
            .build();
    }
}
