package com.flagship.expense_workflow.budget.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_workflow.budget.BudgetStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class BudgetStatusResponse {

    @JsonProperty("budget_id")
    UUID budgetId;

    @JsonProperty("budget_name")
    String budgetName;

    @JsonProperty("description")
    String description;

    @JsonProperty("budget_amount")
    BigDecimal budgetAmount;

    @JsonProperty("spent_amount")
    BigDecimal spentAmount;

    @JsonProperty("remaining_amount")
    BigDecimal remainingAmount;

    @JsonProperty("percentage_used")
    BigDecimal percentageUsed;

    @JsonProperty("category_name")
    String categoryName;

    @JsonProperty("category_icon")
    String categoryIcon;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("days_remaining")
    long daysRemaining;

    @JsonProperty("is_over_budget")
    boolean overBudget;

    @JsonProperty("is_active")
    boolean active;

    public static BudgetStatusResponse from(BudgetStatus status) {
        return BudgetStatusResponse.builder()
            .budgetId(status.getBudgetId())
            .budgetName(status.getBudgetName())
            .description(status.getDescription())
            .budgetAmount(status.getBudgetAmount())
            .spentAmount(status.getSpentAmount())
            .remainingAmount(status.getRemainingAmount())
            .percentageUsed(status.getPercentageUsed())
            .categoryName(status.getCategoryName())
            .categoryIcon(status.getCategoryIcon())
            .startDate(status.getStartDate())
            .endDate(status.getEndDate())
            .daysRemaining(status.getDaysRemaining())
            .overBudget(status.isOverBudget())
            .active(status.isActive())
            .build();
    }
}
