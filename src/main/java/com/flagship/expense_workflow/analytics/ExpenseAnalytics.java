package com.flagship.expense_workflow.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Dashboard summary of one user's expenses.
 */
@Value
@Builder
public class ExpenseAnalytics {

    @JsonProperty("total_expenses")
    BigDecimal totalExpenses;

    @JsonProperty("approved_amount")
    BigDecimal approvedAmount;

    @JsonProperty("pending_amount")
    BigDecimal pendingAmount;

    @JsonProperty("total_count")
    int totalCount;

    @JsonProperty("approved_count")
    int approvedCount;

    @JsonProperty("pending_count")
    int pendingCount;

    @JsonProperty("rejected_count")
    int rejectedCount;

    @JsonProperty("average_expense")
    BigDecimal averageExpense;

    @JsonProperty("category_breakdown")
    List<CategorySpending> categoryBreakdown;

    @JsonProperty("monthly_trends")
    List<MonthlyTrend> monthlyTrends;
}
