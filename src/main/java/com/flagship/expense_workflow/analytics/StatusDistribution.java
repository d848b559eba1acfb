package com.flagship.expense_workflow.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_workflow.expense.ExpenseStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class StatusDistribution {

    @JsonProperty("status")
    ExpenseStatus status;

    @JsonProperty("count")
    int count;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("percentage")
    BigDecimal percentage;
}
