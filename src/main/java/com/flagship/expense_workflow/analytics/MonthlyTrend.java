package com.flagship.expense_workflow.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class MonthlyTrend {

    @JsonProperty("year")
    int year;

    @JsonProperty("month")
    int month;

    @JsonProperty("month_name")
    String monthName;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("count")
    int count;
}
