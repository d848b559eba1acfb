package com.flagship.expense_workflow.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Spending within one category. categoryId is null for uncategorized expenses.
 */
@Value
@Builder
public class CategorySpending {

    @JsonProperty("category_id")
    UUID categoryId;

    @JsonProperty("category_name")
    String categoryName;

    @JsonProperty("category_icon")
    String categoryIcon;

    @JsonProperty("category_color")
    String categoryColor;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("count")
    int count;
}
