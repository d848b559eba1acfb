package com.flagship.expense_workflow.budget.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_workflow.budget.Budget;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class BudgetResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("category_id")
    UUID categoryId;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static BudgetResponse from(Budget budget) {
        return BudgetResponse.builder()
            .id(budget.getId())
            .name(budget.getName())
            .description(budget.getDescription())
            .amount(budget.getAmount())
            .startDate(budget.getStartDate())
            .endDate(budget.getEndDate())
            .userId(budget.getUserId())
            .categoryId(budget.getCategoryId())
            .active(budget.isActive())
            .createdAt(budget.getCreatedAt())
            .updatedAt(budget.getUpdatedAt())
            .build();
    }
}
