package com.flagship.expense_workflow.category.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_workflow.category.ExpenseCategory;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class CategoryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("icon")
    String icon;

    @JsonProperty("color")
    String color;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("created_at")
    Instant createdAt;

    public static CategoryResponse from(ExpenseCategory category) {
        return new CategoryResponse(
            category.getId(),
            category.getName(),
            category.getDescription(),
            category.getIcon(),
            category.getColor(),
            category.isActive(),
            category.getCreatedAt()
        );
    }
}
