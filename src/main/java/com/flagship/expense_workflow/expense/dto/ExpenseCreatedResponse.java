package com.flagship.expense_workflow.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

@Value
public class ExpenseCreatedResponse {

    @JsonProperty("id")
    UUID id;
}
