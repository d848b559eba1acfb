package com.flagship.expense_workflow.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * The reason is checked by the domain so a blank one surfaces as a
 * business rule violation.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class RejectExpenseRequest {

    @JsonProperty("reason")
    private String reason;
}
