package com.flagship.expense_workflow.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of the expenses submitted in one calendar month (period "yyyy-MM").
 * Expenses still awaiting a decision count towards totalSubmitted only.
 */
@Value
@Builder
public class ApprovalRate {

    @JsonProperty("period")
    String period;

    @JsonProperty("total_submitted")
    int totalSubmitted;

    @JsonProperty("approved")
    int approved;

    @JsonProperty("rejected")
    int rejected;

    @JsonProperty("approval_rate")
    BigDecimal approvalRate;

    @JsonProperty("rejection_rate")
    BigDecimal rejectionRate;
}
