package com.flagship.expense_workflow.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_workflow.expense.ExpenseView;
import com.flagship.expense_workflow.expense.PagedResult;
import lombok.Value;

import java.util.List;

@Value
public class ExpensePageResponse {

    @JsonProperty("items")
    List<ExpenseResponse> items;

    @JsonProperty("total_count")
    long totalCount;

    @JsonProperty("page")
    int page;

    @JsonProperty("page_size")
    int pageSize;

    @JsonProperty("total_pages")
    int totalPages;

    public static ExpensePageResponse from(PagedResult<ExpenseView> result) {
        return new ExpensePageResponse(
            result.getItems().stream().map(ExpenseResponse::from).toList(),
            result.getTotalCount(),
            result.getPage(),
            result.getPageSize(),
            result.getTotalPages()
        );
    }
}
