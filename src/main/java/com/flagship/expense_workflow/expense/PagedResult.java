package com.flagship.expense_workflow.expense;

import lombok.Value;

import java.util.List;
import java.util.function.Function;

/**
 * One page of results. page is 1-based.
 */
@Value
public class PagedResult<T> {
    List<T> items;
    long totalCount;
    int page;
    int pageSize;

    public int getTotalPages() {
        return pageSize == 0 ? 0 : (int) ((totalCount + pageSize - 1) / pageSize);
    }

    public <R> PagedResult<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = items.stream().<R>map(mapper).toList();
        return new PagedResult<>(mapped, totalCount, page, pageSize);
    }
}
