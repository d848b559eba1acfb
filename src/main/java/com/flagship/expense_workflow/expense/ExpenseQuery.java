package com.flagship.expense_workflow.expense;

import lombok.Builder;
import lombok.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;

/**
 * Filter, sort and paging options for expense searches.
 *
 * Every field is optional. page is 1-based; pageSize is clamped to
 * [1, 100] and defaults to 12. Unknown sort keys fall back to createdAt,
 * and any direction other than "asc" sorts descending.
 */
@Value
@Builder
public class ExpenseQuery {

    public static final int DEFAULT_PAGE_SIZE = 12;
    public static final int MAX_PAGE_SIZE = 100;

    private static final String DEFAULT_SORT_PROPERTY = "createdAt";
    private static final Map<String, String> SORT_PROPERTIES = Map.of(
        "amount", "amount",
        "expensedate", "expenseDate",
        "submittedat", "submittedAt",
        "createdat", "createdAt"
    );

    String search;
    ExpenseStatus status;
    LocalDate fromDate;
    LocalDate toDate;
    BigDecimal minAmount;
    BigDecimal maxAmount;
    String sortBy;
    String sortDir;
    Integer page;
    Integer pageSize;

    public static ExpenseQuery all() {
        return ExpenseQuery.builder().build();
    }

    public int effectivePage() {
        return page == null || page < 1 ? 1 : page;
    }

    public int effectivePageSize() {
        if (pageSize == null) {
            return DEFAULT_PAGE_SIZE;
        }
        return Math.max(1, Math.min(MAX_PAGE_SIZE, pageSize));
    }

    public Sort sort() {
        String property = sortBy == null
            ? DEFAULT_SORT_PROPERTY
            : SORT_PROPERTIES.getOrDefault(sortBy.trim().toLowerCase(Locale.ROOT), DEFAULT_SORT_PROPERTY);
        Sort.Direction direction = "asc".equalsIgnoreCase(sortDir) ? Sort.Direction.ASC : Sort.Direction.DESC;
        // id as tiebreaker keeps page boundaries stable
        return Sort.by(direction, property).and(Sort.by(Sort.Direction.ASC, "id"));
    }

    public Pageable pageable() {
        return PageRequest.of(effectivePage() - 1, effectivePageSize(), sort());
    }
}
