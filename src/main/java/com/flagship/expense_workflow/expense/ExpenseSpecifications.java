package com.flagship.expense_workflow.expense;

import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;

/**
 * Composable predicates over {@link ExpenseRequestEntity}.
 *
 * Every factory returns null for a null argument so callers can chain
 * optional filters with {@code Specification.where(..).and(..)}.
 */
public final class ExpenseSpecifications {

    private static final char LIKE_ESCAPE = '\\';

    private ExpenseSpecifications() {
    }

    public static Specification<ExpenseRequestEntity> createdBy(UUID creatorId) {
        if (creatorId == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("creatorId"), creatorId);
    }

    public static Specification<ExpenseRequestEntity> hasStatus(ExpenseStatus status) {
        if (status == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    public static Specification<ExpenseRequestEntity> inCategory(UUID categoryId) {
        if (categoryId == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("categoryId"), categoryId);
    }

    /**
     * Case-insensitive substring match over title and description.
     */
    public static Specification<ExpenseRequestEntity> textContains(String search) {
        if (search == null || search.isBlank()) {
            return null;
        }
        String pattern = "%" + escapeLike(search.trim().toLowerCase(Locale.ROOT)) + "%";
        return (root, query, cb) -> cb.or(
            cb.like(cb.lower(root.get("title")), pattern, LIKE_ESCAPE),
            cb.like(cb.lower(root.get("description")), pattern, LIKE_ESCAPE)
        );
    }

    public static Specification<ExpenseRequestEntity> expenseDateFrom(LocalDate from) {
        if (from == null) {
            return null;
        }
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("expenseDate"), from);
    }

    public static Specification<ExpenseRequestEntity> expenseDateTo(LocalDate to) {
        if (to == null) {
            return null;
        }
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.get("expenseDate"), to);
    }

    public static Specification<ExpenseRequestEntity> amountAtLeast(BigDecimal min) {
        if (min == null) {
            return null;
        }
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("amount"), min);
    }

    public static Specification<ExpenseRequestEntity> amountAtMost(BigDecimal max) {
        if (max == null) {
            return null;
        }
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.get("amount"), max);
    }

    private static String escapeLike(String value) {
        return value
            .replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
    }
}
