package com.flagship.expense_workflow.analytics;

import com.flagship.expense_workflow.category.ExpenseCategory;
import com.flagship.expense_workflow.category.ExpenseCategoryService;
import com.flagship.expense_workflow.expense.ExpenseAggregates;
import com.flagship.expense_workflow.expense.ExpenseAggregates.ExpenseTotal;
import com.flagship.expense_workflow.expense.ExpenseAggregates.SubmissionCount;
import com.flagship.expense_workflow.expense.ExpenseStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-side aggregation over expenses for dashboards.
 *
 * Sums and counts come from grouped queries in {@link ExpenseAggregates};
 * nothing is cached or stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseAnalyticsService {

    public static final int MIN_MONTHS_BACK = 1;
    public static final int MAX_MONTHS_BACK = 24;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final String UNCATEGORIZED = "Uncategorized";

    private final ExpenseAggregates expenseAggregates;
    private final ExpenseCategoryService categoryService;

    /**
     * Totals, category breakdown and monthly trend of one user's expenses.
     *
     * @param from inclusive lower bound on expense date, or null
     * @param to   inclusive upper bound on expense date, or null
     */
    @Transactional(readOnly = true)
    public ExpenseAnalytics getUserAnalytics(UUID userId, LocalDate from, LocalDate to) {
        List<ExpenseTotal> totals = expenseAggregates.totalsByStatusCategoryAndMonth(userId, from, to);

        BigDecimal total = sum(totals);
        long count = count(totals);
        List<ExpenseTotal> approved = withStatus(totals, ExpenseStatus.APPROVED);
        List<ExpenseTotal> pending = withStatus(totals, ExpenseStatus.SUBMITTED);
        BigDecimal average = count == 0
            ? BigDecimal.ZERO
            : total.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP);

        log.debug("Computed analytics over {} expenses for user {}", count, userId);

        return ExpenseAnalytics.builder()
            .totalExpenses(total)
            .approvedAmount(sum(approved))
            .pendingAmount(sum(pending))
            .totalCount((int) count)
            .approvedCount((int) count(approved))
            .pendingCount((int) count(pending))
            .rejectedCount((int) count(withStatus(totals, ExpenseStatus.REJECTED)))
            .averageExpense(average)
            .categoryBreakdown(categoryBreakdown(totals))
            .monthlyTrends(monthlyTrends(totals))
            .build();
    }

    /**
     * Count, amount and share per status. Statuses with no expenses are left out.
     *
     * @param userId restricts to one creator; null covers everyone
     */
    @Transactional(readOnly = true)
    public List<StatusDistribution> getStatusDistribution(UUID userId, LocalDate from, LocalDate to) {
        List<ExpenseTotal> totals = expenseAggregates.totalsByStatusCategoryAndMonth(userId, from, to);
        long overall = count(totals);

        Map<ExpenseStatus, List<ExpenseTotal>> byStatus = totals.stream()
            .collect(Collectors.groupingBy(ExpenseTotal::getStatus,
                () -> new EnumMap<>(ExpenseStatus.class), Collectors.toList()));

        List<StatusDistribution> distribution = new ArrayList<>();
        byStatus.forEach((status, group) -> distribution.add(StatusDistribution.builder()
            .status(status)
            .count((int) count(group))
            .totalAmount(sum(group))
            .percentage(percentage(count(group), overall))
            .build()));
        return distribution;
    }

    /**
     * Approval and rejection rates per month, oldest month first, ending with
     * the current month.
     *
     * @param monthsBack clamped to [1, 24]
     */
    @Transactional(readOnly = true)
    public List<ApprovalRate> getApprovalRates(UUID userId, int monthsBack) {
        return getApprovalRates(userId, monthsBack, YearMonth.now(ZoneOffset.UTC));
    }

    List<ApprovalRate> getApprovalRates(UUID userId, int monthsBack, YearMonth currentMonth) {
        int months = Math.max(MIN_MONTHS_BACK, Math.min(MAX_MONTHS_BACK, monthsBack));
        YearMonth firstMonth = currentMonth.minusMonths(months - 1L);

        Map<YearMonth, List<SubmissionCount>> bySubmissionMonth = expenseAggregates
            .submissionsByMonthAndStatus(userId, firstMonth.atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant())
            .stream()
            .collect(Collectors.groupingBy(SubmissionCount::getMonth));

        List<ApprovalRate> rates = new ArrayList<>(months);
        for (YearMonth month = firstMonth; !month.isAfter(currentMonth); month = month.plusMonths(1)) {
            List<SubmissionCount> submitted = bySubmissionMonth.getOrDefault(month, List.of());
            long total = submitted.stream().mapToLong(SubmissionCount::getCount).sum();
            long approved = submissionsWithStatus(submitted, ExpenseStatus.APPROVED);
            long rejected = submissionsWithStatus(submitted, ExpenseStatus.REJECTED);

            rates.add(ApprovalRate.builder()
                .period(month.toString())
                .totalSubmitted((int) total)
                .approved((int) approved)
                .rejected((int) rejected)
                .approvalRate(percentage(approved, total))
                .rejectionRate(percentage(rejected, total))
                .build());
        }
        return rates;
    }

    private List<CategorySpending> categoryBreakdown(List<ExpenseTotal> totals) {
        if (totals.isEmpty()) {
            return List.of();
        }
        Map<UUID, ExpenseCategory> categories = categoryService.getAllCategories()
            .stream()
            .collect(Collectors.toMap(ExpenseCategory::getId, Function.identity()));

        // LinkedHashMap keeps the null (uncategorized) key, which groupingBy rejects
        Map<UUID, List<ExpenseTotal>> byCategory = new LinkedHashMap<>();
        for (ExpenseTotal group : totals) {
            byCategory.computeIfAbsent(group.getCategoryId(), key -> new ArrayList<>()).add(group);
        }

        List<CategorySpending> breakdown = new ArrayList<>();
        byCategory.forEach((categoryId, group) -> {
            ExpenseCategory category = categoryId != null ? categories.get(categoryId) : null;
            breakdown.add(CategorySpending.builder()
                .categoryId(categoryId)
                .categoryName(category != null ? category.getName() : UNCATEGORIZED)
                .categoryIcon(category != null ? category.getIcon() : "")
                .categoryColor(category != null ? category.getColor() : "")
                .totalAmount(sum(group))
                .count((int) count(group))
                .build());
        });
        breakdown.sort(Comparator.comparing(CategorySpending::getTotalAmount).reversed());
        return breakdown;
    }

    private List<MonthlyTrend> monthlyTrends(List<ExpenseTotal> totals) {
        Map<YearMonth, List<ExpenseTotal>> byMonth = totals.stream()
            .collect(Collectors.groupingBy(ExpenseTotal::getMonth, TreeMap::new, Collectors.toList()));

        List<MonthlyTrend> trends = new ArrayList<>();
        byMonth.forEach((month, group) -> trends.add(MonthlyTrend.builder()
            .year(month.getYear())
            .month(month.getMonthValue())
            .monthName(month.getMonth().getDisplayName(TextStyle.SHORT, Locale.ENGLISH) + " " + month.getYear())
            .totalAmount(sum(group))
            .count((int) count(group))
            .build()));
        return trends;
    }

    private static List<ExpenseTotal> withStatus(List<ExpenseTotal> totals, ExpenseStatus status) {
        return totals.stream()
            .filter(group -> group.getStatus() == status)
            .toList();
    }

    private static long submissionsWithStatus(List<SubmissionCount> submitted, ExpenseStatus status) {
        return submitted.stream()
            .filter(group -> group.getStatus() == status)
            .mapToLong(SubmissionCount::getCount)
            .sum();
    }

    private static BigDecimal sum(List<ExpenseTotal> totals) {
        return totals.stream()
            .map(ExpenseTotal::getTotalAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static long count(List<ExpenseTotal> totals) {
        return totals.stream().mapToLong(ExpenseTotal::getCount).sum();
    }

    private static BigDecimal percentage(long part, long whole) {
        if (whole == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return BigDecimal.valueOf(part)
            .multiply(HUNDRED)
            .divide(BigDecimal.valueOf(whole), 2, RoundingMode.HALF_UP);
    }
}
