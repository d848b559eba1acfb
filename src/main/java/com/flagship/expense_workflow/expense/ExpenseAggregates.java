package com.flagship.expense_workflow.expense;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Sums and counts over expense requests computed in SQL.
 *
 * Budgets and dashboards only need totals, so nothing here loads an entity.
 * Optional filters are appended to the WHERE clause only when present.
 */
@Service
@Slf4j
public class ExpenseAggregates {

    private final JdbcTemplate jdbcTemplate;

    public ExpenseAggregates(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Sums approved amounts with an expense date inside [from, to].
     *
     * @param creatorId  restricts to one creator; null means every creator
     * @param categoryId restricts to one category; null means every category
     */
    @Transactional(readOnly = true)
    public BigDecimal sumApproved(UUID creatorId, UUID categoryId, LocalDate from, LocalDate to) {
        StringBuilder sql = new StringBuilder(
            "SELECT COALESCE(SUM(amount), 0) FROM expense_requests " +
            "WHERE status = ? AND expense_date >= ? AND expense_date <= ?");
        List<Object> args = new ArrayList<>(List.of(ExpenseStatus.APPROVED.name(), Date.valueOf(from), Date.valueOf(to)));
        if (creatorId != null) {
            sql.append(" AND creator_id = ?");
            args.add(creatorId);
        }
        if (categoryId != null) {
            sql.append(" AND category_id = ?");
            args.add(categoryId);
        }

        BigDecimal spent = jdbcTemplate.queryForObject(sql.toString(), BigDecimal.class, args.toArray());
        log.debug("Approved spending {}..{} (creator={}, category={}): {}", from, to, creatorId, categoryId, spent);
        return spent != null ? spent : BigDecimal.ZERO;
    }

    /**
     * Count and amount per (status, category, expense month).
     *
     * @param creatorId restricts to one creator; null means every creator
     * @param from      inclusive lower bound on expense date, or null
     * @param to        inclusive upper bound on expense date, or null
     */
    @Transactional(readOnly = true)
    public List<ExpenseTotal> totalsByStatusCategoryAndMonth(UUID creatorId, LocalDate from, LocalDate to) {
        StringBuilder sql = new StringBuilder(
            "SELECT status, category_id, " +
            "CAST(EXTRACT(YEAR FROM expense_date) AS INTEGER) AS expense_year, " +
            "CAST(EXTRACT(MONTH FROM expense_date) AS INTEGER) AS expense_month, " +
            "COUNT(*) AS expense_count, COALESCE(SUM(amount), 0) AS total_amount " +
            "FROM expense_requests WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (creatorId != null) {
            sql.append(" AND creator_id = ?");
            args.add(creatorId);
        }
        if (from != null) {
            sql.append(" AND expense_date >= ?");
            args.add(Date.valueOf(from));
        }
        if (to != null) {
            sql.append(" AND expense_date <= ?");
            args.add(Date.valueOf(to));
        }
        sql.append(" GROUP BY status, category_id, expense_year, expense_month");

        return jdbcTemplate.query(sql.toString(), (rs, rowNum) -> new ExpenseTotal(
            ExpenseStatus.valueOf(rs.getString("status")),
            rs.getObject("category_id", UUID.class),
            YearMonth.of(rs.getInt("expense_year"), rs.getInt("expense_month")),
            rs.getLong("expense_count"),
            rs.getBigDecimal("total_amount")
        ), args.toArray());
    }

    /**
     * Number of submitted expenses per (UTC submission month, current status),
     * for submissions at or after {@code since}.
     *
     * @param creatorId restricts to one creator; null means every creator
     */
    @Transactional(readOnly = true)
    public List<SubmissionCount> submissionsByMonthAndStatus(UUID creatorId, Instant since) {
        StringBuilder sql = new StringBuilder(
            "SELECT CAST(EXTRACT(YEAR FROM submitted_at AT TIME ZONE 'UTC') AS INTEGER) AS submitted_year, " +
            "CAST(EXTRACT(MONTH FROM submitted_at AT TIME ZONE 'UTC') AS INTEGER) AS submitted_month, " +
            "status, COUNT(*) AS expense_count " +
            "FROM expense_requests WHERE submitted_at IS NOT NULL AND submitted_at >= ?");
        List<Object> args = new ArrayList<>(List.of(Timestamp.from(since)));
        if (creatorId != null) {
            sql.append(" AND creator_id = ?");
            args.add(creatorId);
        }
        sql.append(" GROUP BY submitted_year, submitted_month, status");

        return jdbcTemplate.query(sql.toString(), (rs, rowNum) -> new SubmissionCount(
            YearMonth.of(rs.getInt("submitted_year"), rs.getInt("submitted_month")),
            ExpenseStatus.valueOf(rs.getString("status")),
            rs.getLong("expense_count")
        ), args.toArray());
    }

    /**
     * One group of expenses sharing status, category and expense month.
     * categoryId is null for uncategorized expenses.
     */
    @Value
    public static class ExpenseTotal {
        ExpenseStatus status;
        UUID categoryId;
        YearMonth month;
        long count;
        BigDecimal totalAmount;
    }

    @Value
    public static class SubmissionCount {
        YearMonth month;
        ExpenseStatus status;
        long count;
    }
}
