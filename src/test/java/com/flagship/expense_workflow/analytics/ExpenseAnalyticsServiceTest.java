package com.flagship.expense_workflow.analytics;

import com.flagship.expense_workflow.expense.ExpenseService;
import com.flagship.expense_workflow.expense.ExpenseStatus;
import com.flagship.expense_workflow.identity.UserDirectory;
import com.flagship.expense_workflow.identity.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * These tests verify that dashboard figures are derived from the stored
 * expenses: totals by status, category breakdown, monthly trend, status
 * distribution and monthly approval rates.
 */
@SpringBootTest
@Testcontainers
class ExpenseAnalyticsServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("expense_workflow_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    private static final UUID TRAVEL = UUID.fromString("11111111-1111-1111-1111-111111111111");

    @Autowired
    private ExpenseAnalyticsService analyticsService;

    @Autowired
    private ExpenseService expenseService;

    @Autowired
    private UserDirectory userDirectory;

    private UUID employeeId;
    private UUID managerId;
    private LocalDate today;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @BeforeEach
    void setUp() {
        employeeId = userDirectory.registerUser("Jordan Employee", UserRole.EMPLOYEE);
        managerId = userDirectory.registerUser("Sam Manager", UserRole.MANAGER);
        today = LocalDate.now(ZoneOffset.UTC);

        // one expense per status: draft 40, submitted 60, approved 80 (travel), rejected 20
        expenseService.createExpense(employeeId, "Draft", "", new BigDecimal("40"), today, null);

        UUID submitted = expenseService.createExpense(employeeId, "Submitted", "", new BigDecimal("60"), today, null);
        expenseService.submitExpense(submitted, employeeId);

        UUID approved = expenseService.createExpense(employeeId, "Approved", "", new BigDecimal("80"), today, TRAVEL);
        expenseService.submitExpense(approved, employeeId);
        expenseService.approveExpense(approved, managerId, UserRole.MANAGER);

        UUID rejected = expenseService.createExpense(employeeId, "Rejected", "", new BigDecimal("20"), today, null);
        expenseService.submitExpense(rejected, employeeId);
        expenseService.rejectExpense(rejected, managerId, UserRole.MANAGER, "Duplicate");
    }

    @Test
    @DisplayName("User analytics totals, breakdown and trend")
    void testUserAnalytics() {
        printTestHeader("User Analytics");

        ExpenseAnalytics analytics = analyticsService.getUserAnalytics(employeeId, null, null);
        printOutput("Total", analytics.getTotalExpenses());
        printOutput("Breakdown", analytics.getCategoryBreakdown());

        assertEquals(0, analytics.getTotalExpenses().compareTo(new BigDecimal("200")));
        assertEquals(0, analytics.getApprovedAmount().compareTo(new BigDecimal("80")));
        assertEquals(0, analytics.getPendingAmount().compareTo(new BigDecimal("60")));
        assertEquals(4, analytics.getTotalCount());
        assertEquals(1, analytics.getApprovedCount());
        assertEquals(1, analytics.getPendingCount());
        assertEquals(1, analytics.getRejectedCount());
        assertEquals(new BigDecimal("50.00"), analytics.getAverageExpense());

        List<CategorySpending> breakdown = analytics.getCategoryBreakdown();
        assertEquals(2, breakdown.size());
        assertEquals("Uncategorized", breakdown.get(0).getCategoryName());
        assertEquals(0, breakdown.get(0).getTotalAmount().compareTo(new BigDecimal("120")));
        assertEquals("Travel", breakdown.get(1).getCategoryName());
        assertEquals("plane", breakdown.get(1).getCategoryIcon());

        assertEquals(1, analytics.getMonthlyTrends().size());
        MonthlyTrend trend = analytics.getMonthlyTrends().get(0);
        assertEquals(today.getYear(), trend.getYear());
        assertEquals(today.getMonthValue(), trend.getMonth());
        assertEquals(4, trend.getCount());
    }

    @Test
    @DisplayName("Date range excludes expenses outside it")
    void testUserAnalytics_DateRange() {
        ExpenseAnalytics analytics = analyticsService.getUserAnalytics(employeeId,
                today.plusDays(1), today.plusDays(30));

        assertEquals(0, analytics.getTotalCount());
        assertEquals(0, analytics.getAverageExpense().signum());
        assertTrue(analytics.getCategoryBreakdown().isEmpty());
    }

    @Test
    @DisplayName("Status distribution shares add up to 100")
    void testStatusDistribution() {
        Map<ExpenseStatus, StatusDistribution> byStatus = analyticsService
                .getStatusDistribution(employeeId, null, null)
                .stream()
                .collect(Collectors.toMap(StatusDistribution::getStatus, d -> d));

        assertEquals(4, byStatus.size());
        assertEquals(new BigDecimal("25.00"), byStatus.get(ExpenseStatus.APPROVED).getPercentage());
        assertEquals(0, byStatus.get(ExpenseStatus.REJECTED).getTotalAmount().compareTo(new BigDecimal("20")));
    }

    @Test
    @DisplayName("Approval rates group submissions by month")
    void testApprovalRates() {
        printTestHeader("Approval Rates");
        YearMonth currentMonth = YearMonth.now(ZoneOffset.UTC);

        List<ApprovalRate> rates = analyticsService.getApprovalRates(employeeId, 3);
        printOutput("Rates", rates);

        assertEquals(3, rates.size());
        assertEquals(currentMonth.minusMonths(2).toString(), rates.get(0).getPeriod());
        assertEquals(0, rates.get(0).getTotalSubmitted());
        assertEquals(0, rates.get(0).getApprovalRate().signum());

        ApprovalRate current = rates.get(2);
        assertEquals(currentMonth.toString(), current.getPeriod());
        assertEquals(3, current.getTotalSubmitted());
        assertEquals(1, current.getApproved());
        assertEquals(1, current.getRejected());
        assertEquals(new BigDecimal("33.33"), current.getApprovalRate());

        assertEquals(ExpenseAnalyticsService.MAX_MONTHS_BACK,
                analyticsService.getApprovalRates(employeeId, 100).size());
        assertEquals(ExpenseAnalyticsService.MIN_MONTHS_BACK,
                analyticsService.getApprovalRates(employeeId, 0).size());
    }
}
