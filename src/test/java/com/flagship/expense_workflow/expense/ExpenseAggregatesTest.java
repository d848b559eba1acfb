package com.flagship.expense_workflow.expense;

import com.flagship.expense_workflow.category.ExpenseCategoryService;
import com.flagship.expense_workflow.expense.ExpenseAggregates.ExpenseTotal;
import com.flagship.expense_workflow.expense.ExpenseAggregates.SubmissionCount;
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
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SQL sums and counts against a real PostgreSQL.
 *
 * These tests verify that:
 * - Only approved expenses dated inside the period are summed
 * - Omitted creator or category filters widen the sum to everyone
 * - Grouped totals and submission counts match the stored expenses
 */
@SpringBootTest
@Testcontainers
class ExpenseAggregatesTest {

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

    @Autowired
    private ExpenseAggregates expenseAggregates;

    @Autowired
    private ExpenseService expenseService;

    @Autowired
    private ExpenseCategoryService categoryService;

    @Autowired
    private UserDirectory userDirectory;

    private UUID firstEmployee;
    private UUID secondEmployee;
    private UUID adminId;
    private UUID categoryId;
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
        firstEmployee = userDirectory.registerUser("Drew Employee", UserRole.EMPLOYEE);
        secondEmployee = userDirectory.registerUser("Jamie Employee", UserRole.EMPLOYEE);
        adminId = userDirectory.registerUser("Robin Admin", UserRole.ADMIN);
        categoryId = categoryService.createCategory("Training " + UUID.randomUUID().toString().substring(0, 8),
                "Courses", "book", "#0EA5E9").getId();
        today = LocalDate.now(ZoneOffset.UTC);
    }

    private UUID approved(UUID creatorId, String amount, UUID category) {
        UUID expenseId = expenseService.createExpense(creatorId, "Course " + amount, "",
                new BigDecimal(amount), today, category);
        expenseService.addAttachment(expenseId, "https://receipts/" + expenseId);
        expenseService.submitExpense(expenseId, creatorId);
        expenseService.approveExpense(expenseId, adminId, UserRole.ADMIN);
        return expenseId;
    }

    @Test
    @DisplayName("Approved sum respects creator, category and period filters")
    void testSumApproved() {
        printTestHeader("Sum Approved Spending");
        approved(firstEmployee, "120.50", categoryId);
        approved(secondEmployee, "79.50", categoryId);
        approved(firstEmployee, "30.00", null);
        expenseService.createExpense(firstEmployee, "Draft course", "", new BigDecimal("500"), today, categoryId);

        BigDecimal everyone = expenseAggregates.sumApproved(null, categoryId, today.minusDays(1), today.plusDays(1));
        BigDecimal first = expenseAggregates.sumApproved(firstEmployee, categoryId, today, today);
        BigDecimal firstAllCategories = expenseAggregates.sumApproved(firstEmployee, null, today, today);
        BigDecimal outsidePeriod = expenseAggregates.sumApproved(firstEmployee, null,
                today.minusDays(30), today.minusDays(1));
        printOutput("Everyone in category", everyone);

        assertEquals(0, everyone.compareTo(new BigDecimal("200.00")));
        assertEquals(0, first.compareTo(new BigDecimal("120.50")));
        assertEquals(0, firstAllCategories.compareTo(new BigDecimal("150.50")));
        assertEquals(0, outsidePeriod.signum());
    }

    @Test
    @DisplayName("Totals are grouped by status, category and month")
    void testTotalsByStatusCategoryAndMonth() {
        approved(firstEmployee, "40.00", categoryId);
        approved(firstEmployee, "60.00", categoryId);
        expenseService.createExpense(firstEmployee, "Draft", "", new BigDecimal("15"), today, null);

        List<ExpenseTotal> totals = expenseAggregates.totalsByStatusCategoryAndMonth(firstEmployee, null, null);
        printOutput("Groups", totals);

        assertEquals(2, totals.size());
        ExpenseTotal approvedGroup = totals.stream()
                .filter(total -> total.getStatus() == ExpenseStatus.APPROVED)
                .findFirst()
                .orElseThrow();
        assertEquals(categoryId, approvedGroup.getCategoryId());
        assertEquals(YearMonth.from(today), approvedGroup.getMonth());
        assertEquals(2, approvedGroup.getCount());
        assertEquals(0, approvedGroup.getTotalAmount().compareTo(new BigDecimal("100.00")));

        ExpenseTotal draftGroup = totals.stream()
                .filter(total -> total.getStatus() == ExpenseStatus.DRAFT)
                .findFirst()
                .orElseThrow();
        assertNull(draftGroup.getCategoryId());
        assertEquals(1, draftGroup.getCount());

        assertTrue(expenseAggregates.totalsByStatusCategoryAndMonth(firstEmployee,
                today.plusDays(1), null).isEmpty());
    }

    @Test
    @DisplayName("Submissions are counted per UTC month and current status")
    void testSubmissionsByMonthAndStatus() {
        approved(secondEmployee, "25.00", null);
        UUID pending = expenseService.createExpense(secondEmployee, "Pending", "", new BigDecimal("10"), today, null);
        expenseService.submitExpense(pending, secondEmployee);
        expenseService.createExpense(secondEmployee, "Never submitted", "", new BigDecimal("5"), today, null);

        YearMonth currentMonth = YearMonth.now(ZoneOffset.UTC);
        List<SubmissionCount> counts = expenseAggregates.submissionsByMonthAndStatus(secondEmployee,
                currentMonth.atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant());

        assertEquals(2, counts.size());
        assertTrue(counts.stream().allMatch(count -> count.getMonth().equals(currentMonth)));
        assertTrue(counts.stream().allMatch(count -> count.getCount() == 1));
        assertTrue(counts.stream().anyMatch(count -> count.getStatus() == ExpenseStatus.APPROVED));
        assertTrue(counts.stream().anyMatch(count -> count.getStatus() == ExpenseStatus.SUBMITTED));
    }
}
