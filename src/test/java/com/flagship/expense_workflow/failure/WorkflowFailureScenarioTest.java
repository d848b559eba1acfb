package com.flagship.expense_workflow.failure;

import com.flagship.expense_workflow.audit.AuditLogService;
import com.flagship.expense_workflow.expense.ExpenseService;
import com.flagship.expense_workflow.expense.ExpenseStatus;
import com.flagship.expense_workflow.expense.event.ExpenseApprovedEvent;
import com.flagship.expense_workflow.identity.UserDirectory;
import com.flagship.expense_workflow.identity.UserRole;
import com.flagship.expense_workflow.observability.ExpenseMetrics;
import com.flagship.expense_workflow.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.reset;

/**
 * Failure Scenario Tests
 *
 * A transition writes three things in one transaction: the new expense
 * state, one audit record and one outbox event. If any of them fails,
 * none may survive.
 *
 * KEY INVARIANTS VERIFIED
 * 1. No status change without its audit record
 * 2. No status change without its outbox event
 * 3. A failed operation can be retried once the fault clears
 */
@SpringBootTest
@Testcontainers
class WorkflowFailureScenarioTest {

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
    private ExpenseService expenseService;

    @Autowired
    private AuditLogService auditLogService;

    @Autowired
    private UserDirectory userDirectory;

    @Autowired
    private ExpenseMetrics expenseMetrics;

    @SpyBean
    private OutboxService outboxService;

    private UUID employeeId;
    private UUID managerId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("FAILURE SCENARIO: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ VERIFIED: " + message);
    }

    private void printInvariant(String invariant) {
        System.out.println("🔒 INVARIANT MAINTAINED: " + invariant);
    }

    @BeforeEach
    void setUp() {
        reset(outboxService);
        employeeId = userDirectory.registerUser("Quinn Employee", UserRole.EMPLOYEE);
        managerId = userDirectory.registerUser("Parker Manager", UserRole.MANAGER);
    }

    private UUID submittedExpense() {
        UUID expenseId = expenseService.createExpense(employeeId, "Workshop ticket", "",
                new BigDecimal("75.00"), LocalDate.now(ZoneOffset.UTC), null);
        expenseService.submitExpense(expenseId, employeeId);
        return expenseId;
    }

    @Test
    @DisplayName("Outbox failure rolls back the approval and its audit record")
    void testOutboxFailureRollsBackApproval() {
        printTestHeader("Outbox Write Fails During Approval");

        UUID expenseId = submittedExpense();
        long auditBefore = auditLogService.countFor(expenseId);
        double errorsBefore = expenseMetrics.operationCount("approve", ExpenseMetrics.OUTCOME_ERROR);

        doThrow(new DataAccessResourceFailureException("outbox table unavailable"))
                .when(outboxService).saveEvent(anyString(), eq(expenseId),
                        eq(ExpenseApprovedEvent.EVENT_TYPE), any());

        assertThrows(DataAccessResourceFailureException.class,
                () -> expenseService.approveExpense(expenseId, managerId, UserRole.MANAGER));

        assertEquals(ExpenseStatus.SUBMITTED, expenseService.getExpense(expenseId).getStatus());
        assertNull(expenseService.getExpense(expenseId).getProcessedBy());
        assertEquals(auditBefore, auditLogService.countFor(expenseId));
        assertEquals(1, outboxService.getEventsForAggregate(ExpenseService.AGGREGATE_TYPE, expenseId).size());
        assertEquals(errorsBefore + 1, expenseMetrics.operationCount("approve", ExpenseMetrics.OUTCOME_ERROR));
        printInvariant("No approval without its audit record and event");

        reset(outboxService);
        expenseService.approveExpense(expenseId, managerId, UserRole.MANAGER);

        assertEquals(ExpenseStatus.APPROVED, expenseService.getExpense(expenseId).getStatus());
        assertEquals(auditBefore + 1, auditLogService.countFor(expenseId));
        assertEquals(2, outboxService.getEventsForAggregate(ExpenseService.AGGREGATE_TYPE, expenseId).size());
        printSuccess("Retry after the fault cleared succeeded");
    }

    @Test
    @DisplayName("Outbox failure rolls back the submission")
    void testOutboxFailureRollsBackSubmission() {
        printTestHeader("Outbox Write Fails During Submission");

        UUID expenseId = expenseService.createExpense(employeeId, "Monitor", "",
                new BigDecimal("90.00"), LocalDate.now(ZoneOffset.UTC), null);

        doThrow(new DataAccessResourceFailureException("outbox table unavailable"))
                .when(outboxService).saveEvent(anyString(), eq(expenseId), anyString(), any());

        assertThrows(DataAccessResourceFailureException.class,
                () -> expenseService.submitExpense(expenseId, employeeId));

        assertEquals(ExpenseStatus.DRAFT, expenseService.getExpense(expenseId).getStatus());
        assertEquals(1, auditLogService.countFor(expenseId));
        printInvariant("Draft unchanged, only the creation record exists");
    }
}
