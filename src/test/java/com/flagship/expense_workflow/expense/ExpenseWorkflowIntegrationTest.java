package com.flagship.expense_workflow.expense;

import com.flagship.expense_workflow.audit.AuditLog;
import com.flagship.expense_workflow.comment.ExpenseComment;
import com.flagship.expense_workflow.comment.ExpenseCommentService;
import com.flagship.expense_workflow.exception.BusinessRuleException;
import com.flagship.expense_workflow.exception.ResourceNotFoundException;
import com.flagship.expense_workflow.expense.event.ExpenseApprovedEvent;
import com.flagship.expense_workflow.expense.event.ExpenseSubmittedEvent;
import com.flagship.expense_workflow.identity.CallerHeaders;
import com.flagship.expense_workflow.identity.UserDirectory;
import com.flagship.expense_workflow.identity.UserRole;
import com.flagship.expense_workflow.outbox.OutboxEvent;
import com.flagship.expense_workflow.outbox.OutboxService;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Expense workflow against a real PostgreSQL.
 *
 * These tests verify that:
 * - Every mutating operation leaves exactly one audit record, in order
 * - Status changes write their event to the outbox in the same transaction
 * - Attachments survive a round trip through the database in order
 * - Approval rules see the creator's role from the user directory
 * - Search filters, sorts and pages on the database side
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class ExpenseWorkflowIntegrationTest {

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
    private ExpenseService expenseService;

    @Autowired
    private ExpenseCommentService commentService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private UserDirectory userDirectory;

    @Autowired
    private MockMvc mockMvc;

    private UUID employeeId;
    private UUID managerId;
    private UUID adminId;
    private LocalDate today;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    @BeforeEach
    void setUp() {
        employeeId = userDirectory.registerUser("Erin Employee", UserRole.EMPLOYEE);
        managerId = userDirectory.registerUser("Morgan Manager", UserRole.MANAGER);
        adminId = userDirectory.registerUser("Avery Admin", UserRole.ADMIN);
        today = LocalDate.now(ZoneOffset.UTC);
    }

    private UUID createExpense(UUID creatorId, String title, String amount) {
        return expenseService.createExpense(creatorId, title, "", new BigDecimal(amount), today, null);
    }

    @Test
    @DisplayName("Full lifecycle leaves an ordered audit trail and two outbox events")
    void testFullLifecycle() {
        printTestHeader("Full Lifecycle");

        UUID expenseId = expenseService.createExpense(employeeId, "Flight to Berlin", "Sales summit",
                new BigDecimal("150.00"), today.minusDays(3), TRAVEL);
        printInput("Expense ID", expenseId);

        BusinessRuleException noReceipt = assertThrows(BusinessRuleException.class,
                () -> expenseService.submitExpense(expenseId, employeeId));
        printExpectedException("BusinessRuleException", noReceipt.getMessage());
        assertTrue(noReceipt.getMessage().contains("receipt"));

        expenseService.addAttachment(expenseId, "url1");
        expenseService.submitExpense(expenseId, employeeId);
        expenseService.approveExpense(expenseId, adminId, UserRole.ADMIN);

        ExpenseView approved = expenseService.getExpense(expenseId);
        printOutput("Status", approved.getStatus());
        assertEquals(ExpenseStatus.APPROVED, approved.getStatus());
        assertEquals(adminId, approved.getProcessedBy());
        assertEquals("Erin Employee", approved.getCreatorName());
        assertEquals(List.of("url1"), approved.getAttachmentUrls());
        assertEquals(0, approved.getAmount().compareTo(new BigDecimal("150")));

        BusinessRuleException frozen = assertThrows(BusinessRuleException.class,
                () -> expenseService.updateExpense(expenseId, employeeId, "Changed", "", BigDecimal.TEN, TRAVEL));
        assertEquals("Only draft requests can be edited.", frozen.getMessage());

        List<AuditLog> history = expenseService.getAuditHistory(expenseId);
        printOutput("Audit actions", history.stream().map(AuditLog::getAction).toList());
        assertEquals(List.of(AuditLog.ACTION_CREATED, AuditLog.ACTION_ATTACHMENT_ADDED,
                AuditLog.ACTION_SUBMITTED, AuditLog.ACTION_APPROVED),
                history.stream().map(AuditLog::getAction).toList());
        for (int i = 1; i < history.size(); i++) {
            assertTrue(history.get(i).getSequenceNumber() > history.get(i - 1).getSequenceNumber());
        }
        assertEquals(adminId, history.get(3).getUserId());

        List<OutboxEvent> events = outboxService.getEventsForAggregate(ExpenseService.AGGREGATE_TYPE, expenseId);
        assertEquals(List.of(ExpenseSubmittedEvent.EVENT_TYPE, ExpenseApprovedEvent.EVENT_TYPE),
                events.stream().map(OutboxEvent::getEventType).toList());
        assertFalse(events.get(0).isPublished());
        assertTrue(events.get(1).getPayload().contains(expenseId.toString()));
        printSuccess("Lifecycle audited and published");
    }

    @Test
    @DisplayName("Failed operations write no audit record")
    void testFailedOperationsLeaveNoTrace() {
        UUID expenseId = createExpense(employeeId, "Dinner", "40");

        assertThrows(BusinessRuleException.class,
                () -> expenseService.submitExpense(expenseId, managerId));
        assertThrows(BusinessRuleException.class,
                () -> expenseService.approveExpense(expenseId, managerId, UserRole.MANAGER));

        assertEquals(1, expenseService.getAuditHistory(expenseId).size());
        assertTrue(outboxService.getEventsForAggregate(ExpenseService.AGGREGATE_TYPE, expenseId).isEmpty());
        assertEquals(ExpenseStatus.DRAFT, expenseService.getExpense(expenseId).getStatus());
    }

    @Test
    @DisplayName("Manager cannot approve a peer manager's expense, admin can")
    void testPeerManagerRule() {
        printTestHeader("Peer Manager Rule");
        UUID otherManager = userDirectory.registerUser("Riley Manager", UserRole.MANAGER);
        UUID expenseId = createExpense(otherManager, "Taxi", "35");
        expenseService.submitExpense(expenseId, otherManager);

        BusinessRuleException e = assertThrows(BusinessRuleException.class,
                () -> expenseService.approveExpense(expenseId, managerId, UserRole.MANAGER));
        printExpectedException("BusinessRuleException", e.getMessage());
        assertTrue(e.getMessage().startsWith("Managers cannot approve other managers' expenses."));

        expenseService.approveExpense(expenseId, adminId, UserRole.ADMIN);
        assertEquals(ExpenseStatus.APPROVED, expenseService.getExpense(expenseId).getStatus());
        printSuccess("Peer manager blocked, admin approved");
    }

    @Test
    @DisplayName("Rejection stores the reason and the pending list shrinks")
    void testRejectAndPending() {
        UUID expenseId = createExpense(employeeId, "Gym membership", "60");
        expenseService.submitExpense(expenseId, employeeId);

        assertTrue(expenseService.getPendingExpenses().stream().anyMatch(view -> view.getId().equals(expenseId)));

        expenseService.rejectExpense(expenseId, managerId, UserRole.MANAGER, "Not a business expense");

        ExpenseView rejected = expenseService.getExpense(expenseId);
        assertEquals(ExpenseStatus.REJECTED, rejected.getStatus());
        assertEquals("Not a business expense", rejected.getRejectionReason());
        assertFalse(expenseService.getPendingExpenses().stream().anyMatch(view -> view.getId().equals(expenseId)));

        AuditLog last = expenseService.getAuditHistory(expenseId).get(1);
        assertEquals("Rejected by MANAGER: Not a business expense", last.getDetails());
    }

    @Test
    @DisplayName("Deleting a draft keeps its audit trail")
    void testDeleteDraft() {
        UUID expenseId = createExpense(employeeId, "Parking", "12");

        expenseService.deleteExpense(expenseId, employeeId);

        assertThrows(ResourceNotFoundException.class, () -> expenseService.getExpense(expenseId));
        List<AuditLog> history = expenseService.getAuditHistory(expenseId);
        assertEquals(2, history.size());
        assertEquals(AuditLog.ACTION_DELETED, history.get(1).getAction());
        assertNull(history.get(1).getNewStatus());
    }

    @Test
    @DisplayName("Attachments keep their order through updates")
    void testAttachmentOrder() {
        UUID expenseId = createExpense(employeeId, "Conference", "300");
        expenseService.addAttachment(expenseId, "a");
        expenseService.addAttachment(expenseId, "b");
        expenseService.addAttachment(expenseId, "c");
        expenseService.removeAttachment(expenseId, "b");

        assertEquals(List.of("a", "c"), expenseService.getExpense(expenseId).getAttachmentUrls());
    }

    @Test
    @DisplayName("Inactive or unknown category is rejected on create")
    void testUnknownCategory() {
        BusinessRuleException e = assertThrows(BusinessRuleException.class,
                () -> expenseService.createExpense(employeeId, "Taxi", "", BigDecimal.TEN, today, UUID.randomUUID()));
        assertEquals("Selected category does not exist.", e.getMessage());
    }

    @Test
    @DisplayName("Search filters by text and amount, sorts and pages")
    void testSearch() {
        printTestHeader("Search");
        createExpense(employeeId, "Hotel Lisbon", "220");
        createExpense(employeeId, "hotel Porto", "180");
        createExpense(employeeId, "Taxi", "25");
        createExpense(managerId, "Hotel Madrid", "200");

        ExpenseQuery query = ExpenseQuery.builder()
                .search("HOTEL")
                .minAmount(new BigDecimal("100"))
                .sortBy("amount")
                .sortDir("asc")
                .pageSize(1)
                .build();
        PagedResult<ExpenseView> firstPage = expenseService.searchExpenses(employeeId, query);
        printOutput("Total", firstPage.getTotalCount());

        assertEquals(2, firstPage.getTotalCount());
        assertEquals(2, firstPage.getTotalPages());
        assertEquals("hotel Porto", firstPage.getItems().get(0).getTitle());

        PagedResult<ExpenseView> secondPage = expenseService.searchExpenses(employeeId, ExpenseQuery.builder()
                .search("HOTEL")
                .minAmount(new BigDecimal("100"))
                .sortBy("amount")
                .sortDir("asc")
                .pageSize(1)
                .page(2)
                .build());
        assertEquals("Hotel Lisbon", secondPage.getItems().get(0).getTitle());
        printSuccess("Search filtered, sorted and paged");
    }

    @Test
    @DisplayName("Search text containing LIKE wildcards is matched literally")
    void testSearchEscapesWildcards() {
        createExpense(employeeId, "100% refund", "30");
        createExpense(employeeId, "Full refund", "30");

        PagedResult<ExpenseView> result = expenseService.searchExpenses(employeeId,
                ExpenseQuery.builder().search("%").build());

        assertEquals(1, result.getTotalCount());
        assertEquals("100% refund", result.getItems().get(0).getTitle());
    }

    @Test
    @DisplayName("Comments are stored with the author's name and returned oldest first")
    void testComments() {
        UUID expenseId = createExpense(employeeId, "Books", "45");

        commentService.addComment(expenseId, managerId, "  Which books?  ");
        commentService.addComment(expenseId, employeeId, "Java Concurrency in Practice");

        List<ExpenseComment> comments = commentService.getComments(expenseId);
        assertEquals(2, comments.size());
        assertEquals("Which books?", comments.get(0).getText());
        assertEquals("Morgan Manager", comments.get(0).getUserName());

        assertThrows(ResourceNotFoundException.class,
                () -> commentService.addComment(UUID.randomUUID(), managerId, "Hello"));
    }

    @Test
    @DisplayName("HTTP: create, attach, submit and read back")
    void testHttpFlow() throws Exception {
        printTestHeader("HTTP Flow");

        String createBody = "{\"title\": \"Client lunch\", \"amount\": 120.50, \"expense_date\": \""
                + today + "\", \"category_id\": \"22222222-2222-2222-2222-222222222222\"}";
        String response = mockMvc.perform(post("/api/expenses")
                        .header(CallerHeaders.USER_ID, employeeId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody))
                .andExpect(status().isCreated())
                .andReturn()
                .getResponse()
                .getContentAsString();
        String id = JsonPath.read(response, "$.id");
        printOutput("Created", id);

        mockMvc.perform(post("/api/expenses/{id}/submit", id)
                        .header(CallerHeaders.USER_ID, employeeId.toString()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Expenses over $100 require a receipt attachment."));

        mockMvc.perform(post("/api/expenses/{id}/attachments", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"attachment_url\": \"https://receipts/lunch.pdf\"}"))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/api/expenses/{id}/submit", id)
                        .header(CallerHeaders.USER_ID, employeeId.toString()))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/api/expenses/{id}/approve", id)
                        .header(CallerHeaders.USER_ID, employeeId.toString())
                        .header(CallerHeaders.USER_ROLE, "EMPLOYEE"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Only managers or admins can approve requests."));

        mockMvc.perform(get("/api/expenses/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUBMITTED"))
                .andExpect(jsonPath("$.attachment_urls[0]").value("https://receipts/lunch.pdf"))
                .andExpect(jsonPath("$.creator_name").value("Erin Employee"));

        mockMvc.perform(get("/api/expenses/{id}/audit-history", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3));
        printSuccess("HTTP flow completed");
    }
}
