package com.flagship.expense_workflow.expense;

import com.flagship.expense_workflow.expense.dto.AddAttachmentRequest;
import com.flagship.expense_workflow.expense.dto.AuditLogResponse;
import com.flagship.expense_workflow.expense.dto.CreateExpenseRequest;
import com.flagship.expense_workflow.expense.dto.ExpenseCreatedResponse;
import com.flagship.expense_workflow.expense.dto.ExpensePageResponse;
import com.flagship.expense_workflow.expense.dto.ExpenseResponse;
import com.flagship.expense_workflow.expense.dto.RejectExpenseRequest;
import com.flagship.expense_workflow.expense.dto.UpdateExpenseRequest;
import com.flagship.expense_workflow.identity.CallerHeaders;
import com.flagship.expense_workflow.identity.UserRole;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * REST controller for the expense workflow.
 *
 * The caller is identified by the X-User-Id and X-User-Role headers set by
 * the gateway. Business rules are enforced by the domain, so this layer only
 * translates requests and responses; errors are mapped by GlobalExceptionHandler.
 */
@RestController
@RequestMapping("/api/expenses")
@RequiredArgsConstructor
@Slf4j
public class ExpenseController {

    private final ExpenseService expenseService;

    @PostMapping
    public ResponseEntity<ExpenseCreatedResponse> createExpense(
            @Valid @RequestBody CreateExpenseRequest request,
            @RequestHeader(CallerHeaders.USER_ID) UUID userId) {

        log.info("Received expense creation request: amount={}, expenseDate={}",
                request.getAmount(), request.getExpenseDate());

        UUID expenseId = expenseService.createExpense(
            userId,
            request.getTitle(),
            request.getDescription(),
            request.getAmount(),
            request.getExpenseDate(),
            request.getCategoryId()
        );

        return ResponseEntity.status(HttpStatus.CREATED).body(new ExpenseCreatedResponse(expenseId));
    }

    /**
     * The caller's own expenses, filtered, sorted and paged.
     */
    @GetMapping
    public ResponseEntity<ExpensePageResponse> getMyExpenses(
            @RequestHeader(CallerHeaders.USER_ID) UUID userId,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "fromDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(name = "toDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate,
            @RequestParam(name = "minAmount", required = false) BigDecimal minAmount,
            @RequestParam(name = "maxAmount", required = false) BigDecimal maxAmount,
            @RequestParam(name = "sortBy", required = false) String sortBy,
            @RequestParam(name = "sortDir", required = false) String sortDir,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "pageSize", required = false) Integer pageSize) {

        ExpenseQuery query = ExpenseQuery.builder()
            .search(search)
            .status(parseStatus(status))
            .fromDate(fromDate)
            .toDate(toDate)
            .minAmount(minAmount)
            .maxAmount(maxAmount)
            .sortBy(sortBy)
            .sortDir(sortDir)
            .page(page)
            .pageSize(pageSize)
            .build();

        return ResponseEntity.ok(ExpensePageResponse.from(expenseService.searchExpenses(userId, query)));
    }

    /**
     * Submitted expenses awaiting a decision (managers and admins only).
     */
    @GetMapping("/pending")
    public ResponseEntity<List<ExpenseResponse>> getPendingExpenses(
            @RequestHeader(CallerHeaders.USER_ROLE) String role) {
        CallerHeaders.requireProcessor(role);
        List<ExpenseResponse> pending = expenseService.getPendingExpenses()
            .stream()
            .map(ExpenseResponse::from)
            .toList();
        return ResponseEntity.ok(pending);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ExpenseResponse> getExpense(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(ExpenseResponse.from(expenseService.getExpense(id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Void> updateExpense(
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateExpenseRequest request,
            @RequestHeader(CallerHeaders.USER_ID) UUID userId) {
        expenseService.updateExpense(id, userId, request.getTitle(), request.getDescription(),
                request.getAmount(), request.getCategoryId());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteExpense(
            @PathVariable("id") UUID id,
            @RequestHeader(CallerHeaders.USER_ID) UUID userId) {
        expenseService.deleteExpense(id, userId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/submit")
    public ResponseEntity<Void> submitExpense(
            @PathVariable("id") UUID id,
            @RequestHeader(CallerHeaders.USER_ID) UUID userId) {
        expenseService.submitExpense(id, userId);
        return ResponseEntity.noContent().build();
    }

    /**
     * The header role is only a claim; the service resolves the caller's role
     * from the directory. An employee calling this gets the domain's
     * "Only managers or admins" rejection.
     */
    @PostMapping("/{id}/approve")
    public ResponseEntity<Void> approveExpense(
            @PathVariable("id") UUID id,
            @RequestHeader(CallerHeaders.USER_ID) UUID userId,
            @RequestHeader(CallerHeaders.USER_ROLE) String role) {
        expenseService.approveExpense(id, userId, UserRole.parse(role));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<Void> rejectExpense(
            @PathVariable("id") UUID id,
            @RequestBody RejectExpenseRequest request,
            @RequestHeader(CallerHeaders.USER_ID) UUID userId,
            @RequestHeader(CallerHeaders.USER_ROLE) String role) {
        expenseService.rejectExpense(id, userId, UserRole.parse(role), request.getReason());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/attachments")
    public ResponseEntity<Void> addAttachment(
            @PathVariable("id") UUID id,
            @RequestBody AddAttachmentRequest request) {
        expenseService.addAttachment(id, request.getAttachmentUrl());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}/attachments")
    public ResponseEntity<Void> removeAttachment(
            @PathVariable("id") UUID id,
            @RequestParam("url") String url) {
        expenseService.removeAttachment(id, url);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/audit-history")
    public ResponseEntity<List<AuditLogResponse>> getAuditHistory(@PathVariable("id") UUID id) {
        List<AuditLogResponse> history = expenseService.getAuditHistory(id)
            .stream()
            .map(AuditLogResponse::from)
            .toList();
        return ResponseEntity.ok(history);
    }

    private static ExpenseStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return ExpenseStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown expense status: " + status);
        }
    }
}
