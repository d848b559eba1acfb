package com.flagship.expense_workflow.analytics;

import com.flagship.expense_workflow.category.ExpenseCategoryService;
import com.flagship.expense_workflow.category.dto.CategoryResponse;
import com.flagship.expense_workflow.identity.CallerHeaders;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Dashboard endpoints. The manager/* variants cover every user and require
 * the MANAGER or ADMIN role.
 */
@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private static final String DEFAULT_MONTHS_BACK = "6";

    private final ExpenseAnalyticsService analyticsService;
    private final ExpenseCategoryService categoryService;

    @GetMapping("/my-expenses")
    public ResponseEntity<ExpenseAnalytics> getMyExpensesAnalytics(
            @RequestHeader(CallerHeaders.USER_ID) UUID userId,
            @RequestParam(name = "startDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "endDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return ResponseEntity.ok(analyticsService.getUserAnalytics(userId, startDate, endDate));
    }

    @GetMapping("/categories")
    public ResponseEntity<List<CategoryResponse>> getCategories() {
        return ResponseEntity.ok(categoryService.getActiveCategories()
            .stream()
            .map(CategoryResponse::from)
            .toList());
    }

    @GetMapping("/status-distribution")
    public ResponseEntity<List<StatusDistribution>> getStatusDistribution(
            @RequestHeader(CallerHeaders.USER_ID) UUID userId,
            @RequestParam(name = "startDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "endDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return ResponseEntity.ok(analyticsService.getStatusDistribution(userId, startDate, endDate));
    }

    @GetMapping("/approval-rates")
    public ResponseEntity<List<ApprovalRate>> getApprovalRates(
            @RequestHeader(CallerHeaders.USER_ID) UUID userId,
            @RequestParam(name = "monthsBack", defaultValue = DEFAULT_MONTHS_BACK) int monthsBack) {
        return ResponseEntity.ok(analyticsService.getApprovalRates(userId, monthsBack));
    }

    @GetMapping("/manager/status-distribution")
    public ResponseEntity<List<StatusDistribution>> getManagerStatusDistribution(
            @RequestHeader(CallerHeaders.USER_ROLE) String role,
            @RequestParam(name = "startDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "endDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        CallerHeaders.requireProcessor(role);
        return ResponseEntity.ok(analyticsService.getStatusDistribution(null, startDate, endDate));
    }

    @GetMapping("/manager/approval-rates")
    public ResponseEntity<List<ApprovalRate>> getManagerApprovalRates(
            @RequestHeader(CallerHeaders.USER_ROLE) String role,
            @RequestParam(name = "monthsBack", defaultValue = DEFAULT_MONTHS_BACK) int monthsBack) {
        CallerHeaders.requireProcessor(role);
        return ResponseEntity.ok(analyticsService.getApprovalRates(null, monthsBack));
    }
}
