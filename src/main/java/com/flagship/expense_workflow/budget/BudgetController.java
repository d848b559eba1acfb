package com.flagship.expense_workflow.budget;

import com.flagship.expense_workflow.budget.dto.BudgetResponse;
import com.flagship.expense_workflow.budget.dto.BudgetStatusResponse;
import com.flagship.expense_workflow.budget.dto.CreateBudgetRequest;
import com.flagship.expense_workflow.budget.dto.UpdateBudgetRequest;
import com.flagship.expense_workflow.identity.CallerHeaders;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
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

import java.util.List;
import java.util.UUID;

/**
 * REST controller for the caller's budgets.
 */
@RestController
@RequestMapping("/api/budgets")
@RequiredArgsConstructor
public class BudgetController {

    private final BudgetService budgetService;

    @GetMapping
    public ResponseEntity<List<BudgetResponse>> getMyBudgets(
            @RequestHeader(CallerHeaders.USER_ID) UUID userId,
            @RequestParam(name = "activeOnly", defaultValue = "false") boolean activeOnly) {
        List<BudgetResponse> budgets = budgetService.getUserBudgets(userId, activeOnly)
            .stream()
            .map(BudgetResponse::from)
            .toList();
        return ResponseEntity.ok(budgets);
    }

    @GetMapping("/status")
    public ResponseEntity<List<BudgetStatusResponse>> getBudgetStatus(
            @RequestHeader(CallerHeaders.USER_ID) UUID userId) {
        List<BudgetStatusResponse> statuses = budgetService.getBudgetStatus(userId)
            .stream()
            .map(BudgetStatusResponse::from)
            .toList();
        return ResponseEntity.ok(statuses);
    }

    @PostMapping
    public ResponseEntity<BudgetResponse> createBudget(
            @Valid @RequestBody CreateBudgetRequest request,
            @RequestHeader(CallerHeaders.USER_ID) UUID userId) {
        UUID budgetId = budgetService.createBudget(
            userId,
            request.getName(),
            request.getAmount(),
            request.getStartDate(),
            request.getEndDate(),
            request.getDescription(),
            request.getCategoryId()
        );
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(BudgetResponse.from(budgetService.getBudget(budgetId)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<BudgetResponse> updateBudget(
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateBudgetRequest request,
            @RequestHeader(CallerHeaders.USER_ID) UUID userId) {
        Budget updated = budgetService.updateBudget(id, userId, request.getName(), request.getAmount(),
                request.getStartDate(), request.getEndDate(), request.getDescription());
        return ResponseEntity.ok(BudgetResponse.from(updated));
    }

    @PostMapping("/{id}/activate")
    public ResponseEntity<BudgetResponse> activateBudget(
            @PathVariable("id") UUID id,
            @RequestHeader(CallerHeaders.USER_ID) UUID userId) {
        return ResponseEntity.ok(BudgetResponse.from(budgetService.activateBudget(id, userId)));
    }

    @PostMapping("/{id}/deactivate")
    public ResponseEntity<BudgetResponse> deactivateBudget(
            @PathVariable("id") UUID id,
            @RequestHeader(CallerHeaders.USER_ID) UUID userId) {
        return ResponseEntity.ok(BudgetResponse.from(budgetService.deactivateBudget(id, userId)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteBudget(
            @PathVariable("id") UUID id,
            @RequestHeader(CallerHeaders.USER_ID) UUID userId) {
        budgetService.deleteBudget(id, userId);
        return ResponseEntity.noContent().build();
    }
}
