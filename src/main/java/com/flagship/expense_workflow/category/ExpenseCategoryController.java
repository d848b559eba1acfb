package com.flagship.expense_workflow.category;

import com.flagship.expense_workflow.category.dto.CategoryResponse;
import com.flagship.expense_workflow.category.dto.CreateCategoryRequest;
import com.flagship.expense_workflow.exception.ForbiddenException;
import com.flagship.expense_workflow.identity.CallerHeaders;
import com.flagship.expense_workflow.identity.UserRole;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Category catalogue. Anyone may read it; only admins change it.
 */
@RestController
@RequestMapping("/api/categories")
@RequiredArgsConstructor
public class ExpenseCategoryController {

    private final ExpenseCategoryService categoryService;

    @GetMapping
    public ResponseEntity<List<CategoryResponse>> getCategories(
            @RequestParam(name = "includeInactive", defaultValue = "false") boolean includeInactive) {
        List<ExpenseCategory> categories = includeInactive
            ? categoryService.getAllCategories()
            : categoryService.getActiveCategories();
        return ResponseEntity.ok(categories.stream().map(CategoryResponse::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<CategoryResponse> getCategory(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(CategoryResponse.from(categoryService.getCategory(id)));
    }

    @PostMapping
    public ResponseEntity<CategoryResponse> createCategory(
            @Valid @RequestBody CreateCategoryRequest request,
            @RequestHeader(CallerHeaders.USER_ROLE) String role) {
        requireAdmin(role);
        ExpenseCategory category = categoryService.createCategory(
            request.getName(), request.getDescription(), request.getIcon(), request.getColor());
        return ResponseEntity.status(HttpStatus.CREATED).body(CategoryResponse.from(category));
    }

    @PostMapping("/{id}/activate")
    public ResponseEntity<CategoryResponse> activateCategory(
            @PathVariable("id") UUID id,
            @RequestHeader(CallerHeaders.USER_ROLE) String role) {
        requireAdmin(role);
        return ResponseEntity.ok(CategoryResponse.from(categoryService.activateCategory(id)));
    }

    @PostMapping("/{id}/deactivate")
    public ResponseEntity<CategoryResponse> deactivateCategory(
            @PathVariable("id") UUID id,
            @RequestHeader(CallerHeaders.USER_ROLE) String role) {
        requireAdmin(role);
        return ResponseEntity.ok(CategoryResponse.from(categoryService.deactivateCategory(id)));
    }

    private static void requireAdmin(String role) {
        if (UserRole.parse(role) != UserRole.ADMIN) {
            throw new ForbiddenException("Only admins can manage expense categories.");
        }
    }
}
