package com.flagship.expense_workflow.category;

import com.flagship.expense_workflow.exception.BusinessRuleException;
import com.flagship.expense_workflow.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Manages the expense category catalogue.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseCategoryService {

    private static final String RESOURCE_TYPE = "Expense category";

    private final ExpenseCategoryRepository repository;

    @Transactional
    public ExpenseCategory createCategory(String name, String description, String icon, String color) {
        ExpenseCategory category = ExpenseCategory.create(name, description, icon, color);
        ExpenseCategory saved = repository.save(ExpenseCategoryEntity.fromDomain(category)).toDomain();
        log.info("Created expense category: id={}, name={}", saved.getId(), saved.getName());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ExpenseCategory> getActiveCategories() {
        return repository.findByActiveTrueOrderByNameAsc()
            .stream()
            .map(ExpenseCategoryEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<ExpenseCategory> getAllCategories() {
        return repository.findAllByOrderByNameAsc()
            .stream()
            .map(ExpenseCategoryEntity::toDomain)
            .toList();
    }

    /**
     * @throws ResourceNotFoundException if no category has this id
     */
    @Transactional(readOnly = true)
    public ExpenseCategory getCategory(UUID categoryId) {
        return findCategory(categoryId)
            .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE, categoryId));
    }

    @Transactional(readOnly = true)
    public Optional<ExpenseCategory> findCategory(UUID categoryId) {
        if (categoryId == null) {
            return Optional.empty();
        }
        return repository.findById(categoryId).map(ExpenseCategoryEntity::toDomain);
    }

    /**
     * Checks that a category can be assigned to an expense.
     *
     * @throws BusinessRuleException if the category is unknown or inactive
     */
    @Transactional(readOnly = true)
    public void ensureAssignable(UUID categoryId) {
        if (categoryId == null) {
            return;
        }
        ExpenseCategory category = findCategory(categoryId)
            .orElseThrow(() -> new BusinessRuleException("Selected category does not exist."));
        if (!category.isActive()) {
            throw new BusinessRuleException("Selected category is not active.");
        }
    }

    @Transactional
    public ExpenseCategory activateCategory(UUID categoryId) {
        return changeActive(categoryId, true);
    }

    @Transactional
    public ExpenseCategory deactivateCategory(UUID categoryId) {
        return changeActive(categoryId, false);
    }

    private ExpenseCategory changeActive(UUID categoryId, boolean active) {
        ExpenseCategoryEntity entity = repository.findById(categoryId)
            .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE, categoryId));

        ExpenseCategory current = entity.toDomain();
        ExpenseCategory changed = active ? current.activate() : current.deactivate();
        entity.updateFromDomain(changed);
        repository.save(entity);

        log.info("Expense category {} is now {}", categoryId, active ? "active" : "inactive");
        return changed;
    }
}
