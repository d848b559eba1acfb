package com.flagship.expense_workflow.budget;

import com.flagship.expense_workflow.category.ExpenseCategory;
import com.flagship.expense_workflow.category.ExpenseCategoryService;
import com.flagship.expense_workflow.exception.BusinessRuleException;
import com.flagship.expense_workflow.exception.ResourceNotFoundException;
import com.flagship.expense_workflow.expense.ExpenseAggregates;
import com.flagship.expense_workflow.observability.CorrelationContext;
import com.flagship.expense_workflow.observability.ExpenseMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Manages budgets and computes their utilization.
 *
 * Budgets created through this service belong to their creator. Budgets
 * that apply to every user (no owner) are provisioned directly in the
 * database; they show up in every user's status list but nobody can edit
 * them through the API.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetService {

    private static final String RESOURCE_TYPE = "Budget";

    private final BudgetRepository repository;
    private final ExpenseAggregates expenseAggregates;
    private final ExpenseCategoryService categoryService;
    private final ExpenseMetrics expenseMetrics;

    /**
     * @param categoryId optional; must be an existing, active category
     * @return id of the new budget
     */
    @Transactional
    public UUID createBudget(UUID userId, String name, BigDecimal amount, LocalDate startDate, LocalDate endDate,
                             String description, UUID categoryId) {
        Budget budget = Budget.create(name, amount, startDate, endDate, description, userId, categoryId);
        categoryService.ensureAssignable(categoryId);

        MDC.put(CorrelationContext.BUDGET_ID_MDC_KEY, budget.getId().toString());
        try {
            repository.save(BudgetEntity.fromDomain(budget));
            expenseMetrics.recordOperation("budget_create", ExpenseMetrics.OUTCOME_SUCCESS);
            log.info("Budget created: name={}, amount={}, period={}..{}", name, amount, startDate, endDate);
            return budget.getId();
        } finally {
            MDC.remove(CorrelationContext.BUDGET_ID_MDC_KEY);
        }
    }

    @Transactional
    public Budget updateBudget(UUID budgetId, UUID userId, String name, BigDecimal amount,
                               LocalDate startDate, LocalDate endDate, String description) {
        return modify(budgetId, userId, "budget_update",
                budget -> budget.update(name, amount, startDate, endDate, description));
    }

    @Transactional
    public Budget activateBudget(UUID budgetId, UUID userId) {
        return modify(budgetId, userId, "budget_activate", Budget::activate);
    }

    @Transactional
    public Budget deactivateBudget(UUID budgetId, UUID userId) {
        return modify(budgetId, userId, "budget_deactivate", Budget::deactivate);
    }

    /**
     * @throws BusinessRuleException if the caller does not own the budget
     */
    @Transactional
    public void deleteBudget(UUID budgetId, UUID userId) {
        MDC.put(CorrelationContext.BUDGET_ID_MDC_KEY, budgetId.toString());
        try {
            Budget budget = loadBudget(budgetId);
            if (!budget.isOwnedBy(userId)) {
                throw new BusinessRuleException("You can only delete your own budgets.");
            }
            repository.deleteById(budgetId);
            expenseMetrics.recordOperation("budget_delete", ExpenseMetrics.OUTCOME_SUCCESS);
            log.info("Budget deleted");
        } finally {
            MDC.remove(CorrelationContext.BUDGET_ID_MDC_KEY);
        }
    }

    /**
     * @throws ResourceNotFoundException if no budget has this id
     */
    @Transactional(readOnly = true)
    public Budget getBudget(UUID budgetId) {
        return loadBudget(budgetId);
    }

    /**
     * The user's own budgets, newest first.
     */
    @Transactional(readOnly = true)
    public List<Budget> getUserBudgets(UUID userId, boolean activeOnly) {
        List<BudgetEntity> entities = activeOnly
            ? repository.findByUserIdAndActiveTrueOrderByCreatedAtDesc(userId)
            : repository.findByUserIdOrderByCreatedAtDesc(userId);
        return entities.stream().map(BudgetEntity::toDomain).toList();
    }

    /**
     * Utilization of the user's active budgets plus the active budgets that
     * apply to everyone, highest percentage first.
     */
    @Transactional(readOnly = true)
    public List<BudgetStatus> getBudgetStatus(UUID userId) {
        LocalDate today = LocalDate.now(ZoneOffset.UTC);

        List<BudgetEntity> budgets = new ArrayList<>(repository.findByUserIdAndActiveTrueOrderByCreatedAtDesc(userId));
        budgets.addAll(repository.findByUserIdIsNullAndActiveTrue());

        return budgets.stream()
            .map(BudgetEntity::toDomain)
            .map(budget -> computeStatus(budget, today))
            .sorted(Comparator.comparing(BudgetStatus::getPercentageUsed).reversed())
            .toList();
    }

    /**
     * Sums the approved expenses the budget covers (its owner's, or everyone's
     * for a global budget; its category, or all) dated inside its period.
     */
    @Transactional(readOnly = true)
    public BudgetStatus computeStatus(Budget budget, LocalDate today) {
        BigDecimal spent = expenseAggregates.sumApproved(
            budget.getUserId(),
            budget.getCategoryId(),
            budget.getStartDate(),
            budget.getEndDate()
        );
        ExpenseCategory category = categoryService.findCategory(budget.getCategoryId()).orElse(null);
        return BudgetStatus.compute(budget, spent, category, today);
    }

    private Budget modify(UUID budgetId, UUID userId, String operation, UnaryOperator<Budget> change) {
        MDC.put(CorrelationContext.BUDGET_ID_MDC_KEY, budgetId.toString());
        try {
            BudgetEntity entity = repository.findById(budgetId)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE, budgetId));
            Budget current = entity.toDomain();
            if (!current.isOwnedBy(userId)) {
                throw new BusinessRuleException("You can only modify your own budgets.");
            }

            Budget changed = change.apply(current);
            entity.updateFromDomain(changed);
            repository.save(entity);

            expenseMetrics.recordOperation(operation, ExpenseMetrics.OUTCOME_SUCCESS);
            log.info("Budget changed: operation={}, active={}", operation, changed.isActive());
            return changed;
        } finally {
            MDC.remove(CorrelationContext.BUDGET_ID_MDC_KEY);
        }
    }

    private Budget loadBudget(UUID budgetId) {
        return repository.findById(budgetId)
            .map(BudgetEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE, budgetId));
    }
}
