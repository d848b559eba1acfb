package com.flagship.expense_workflow.expense;

import com.flagship.expense_workflow.audit.AuditLog;
import com.flagship.expense_workflow.audit.AuditLogService;
import com.flagship.expense_workflow.category.ExpenseCategoryService;
import com.flagship.expense_workflow.exception.BusinessRuleException;
import com.flagship.expense_workflow.exception.ResourceNotFoundException;
import com.flagship.expense_workflow.expense.event.ExpenseApprovedEvent;
import com.flagship.expense_workflow.expense.event.ExpenseEvent;
import com.flagship.expense_workflow.expense.event.ExpenseRejectedEvent;
import com.flagship.expense_workflow.expense.event.ExpenseSubmittedEvent;
import com.flagship.expense_workflow.identity.IdentityLookup;
import com.flagship.expense_workflow.identity.UserRole;
import com.flagship.expense_workflow.observability.CorrelationContext;
import com.flagship.expense_workflow.observability.ExpenseMetrics;
import com.flagship.expense_workflow.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.domain.Page;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Orchestrates the expense workflow.
 *
 * Every mutating operation is one unit of work:
 * 1. Load the expense (ResourceNotFoundException if missing)
 * 2. Apply the domain operation, which validates and returns a new state
 * 3. Persist the new state
 * 4. Append exactly one audit record (same transaction)
 * 5. For status changes, write the emitted event to the outbox (same transaction)
 *
 * A validation failure in step 2 aborts before any write; any later failure
 * rolls the whole unit back, so no partial entity or audit state survives.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseService {

    public static final String AGGREGATE_TYPE = "ExpenseRequest";
    private static final String RESOURCE_TYPE = "Expense request";

    private final ExpensePersistenceService persistenceService;
    private final AuditLogService auditLogService;
    private final OutboxService outboxService;
    private final ExpenseCategoryService categoryService;
    private final IdentityLookup identityLookup;
    private final ExpenseRules expenseRules;
    private final ExpenseMetrics expenseMetrics;

    /**
     * Creates a draft expense. The creator's role is taken from the identity
     * store (EMPLOYEE when unknown) and kept on the expense for the approval rules.
     *
     * @return id of the new expense
     * @throws BusinessRuleException if the fields break a rule or the category
     *                               is unknown or inactive
     */
    @Transactional
    public UUID createExpense(UUID creatorId, String title, String description, BigDecimal amount,
                              LocalDate expenseDate, UUID categoryId) {
        return execute("create", null, () -> {
            UserRole creatorRole = identityLookup.roleOf(creatorId).orElse(UserRole.EMPLOYEE);
            ExpenseRequest expense = ExpenseRequest.create(creatorId, creatorRole, title, description,
                    amount, expenseDate, categoryId, expenseRules);
            categoryService.ensureAssignable(categoryId);

            MDC.put(CorrelationContext.EXPENSE_ID_MDC_KEY, expense.getId().toString());

            persistenceService.save(expense);
            auditLogService.record(AuditLog.forCreation(expense.getId(), creatorId));
            expenseMetrics.recordAmount("create", amount.doubleValue());

            log.info("Expense created: amount={}, expenseDate={}, creatorRole={}",
                    amount, expenseDate, creatorRole);
            return expense.getId();
        });
    }

    @Transactional
    public void updateExpense(UUID expenseId, UUID userId, String title, String description,
                              BigDecimal amount, UUID categoryId) {
        execute("update", expenseId, () -> {
            ExpenseRequest expense = loadExpense(expenseId);
            ExpenseRequest updated = expense.update(userId, title, description, amount, categoryId);
            // an expense may keep a category that was deactivated after it was assigned
            if (!Objects.equals(expense.getCategoryId(), categoryId)) {
                categoryService.ensureAssignable(categoryId);
            }

            AuditLog auditLog = AuditLog.forUpdate(expense, updated, userId);
            persistenceService.update(updated);
            auditLogService.record(auditLog);

            log.info("Expense updated: {}", auditLog.getDetails());
            return null;
        });
    }

    /**
     * DRAFT → SUBMITTED, writing ExpenseSubmitted to the outbox.
     */
    @Transactional
    public void submitExpense(UUID expenseId, UUID userId) {
        execute("submit", expenseId, () -> {
            ExpenseRequest expense = loadExpense(expenseId);
            ExpenseTransition<ExpenseSubmittedEvent> transition = expense.submit(userId, expenseRules);

            persistenceService.update(transition.getExpense());
            auditLogService.record(AuditLog.forSubmission(expenseId, userId));
            publish(transition.getEvent());

            log.info("Expense submitted: amount={}, attachments={}",
                    expense.getAmount(), expense.getAttachmentUrls().size());
            return null;
        });
    }

    /**
     * SUBMITTED → APPROVED, writing ExpenseApproved to the outbox.
     *
     * Both roles come from the directory: the creator's, so a creator promoted
     * to manager after submitting is subject to the peer-manager rule, and the
     * approver's, which overrides the role the caller claimed.
     */
    @Transactional
    public void approveExpense(UUID expenseId, UUID actingUserId, UserRole claimedRole) {
        execute("approve", expenseId, () -> {
            ExpenseRequest expense = loadExpense(expenseId);
            UserRole actingRole = resolveActingRole(actingUserId, claimedRole);
            UserRole creatorRole = identityLookup.roleOf(expense.getCreatorId())
                    .orElse(expense.getCreatorRole());

            ExpenseTransition<ExpenseApprovedEvent> transition = expense
                    .withCreatorRole(creatorRole)
                    .approve(actingUserId, actingRole, expenseRules);

            persistenceService.update(transition.getExpense());
            auditLogService.record(AuditLog.forApproval(expenseId, actingUserId, actingRole));
            publish(transition.getEvent());

            log.info("Expense approved: approver={}, approverRole={}, amount={}",
                    actingUserId, actingRole, expense.getAmount());
            return null;
        });
    }

    /**
     * SUBMITTED → REJECTED, writing ExpenseRejected to the outbox. The
     * rejecter's role is resolved from the directory as for approval.
     */
    @Transactional
    public void rejectExpense(UUID expenseId, UUID actingUserId, UserRole claimedRole, String reason) {
        execute("reject", expenseId, () -> {
            ExpenseRequest expense = loadExpense(expenseId);
            UserRole actingRole = resolveActingRole(actingUserId, claimedRole);
            ExpenseTransition<ExpenseRejectedEvent> transition = expense.reject(actingUserId, actingRole, reason);

            persistenceService.update(transition.getExpense());
            auditLogService.record(AuditLog.forRejection(expenseId, actingUserId, actingRole, reason));
            publish(transition.getEvent());

            log.info("Expense rejected: rejecter={}, rejecterRole={}", actingUserId, actingRole);
            return null;
        });
    }

    /**
     * Attaches a receipt URL to a draft. The audit record is attributed to the creator.
     */
    @Transactional
    public void addAttachment(UUID expenseId, String attachmentUrl) {
        execute("add_attachment", expenseId, () -> {
            ExpenseRequest expense = loadExpense(expenseId);
            ExpenseRequest updated = expense.addAttachment(attachmentUrl);

            persistenceService.update(updated);
            auditLogService.record(AuditLog.forAttachmentAdded(expenseId, expense.getCreatorId(), attachmentUrl));

            log.info("Attachment added: attachments={}", updated.getAttachmentUrls().size());
            return null;
        });
    }

    @Transactional
    public void removeAttachment(UUID expenseId, String attachmentUrl) {
        execute("remove_attachment", expenseId, () -> {
            ExpenseRequest expense = loadExpense(expenseId);
            ExpenseRequest updated = expense.removeAttachment(attachmentUrl);

            persistenceService.update(updated);
            auditLogService.record(AuditLog.forAttachmentRemoved(expenseId, expense.getCreatorId(), attachmentUrl));

            log.info("Attachment removed: attachments={}", updated.getAttachmentUrls().size());
            return null;
        });
    }

    /**
     * Deletes a draft. Only its creator may do so. The audit trail is kept.
     */
    @Transactional
    public void deleteExpense(UUID expenseId, UUID userId) {
        execute("delete", expenseId, () -> {
            ExpenseRequest expense = loadExpense(expenseId);
            if (expense.getStatus() != ExpenseStatus.DRAFT) {
                throw new BusinessRuleException("Only draft requests can be deleted.");
            }
            if (!expense.isOwnedBy(userId)) {
                throw new BusinessRuleException("Only the creator can delete this request.");
            }

            auditLogService.record(AuditLog.forDeletion(expenseId, userId));
            persistenceService.delete(expenseId);

            log.info("Draft expense deleted");
            return null;
        });
    }

    /**
     * Audit trail oldest first. Deleted expenses keep their trail, so no
     * existence check is made here.
     */
    @Transactional(readOnly = true)
    public List<AuditLog> getAuditHistory(UUID expenseId) {
        return auditLogService.getHistory(expenseId);
    }

    /**
     * @throws ResourceNotFoundException if no expense has this id
     */
    @Transactional(readOnly = true)
    public ExpenseView getExpense(UUID expenseId) {
        ExpenseRequest expense = loadExpense(expenseId);
        return ExpenseView.of(expense, displayName(expense.getCreatorId()));
    }

    @Transactional(readOnly = true)
    public boolean exists(UUID expenseId) {
        return persistenceService.findById(expenseId).isPresent();
    }

    /**
     * The creator's expenses, newest first.
     */
    @Transactional(readOnly = true)
    public List<ExpenseView> getExpensesByCreator(UUID creatorId) {
        String creatorName = displayName(creatorId);
        return persistenceService.findByCreator(creatorId)
                .stream()
                .map(expense -> ExpenseView.of(expense, creatorName))
                .toList();
    }

    /**
     * Expenses awaiting a decision, oldest submission first.
     */
    @Transactional(readOnly = true)
    public List<ExpenseView> getPendingExpenses() {
        return toViews(persistenceService.findByStatusOldestSubmittedFirst(ExpenseStatus.SUBMITTED));
    }

    /**
     * Filters, sorts and pages expenses.
     *
     * @param creatorId restricts to one creator's expenses; null searches all
     */
    @Transactional(readOnly = true)
    public PagedResult<ExpenseView> searchExpenses(UUID creatorId, ExpenseQuery query) {
        ExpenseQuery effective = query != null ? query : ExpenseQuery.all();

        Specification<ExpenseRequestEntity> specification = Specification
                .where(ExpenseSpecifications.createdBy(creatorId))
                .and(ExpenseSpecifications.textContains(effective.getSearch()))
                .and(ExpenseSpecifications.hasStatus(effective.getStatus()))
                .and(ExpenseSpecifications.expenseDateFrom(effective.getFromDate()))
                .and(ExpenseSpecifications.expenseDateTo(effective.getToDate()))
                .and(ExpenseSpecifications.amountAtLeast(effective.getMinAmount()))
                .and(ExpenseSpecifications.amountAtMost(effective.getMaxAmount()));

        Page<ExpenseRequest> page = persistenceService.search(specification, effective.pageable());
        log.debug("Expense search returned {} of {} results", page.getNumberOfElements(), page.getTotalElements());

        return new PagedResult<>(
                toViews(page.getContent()),
                page.getTotalElements(),
                effective.effectivePage(),
                effective.effectivePageSize()
        );
    }

    /**
     * The directory is authoritative; the claimed role only applies to users
     * the directory does not know.
     */
    private UserRole resolveActingRole(UUID actingUserId, UserRole claimedRole) {
        return identityLookup.roleOf(actingUserId)
                .map(role -> {
                    if (role != claimedRole) {
                        log.warn("Caller {} claimed role {} but the directory has {}", actingUserId, claimedRole, role);
                    }
                    return role;
                })
                .orElse(claimedRole);
    }

    private ExpenseRequest loadExpense(UUID expenseId) {
        return persistenceService.findById(expenseId)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE, expenseId));
    }

    private List<ExpenseView> toViews(List<ExpenseRequest> expenses) {
        Map<UUID, String> names = new HashMap<>();
        return expenses.stream()
                .map(expense -> ExpenseView.of(expense,
                        names.computeIfAbsent(expense.getCreatorId(), this::displayName)))
                .toList();
    }

    private String displayName(UUID userId) {
        return identityLookup.displayNameOf(userId).orElse("Unknown");
    }

    private void publish(ExpenseEvent event) {
        outboxService.saveEvent(AGGREGATE_TYPE, event.getExpenseId(), event.getEventType(), event);
    }

    /**
     * Runs one operation with the expense id in the MDC, recording outcome
     * and latency. Business rule and not-found failures count as "rejected",
     * everything else as "error".
     */
    private <T> T execute(String operation, UUID expenseId, Supplier<T> action) {
        long startTime = System.currentTimeMillis();
        if (expenseId != null) {
            MDC.put(CorrelationContext.EXPENSE_ID_MDC_KEY, expenseId.toString());
        }

        try {
            T result = action.get();

            long duration = System.currentTimeMillis() - startTime;
            expenseMetrics.recordOperation(operation, ExpenseMetrics.OUTCOME_SUCCESS);
            expenseMetrics.recordLatency(operation, duration);
            return result;

        } catch (BusinessRuleException | ResourceNotFoundException e) {
            long duration = System.currentTimeMillis() - startTime;
            expenseMetrics.recordOperation(operation, ExpenseMetrics.OUTCOME_REJECTED);
            expenseMetrics.recordLatency(operation, duration);
            log.warn("Expense {} rejected: {}, duration={}ms", operation, e.getMessage(), duration);
            throw e;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            expenseMetrics.recordOperation(operation, ExpenseMetrics.OUTCOME_ERROR);
            expenseMetrics.recordLatency(operation, duration);
            log.error("Expense {} failed: error={}, duration={}ms", operation, e.getMessage(), duration);
            throw e;

        } finally {
            MDC.remove(CorrelationContext.EXPENSE_ID_MDC_KEY);
        }
    }
}
