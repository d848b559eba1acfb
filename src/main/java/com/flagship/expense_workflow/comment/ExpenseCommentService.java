package com.flagship.expense_workflow.comment;

import com.flagship.expense_workflow.exception.ResourceNotFoundException;
import com.flagship.expense_workflow.expense.ExpenseService;
import com.flagship.expense_workflow.identity.IdentityLookup;
import com.flagship.expense_workflow.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Comment thread attached to each expense request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseCommentService {

    private static final String RESOURCE_TYPE = "Expense request";

    private final ExpenseCommentRepository repository;
    private final ExpenseService expenseService;
    private final IdentityLookup identityLookup;

    /**
     * Adds a comment in any status. The author's display name is resolved
     * now and stored with the comment.
     *
     * @throws ResourceNotFoundException if the expense does not exist
     */
    @Transactional
    public ExpenseComment addComment(UUID expenseId, UUID userId, String text) {
        MDC.put(CorrelationContext.EXPENSE_ID_MDC_KEY, expenseId.toString());
        try {
            ensureExpenseExists(expenseId);

            String userName = identityLookup.displayNameOf(userId).orElse("Unknown");
            ExpenseComment comment = ExpenseComment.create(expenseId, userId, userName, text);
            ExpenseComment saved = repository.save(ExpenseCommentEntity.fromDomain(comment)).toDomain();

            log.info("Comment added: commentId={}, author={}", saved.getId(), userId);
            return saved;
        } finally {
            MDC.remove(CorrelationContext.EXPENSE_ID_MDC_KEY);
        }
    }

    /**
     * Oldest first.
     *
     * @throws ResourceNotFoundException if the expense does not exist
     */
    @Transactional(readOnly = true)
    public List<ExpenseComment> getComments(UUID expenseId) {
        ensureExpenseExists(expenseId);
        return repository.findByExpenseRequestIdOrderByCreatedAtAsc(expenseId)
            .stream()
            .map(ExpenseCommentEntity::toDomain)
            .toList();
    }

    private void ensureExpenseExists(UUID expenseId) {
        if (!expenseService.exists(expenseId)) {
            throw new ResourceNotFoundException(RESOURCE_TYPE, expenseId);
        }
    }
}
