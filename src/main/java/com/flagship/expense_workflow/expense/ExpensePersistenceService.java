package com.flagship.expense_workflow.expense;

import com.flagship.expense_workflow.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the domain layer (ExpenseRequest) and the persistence layer
 * (ExpenseRequestEntity).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpensePersistenceService {

    private final ExpenseRequestRepository repository;

    @Transactional
    public ExpenseRequest save(ExpenseRequest expense) {
        ExpenseRequestEntity saved = repository.save(ExpenseRequestEntity.fromDomain(expense));
        log.debug("Saved expense request {}", saved.getId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<ExpenseRequest> findById(UUID expenseId) {
        return repository.findById(expenseId)
            .map(ExpenseRequestEntity::toDomain);
    }

    /**
     * Writes the new state of an existing expense through the controlled
     * update method, never through setters.
     *
     * @throws ResourceNotFoundException if the row is gone
     */
    @Transactional
    public ExpenseRequest update(ExpenseRequest expense) {
        ExpenseRequestEntity existing = repository.findById(expense.getId())
            .orElseThrow(() -> new ResourceNotFoundException("Expense request", expense.getId()));

        existing.updateFromDomain(expense);

        ExpenseRequestEntity updated = repository.save(existing);
        log.debug("Updated expense request {} (status={})", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }

    @Transactional
    public void delete(UUID expenseId) {
        repository.deleteById(expenseId);
        log.debug("Deleted expense request {}", expenseId);
    }

    @Transactional(readOnly = true)
    public List<ExpenseRequest> findByCreator(UUID creatorId) {
        return repository.findByCreatorIdOrderByCreatedAtDesc(creatorId)
            .stream()
            .map(ExpenseRequestEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<ExpenseRequest> findByStatusOldestSubmittedFirst(ExpenseStatus status) {
        return repository.findByStatusOrderBySubmittedAtAsc(status)
            .stream()
            .map(ExpenseRequestEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Page<ExpenseRequest> search(Specification<ExpenseRequestEntity> specification, Pageable pageable) {
        return repository.findAll(specification, pageable)
            .map(ExpenseRequestEntity::toDomain);
    }
}
