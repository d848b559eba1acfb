package com.flagship.expense_workflow.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes and reads the expense audit trail.
 *
 * Usage:
 * 1. Mutate the expense inside a @Transactional service method
 * 2. Call record() with the matching AuditLog factory result
 * 3. Both rows commit or roll back together
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLogService {

    private final AuditLogRepository repository;

    /**
     * Appends a record within the caller's transaction.
     *
     * Uses MANDATORY propagation: an audit record written outside the unit of
     * work that performs the mutation could outlive a rolled-back change.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AuditLog record(AuditLog auditLog) {
        AuditLogEntity saved = repository.save(AuditLogEntity.fromDomain(auditLog));

        log.debug("Recorded audit entry: action={}, expenseRequestId={}, {} -> {}",
                auditLog.getAction(), auditLog.getExpenseRequestId(),
                auditLog.getPreviousStatus(), auditLog.getNewStatus());

        return saved.toDomain();
    }

    /**
     * Returns the trail for an expense, oldest first. Works for deleted
     * expenses too, so an unknown id yields an empty list rather than an error.
     */
    @Transactional(readOnly = true)
    public List<AuditLog> getHistory(UUID expenseRequestId) {
        return repository.findByExpenseRequestIdOrderBySequenceNumberAsc(expenseRequestId)
                .stream()
                .map(AuditLogEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countFor(UUID expenseRequestId) {
        return repository.countByExpenseRequestId(expenseRequestId);
    }
}
