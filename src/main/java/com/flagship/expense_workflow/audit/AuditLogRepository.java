package com.flagship.expense_workflow.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLogEntity, UUID> {

    List<AuditLogEntity> findByExpenseRequestIdOrderBySequenceNumberAsc(UUID expenseRequestId);

    long countByExpenseRequestId(UUID expenseRequestId);
}
