package com.flagship.expense_workflow.expense;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for expense requests. Ad-hoc filtering goes through
 * {@link ExpenseSpecifications}.
 */
@Repository
public interface ExpenseRequestRepository
        extends JpaRepository<ExpenseRequestEntity, UUID>, JpaSpecificationExecutor<ExpenseRequestEntity> {

    List<ExpenseRequestEntity> findByCreatorIdOrderByCreatedAtDesc(UUID creatorId);

    List<ExpenseRequestEntity> findByStatusOrderBySubmittedAtAsc(ExpenseStatus status);
}
