package com.flagship.expense_workflow.comment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ExpenseCommentRepository extends JpaRepository<ExpenseCommentEntity, UUID> {

    List<ExpenseCommentEntity> findByExpenseRequestIdOrderByCreatedAtAsc(UUID expenseRequestId);
}
