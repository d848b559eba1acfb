package com.flagship.expense_workflow.budget;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BudgetRepository extends JpaRepository<BudgetEntity, UUID> {

    List<BudgetEntity> findByUserIdOrderByCreatedAtDesc(UUID userId);

    List<BudgetEntity> findByUserIdAndActiveTrueOrderByCreatedAtDesc(UUID userId);

    /**
     * Active budgets that apply to every user.
     */
    List<BudgetEntity> findByUserIdIsNullAndActiveTrue();
}
